package com.socialnetwork.domain.service;

import com.socialnetwork.domain.exception.BadRequestException;
import com.socialnetwork.domain.exception.ConflictException;
import com.socialnetwork.domain.exception.ForbiddenException;
import com.socialnetwork.domain.exception.NotFoundException;
import com.socialnetwork.domain.model.GroupInvitationView;
import com.socialnetwork.domain.model.GroupMemberView;
import com.socialnetwork.domain.model.GroupRequest;
import com.socialnetwork.domain.model.GroupView;
import com.socialnetwork.domain.model.JoinRequestView;
import com.socialnetwork.domain.model.UserSummary;
import com.socialnetwork.infrastructure.persistence.entity.GroupEntity;
import com.socialnetwork.infrastructure.persistence.entity.GroupInvitationEntity;
import com.socialnetwork.infrastructure.persistence.entity.GroupJoinRequestEntity;
import com.socialnetwork.infrastructure.persistence.entity.GroupMemberEntity;
import com.socialnetwork.infrastructure.persistence.entity.NotificationEntity;
import com.socialnetwork.infrastructure.persistence.entity.UserEntity;
import com.socialnetwork.infrastructure.persistence.entity.VoteEntity;
import com.socialnetwork.infrastructure.persistence.repository.GroupInvitationRepository;
import com.socialnetwork.infrastructure.persistence.repository.GroupJoinRequestRepository;
import com.socialnetwork.infrastructure.persistence.repository.GroupMemberRepository;
import com.socialnetwork.infrastructure.persistence.repository.GroupPostCommentRepository;
import com.socialnetwork.infrastructure.persistence.repository.GroupPostRepository;
import com.socialnetwork.infrastructure.persistence.repository.GroupRepository;
import com.socialnetwork.infrastructure.persistence.repository.OffsetPageRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Groups, membership, invitations and join requests.
 *
 * Roles:
 * - the creator is an ADMIN member, cannot leave and cannot be removed
 * - only the creator manages join requests, direct member additions, removals and deletion
 * - any member may invite
 *
 * Private groups are readable only by members, the creator and users holding a pending invitation.
 * Group chat participation follows membership.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GroupService {

    public static final int DEFAULT_LIMIT = 20;
    public static final int MAX_LIMIT = 100;

    private final GroupRepository groupRepository;
    private final GroupMemberRepository memberRepository;
    private final GroupInvitationRepository invitationRepository;
    private final GroupJoinRequestRepository joinRequestRepository;
    private final GroupPostRepository groupPostRepository;
    private final GroupPostCommentRepository groupPostCommentRepository;
    private final UserLookupService userLookupService;
    private final NotificationService notificationService;
    private final VoteService voteService;
    private final ChatService chatService;

    @Transactional(readOnly = true)
    public List<GroupView> list(Long viewerId, Integer limit, Integer offset) {
        int pageLimit = limit == null || limit < 1 ? DEFAULT_LIMIT : Math.min(limit, MAX_LIMIT);
        int pageOffset = offset == null || offset < 0 ? 0 : offset;

        List<GroupEntity> groups = groupRepository.findVisibleTo(viewerId, OffsetPageRequest.of(pageOffset, pageLimit));
        return toViews(groups, viewerId);
    }

    @Transactional(readOnly = true)
    public List<GroupView> userGroups(Long userId) {
        return toViews(groupRepository.findByMember(userId), userId);
    }

    /**
     * Create a group. The creator becomes ADMIN, the group chat is opened and
     * each listed user gets an invitation.
     */
    @Transactional
    public GroupView create(Long creatorId, GroupRequest request) {
        if (request.getName() == null || request.getName().isBlank()) {
            throw new BadRequestException("Group name is required");
        }
        UserEntity creator = userLookupService.require(creatorId);

        GroupEntity group = groupRepository.save(GroupEntity.builder()
                .name(request.getName().trim())
                .description(request.getDescription())
                .avatar(request.getAvatar())
                .privacy(request.getPrivacy() != null ? request.getPrivacy() : GroupEntity.Privacy.PUBLIC)
                .creatorId(creatorId)
                .build());

        memberRepository.save(GroupMemberEntity.builder()
                .groupId(group.getId())
                .userId(creatorId)
                .role(GroupMemberEntity.Role.ADMIN)
                .build());

        chatService.createGroupConversation(group);

        int invited = 0;
        if (request.getInviteeIds() != null) {
            for (Long inviteeId : new LinkedHashSet<>(request.getInviteeIds())) {
                if (!inviteeId.equals(creatorId) && userLookupService.exists(inviteeId)) {
                    createOrRenewInvitation(group, creator, inviteeId);
                    invited++;
                }
            }
        }

        log.info("Group {} created by user {} ({} invitations)", group.getId(), creatorId, invited);
        return get(group.getId(), creatorId);
    }

    @Transactional(readOnly = true)
    public GroupView get(Long groupId, Long viewerId) {
        GroupEntity group = requireReadable(groupId, viewerId);

        GroupView view = toViews(List.of(group), viewerId).get(0);
        if (Boolean.TRUE.equals(view.getIsJoined())) {
            view.setConversationId(chatService.groupConversationId(groupId));
        }
        return view;
    }

    @Transactional
    public GroupView update(Long groupId, Long actorId, GroupRequest request) {
        GroupEntity group = requireGroup(groupId);
        if (!isAdmin(groupId, actorId)) {
            throw new ForbiddenException("Only group admins can update the group");
        }

        if (request.getName() != null) {
            if (request.getName().isBlank()) {
                throw new BadRequestException("Group name cannot be empty");
            }
            group.setName(request.getName().trim());
        }
        if (request.getDescription() != null) {
            group.setDescription(request.getDescription());
        }
        if (request.getAvatar() != null) {
            group.setAvatar(request.getAvatar());
        }
        if (request.getPrivacy() != null) {
            group.setPrivacy(request.getPrivacy());
        }
        groupRepository.save(group);

        log.info("Group {} updated by user {}", groupId, actorId);
        return get(groupId, actorId);
    }

    /**
     * Delete a group (creator only). Members, invitations, requests, posts, comments,
     * events, messages and the group chat cascade in the database; votes are removed here.
     */
    @Transactional
    public void delete(Long groupId, Long actorId) {
        GroupEntity group = requireGroup(groupId);
        if (!group.isCreator(actorId)) {
            throw new ForbiddenException("Only the group creator can delete the group");
        }

        List<Long> postIds = groupPostRepository.findIdsByGroupId(groupId);
        if (!postIds.isEmpty()) {
            voteService.deleteVotes(VoteEntity.ContentType.GROUP_POST_COMMENT,
                    groupPostCommentRepository.findIdsByPostIds(postIds));
            voteService.deleteVotes(VoteEntity.ContentType.GROUP_POST, postIds);
        }
        groupRepository.delete(group);

        log.info("Group {} deleted by user {}", groupId, actorId);
    }

    @Transactional
    public void join(Long groupId, Long userId) {
        GroupEntity group = requireGroup(groupId);
        if (group.getPrivacy() == GroupEntity.Privacy.PRIVATE) {
            throw new ForbiddenException("This group is private, request to join instead");
        }
        if (memberRepository.existsByGroupIdAndUserId(groupId, userId)) {
            throw new ConflictException("You are already a member of this group");
        }

        addMember(groupId, userId);
        log.info("User {} joined group {}", userId, groupId);
    }

    @Transactional
    public void leave(Long groupId, Long userId) {
        GroupEntity group = requireGroup(groupId);
        if (group.isCreator(userId)) {
            throw new BadRequestException("The group creator cannot leave the group");
        }
        if (memberRepository.deleteMembership(groupId, userId) == 0) {
            throw new BadRequestException("You are not a member of this group");
        }

        chatService.removeGroupParticipant(groupId, userId);
        log.info("User {} left group {}", userId, groupId);
    }

    @Transactional(readOnly = true)
    public List<GroupMemberView> members(Long groupId, Long viewerId) {
        requireReadable(groupId, viewerId);

        List<GroupMemberEntity> members = memberRepository.findByGroupIdOrderByJoinedAtAsc(groupId);
        Map<Long, UserSummary> users = userLookupService.summaries(
                members.stream().map(GroupMemberEntity::getUserId).collect(Collectors.toList()));

        return members.stream()
                .filter(member -> users.containsKey(member.getUserId()))
                .map(member -> {
                    UserSummary user = users.get(member.getUserId());
                    return GroupMemberView.builder()
                            .userId(member.getUserId())
                            .firstName(user.getFirstName())
                            .lastName(user.getLastName())
                            .avatar(user.getAvatar())
                            .nickname(user.getNickname())
                            .role(member.getRole())
                            .joinedAt(member.getJoinedAt())
                            .build();
                })
                .collect(Collectors.toList());
    }

    /**
     * Invite several users at once (creator only). Users that are already members,
     * already invited, unknown, or the creator are skipped.
     *
     * @return number of invitations sent
     */
    @Transactional
    public int addMembers(Long groupId, Long actorId, List<Long> userIds) {
        GroupEntity group = requireGroup(groupId);
        if (!group.isCreator(actorId)) {
            throw new ForbiddenException("Only the group creator can add members");
        }
        if (userIds.isEmpty()) {
            throw new BadRequestException("No users to add");
        }
        UserEntity creator = userLookupService.require(actorId);

        int invited = 0;
        for (Long userId : new LinkedHashSet<>(userIds)) {
            if (userId.equals(actorId)
                    || !userLookupService.exists(userId)
                    || memberRepository.existsByGroupIdAndUserId(groupId, userId)
                    || invitationRepository.existsByGroupIdAndInviteeIdAndStatus(groupId, userId, GroupInvitationEntity.Status.PENDING)) {
                continue;
            }
            createOrRenewInvitation(group, creator, userId);
            invited++;
        }

        log.info("Group {}: {} of {} users invited by creator", groupId, invited, userIds.size());
        return invited;
    }

    @Transactional
    public void removeMember(Long groupId, Long actorId, Long memberId) {
        GroupEntity group = requireGroup(groupId);
        if (!group.isCreator(actorId)) {
            throw new ForbiddenException("Only the group creator can remove members");
        }
        if (group.isCreator(memberId)) {
            throw new BadRequestException("The group creator cannot be removed");
        }
        if (memberRepository.deleteMembership(groupId, memberId) == 0) {
            throw new BadRequestException("User is not a member of this group");
        }

        chatService.removeGroupParticipant(groupId, memberId);
        log.info("User {} removed from group {} by {}", memberId, groupId, actorId);
    }

    @Transactional
    public void invite(Long groupId, Long inviterId, Long inviteeId) {
        GroupEntity group = requireGroup(groupId);
        if (!memberRepository.existsByGroupIdAndUserId(groupId, inviterId)) {
            throw new ForbiddenException("Only group members can invite users");
        }
        if (!userLookupService.exists(inviteeId)) {
            throw new NotFoundException("User not found");
        }
        if (memberRepository.existsByGroupIdAndUserId(groupId, inviteeId)) {
            throw new ConflictException("User is already a member of this group");
        }
        if (invitationRepository.existsByGroupIdAndInviteeIdAndStatus(groupId, inviteeId, GroupInvitationEntity.Status.PENDING)) {
            throw new ConflictException("Invitation already sent");
        }

        createOrRenewInvitation(group, userLookupService.require(inviterId), inviteeId);
        log.info("User {} invited user {} to group {}", inviterId, inviteeId, groupId);
    }

    @Transactional(readOnly = true)
    public List<GroupInvitationView> invitations(Long userId) {
        List<GroupInvitationEntity> invitations = invitationRepository
                .findByInviteeIdAndStatusOrderByCreatedAtDesc(userId, GroupInvitationEntity.Status.PENDING);
        if (invitations.isEmpty()) {
            return List.of();
        }

        Map<Long, GroupEntity> groups = groupRepository.findAllById(
                        invitations.stream().map(GroupInvitationEntity::getGroupId).collect(Collectors.toSet()))
                .stream()
                .collect(Collectors.toMap(GroupEntity::getId, Function.identity()));
        Map<Long, UserSummary> inviters = userLookupService.summaries(
                invitations.stream().map(GroupInvitationEntity::getInviterId).collect(Collectors.toList()));

        return invitations.stream()
                .filter(invitation -> groups.containsKey(invitation.getGroupId()))
                .map(invitation -> GroupInvitationView.builder()
                        .id(invitation.getId())
                        .groupId(invitation.getGroupId())
                        .groupName(groups.get(invitation.getGroupId()).getName())
                        .inviter(inviters.get(invitation.getInviterId()))
                        .createdAt(invitation.getCreatedAt())
                        .build())
                .collect(Collectors.toList());
    }

    @Transactional
    public void acceptInvitation(Long invitationId, Long userId) {
        GroupInvitationEntity invitation = requirePendingInvitation(invitationId, userId);

        if (!memberRepository.existsByGroupIdAndUserId(invitation.getGroupId(), userId)) {
            addMember(invitation.getGroupId(), userId);
        }
        invitation.setStatus(GroupInvitationEntity.Status.ACCEPTED);
        invitationRepository.save(invitation);
        notificationService.deleteByReference(userId, NotificationEntity.Type.GROUP_INVITATION, invitation.getGroupId());

        log.info("User {} accepted invitation {} to group {}", userId, invitationId, invitation.getGroupId());
    }

    @Transactional
    public void rejectInvitation(Long invitationId, Long userId) {
        GroupInvitationEntity invitation = requirePendingInvitation(invitationId, userId);

        invitation.setStatus(GroupInvitationEntity.Status.DECLINED);
        invitationRepository.save(invitation);
        notificationService.deleteByReference(userId, NotificationEntity.Type.GROUP_INVITATION, invitation.getGroupId());

        log.info("User {} declined invitation {}", userId, invitationId);
    }

    /**
     * Ask to join a group. A previously declined request may be renewed.
     */
    @Transactional
    public Long requestJoin(Long groupId, Long userId, String message) {
        GroupEntity group = requireGroup(groupId);
        if (memberRepository.existsByGroupIdAndUserId(groupId, userId)) {
            throw new ConflictException("You are already a member of this group");
        }

        Optional<GroupJoinRequestEntity> existing = joinRequestRepository.findByGroupIdAndUserId(groupId, userId);
        if (existing.isPresent() && existing.get().getStatus() == GroupInvitationEntity.Status.PENDING) {
            throw new ConflictException("You have already requested to join this group");
        }

        GroupJoinRequestEntity request = existing.orElseGet(() -> GroupJoinRequestEntity.builder()
                .groupId(groupId)
                .userId(userId)
                .build());
        request.setMessage(message);
        request.setStatus(GroupInvitationEntity.Status.PENDING);
        request = joinRequestRepository.save(request);

        notificationService.groupJoinRequested(userLookupService.require(userId), group, request.getId());
        log.info("User {} requested to join group {}", userId, groupId);
        return request.getId();
    }

    @Transactional(readOnly = true)
    public List<JoinRequestView> joinRequests(Long groupId, Long actorId) {
        GroupEntity group = requireGroup(groupId);
        if (!group.isCreator(actorId)) {
            throw new ForbiddenException("Only the group creator can view join requests");
        }

        List<GroupJoinRequestEntity> requests = joinRequestRepository
                .findByGroupIdAndStatusOrderByCreatedAtAsc(groupId, GroupInvitationEntity.Status.PENDING);
        Map<Long, UserSummary> users = userLookupService.summaries(
                requests.stream().map(GroupJoinRequestEntity::getUserId).collect(Collectors.toList()));

        return requests.stream()
                .map(request -> JoinRequestView.builder()
                        .id(request.getId())
                        .groupId(groupId)
                        .user(users.get(request.getUserId()))
                        .message(request.getMessage())
                        .createdAt(request.getCreatedAt())
                        .build())
                .collect(Collectors.toList());
    }

    @Transactional
    public void acceptJoinRequest(Long requestId, Long actorId) {
        GroupJoinRequestEntity request = requirePendingJoinRequest(requestId, actorId);
        GroupEntity group = requireGroup(request.getGroupId());

        if (!memberRepository.existsByGroupIdAndUserId(group.getId(), request.getUserId())) {
            addMember(group.getId(), request.getUserId());
        }
        request.setStatus(GroupInvitationEntity.Status.ACCEPTED);
        joinRequestRepository.save(request);
        notificationService.deleteByReference(actorId, NotificationEntity.Type.GROUP_JOIN_REQUEST, requestId);
        notificationService.groupJoinAccepted(group, actorId, request.getUserId());

        log.info("Join request {} accepted, user {} joined group {}", requestId, request.getUserId(), group.getId());
    }

    @Transactional
    public void rejectJoinRequest(Long requestId, Long actorId) {
        GroupJoinRequestEntity request = requirePendingJoinRequest(requestId, actorId);

        request.setStatus(GroupInvitationEntity.Status.DECLINED);
        joinRequestRepository.save(request);
        notificationService.deleteByReference(actorId, NotificationEntity.Type.GROUP_JOIN_REQUEST, requestId);
        log.info("Join request {} rejected", requestId);
    }

    public GroupEntity requireGroup(Long groupId) {
        return groupRepository.findById(groupId)
                .orElseThrow(() -> new NotFoundException("Group not found"));
    }

    /**
     * @throws ForbiddenException when the user is not a member
     */
    public GroupMemberEntity requireMember(Long groupId, Long userId) {
        return memberRepository.findByGroupIdAndUserId(groupId, userId)
                .orElseThrow(() -> new ForbiddenException("You must be a member of this group"));
    }

    public boolean isAdmin(Long groupId, Long userId) {
        return memberRepository.findByGroupIdAndUserId(groupId, userId)
                .map(member -> member.getRole() == GroupMemberEntity.Role.ADMIN)
                .orElse(false);
    }

    private GroupEntity requireReadable(Long groupId, Long viewerId) {
        GroupEntity group = requireGroup(groupId);
        if (group.getPrivacy() == GroupEntity.Privacy.PRIVATE
                && !group.isCreator(viewerId)
                && !memberRepository.existsByGroupIdAndUserId(groupId, viewerId)
                && !invitationRepository.existsByGroupIdAndInviteeIdAndStatus(groupId, viewerId, GroupInvitationEntity.Status.PENDING)) {
            log.warn("User {} denied access to private group {}", viewerId, groupId);
            throw new ForbiddenException("This group is private");
        }
        return group;
    }

    private void addMember(Long groupId, Long userId) {
        memberRepository.save(GroupMemberEntity.builder()
                .groupId(groupId)
                .userId(userId)
                .role(GroupMemberEntity.Role.MEMBER)
                .build());
        chatService.addGroupParticipant(groupId, userId);
    }

    private void createOrRenewInvitation(GroupEntity group, UserEntity inviter, Long inviteeId) {
        GroupInvitationEntity invitation = invitationRepository.findByGroupIdAndInviteeId(group.getId(), inviteeId)
                .orElseGet(() -> GroupInvitationEntity.builder()
                        .groupId(group.getId())
                        .inviteeId(inviteeId)
                        .build());
        invitation.setInviterId(inviter.getId());
        invitation.setStatus(GroupInvitationEntity.Status.PENDING);
        invitationRepository.save(invitation);

        notificationService.groupInvitation(inviter, inviteeId, group);
    }

    private GroupInvitationEntity requirePendingInvitation(Long invitationId, Long userId) {
        GroupInvitationEntity invitation = invitationRepository.findById(invitationId)
                .filter(inv -> inv.getInviteeId().equals(userId))
                .orElseThrow(() -> new NotFoundException("Invitation not found"));
        if (invitation.getStatus() != GroupInvitationEntity.Status.PENDING) {
            throw new BadRequestException("Invitation is no longer pending");
        }
        return invitation;
    }

    private GroupJoinRequestEntity requirePendingJoinRequest(Long requestId, Long actorId) {
        GroupJoinRequestEntity request = joinRequestRepository.findById(requestId)
                .orElseThrow(() -> new NotFoundException("Join request not found"));
        GroupEntity group = requireGroup(request.getGroupId());
        if (!group.isCreator(actorId)) {
            throw new ForbiddenException("Only the group creator can handle join requests");
        }
        if (request.getStatus() != GroupInvitationEntity.Status.PENDING) {
            throw new BadRequestException("Join request is no longer pending");
        }
        return request;
    }

    private List<GroupView> toViews(List<GroupEntity> groups, Long viewerId) {
        if (groups.isEmpty()) {
            return List.of();
        }
        Set<Long> groupIds = groups.stream().map(GroupEntity::getId).collect(Collectors.toSet());

        Map<Long, Long> memberCounts = new HashMap<>();
        for (Object[] row : memberRepository.countByGroupIds(groupIds)) {
            memberCounts.put((Long) row[0], ((Number) row[1]).longValue());
        }

        Map<Long, GroupMemberEntity.Role> roles = memberRepository.findByUserIdAndGroupIdIn(viewerId, groupIds).stream()
                .collect(Collectors.toMap(GroupMemberEntity::getGroupId, GroupMemberEntity::getRole));
        Set<Long> invitedTo = invitationRepository
                .findByInviteeIdAndStatusAndGroupIdIn(viewerId, GroupInvitationEntity.Status.PENDING, groupIds).stream()
                .map(GroupInvitationEntity::getGroupId)
                .collect(Collectors.toSet());
        Set<Long> requested = joinRequestRepository
                .findByUserIdAndStatusAndGroupIdIn(viewerId, GroupInvitationEntity.Status.PENDING, groupIds).stream()
                .map(GroupJoinRequestEntity::getGroupId)
                .collect(Collectors.toSet());
        Map<Long, UserSummary> creators = userLookupService.summaries(
                groups.stream().map(GroupEntity::getCreatorId).collect(Collectors.toList()));

        return groups.stream()
                .map(group -> {
                    UserSummary creator = creators.get(group.getCreatorId());
                    return GroupView.builder()
                            .id(group.getId())
                            .name(group.getName())
                            .description(group.getDescription())
                            .avatar(group.getAvatar())
                            .privacy(group.getPrivacy())
                            .creatorId(group.getCreatorId())
                            .creatorName(creator == null ? null : creator.getFirstName() + " " + creator.getLastName())
                            .memberCount(memberCounts.getOrDefault(group.getId(), 0L))
                            .createdAt(group.getCreatedAt())
                            .isJoined(roles.containsKey(group.getId()))
                            .isPending(invitedTo.contains(group.getId()))
                            .hasJoinRequest(requested.contains(group.getId()))
                            .userRole(roles.get(group.getId()))
                            .build();
                })
                .collect(Collectors.toList());
    }
}
