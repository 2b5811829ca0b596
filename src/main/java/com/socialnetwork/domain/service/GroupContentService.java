package com.socialnetwork.domain.service;

import com.socialnetwork.domain.exception.BadRequestException;
import com.socialnetwork.domain.exception.ForbiddenException;
import com.socialnetwork.domain.exception.NotFoundException;
import com.socialnetwork.domain.model.ContentRequest;
import com.socialnetwork.domain.model.GroupCommentView;
import com.socialnetwork.domain.model.GroupEventRequest;
import com.socialnetwork.domain.model.GroupEventView;
import com.socialnetwork.domain.model.GroupPostView;
import com.socialnetwork.domain.model.UserSummary;
import com.socialnetwork.domain.model.VoteResult;
import com.socialnetwork.infrastructure.persistence.entity.GroupEntity;
import com.socialnetwork.infrastructure.persistence.entity.GroupEventEntity;
import com.socialnetwork.infrastructure.persistence.entity.GroupEventResponseEntity;
import com.socialnetwork.infrastructure.persistence.entity.GroupPostCommentEntity;
import com.socialnetwork.infrastructure.persistence.entity.GroupPostEntity;
import com.socialnetwork.infrastructure.persistence.entity.UserEntity;
import com.socialnetwork.infrastructure.persistence.entity.VoteEntity;
import com.socialnetwork.infrastructure.persistence.repository.GroupEventRepository;
import com.socialnetwork.infrastructure.persistence.repository.GroupEventResponseRepository;
import com.socialnetwork.infrastructure.persistence.repository.GroupMemberRepository;
import com.socialnetwork.infrastructure.persistence.repository.GroupPostCommentRepository;
import com.socialnetwork.infrastructure.persistence.repository.GroupPostRepository;
import com.socialnetwork.infrastructure.persistence.repository.OffsetPageRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Posts, comments and events inside a group. Every operation requires membership.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GroupContentService {

    public static final int DEFAULT_LIMIT = 20;
    public static final int MAX_LIMIT = 100;

    private final GroupService groupService;
    private final GroupMemberRepository memberRepository;
    private final GroupPostRepository postRepository;
    private final GroupPostCommentRepository commentRepository;
    private final GroupEventRepository eventRepository;
    private final GroupEventResponseRepository responseRepository;
    private final VoteService voteService;
    private final NotificationService notificationService;
    private final UserLookupService userLookupService;

    @Transactional(readOnly = true)
    public List<GroupPostView> posts(Long groupId, Long viewerId, Integer limit, Integer offset) {
        requireMembership(groupId, viewerId);

        int pageLimit = limit == null || limit < 1 ? DEFAULT_LIMIT : Math.min(limit, MAX_LIMIT);
        int pageOffset = offset == null || offset < 0 ? 0 : offset;

        List<GroupPostEntity> posts = postRepository.findByGroupIdOrderByCreatedAtDescIdDesc(
                groupId, OffsetPageRequest.of(pageOffset, pageLimit));
        return postViews(posts, viewerId);
    }

    @Transactional
    public GroupPostView createPost(Long groupId, Long authorId, ContentRequest request) {
        requireMembership(groupId, authorId);
        if (request.getContent() == null || request.getContent().isBlank()) {
            throw new BadRequestException("Content is required");
        }

        GroupPostEntity post = postRepository.save(GroupPostEntity.builder()
                .groupId(groupId)
                .authorId(authorId)
                .content(request.getContent().trim())
                .imagePath(blankToNull(request.getImageUrl()))
                .build());

        log.info("Group post {} created in group {} by user {}", post.getId(), groupId, authorId);
        return postViews(List.of(post), authorId).get(0);
    }

    /**
     * Delete a group post. Allowed for the author and group admins.
     */
    @Transactional
    public void deletePost(Long postId, Long actorId) {
        GroupPostEntity post = requirePost(postId);
        requireMembership(post.getGroupId(), actorId);

        if (!post.getAuthorId().equals(actorId) && !groupService.isAdmin(post.getGroupId(), actorId)) {
            throw new ForbiddenException("You can only delete your own posts");
        }

        voteService.deleteVotes(VoteEntity.ContentType.GROUP_POST_COMMENT, commentRepository.findIdsByPostIds(List.of(postId)));
        voteService.deleteVotes(VoteEntity.ContentType.GROUP_POST, List.of(postId));
        postRepository.delete(post);

        log.info("Group post {} deleted by user {}", postId, actorId);
    }

    @Transactional
    public VoteResult votePost(Long postId, Long userId, Integer voteType) {
        GroupPostEntity post = requirePost(postId);
        requireMembership(post.getGroupId(), userId);
        return voteService.vote(userId, VoteEntity.ContentType.GROUP_POST, postId, voteType);
    }

    @Transactional(readOnly = true)
    public List<GroupCommentView> comments(Long postId, Long viewerId) {
        GroupPostEntity post = requirePost(postId);
        requireMembership(post.getGroupId(), viewerId);
        return commentViews(commentRepository.findByPostIdOrderByCreatedAtAscIdAsc(postId), viewerId);
    }

    @Transactional
    public GroupCommentView addComment(Long postId, Long authorId, ContentRequest request) {
        GroupPostEntity post = requirePost(postId);
        requireMembership(post.getGroupId(), authorId);

        String content = request.getContent() == null ? "" : request.getContent().trim();
        String imagePath = blankToNull(request.getImageUrl());
        if (content.isEmpty() && imagePath == null) {
            throw new BadRequestException("Comment content is required");
        }

        GroupPostCommentEntity comment = commentRepository.save(GroupPostCommentEntity.builder()
                .postId(postId)
                .authorId(authorId)
                .content(content)
                .imagePath(imagePath)
                .build());
        postRepository.adjustCommentsCount(postId, 1);

        if (!post.getAuthorId().equals(authorId)) {
            UserEntity commenter = userLookupService.require(authorId);
            notificationService.groupPostCommented(commenter, post.getAuthorId(), postId);
        }

        log.info("Comment {} added to group post {} by user {}", comment.getId(), postId, authorId);
        return commentViews(List.of(comment), authorId).get(0);
    }

    /**
     * Delete a comment. Allowed for the comment author and the post author.
     */
    @Transactional
    public void deleteComment(Long postId, Long commentId, Long actorId) {
        GroupPostCommentEntity comment = commentRepository.findById(commentId)
                .filter(c -> c.getPostId().equals(postId))
                .orElseThrow(() -> new NotFoundException("Comment not found"));
        GroupPostEntity post = requirePost(postId);
        requireMembership(post.getGroupId(), actorId);

        if (!comment.getAuthorId().equals(actorId) && !post.getAuthorId().equals(actorId)) {
            throw new ForbiddenException("You can only delete your own comments or comments on your posts");
        }

        voteService.deleteVotes(VoteEntity.ContentType.GROUP_POST_COMMENT, List.of(commentId));
        commentRepository.delete(comment);
        postRepository.adjustCommentsCount(postId, -1);

        log.info("Group comment {} deleted by user {}", commentId, actorId);
    }

    @Transactional
    public VoteResult voteComment(Long postId, Long commentId, Long userId, Integer voteType) {
        GroupPostEntity post = requirePost(postId);
        requireMembership(post.getGroupId(), userId);
        commentRepository.findById(commentId)
                .filter(c -> c.getPostId().equals(postId))
                .orElseThrow(() -> new NotFoundException("Comment not found"));
        return voteService.vote(userId, VoteEntity.ContentType.GROUP_POST_COMMENT, commentId, voteType);
    }

    @Transactional(readOnly = true)
    public List<GroupEventView> events(Long groupId, Long viewerId) {
        requireMembership(groupId, viewerId);
        return eventViews(eventRepository.findByGroupIdOrderByEventDateAsc(groupId), viewerId);
    }

    /**
     * Create an event. Every other member receives a GROUP_EVENT notification.
     */
    @Transactional
    public GroupEventView createEvent(Long groupId, Long creatorId, GroupEventRequest request) {
        GroupEntity group = requireMembership(groupId, creatorId);
        if (request.getTitle() == null || request.getTitle().isBlank()) {
            throw new BadRequestException("Title is required");
        }
        if (request.getEventDate() == null) {
            throw new BadRequestException("Event date is required");
        }

        GroupEventEntity event = eventRepository.save(GroupEventEntity.builder()
                .groupId(groupId)
                .creatorId(creatorId)
                .title(request.getTitle().trim())
                .description(blankToNull(request.getDescription()))
                .eventDate(request.getEventDate())
                .build());

        UserEntity creator = userLookupService.require(creatorId);
        int notified = 0;
        for (Long memberId : memberRepository.findUserIdsByGroupId(groupId)) {
            if (!memberId.equals(creatorId)) {
                notificationService.groupEventCreated(creator, memberId, group, event.getTitle());
                notified++;
            }
        }

        log.info("Event {} created in group {} by user {} ({} members notified)", event.getId(), groupId, creatorId, notified);
        return eventViews(List.of(event), creatorId).get(0);
    }

    /**
     * Record a response: {@code going}, {@code not_going}, or {@code remove} to clear it.
     */
    @Transactional
    public GroupEventView respond(Long eventId, Long userId, String response) {
        GroupEventEntity event = requireEvent(eventId);
        requireMembership(event.getGroupId(), userId);

        String normalized = response == null ? "" : response.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "going" -> saveResponse(eventId, userId, GroupEventResponseEntity.Response.GOING);
            case "not_going" -> saveResponse(eventId, userId, GroupEventResponseEntity.Response.NOT_GOING);
            case "remove" -> responseRepository.deleteResponse(eventId, userId);
            default -> throw new BadRequestException("Invalid response, must be going, not_going or remove");
        }

        log.debug("User {} responded {} to event {}", userId, normalized, eventId);
        return eventViews(List.of(event), userId).get(0);
    }

    /**
     * Delete an event. Allowed for the event creator and group admins.
     */
    @Transactional
    public void deleteEvent(Long eventId, Long actorId) {
        GroupEventEntity event = requireEvent(eventId);
        requireMembership(event.getGroupId(), actorId);

        if (!event.getCreatorId().equals(actorId) && !groupService.isAdmin(event.getGroupId(), actorId)) {
            throw new ForbiddenException("Only the event creator or a group admin can delete this event");
        }

        eventRepository.delete(event);
        log.info("Event {} deleted by user {}", eventId, actorId);
    }

    private GroupEntity requireMembership(Long groupId, Long userId) {
        GroupEntity group = groupService.requireGroup(groupId);
        groupService.requireMember(groupId, userId);
        return group;
    }

    private GroupPostEntity requirePost(Long postId) {
        return postRepository.findById(postId)
                .orElseThrow(() -> new NotFoundException("Group post not found"));
    }

    private GroupEventEntity requireEvent(Long eventId) {
        return eventRepository.findById(eventId)
                .orElseThrow(() -> new NotFoundException("Event not found"));
    }

    private void saveResponse(Long eventId, Long userId, GroupEventResponseEntity.Response response) {
        GroupEventResponseEntity entity = responseRepository.findByEventIdAndUserId(eventId, userId)
                .orElseGet(() -> GroupEventResponseEntity.builder()
                        .eventId(eventId)
                        .userId(userId)
                        .build());
        entity.setResponse(response);
        responseRepository.save(entity);
    }

    private List<GroupPostView> postViews(List<GroupPostEntity> posts, Long viewerId) {
        if (posts.isEmpty()) {
            return List.of();
        }
        Map<Long, UserSummary> authors = userLookupService.summaries(
                posts.stream().map(GroupPostEntity::getAuthorId).collect(Collectors.toList()));
        Map<Long, Integer> votes = voteService.userVotes(viewerId, VoteEntity.ContentType.GROUP_POST,
                posts.stream().map(GroupPostEntity::getId).collect(Collectors.toList()));

        return posts.stream()
                .map(post -> GroupPostView.builder()
                        .id(post.getId())
                        .groupId(post.getGroupId())
                        .content(post.getContent())
                        .imagePath(post.getImagePath())
                        .commentsCount(post.getCommentsCount())
                        .upvotes(post.getUpvotes())
                        .downvotes(post.getDownvotes())
                        .userVote(votes.getOrDefault(post.getId(), 0))
                        .author(authors.get(post.getAuthorId()))
                        .createdAt(post.getCreatedAt())
                        .build())
                .collect(Collectors.toList());
    }

    private List<GroupCommentView> commentViews(List<GroupPostCommentEntity> comments, Long viewerId) {
        if (comments.isEmpty()) {
            return List.of();
        }
        Map<Long, UserSummary> authors = userLookupService.summaries(
                comments.stream().map(GroupPostCommentEntity::getAuthorId).collect(Collectors.toList()));
        Map<Long, Integer> votes = voteService.userVotes(viewerId, VoteEntity.ContentType.GROUP_POST_COMMENT,
                comments.stream().map(GroupPostCommentEntity::getId).collect(Collectors.toList()));

        return comments.stream()
                .map(comment -> GroupCommentView.builder()
                        .id(comment.getId())
                        .postId(comment.getPostId())
                        .content(comment.getContent())
                        .imagePath(comment.getImagePath())
                        .voteCount(comment.getVoteCount())
                        .upvotes(comment.getUpvotes())
                        .downvotes(comment.getDownvotes())
                        .userVote(votes.getOrDefault(comment.getId(), 0))
                        .author(authors.get(comment.getAuthorId()))
                        .createdAt(comment.getCreatedAt())
                        .build())
                .collect(Collectors.toList());
    }

    private List<GroupEventView> eventViews(List<GroupEventEntity> events, Long viewerId) {
        if (events.isEmpty()) {
            return List.of();
        }
        List<Long> eventIds = events.stream().map(GroupEventEntity::getId).collect(Collectors.toList());

        Map<Long, Long> going = new HashMap<>();
        Map<Long, Long> notGoing = new HashMap<>();
        for (Object[] row : responseRepository.countByEventIds(eventIds)) {
            Long eventId = (Long) row[0];
            long count = ((Number) row[2]).longValue();
            if (row[1] == GroupEventResponseEntity.Response.GOING) {
                going.put(eventId, count);
            } else {
                notGoing.put(eventId, count);
            }
        }

        Map<Long, GroupEventResponseEntity.Response> responses = responseRepository
                .findByUserIdAndEventIdIn(viewerId, eventIds).stream()
                .collect(Collectors.toMap(GroupEventResponseEntity::getEventId, GroupEventResponseEntity::getResponse));
        Map<Long, UserSummary> creators = userLookupService.summaries(
                events.stream().map(GroupEventEntity::getCreatorId).collect(Collectors.toList()));

        return events.stream()
                .map(event -> GroupEventView.builder()
                        .id(event.getId())
                        .groupId(event.getGroupId())
                        .creatorId(event.getCreatorId())
                        .title(event.getTitle())
                        .description(event.getDescription())
                        .eventDate(event.getEventDate())
                        .goingCount(going.getOrDefault(event.getId(), 0L))
                        .notGoingCount(notGoing.getOrDefault(event.getId(), 0L))
                        .userResponse(responses.get(event.getId()))
                        .creator(creators.get(event.getCreatorId()))
                        .createdAt(event.getCreatedAt())
                        .build())
                .collect(Collectors.toList());
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
