package com.socialnetwork.domain.service;

import com.socialnetwork.domain.exception.BadRequestException;
import com.socialnetwork.domain.exception.ConflictException;
import com.socialnetwork.domain.exception.ForbiddenException;
import com.socialnetwork.domain.exception.NotFoundException;
import com.socialnetwork.domain.model.FollowCounts;
import com.socialnetwork.domain.model.FollowRequestView;
import com.socialnetwork.domain.model.FollowResult;
import com.socialnetwork.domain.model.FollowStatus;
import com.socialnetwork.domain.model.UserSummary;
import com.socialnetwork.infrastructure.cache.AfterCommit;
import com.socialnetwork.infrastructure.cache.SocialCacheService;
import com.socialnetwork.infrastructure.persistence.entity.FollowEntity;
import com.socialnetwork.infrastructure.persistence.entity.FollowRequestEntity;
import com.socialnetwork.infrastructure.persistence.entity.NotificationEntity;
import com.socialnetwork.infrastructure.persistence.entity.UserEntity;
import com.socialnetwork.infrastructure.persistence.repository.FollowRepository;
import com.socialnetwork.infrastructure.persistence.repository.FollowRequestRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Follow relationships and follow requests.
 *
 * Public accounts are followed directly. Private accounts receive a follow request
 * that the owner accepts (creating the follow edge) or rejects. Making a private
 * account public approves every pending request.
 *
 * Follower/following counts are cached per user and evicted whenever an edge changes.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FollowService {

    private final FollowRepository followRepository;
    private final FollowRequestRepository followRequestRepository;
    private final UserLookupService userLookupService;
    private final NotificationService notificationService;
    private final SocialCacheService cacheService;

    @Value("${app.cache.ttl.follow-counts:300}")
    private long countsTtl;

    @Transactional
    public FollowResult follow(Long followerId, Long targetId) {
        if (followerId.equals(targetId)) {
            throw new BadRequestException("You cannot follow yourself");
        }

        UserEntity target = userLookupService.require(targetId);
        UserEntity follower = userLookupService.require(followerId);

        if (followRepository.existsByFollowerIdAndFollowingId(followerId, targetId)) {
            throw new ConflictException("You are already following this user");
        }

        if (target.isPublic()) {
            followRepository.save(FollowEntity.builder()
                    .followerId(followerId)
                    .followingId(targetId)
                    .build());
            notificationService.followed(follower, targetId);
            evictCounts(followerId, targetId);

            log.info("User {} followed user {}", followerId, targetId);
            return FollowResult.builder()
                    .status(FollowResult.FOLLOWED)
                    .message("You are now following " + target.getFullName())
                    .build();
        }

        Optional<FollowRequestEntity> existing = followRequestRepository.findByRequesterIdAndRequestedId(followerId, targetId);
        if (existing.isPresent()) {
            return FollowResult.builder()
                    .status(FollowResult.REQUEST_SENT)
                    .requestId(existing.get().getId())
                    .message("Follow request already sent")
                    .build();
        }

        FollowRequestEntity request = followRequestRepository.save(FollowRequestEntity.builder()
                .requesterId(followerId)
                .requestedId(targetId)
                .build());
        notificationService.followRequested(follower, targetId, request.getId());

        log.info("User {} requested to follow user {} (request {})", followerId, targetId, request.getId());
        return FollowResult.builder()
                .status(FollowResult.REQUEST_SENT)
                .requestId(request.getId())
                .message("Follow request sent")
                .build();
    }

    @Transactional
    public void unfollow(Long followerId, Long targetId) {
        if (followRepository.deletePair(followerId, targetId) == 0) {
            throw new NotFoundException("You are not following this user");
        }
        evictCounts(followerId, targetId);
        log.info("User {} unfollowed user {}", followerId, targetId);
    }

    @Transactional(readOnly = true)
    public FollowStatus status(Long viewerId, Long targetId) {
        return FollowStatus.builder()
                .isFollowing(followRepository.existsByFollowerIdAndFollowingId(viewerId, targetId))
                .followRequestSent(followRequestRepository.existsByRequesterIdAndRequestedId(viewerId, targetId))
                .isFollowedBy(followRepository.existsByFollowerIdAndFollowingId(targetId, viewerId))
                .build();
    }

    @Transactional(readOnly = true)
    public boolean isFollowing(Long followerId, Long targetId) {
        return followRepository.existsByFollowerIdAndFollowingId(followerId, targetId);
    }

    @Transactional(readOnly = true)
    public List<FollowRequestView> pendingRequests(Long userId) {
        List<FollowRequestEntity> requests = followRequestRepository.findByRequestedIdOrderByCreatedAtDesc(userId);
        Map<Long, UserSummary> requesters = userLookupService.summaries(
                requests.stream().map(FollowRequestEntity::getRequesterId).collect(Collectors.toList()));

        return requests.stream()
                .filter(request -> requesters.containsKey(request.getRequesterId()))
                .map(request -> FollowRequestView.builder()
                        .id(request.getId())
                        .requester(requesters.get(request.getRequesterId()))
                        .createdAt(request.getCreatedAt())
                        .build())
                .collect(Collectors.toList());
    }

    /**
     * Accept a follow request addressed to {@code userId}.
     *
     * Creating the follow edge and deleting the request happen in one transaction.
     */
    @Transactional
    public void acceptRequest(Long requestId, Long userId) {
        FollowRequestEntity request = requireOwnRequest(requestId, userId);
        UserEntity accepter = userLookupService.require(userId);

        approve(request, accepter);
        log.info("User {} accepted follow request {} from user {}", userId, requestId, request.getRequesterId());
    }

    @Transactional
    public void rejectRequest(Long requestId, Long userId) {
        FollowRequestEntity request = requireOwnRequest(requestId, userId);

        followRequestRepository.delete(request);
        notificationService.deleteByReference(userId, NotificationEntity.Type.FOLLOW_REQUEST, requestId);
        notificationService.evictUnreadCount(userId);
        log.info("User {} rejected follow request {}", userId, requestId);
    }

    /**
     * Withdraw the request {@code requesterId} sent to {@code targetId}.
     */
    @Transactional
    public void cancelRequest(Long requesterId, Long targetId) {
        FollowRequestEntity request = followRequestRepository.findByRequesterIdAndRequestedId(requesterId, targetId)
                .orElseThrow(() -> new NotFoundException("Follow request not found"));

        followRequestRepository.delete(request);
        notificationService.deleteByReference(targetId, NotificationEntity.Type.FOLLOW_REQUEST, request.getId());
        notificationService.evictUnreadCount(targetId);
        log.info("User {} cancelled follow request to user {}", requesterId, targetId);
    }

    /**
     * Approve every pending request addressed to {@code userId}. Used when a profile goes public.
     *
     * @return number of requests approved
     */
    @Transactional
    public int approveAllPending(Long userId) {
        List<FollowRequestEntity> pending = followRequestRepository.findByRequestedIdOrderByCreatedAtDesc(userId);
        if (pending.isEmpty()) {
            return 0;
        }

        UserEntity accepter = userLookupService.require(userId);
        pending.forEach(request -> approve(request, accepter));

        log.info("Auto-approved {} follow requests for user {}", pending.size(), userId);
        return pending.size();
    }

    @Transactional
    public void removeFollower(Long userId, Long followerId) {
        if (followRepository.deletePair(followerId, userId) == 0) {
            throw new NotFoundException("This user is not following you");
        }
        evictCounts(followerId, userId);
        log.info("User {} removed follower {}", userId, followerId);
    }

    @Transactional(readOnly = true)
    public List<UserSummary> followers(Long userId) {
        return followRepository.findFollowers(userId).stream()
                .map(UserLookupService::toSummary)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public List<UserSummary> following(Long userId) {
        return followRepository.findFollowing(userId).stream()
                .map(UserLookupService::toSummary)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public List<Long> followerIds(Long userId) {
        return followRepository.findFollowerIds(userId);
    }

    @Transactional(readOnly = true)
    public FollowCounts counts(Long userId) {
        Optional<FollowCounts> cached = cacheService.lookup(SocialCacheService.Region.FOLLOW_COUNTS, userId, FollowCounts.class);
        if (cached.isPresent()) {
            return cached.get();
        }

        FollowCounts counts = FollowCounts.builder()
                .followers(followRepository.countByFollowingId(userId))
                .following(followRepository.countByFollowerId(userId))
                .build();

        cacheService.store(SocialCacheService.Region.FOLLOW_COUNTS, userId, counts, Duration.ofSeconds(countsTtl));
        return counts;
    }

    private FollowRequestEntity requireOwnRequest(Long requestId, Long userId) {
        FollowRequestEntity request = followRequestRepository.findById(requestId)
                .orElseThrow(() -> new NotFoundException("Follow request not found"));
        if (!request.getRequestedId().equals(userId)) {
            throw new ForbiddenException("This follow request is not addressed to you");
        }
        return request;
    }

    private void approve(FollowRequestEntity request, UserEntity accepter) {
        Long requesterId = request.getRequesterId();

        if (!followRepository.existsByFollowerIdAndFollowingId(requesterId, accepter.getId())) {
            followRepository.save(FollowEntity.builder()
                    .followerId(requesterId)
                    .followingId(accepter.getId())
                    .build());
        }
        followRequestRepository.delete(request);

        notificationService.deleteByReference(accepter.getId(), NotificationEntity.Type.FOLLOW_REQUEST, request.getId());
        notificationService.followAccepted(accepter, requesterId);
        notificationService.evictUnreadCount(accepter.getId());
        evictCounts(requesterId, accepter.getId());
    }

    private void evictCounts(Long... userIds) {
        AfterCommit.run(() -> cacheService.evict(SocialCacheService.Region.FOLLOW_COUNTS, userIds));
    }
}
