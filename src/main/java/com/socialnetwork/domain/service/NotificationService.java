package com.socialnetwork.domain.service;

import com.socialnetwork.domain.exception.BadRequestException;
import com.socialnetwork.domain.exception.NotFoundException;
import com.socialnetwork.domain.model.NotificationPage;
import com.socialnetwork.domain.model.NotificationView;
import com.socialnetwork.domain.model.UserSummary;
import com.socialnetwork.infrastructure.cache.AfterCommit;
import com.socialnetwork.infrastructure.cache.SocialCacheService;
import com.socialnetwork.infrastructure.persistence.entity.FollowRequestEntity;
import com.socialnetwork.infrastructure.persistence.entity.GroupEntity;
import com.socialnetwork.infrastructure.persistence.entity.NotificationEntity;
import com.socialnetwork.infrastructure.persistence.entity.UserEntity;
import com.socialnetwork.infrastructure.persistence.repository.FollowRequestRepository;
import com.socialnetwork.infrastructure.persistence.repository.NotificationRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Notification service.
 *
 * Notifications come from two tables:
 * 1. notifications: everything stored explicitly (follows, messages, group activity)
 * 2. follow_requests: each pending request is also shown as a FOLLOW_REQUEST entry
 *
 * Listing merges both sources:
 * - a stored FOLLOW_REQUEST whose request was resolved is dropped
 * - a stored and a synthetic entry for the same request collapse into the stored one
 * - the result is ordered newest first, then sliced by offset/limit
 *
 * Unread count = unread stored notifications (excluding FOLLOW_REQUEST) + pending requests,
 * so a request is never counted twice. The count is cached in Redis and evicted on writes.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationService {

    public static final int DEFAULT_LIMIT = 20;
    public static final int MAX_LIMIT = 100;

    private static final Comparator<NotificationView> NEWEST_FIRST = Comparator
            .comparing(NotificationView::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(NotificationView::getId, Comparator.nullsLast(Comparator.reverseOrder()));

    private final NotificationRepository notificationRepository;
    private final FollowRequestRepository followRequestRepository;
    private final UserLookupService userLookupService;
    private final SocialCacheService cacheService;
    private final MeterRegistry meterRegistry;

    @Value("${app.cache.ttl.unread-count:60}")
    private long unreadCountTtl;

    /**
     * Store a notification. Self-notifications are skipped.
     */
    @Transactional
    public Optional<NotificationEntity> notify(Long receiverId, Long senderId, NotificationEntity.Type type,
                                               String content, Long referenceId) {
        if (senderId != null && senderId.equals(receiverId)) {
            return Optional.empty();
        }

        NotificationEntity notification = notificationRepository.save(NotificationEntity.builder()
                .receiverId(receiverId)
                .senderId(senderId)
                .type(type)
                .content(content)
                .referenceId(referenceId)
                .build());

        Counter.builder("notifications.created")
                .tag("type", type.name().toLowerCase(Locale.ROOT))
                .register(meterRegistry)
                .increment();

        evictUnreadCount(receiverId);
        log.debug("Notification {} ({}) stored for user {}", notification.getId(), type, receiverId);
        return Optional.of(notification);
    }

    // Typed helpers. The wording here is what clients display.

    public void followed(UserEntity follower, Long followedId) {
        notify(followedId, follower.getId(), NotificationEntity.Type.FOLLOW,
                follower.getFullName() + " started following you", follower.getId());
    }

    public void followRequested(UserEntity requester, Long requestedId, Long requestId) {
        notify(requestedId, requester.getId(), NotificationEntity.Type.FOLLOW_REQUEST,
                requester.getFullName() + " wants to follow you", requestId);
    }

    public void followAccepted(UserEntity accepter, Long requesterId) {
        notify(requesterId, accepter.getId(), NotificationEntity.Type.FOLLOW_ACCEPTED,
                accepter.getFullName() + " accepted your follow request", accepter.getId());
    }

    public void messageReceived(UserEntity sender, Long receiverId, Long conversationId) {
        notify(receiverId, sender.getId(), NotificationEntity.Type.MESSAGE,
                sender.getFullName() + " sent you a message", conversationId);
    }

    public void groupInvitation(UserEntity inviter, Long inviteeId, GroupEntity group) {
        notify(inviteeId, inviter.getId(), NotificationEntity.Type.GROUP_INVITATION,
                inviter.getFullName() + " invited you to join " + group.getName(), group.getId());
    }

    /**
     * References the join request, so the creator can act on it and it can be cleared once handled.
     */
    public void groupJoinRequested(UserEntity requester, GroupEntity group, Long requestId) {
        notify(group.getCreatorId(), requester.getId(), NotificationEntity.Type.GROUP_JOIN_REQUEST,
                requester.getFullName() + " requested to join " + group.getName(), requestId);
    }

    public void groupJoinAccepted(GroupEntity group, Long approverId, Long requesterId) {
        notify(requesterId, approverId, NotificationEntity.Type.GROUP_JOIN_ACCEPTED,
                "Your request to join " + group.getName() + " was accepted", group.getId());
    }

    public void groupEventCreated(UserEntity creator, Long receiverId, GroupEntity group, String title) {
        notify(receiverId, creator.getId(), NotificationEntity.Type.GROUP_EVENT,
                creator.getFullName() + " created a new event \"" + title + "\" in " + group.getName(), group.getId());
    }

    public void postCommented(UserEntity commenter, Long postAuthorId, Long postId) {
        notify(postAuthorId, commenter.getId(), NotificationEntity.Type.POST_COMMENT,
                commenter.getFullName() + " commented on your post", postId);
    }

    public void groupPostCommented(UserEntity commenter, Long postAuthorId, Long groupPostId) {
        notify(postAuthorId, commenter.getId(), NotificationEntity.Type.GROUP_POST_COMMENT,
                commenter.getFullName() + " commented on your group post", groupPostId);
    }

    /**
     * List notifications merged with pending follow requests.
     *
     * @param type optional filter, in its wire form (e.g. "follow_request")
     * @param markAsRead mark the returned stored notifications as read
     */
    @Transactional
    public NotificationPage list(Long userId, String type, Integer limit, Integer offset, boolean markAsRead) {
        NotificationEntity.Type typeFilter = parseType(type);
        int pageLimit = limit == null || limit <= 0 ? DEFAULT_LIMIT : Math.min(limit, MAX_LIMIT);
        int pageOffset = offset == null || offset < 0 ? 0 : offset;

        List<NotificationEntity> stored = notificationRepository.findForReceiver(userId, typeFilter);
        List<FollowRequestEntity> pending = typeFilter == null || typeFilter == NotificationEntity.Type.FOLLOW_REQUEST
                ? followRequestRepository.findByRequestedIdOrderByCreatedAtDesc(userId)
                : List.of();

        Set<NotificationView> synthetic = Collections.newSetFromMap(new IdentityHashMap<>());
        List<NotificationView> merged = merge(stored, pending, synthetic);

        int total = merged.size();
        int from = Math.min(pageOffset, total);
        int to = Math.min(from + pageLimit, total);
        List<NotificationView> page = new ArrayList<>(merged.subList(from, to));

        if (markAsRead) {
            List<NotificationView> unread = page.stream()
                    .filter(view -> !synthetic.contains(view))
                    .filter(view -> !Boolean.TRUE.equals(view.getIsRead()))
                    .collect(Collectors.toList());
            if (!unread.isEmpty()) {
                notificationRepository.markRead(userId,
                        unread.stream().map(NotificationView::getId).collect(Collectors.toList()));
                unread.forEach(view -> view.setIsRead(true));
                evictUnreadCount(userId);
            }
        }

        return NotificationPage.builder()
                .notifications(page)
                .unreadCount(unreadCount(userId))
                .total(total)
                .offset(pageOffset)
                .limit(pageLimit)
                .build();
    }

    @Transactional(readOnly = true)
    public long unreadCount(Long userId) {
        Optional<Long> cached = cacheService.lookup(SocialCacheService.Region.UNREAD_NOTIFICATIONS, userId, Long.class);
        if (cached.isPresent()) {
            return cached.get();
        }

        long count = notificationRepository.countUnreadExcluding(userId, NotificationEntity.Type.FOLLOW_REQUEST)
                + followRequestRepository.countByRequestedId(userId);

        cacheService.store(SocialCacheService.Region.UNREAD_NOTIFICATIONS, userId, count, Duration.ofSeconds(unreadCountTtl));
        return count;
    }

    @Transactional
    public void markRead(Long notificationId, Long userId) {
        NotificationEntity notification = notificationRepository.findByIdAndReceiverId(notificationId, userId)
                .orElseThrow(() -> new NotFoundException("Notification not found"));
        if (!notification.isRead()) {
            notification.setRead(true);
            notificationRepository.save(notification);
            evictUnreadCount(userId);
        }
    }

    @Transactional
    public int markAllRead(Long userId) {
        int updated = notificationRepository.markAllRead(userId);
        evictUnreadCount(userId);
        log.info("Marked {} notifications read for user {}", updated, userId);
        return updated;
    }

    @Transactional
    public void delete(Long notificationId, Long userId) {
        NotificationEntity notification = notificationRepository.findByIdAndReceiverId(notificationId, userId)
                .orElseThrow(() -> new NotFoundException("Notification not found"));
        notificationRepository.delete(notification);
        evictUnreadCount(userId);
    }

    @Transactional
    public int deleteAll(Long userId) {
        int deleted = notificationRepository.deleteAllForReceiver(userId);
        evictUnreadCount(userId);
        log.info("Deleted {} notifications for user {}", deleted, userId);
        return deleted;
    }

    /**
     * Remove notifications about something that was resolved elsewhere
     * (an answered invitation, a handled follow request).
     */
    @Transactional
    public void deleteByReference(Long receiverId, NotificationEntity.Type type, Long referenceId) {
        int deleted = notificationRepository.deleteByReference(receiverId, type, referenceId);
        if (deleted > 0) {
            evictUnreadCount(receiverId);
        }
    }

    public void evictUnreadCount(Long userId) {
        AfterCommit.run(() -> cacheService.evict(SocialCacheService.Region.UNREAD_NOTIFICATIONS, userId));
    }

    static NotificationEntity.Type parseType(String type) {
        if (type == null || type.isBlank()) {
            return null;
        }
        try {
            return NotificationEntity.Type.valueOf(type.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new BadRequestException("Invalid notification type: " + type);
        }
    }

    private List<NotificationView> merge(List<NotificationEntity> stored, List<FollowRequestEntity> pending,
                                         Set<NotificationView> synthetic) {
        Set<Long> pendingIds = pending.stream().map(FollowRequestEntity::getId).collect(Collectors.toSet());
        Set<Long> senderIds = new HashSet<>();
        stored.forEach(n -> senderIds.add(n.getSenderId()));
        pending.forEach(r -> senderIds.add(r.getRequesterId()));
        Map<Long, UserSummary> senders = userLookupService.summaries(senderIds);

        Set<Long> coveredRequests = new HashSet<>();
        List<NotificationView> merged = new ArrayList<>();

        for (NotificationEntity notification : stored) {
            if (notification.getType() == NotificationEntity.Type.FOLLOW_REQUEST) {
                Long requestId = notification.getReferenceId();
                if (requestId == null || !pendingIds.contains(requestId) || !coveredRequests.add(requestId)) {
                    continue;
                }
            }
            merged.add(toView(notification, senders));
        }

        for (FollowRequestEntity request : pending) {
            if (coveredRequests.add(request.getId())) {
                NotificationView view = toView(request, senders);
                synthetic.add(view);
                merged.add(view);
            }
        }

        merged.sort(NEWEST_FIRST);
        return merged;
    }

    private NotificationView toView(NotificationEntity notification, Map<Long, UserSummary> senders) {
        NotificationView view = NotificationView.builder()
                .id(notification.getId())
                .type(notification.getType())
                .content(notification.getContent())
                .referenceId(notification.getReferenceId())
                .isRead(notification.isRead())
                .createdAt(notification.getCreatedAt())
                .sender(senderOf(notification.getSenderId(), senders))
                .build();

        Long ref = notification.getReferenceId();
        switch (notification.getType()) {
            case MESSAGE -> view.setConversationId(ref);
            case FOLLOW, FOLLOW_ACCEPTED -> view.setFollowerId(notification.getSenderId());
            case FOLLOW_REQUEST -> {
                view.setFollowerId(notification.getSenderId());
                view.setRequestId(ref);
            }
            case GROUP_JOIN_REQUEST -> view.setRequestId(ref);
            case GROUP_INVITATION, GROUP_JOIN_ACCEPTED, GROUP_EVENT -> view.setGroupId(ref);
            case POST_COMMENT, GROUP_POST_COMMENT -> view.setPostId(ref);
            default -> {
            }
        }
        return view;
    }

    private NotificationView toView(FollowRequestEntity request, Map<Long, UserSummary> senders) {
        UserSummary sender = senderOf(request.getRequesterId(), senders);
        return NotificationView.builder()
                .id(request.getId())
                .type(NotificationEntity.Type.FOLLOW_REQUEST)
                .content(sender.getFirstName() + " " + sender.getLastName() + " wants to follow you")
                .referenceId(request.getId())
                .isRead(false)
                .createdAt(request.getCreatedAt())
                .sender(sender)
                .followerId(request.getRequesterId())
                .requestId(request.getId())
                .build();
    }

    private static UserSummary senderOf(Long senderId, Map<Long, UserSummary> senders) {
        if (senderId == null) {
            return UserSummary.builder().firstName("System").lastName("").build();
        }
        UserSummary sender = senders.get(senderId);
        if (sender == null) {
            return UserSummary.builder().id(senderId).firstName("Unknown").lastName("User").build();
        }
        return sender;
    }
}
