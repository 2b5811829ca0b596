package com.socialnetwork.domain.service;

import com.socialnetwork.domain.exception.BadRequestException;
import com.socialnetwork.domain.exception.ForbiddenException;
import com.socialnetwork.domain.exception.NotFoundException;
import com.socialnetwork.domain.model.ConversationView;
import com.socialnetwork.domain.model.MessageView;
import com.socialnetwork.domain.model.UserSummary;
import com.socialnetwork.infrastructure.persistence.entity.ChatMessageEntity;
import com.socialnetwork.infrastructure.persistence.entity.ConversationEntity;
import com.socialnetwork.infrastructure.persistence.entity.ConversationParticipantEntity;
import com.socialnetwork.infrastructure.persistence.entity.GroupEntity;
import com.socialnetwork.infrastructure.persistence.entity.GroupMessageEntity;
import com.socialnetwork.infrastructure.persistence.entity.UserEntity;
import com.socialnetwork.infrastructure.persistence.repository.ChatMessageRepository;
import com.socialnetwork.infrastructure.persistence.repository.ConversationParticipantRepository;
import com.socialnetwork.infrastructure.persistence.repository.ConversationRepository;
import com.socialnetwork.infrastructure.persistence.repository.GroupMemberRepository;
import com.socialnetwork.infrastructure.persistence.repository.GroupMessageRepository;
import com.socialnetwork.infrastructure.persistence.repository.GroupRepository;
import com.socialnetwork.infrastructure.persistence.repository.OffsetPageRequest;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Direct conversations and group chat.
 *
 * Two users may message each other when the recipient's profile is public or
 * either one follows the other. Group chat is open to group members only; the
 * group's conversation participants follow membership.
 *
 * Messages are paged newest first from storage and returned oldest first.
 * Deleted messages keep their row and are shown with placeholder content.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChatService {

    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 100;
    public static final int MAX_MESSAGE_LENGTH = 2000;
    static final String DELETED_PLACEHOLDER = "This message was deleted";

    private final ConversationRepository conversationRepository;
    private final ConversationParticipantRepository participantRepository;
    private final ChatMessageRepository messageRepository;
    private final GroupMessageRepository groupMessageRepository;
    private final GroupRepository groupRepository;
    private final GroupMemberRepository groupMemberRepository;
    private final FollowService followService;
    private final NotificationService notificationService;
    private final UserLookupService userLookupService;
    private final MeterRegistry meterRegistry;

    @Transactional(readOnly = true)
    public boolean canMessage(Long senderId, Long recipientId) {
        UserEntity recipient = userLookupService.require(recipientId);
        return recipient.isPublic()
                || followService.isFollowing(senderId, recipientId)
                || followService.isFollowing(recipientId, senderId);
    }

    /**
     * Find or create the direct conversation between two users.
     */
    @Transactional
    public ConversationView openDirect(Long userId, Long recipientId) {
        if (userId.equals(recipientId)) {
            throw new BadRequestException("You cannot start a conversation with yourself");
        }
        if (!canMessage(userId, recipientId)) {
            throw new ForbiddenException("You can only message users you follow, who follow you, or who have a public profile");
        }

        List<ConversationEntity> existing = conversationRepository.findDirectBetween(userId, recipientId);
        if (!existing.isEmpty()) {
            return toView(existing.get(0), userId);
        }

        ConversationEntity conversation = conversationRepository.save(ConversationEntity.builder()
                .isGroup(false)
                .build());
        addParticipant(conversation.getId(), userId);
        addParticipant(conversation.getId(), recipientId);

        log.info("Conversation {} opened between users {} and {}", conversation.getId(), userId, recipientId);
        return toView(conversation, userId);
    }

    @Transactional(readOnly = true)
    public List<ConversationView> conversations(Long userId) {
        return conversationRepository.findDirectForUser(userId).stream()
                .map(conversation -> toView(conversation, userId))
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public ConversationView conversation(Long conversationId, Long userId) {
        ConversationEntity conversation = requireConversation(conversationId);
        requireParticipant(conversationId, userId);
        return toView(conversation, userId);
    }

    @Transactional(readOnly = true)
    public List<MessageView> messages(Long conversationId, Long userId, Integer limit, Integer offset) {
        requireConversation(conversationId);
        requireParticipant(conversationId, userId);

        List<ChatMessageEntity> page = messageRepository.findByConversationIdOrderByIdDesc(
                conversationId, OffsetPageRequest.of(normalizeOffset(offset), normalizeLimit(limit)));
        List<ChatMessageEntity> ordered = new ArrayList<>(page);
        Collections.reverse(ordered);

        Map<Long, UserSummary> senders = userLookupService.summaries(
                ordered.stream().map(ChatMessageEntity::getSenderId).collect(Collectors.toList()));
        return ordered.stream()
                .map(message -> toView(message, senders.get(message.getSenderId())))
                .collect(Collectors.toList());
    }

    /**
     * Send a direct message. Other participants get a MESSAGE notification.
     */
    @Transactional
    public MessageView send(Long conversationId, Long senderId, String content) {
        String text = requireContent(content);
        ConversationEntity conversation = requireConversation(conversationId);
        if (conversation.isGroup()) {
            throw new BadRequestException("Use the group chat to message this conversation");
        }
        ConversationParticipantEntity participant = requireParticipant(conversationId, senderId);

        ChatMessageEntity message = messageRepository.save(ChatMessageEntity.builder()
                .conversationId(conversationId)
                .senderId(senderId)
                .content(text)
                .build());

        participant.setLastReadMessageId(message.getId());
        participantRepository.save(participant);
        conversation.setUpdatedAt(Instant.now());
        conversationRepository.save(conversation);

        UserEntity sender = userLookupService.require(senderId);
        for (ConversationParticipantEntity other : participantRepository.findByConversationId(conversationId)) {
            if (!other.getUserId().equals(senderId)) {
                notificationService.messageReceived(sender, other.getUserId(), conversationId);
            }
        }

        countMessage("direct");
        log.debug("Message {} sent to conversation {} by user {}", message.getId(), conversationId, senderId);
        return toView(message, UserLookupService.toSummary(sender));
    }

    /**
     * Move the user's read marker to {@code messageId}, or to the newest message when it is null.
     */
    @Transactional
    public void markRead(Long conversationId, Long userId, Long messageId) {
        requireConversation(conversationId);
        ConversationParticipantEntity participant = requireParticipant(conversationId, userId);

        if (messageId != null) {
            ChatMessageEntity message = messageRepository.findById(messageId)
                    .filter(m -> m.getConversationId().equals(conversationId))
                    .orElseThrow(() -> new NotFoundException("Message not found"));
            participant.setLastReadMessageId(message.getId());
            participantRepository.save(participant);
            return;
        }

        messageRepository.findTopByConversationIdOrderByIdDesc(conversationId).ifPresent(latest -> {
            participant.setLastReadMessageId(latest.getId());
            participantRepository.save(participant);
        });
    }

    @Transactional
    public void deleteMessage(Long messageId, Long userId) {
        ChatMessageEntity message = messageRepository.findById(messageId)
                .orElseThrow(() -> new NotFoundException("Message not found"));
        if (!message.getSenderId().equals(userId)) {
            throw new ForbiddenException("You can only delete your own messages");
        }

        message.setDeleted(true);
        messageRepository.save(message);
        log.info("Message {} deleted by user {}", messageId, userId);
    }

    @Transactional
    public ConversationEntity createGroupConversation(GroupEntity group) {
        ConversationEntity conversation = conversationRepository.save(ConversationEntity.builder()
                .name(group.getName())
                .isGroup(true)
                .groupId(group.getId())
                .build());
        addParticipant(conversation.getId(), group.getCreatorId());
        return conversation;
    }

    @Transactional
    public void addGroupParticipant(Long groupId, Long userId) {
        conversationRepository.findFirstByGroupId(groupId).ifPresent(conversation -> {
            if (!participantRepository.existsByConversationIdAndUserId(conversation.getId(), userId)) {
                addParticipant(conversation.getId(), userId);
            }
        });
    }

    @Transactional
    public void removeGroupParticipant(Long groupId, Long userId) {
        conversationRepository.findFirstByGroupId(groupId)
                .ifPresent(conversation -> participantRepository.deleteParticipant(conversation.getId(), userId));
    }

    @Transactional(readOnly = true)
    public Long groupConversationId(Long groupId) {
        return conversationRepository.findFirstByGroupId(groupId)
                .map(ConversationEntity::getId)
                .orElse(null);
    }

    @Transactional(readOnly = true)
    public List<MessageView> groupMessages(Long groupId, Long userId, Integer limit, Integer offset) {
        requireGroupMember(groupId, userId);

        List<GroupMessageEntity> page = groupMessageRepository.findByGroupIdOrderByIdDesc(
                groupId, OffsetPageRequest.of(normalizeOffset(offset), normalizeLimit(limit)));
        List<GroupMessageEntity> ordered = new ArrayList<>(page);
        Collections.reverse(ordered);

        Map<Long, UserSummary> senders = userLookupService.summaries(
                ordered.stream().map(GroupMessageEntity::getSenderId).collect(Collectors.toList()));
        return ordered.stream()
                .map(message -> toView(message, senders.get(message.getSenderId())))
                .collect(Collectors.toList());
    }

    @Transactional
    public MessageView sendGroupMessage(Long groupId, Long senderId, String content) {
        String text = requireContent(content);
        requireGroupMember(groupId, senderId);

        GroupMessageEntity message = groupMessageRepository.save(GroupMessageEntity.builder()
                .groupId(groupId)
                .senderId(senderId)
                .content(text)
                .build());

        conversationRepository.findFirstByGroupId(groupId).ifPresent(conversation -> {
            conversation.setUpdatedAt(Instant.now());
            conversationRepository.save(conversation);
        });

        countMessage("group");
        log.debug("Group message {} sent to group {} by user {}", message.getId(), groupId, senderId);
        return toView(message, UserLookupService.toSummary(userLookupService.require(senderId)));
    }

    private void requireGroupMember(Long groupId, Long userId) {
        if (!groupRepository.existsById(groupId)) {
            throw new NotFoundException("Group not found");
        }
        if (!groupMemberRepository.existsByGroupIdAndUserId(groupId, userId)) {
            throw new ForbiddenException("You must be a member of this group");
        }
    }

    private ConversationEntity requireConversation(Long conversationId) {
        return conversationRepository.findById(conversationId)
                .orElseThrow(() -> new NotFoundException("Conversation not found"));
    }

    private ConversationParticipantEntity requireParticipant(Long conversationId, Long userId) {
        return participantRepository.findByConversationIdAndUserId(conversationId, userId)
                .orElseThrow(() -> new ForbiddenException("You are not a participant in this conversation"));
    }

    private void addParticipant(Long conversationId, Long userId) {
        participantRepository.save(ConversationParticipantEntity.builder()
                .conversationId(conversationId)
                .userId(userId)
                .build());
    }

    private ConversationView toView(ConversationEntity conversation, Long userId) {
        ConversationView.ConversationViewBuilder view = ConversationView.builder()
                .id(conversation.getId())
                .name(conversation.getName())
                .isGroup(conversation.isGroup())
                .groupId(conversation.getGroupId())
                .updatedAt(conversation.getUpdatedAt());

        List<ConversationParticipantEntity> participants = participantRepository.findByConversationId(conversation.getId());
        Long lastRead = 0L;
        Long otherUserId = null;
        for (ConversationParticipantEntity participant : participants) {
            if (participant.getUserId().equals(userId)) {
                if (participant.getLastReadMessageId() != null) {
                    lastRead = participant.getLastReadMessageId();
                }
            } else if (otherUserId == null) {
                otherUserId = participant.getUserId();
            }
        }

        if (!conversation.isGroup() && otherUserId != null) {
            view.otherUser(userLookupService.summaries(List.of(otherUserId)).get(otherUserId));
        }
        messageRepository.findTopByConversationIdOrderByIdDesc(conversation.getId())
                .ifPresent(latest -> view.lastMessage(toView(latest, null)));

        return view
                .unreadCount(messageRepository.countUnread(conversation.getId(), userId, lastRead))
                .build();
    }

    private MessageView toView(ChatMessageEntity message, UserSummary sender) {
        return MessageView.builder()
                .id(message.getId())
                .conversationId(message.getConversationId())
                .senderId(message.getSenderId())
                .sender(sender)
                .content(message.isDeleted() ? DELETED_PLACEHOLDER : message.getContent())
                .isDeleted(message.isDeleted())
                .createdAt(message.getCreatedAt())
                .build();
    }

    private MessageView toView(GroupMessageEntity message, UserSummary sender) {
        return MessageView.builder()
                .id(message.getId())
                .groupId(message.getGroupId())
                .senderId(message.getSenderId())
                .sender(sender)
                .content(message.isDeleted() ? DELETED_PLACEHOLDER : message.getContent())
                .isDeleted(message.isDeleted())
                .createdAt(message.getCreatedAt())
                .build();
    }

    private void countMessage(String kind) {
        Counter.builder("chat.messages.sent")
                .tag("kind", kind)
                .register(meterRegistry)
                .increment();
    }

    private static String requireContent(String content) {
        String text = content == null ? "" : content.trim();
        if (text.isEmpty()) {
            throw new BadRequestException("Message content is required");
        }
        if (text.length() > MAX_MESSAGE_LENGTH) {
            throw new BadRequestException("Message is too long (max " + MAX_MESSAGE_LENGTH + " characters)");
        }
        return text;
    }

    private static int normalizeLimit(Integer limit) {
        return limit == null || limit < 1 ? DEFAULT_LIMIT : Math.min(limit, MAX_LIMIT);
    }

    private static int normalizeOffset(Integer offset) {
        return offset == null || offset < 0 ? 0 : offset;
    }
}
