package com.socialnetwork.domain.service;

import com.socialnetwork.domain.exception.BadRequestException;
import com.socialnetwork.domain.exception.ForbiddenException;
import com.socialnetwork.domain.exception.NotFoundException;
import com.socialnetwork.domain.model.ConversationView;
import com.socialnetwork.domain.model.MessageView;
import com.socialnetwork.infrastructure.persistence.entity.ChatMessageEntity;
import com.socialnetwork.infrastructure.persistence.entity.ConversationEntity;
import com.socialnetwork.infrastructure.persistence.entity.ConversationParticipantEntity;
import com.socialnetwork.infrastructure.persistence.entity.UserEntity;
import com.socialnetwork.infrastructure.persistence.repository.ChatMessageRepository;
import com.socialnetwork.infrastructure.persistence.repository.ConversationParticipantRepository;
import com.socialnetwork.infrastructure.persistence.repository.ConversationRepository;
import com.socialnetwork.infrastructure.persistence.repository.GroupMemberRepository;
import com.socialnetwork.infrastructure.persistence.repository.GroupMessageRepository;
import com.socialnetwork.infrastructure.persistence.repository.GroupRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Pageable;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ChatService.
 */
@ExtendWith(MockitoExtension.class)
class ChatServiceTest {

    private static final Long ALICE = 1L;
    private static final Long BOB = 2L;
    private static final Long CONVERSATION = 5L;

    @Mock
    private ConversationRepository conversationRepository;

    @Mock
    private ConversationParticipantRepository participantRepository;

    @Mock
    private ChatMessageRepository messageRepository;

    @Mock
    private GroupMessageRepository groupMessageRepository;

    @Mock
    private GroupRepository groupRepository;

    @Mock
    private GroupMemberRepository groupMemberRepository;

    @Mock
    private FollowService followService;

    @Mock
    private NotificationService notificationService;

    @Mock
    private UserLookupService userLookupService;

    private SimpleMeterRegistry meterRegistry;

    private ChatService chatService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        chatService = new ChatService(conversationRepository, participantRepository, messageRepository,
                groupMessageRepository, groupRepository, groupMemberRepository,
                followService, notificationService, userLookupService, meterRegistry);
    }

    @Test
    void testCanMessage_FollowerOfPrivateUser() {
        // Given
        when(userLookupService.require(BOB)).thenReturn(user(BOB, false));
        when(followService.isFollowing(ALICE, BOB)).thenReturn(false);
        when(followService.isFollowing(BOB, ALICE)).thenReturn(true);

        // When / Then
        assertTrue(chatService.canMessage(ALICE, BOB));
    }

    @Test
    void testOpenDirect_Self() {
        // When / Then
        assertThrows(BadRequestException.class, () -> chatService.openDirect(ALICE, ALICE));
        verifyNoInteractions(conversationRepository);
    }

    @Test
    void testOpenDirect_PrivateStrangerForbidden() {
        // Given
        when(userLookupService.require(BOB)).thenReturn(user(BOB, false));
        when(followService.isFollowing(ALICE, BOB)).thenReturn(false);
        when(followService.isFollowing(BOB, ALICE)).thenReturn(false);

        // When / Then
        assertThrows(ForbiddenException.class, () -> chatService.openDirect(ALICE, BOB));
        verify(conversationRepository, never()).save(any());
    }

    @Test
    void testOpenDirect_ReusesExistingConversation() {
        // Given
        ConversationEntity existing = ConversationEntity.builder().id(CONVERSATION).build();
        when(userLookupService.require(BOB)).thenReturn(user(BOB, true));
        when(conversationRepository.findDirectBetween(ALICE, BOB)).thenReturn(List.of(existing));

        // When
        ConversationView view = chatService.openDirect(ALICE, BOB);

        // Then
        assertEquals(CONVERSATION, view.getId());
        verify(conversationRepository, never()).save(any());
        verify(participantRepository, never()).save(any());
    }

    @Test
    void testOpenDirect_CreatesConversationWithBothParticipants() {
        // Given
        when(userLookupService.require(BOB)).thenReturn(user(BOB, true));
        when(conversationRepository.findDirectBetween(ALICE, BOB)).thenReturn(List.of());
        when(conversationRepository.save(any(ConversationEntity.class))).thenAnswer(invocation -> {
            ConversationEntity conversation = invocation.getArgument(0);
            conversation.setId(CONVERSATION);
            return conversation;
        });

        // When
        ConversationView view = chatService.openDirect(ALICE, BOB);

        // Then
        assertEquals(CONVERSATION, view.getId());
        assertFalse(view.getIsGroup());
        verify(participantRepository, times(2)).save(any(ConversationParticipantEntity.class));
    }

    @Test
    void testSend_NotifiesOtherParticipant() {
        // Given
        ConversationEntity conversation = ConversationEntity.builder().id(CONVERSATION).build();
        ConversationParticipantEntity alice = participant(ALICE);
        UserEntity sender = user(ALICE, true);

        when(conversationRepository.findById(CONVERSATION)).thenReturn(Optional.of(conversation));
        when(participantRepository.findByConversationIdAndUserId(CONVERSATION, ALICE)).thenReturn(Optional.of(alice));
        when(messageRepository.save(any(ChatMessageEntity.class))).thenAnswer(invocation -> {
            ChatMessageEntity message = invocation.getArgument(0);
            message.setId(100L);
            return message;
        });
        when(userLookupService.require(ALICE)).thenReturn(sender);
        when(participantRepository.findByConversationId(CONVERSATION)).thenReturn(List.of(alice, participant(BOB)));

        // When
        MessageView view = chatService.send(CONVERSATION, ALICE, "  hello  ");

        // Then
        assertEquals("hello", view.getContent());
        assertEquals(100L, alice.getLastReadMessageId());
        assertNotNull(conversation.getUpdatedAt());
        verify(notificationService).messageReceived(sender, BOB, CONVERSATION);
        verify(notificationService, never()).messageReceived(any(), eq(ALICE), any());
        assertEquals(1.0, meterRegistry.get("chat.messages.sent").tag("kind", "direct").counter().count());
    }

    @Test
    void testSend_MessageTooLong() {
        // When / Then
        assertThrows(BadRequestException.class,
                () -> chatService.send(CONVERSATION, ALICE, "x".repeat(ChatService.MAX_MESSAGE_LENGTH + 1)));
        verifyNoInteractions(messageRepository);
    }

    @Test
    void testSend_BlankMessage() {
        // When / Then
        assertThrows(BadRequestException.class, () -> chatService.send(CONVERSATION, ALICE, "   "));
        verifyNoInteractions(conversationRepository);
    }

    @Test
    void testSend_NotParticipant() {
        // Given
        when(conversationRepository.findById(CONVERSATION))
                .thenReturn(Optional.of(ConversationEntity.builder().id(CONVERSATION).build()));
        when(participantRepository.findByConversationIdAndUserId(CONVERSATION, 3L)).thenReturn(Optional.empty());

        // When / Then
        assertThrows(ForbiddenException.class, () -> chatService.send(CONVERSATION, 3L, "hi"));
        verifyNoInteractions(messageRepository);
    }

    @Test
    void testMessages_OldestFirstWithDeletedPlaceholder() {
        // Given
        ChatMessageEntity newest = ChatMessageEntity.builder()
                .id(12L).conversationId(CONVERSATION).senderId(BOB).content("secret").isDeleted(true).build();
        ChatMessageEntity older = ChatMessageEntity.builder()
                .id(11L).conversationId(CONVERSATION).senderId(ALICE).content("hi").build();

        when(conversationRepository.findById(CONVERSATION))
                .thenReturn(Optional.of(ConversationEntity.builder().id(CONVERSATION).build()));
        when(participantRepository.findByConversationIdAndUserId(CONVERSATION, ALICE))
                .thenReturn(Optional.of(participant(ALICE)));
        when(messageRepository.findByConversationIdOrderByIdDesc(eq(CONVERSATION), any(Pageable.class)))
                .thenReturn(List.of(newest, older));

        // When
        List<MessageView> messages = chatService.messages(CONVERSATION, ALICE, null, null);

        // Then
        assertEquals(2, messages.size());
        assertEquals(11L, messages.get(0).getId());
        assertEquals("hi", messages.get(0).getContent());
        assertEquals(ChatService.DELETED_PLACEHOLDER, messages.get(1).getContent());
        assertTrue(messages.get(1).getIsDeleted());
    }

    @Test
    void testMarkRead_MessageFromAnotherConversation() {
        // Given
        when(conversationRepository.findById(CONVERSATION))
                .thenReturn(Optional.of(ConversationEntity.builder().id(CONVERSATION).build()));
        when(participantRepository.findByConversationIdAndUserId(CONVERSATION, ALICE))
                .thenReturn(Optional.of(participant(ALICE)));
        when(messageRepository.findById(99L))
                .thenReturn(Optional.of(ChatMessageEntity.builder().id(99L).conversationId(6L).senderId(BOB).build()));

        // When / Then
        assertThrows(NotFoundException.class, () -> chatService.markRead(CONVERSATION, ALICE, 99L));
        verify(participantRepository, never()).save(any());
    }

    @Test
    void testMarkRead_DefaultsToLatestMessage() {
        // Given
        ConversationParticipantEntity alice = participant(ALICE);
        when(conversationRepository.findById(CONVERSATION))
                .thenReturn(Optional.of(ConversationEntity.builder().id(CONVERSATION).build()));
        when(participantRepository.findByConversationIdAndUserId(CONVERSATION, ALICE)).thenReturn(Optional.of(alice));
        when(messageRepository.findTopByConversationIdOrderByIdDesc(CONVERSATION))
                .thenReturn(Optional.of(ChatMessageEntity.builder().id(42L).conversationId(CONVERSATION).build()));

        // When
        chatService.markRead(CONVERSATION, ALICE, null);

        // Then
        assertEquals(42L, alice.getLastReadMessageId());
        verify(participantRepository).save(alice);
    }

    @Test
    void testDeleteMessage_OnlySender() {
        // Given
        when(messageRepository.findById(11L))
                .thenReturn(Optional.of(ChatMessageEntity.builder().id(11L).conversationId(CONVERSATION).senderId(BOB).build()));

        // When / Then
        assertThrows(ForbiddenException.class, () -> chatService.deleteMessage(11L, ALICE));
        verify(messageRepository, never()).save(any());
    }

    @Test
    void testDeleteMessage_SoftDeletes() {
        // Given
        ChatMessageEntity message = ChatMessageEntity.builder()
                .id(11L).conversationId(CONVERSATION).senderId(ALICE).content("oops").build();
        when(messageRepository.findById(11L)).thenReturn(Optional.of(message));

        // When
        chatService.deleteMessage(11L, ALICE);

        // Then
        assertTrue(message.isDeleted());
        assertEquals("oops", message.getContent());
        verify(messageRepository).save(message);
    }

    @Test
    void testSendGroupMessage_NonMemberForbidden() {
        // Given
        when(groupRepository.existsById(10L)).thenReturn(true);
        when(groupMemberRepository.existsByGroupIdAndUserId(10L, ALICE)).thenReturn(false);

        // When / Then
        assertThrows(ForbiddenException.class, () -> chatService.sendGroupMessage(10L, ALICE, "hi all"));
        verifyNoInteractions(groupMessageRepository);
    }

    @Test
    void testSendGroupMessage_UnknownGroup() {
        // Given
        when(groupRepository.existsById(10L)).thenReturn(false);

        // When / Then
        assertThrows(NotFoundException.class, () -> chatService.sendGroupMessage(10L, ALICE, "hi all"));
    }

    private static UserEntity user(Long id, boolean isPublic) {
        return UserEntity.builder()
                .id(id)
                .firstName("User")
                .lastName(String.valueOf(id))
                .isPublic(isPublic)
                .build();
    }

    private static ConversationParticipantEntity participant(Long userId) {
        return ConversationParticipantEntity.builder()
                .conversationId(CONVERSATION)
                .userId(userId)
                .build();
    }
}
