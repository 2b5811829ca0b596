package com.socialnetwork.api;

import com.socialnetwork.domain.model.ConversationRequest;
import com.socialnetwork.domain.model.ConversationView;
import com.socialnetwork.domain.model.MessageRequest;
import com.socialnetwork.domain.model.MessageView;
import com.socialnetwork.domain.service.ChatService;
import com.socialnetwork.infrastructure.security.SessionAuthInterceptor;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Direct messaging and group chat. Clients poll these endpoints.
 *
 * Endpoints:
 * - GET /api/conversations - Direct conversations, most recent first
 * - POST /api/conversations - Open (or reuse) a conversation with {"recipient_id": 2}
 * - GET /api/conversations/{id}
 * - GET|POST /api/conversations/{id}/messages
 * - POST /api/conversations/{id}/read?message_id= - Move the read marker
 * - DELETE /api/messages/{id} - Soft delete own message
 * - GET|POST /api/groups/{id}/messages - Group chat
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ChatController {

    private final ChatService chatService;

    @GetMapping("/conversations")
    public ResponseEntity<List<ConversationView>> conversations(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId) {
        return ResponseEntity.ok(chatService.conversations(userId));
    }

    @PostMapping("/conversations")
    public ResponseEntity<ConversationView> openConversation(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
            @Valid @RequestBody ConversationRequest request) {
        return ResponseEntity.ok(chatService.openDirect(userId, request.getRecipientId()));
    }

    @GetMapping("/conversations/{id}")
    public ResponseEntity<ConversationView> conversation(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
            @PathVariable Long id) {
        return ResponseEntity.ok(chatService.conversation(id, userId));
    }

    @GetMapping("/conversations/{id}/messages")
    public ResponseEntity<List<MessageView>> messages(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
            @PathVariable Long id,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer offset) {
        return ResponseEntity.ok(chatService.messages(id, userId, limit, offset));
    }

    @PostMapping("/conversations/{id}/messages")
    public ResponseEntity<MessageView> send(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
            @PathVariable Long id,
            @RequestBody MessageRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(chatService.send(id, userId, request.getContent()));
    }

    @PostMapping("/conversations/{id}/read")
    public ResponseEntity<Map<String, String>> markRead(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
            @PathVariable Long id,
            @RequestParam(name = "message_id", required = false) Long messageId) {
        chatService.markRead(id, userId, messageId);
        return ResponseEntity.ok(Map.of("message", "Conversation marked as read"));
    }

    @DeleteMapping("/messages/{id}")
    public ResponseEntity<Map<String, String>> deleteMessage(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
            @PathVariable Long id) {
        chatService.deleteMessage(id, userId);
        return ResponseEntity.ok(Map.of("message", "Message deleted"));
    }

    @GetMapping("/groups/{id}/messages")
    public ResponseEntity<List<MessageView>> groupMessages(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
            @PathVariable Long id,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer offset) {
        return ResponseEntity.ok(chatService.groupMessages(id, userId, limit, offset));
    }

    @PostMapping("/groups/{id}/messages")
    public ResponseEntity<MessageView> sendGroupMessage(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
            @PathVariable Long id,
            @RequestBody MessageRequest request) {
        log.debug("Group message: groupId={}, userId={}", id, userId);
        return ResponseEntity.status(HttpStatus.CREATED).body(chatService.sendGroupMessage(id, userId, request.getContent()));
    }
}
