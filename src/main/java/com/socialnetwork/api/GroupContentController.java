package com.socialnetwork.api;

import com.socialnetwork.domain.model.ContentRequest;
import com.socialnetwork.domain.model.EventResponseRequest;
import com.socialnetwork.domain.model.GroupCommentView;
import com.socialnetwork.domain.model.GroupEventRequest;
import com.socialnetwork.domain.model.GroupEventView;
import com.socialnetwork.domain.model.GroupPostView;
import com.socialnetwork.domain.model.VoteRequest;
import com.socialnetwork.domain.model.VoteResult;
import com.socialnetwork.domain.service.GroupContentService;
import com.socialnetwork.infrastructure.security.SessionAuthInterceptor;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Group posts, comments and events. Members only.
 */
@RestController
@RequestMapping("/api/groups")
@RequiredArgsConstructor
public class GroupContentController {

    private final GroupContentService contentService;

    @GetMapping("/{id}/posts")
    public ResponseEntity<List<GroupPostView>> posts(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
            @PathVariable Long id,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer offset) {
        return ResponseEntity.ok(contentService.posts(id, userId, limit, offset));
    }

    @PostMapping("/{id}/posts")
    public ResponseEntity<GroupPostView> createPost(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
            @PathVariable Long id,
            @RequestBody ContentRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(contentService.createPost(id, userId, request));
    }

    @DeleteMapping("/posts/{postId}")
    public ResponseEntity<Map<String, String>> deletePost(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
            @PathVariable Long postId) {
        contentService.deletePost(postId, userId);
        return ResponseEntity.ok(Map.of("message", "Post deleted successfully"));
    }

    @PostMapping("/posts/{postId}/vote")
    public ResponseEntity<VoteResult> votePost(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
            @PathVariable Long postId,
            @Valid @RequestBody VoteRequest request) {
        return ResponseEntity.ok(contentService.votePost(postId, userId, request.getVoteType()));
    }

    @GetMapping("/posts/{postId}/comments")
    public ResponseEntity<List<GroupCommentView>> comments(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
            @PathVariable Long postId) {
        return ResponseEntity.ok(contentService.comments(postId, userId));
    }

    @PostMapping("/posts/{postId}/comments")
    public ResponseEntity<GroupCommentView> addComment(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
            @PathVariable Long postId,
            @RequestBody ContentRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(contentService.addComment(postId, userId, request));
    }

    @DeleteMapping("/posts/{postId}/comments/{commentId}")
    public ResponseEntity<Map<String, String>> deleteComment(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
            @PathVariable Long postId,
            @PathVariable Long commentId) {
        contentService.deleteComment(postId, commentId, userId);
        return ResponseEntity.ok(Map.of("message", "Comment deleted successfully"));
    }

    @PostMapping("/posts/{postId}/comments/{commentId}/vote")
    public ResponseEntity<VoteResult> voteComment(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
            @PathVariable Long postId,
            @PathVariable Long commentId,
            @Valid @RequestBody VoteRequest request) {
        return ResponseEntity.ok(contentService.voteComment(postId, commentId, userId, request.getVoteType()));
    }

    @GetMapping("/{id}/events")
    public ResponseEntity<List<GroupEventView>> events(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
            @PathVariable Long id) {
        return ResponseEntity.ok(contentService.events(id, userId));
    }

    @PostMapping("/{id}/events")
    public ResponseEntity<GroupEventView> createEvent(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
            @PathVariable Long id,
            @Valid @RequestBody GroupEventRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(contentService.createEvent(id, userId, request));
    }

    /**
     * POST /api/groups/events/{eventId}/respond with {"response": "going|not_going|remove"}
     */
    @PostMapping("/events/{eventId}/respond")
    public ResponseEntity<GroupEventView> respond(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
            @PathVariable Long eventId,
            @Valid @RequestBody EventResponseRequest request) {
        return ResponseEntity.ok(contentService.respond(eventId, userId, request.getResponse()));
    }

    @DeleteMapping("/events/{eventId}")
    public ResponseEntity<Map<String, String>> deleteEvent(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
            @PathVariable Long eventId) {
        contentService.deleteEvent(eventId, userId);
        return ResponseEntity.ok(Map.of("message", "Event deleted successfully"));
    }
}
