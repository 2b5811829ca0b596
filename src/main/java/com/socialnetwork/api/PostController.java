package com.socialnetwork.api;

import com.socialnetwork.domain.model.CommentView;
import com.socialnetwork.domain.model.ContentRequest;
import com.socialnetwork.domain.model.CreatePostRequest;
import com.socialnetwork.domain.model.FeedPage;
import com.socialnetwork.domain.model.PostView;
import com.socialnetwork.domain.model.VoteRequest;
import com.socialnetwork.domain.model.VoteResult;
import com.socialnetwork.domain.service.PostService;
import com.socialnetwork.infrastructure.security.SessionAuthInterceptor;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST API for posts, comments and their votes.
 *
 * Endpoints:
 * - GET /api/posts - Feed with page/limit pagination
 * - POST /api/posts - Create a post
 * - GET /api/posts/{id} - Post with comments
 * - DELETE /api/posts/{id} - Delete own post
 * - POST /api/posts/{id}/comments - Comment on a post
 * - DELETE /api/posts/{id}/comments/{commentId} - Delete a comment
 * - POST /api/posts/{id}/vote - Toggle a vote on a post
 * - POST /api/posts/{id}/comments/{commentId}/vote - Toggle a vote on a comment
 */
@Slf4j
@RestController
@RequestMapping("/api/posts")
@RequiredArgsConstructor
public class PostController {

    private final PostService postService;

    /**
     * Feed of posts visible to the current user, newest first.
     *
     * GET /api/posts?page=1&limit=10
     *
     * Response:
     * - posts: Page of posts with author, comment count and the viewer's vote
     * - page, limit: Effective paging values
     * - has_more: Whether another page exists
     */
    @GetMapping
    public ResponseEntity<FeedPage> feed(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit) {

        log.debug("Feed: userId={}, page={}, limit={}", userId, page, limit);
        return ResponseEntity.ok(postService.feed(userId, page, limit));
    }

    @PostMapping
    public ResponseEntity<PostView> create(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
            @RequestBody CreatePostRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(postService.createPost(userId, request));
    }

    @GetMapping("/{id}")
    public ResponseEntity<PostView> get(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
            @PathVariable Long id) {
        return ResponseEntity.ok(postService.getPost(id, userId));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, String>> delete(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
            @PathVariable Long id) {
        postService.deletePost(id, userId);
        return ResponseEntity.ok(Map.of("message", "Post deleted successfully"));
    }

    @PostMapping("/{id}/comments")
    public ResponseEntity<CommentView> addComment(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
            @PathVariable Long id,
            @RequestBody ContentRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(postService.addComment(id, userId, request));
    }

    @DeleteMapping("/{id}/comments/{commentId}")
    public ResponseEntity<Map<String, String>> deleteComment(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
            @PathVariable Long id,
            @PathVariable Long commentId) {
        postService.deleteComment(id, commentId, userId);
        return ResponseEntity.ok(Map.of("message", "Comment deleted successfully"));
    }

    /**
     * Toggle a vote on a post.
     *
     * POST /api/posts/{id}/vote
     *
     * Request body:
     * {
     *   "vote_type": 1 | -1
     * }
     *
     * The same vote twice removes it; the opposite vote switches it.
     */
    @PostMapping("/{id}/vote")
    public ResponseEntity<VoteResult> votePost(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
            @PathVariable Long id,
            @Valid @RequestBody VoteRequest request) {
        return ResponseEntity.ok(postService.votePost(id, userId, request.getVoteType()));
    }

    @PostMapping("/{id}/comments/{commentId}/vote")
    public ResponseEntity<VoteResult> voteComment(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
            @PathVariable Long id,
            @PathVariable Long commentId,
            @Valid @RequestBody VoteRequest request) {
        return ResponseEntity.ok(postService.voteComment(id, commentId, userId, request.getVoteType()));
    }
}
