package com.socialnetwork.api;

import com.socialnetwork.domain.model.FollowRequestView;
import com.socialnetwork.domain.model.FollowResult;
import com.socialnetwork.domain.model.FollowStatus;
import com.socialnetwork.domain.model.UserSummary;
import com.socialnetwork.domain.service.FollowService;
import com.socialnetwork.infrastructure.security.SessionAuthInterceptor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Follow edges and follow requests of the current user.
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class FollowController {

    private final FollowService followService;

    /**
     * Follow a user, or send a request when the account is private.
     *
     * POST /api/follow/{id}
     *
     * Response:
     * {
     *   "status": "followed|request_sent",
     *   "request_id": 12,
     *   "message": "..."
     * }
     */
    @PostMapping("/follow/{id}")
    public ResponseEntity<FollowResult> follow(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
            @PathVariable Long id) {
        log.info("Follow: userId={}, targetId={}", userId, id);
        return ResponseEntity.ok(followService.follow(userId, id));
    }

    @DeleteMapping("/follow/{id}")
    public ResponseEntity<Map<String, String>> unfollow(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
            @PathVariable Long id) {
        followService.unfollow(userId, id);
        return ResponseEntity.ok(Map.of("message", "Unfollowed successfully"));
    }

    @GetMapping("/follow/status/{id}")
    public ResponseEntity<FollowStatus> status(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
            @PathVariable Long id) {
        return ResponseEntity.ok(followService.status(userId, id));
    }

    @GetMapping("/follow/requests")
    public ResponseEntity<List<FollowRequestView>> pendingRequests(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId) {
        return ResponseEntity.ok(followService.pendingRequests(userId));
    }

    @PostMapping("/follow/request/{id}/accept")
    public ResponseEntity<Map<String, String>> acceptRequest(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
            @PathVariable Long id) {
        followService.acceptRequest(id, userId);
        return ResponseEntity.ok(Map.of("message", "Follow request accepted"));
    }

    @PostMapping("/follow/request/{id}/reject")
    public ResponseEntity<Map<String, String>> rejectRequest(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
            @PathVariable Long id) {
        followService.rejectRequest(id, userId);
        return ResponseEntity.ok(Map.of("message", "Follow request rejected"));
    }

    /**
     * Withdraw a pending request. The path id is the target user, not the request.
     */
    @PostMapping("/follow/request/{id}/cancel")
    public ResponseEntity<Map<String, String>> cancelRequest(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
            @PathVariable Long id) {
        followService.cancelRequest(userId, id);
        return ResponseEntity.ok(Map.of("message", "Follow request cancelled"));
    }

    @DeleteMapping("/followers/remove/{id}")
    public ResponseEntity<Map<String, String>> removeFollower(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
            @PathVariable Long id) {
        followService.removeFollower(userId, id);
        return ResponseEntity.ok(Map.of("message", "Follower removed"));
    }

    @GetMapping("/followers")
    public ResponseEntity<List<UserSummary>> followers(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId) {
        return ResponseEntity.ok(followService.followers(userId));
    }

    @GetMapping("/following")
    public ResponseEntity<List<UserSummary>> following(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId) {
        return ResponseEntity.ok(followService.following(userId));
    }

    @GetMapping("/followers/count")
    public ResponseEntity<Map<String, Long>> followerCount(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId) {
        return ResponseEntity.ok(Map.of("count", followService.counts(userId).getFollowers()));
    }

    @GetMapping("/following/count")
    public ResponseEntity<Map<String, Long>> followingCount(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId) {
        return ResponseEntity.ok(Map.of("count", followService.counts(userId).getFollowing()));
    }
}
