package com.socialnetwork.api;

import com.socialnetwork.domain.model.PostView;
import com.socialnetwork.domain.model.ProfileUpdateRequest;
import com.socialnetwork.domain.model.UserProfile;
import com.socialnetwork.domain.model.UserSummary;
import com.socialnetwork.domain.service.FollowService;
import com.socialnetwork.domain.service.PostService;
import com.socialnetwork.domain.service.UserLookupService;
import com.socialnetwork.domain.service.UserService;
import com.socialnetwork.infrastructure.security.SessionAuthInterceptor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Profiles and user search.
 *
 * Endpoints:
 * - GET /api/profile - Own profile
 * - POST /api/profile/update - Partial profile update
 * - GET /api/users/{id} - Profile, limited for private accounts the viewer does not follow
 * - GET /api/users/search?q= - Search by name, nickname or email
 * - GET /api/users/{id}/followers, /following, /posts
 * - GET /api/users/nickname-available?nickname= - Public
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class UserController {

    private final UserService userService;
    private final FollowService followService;
    private final PostService postService;
    private final UserLookupService userLookupService;

    @GetMapping("/profile")
    public ResponseEntity<UserProfile> ownProfile(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId) {
        return ResponseEntity.ok(userService.profile(userId, userId));
    }

    @PostMapping("/profile/update")
    public ResponseEntity<UserProfile> updateProfile(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
            @RequestBody ProfileUpdateRequest request) {
        log.info("Profile update: userId={}", userId);
        return ResponseEntity.ok(userService.updateProfile(userId, request));
    }

    @GetMapping("/users/{id}")
    public ResponseEntity<UserProfile> profile(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
            @PathVariable Long id) {
        return ResponseEntity.ok(userService.profile(id, userId));
    }

    @GetMapping("/users/search")
    public ResponseEntity<List<UserSummary>> search(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
            @RequestParam(name = "q", required = false) String query) {
        return ResponseEntity.ok(userService.search(query, userId));
    }

    @GetMapping("/users/{id}/followers")
    public ResponseEntity<List<UserSummary>> followers(@PathVariable Long id) {
        userLookupService.require(id);
        return ResponseEntity.ok(followService.followers(id));
    }

    @GetMapping("/users/{id}/following")
    public ResponseEntity<List<UserSummary>> following(@PathVariable Long id) {
        userLookupService.require(id);
        return ResponseEntity.ok(followService.following(id));
    }

    @GetMapping("/users/{id}/posts")
    public ResponseEntity<List<PostView>> posts(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
            @PathVariable Long id) {
        return ResponseEntity.ok(postService.userPosts(id, userId));
    }

    @GetMapping("/users/nickname-available")
    public ResponseEntity<Map<String, Boolean>> nicknameAvailable(@RequestParam String nickname) {
        return ResponseEntity.ok(Map.of("available", userService.nicknameAvailable(nickname)));
    }
}
