package com.socialnetwork.api;

import com.socialnetwork.domain.model.LoginRequest;
import com.socialnetwork.domain.model.RegisterRequest;
import com.socialnetwork.domain.model.UserProfile;
import com.socialnetwork.domain.service.SessionService;
import com.socialnetwork.domain.service.UserService;
import com.socialnetwork.infrastructure.persistence.entity.SessionEntity;
import com.socialnetwork.infrastructure.persistence.entity.UserEntity;
import com.socialnetwork.infrastructure.security.SessionAuthInterceptor;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseCookie;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registration, login and session endpoints.
 *
 * Endpoints:
 * - POST /api/register - Create an account
 * - POST /api/login - Check credentials and set the session cookie
 * - POST /api/logout - End the session and clear the cookie
 * - GET /api/auth/check - Session state, never 401
 * - GET /api/users/me - Current user's profile
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class AuthController {

    private final UserService userService;
    private final SessionService sessionService;

    @Value("${app.session.cookie-name:session_id}")
    private String cookieName;

    @Value("${app.session.secure-cookie:false}")
    private boolean secureCookie;

    @PostMapping("/register")
    public ResponseEntity<Map<String, Object>> register(@Valid @RequestBody RegisterRequest request) {
        UserProfile user = userService.register(request);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "User registered successfully");
        body.put("user", user);
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }

    /**
     * Check credentials, create a session and set it as an HttpOnly cookie.
     */
    @PostMapping("/login")
    public ResponseEntity<Map<String, Object>> login(@Valid @RequestBody LoginRequest request) {
        UserEntity user = userService.authenticate(request);
        SessionEntity session = sessionService.create(user.getId());

        ResponseCookie cookie = sessionCookie(session.getId(), sessionService.getTtl());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Login successful");
        body.put("user", userService.profile(user.getId(), user.getId()));
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, cookie.toString())
                .body(body);
    }

    @PostMapping("/logout")
    public ResponseEntity<Map<String, String>> logout(HttpServletRequest request) {
        SessionAuthInterceptor.readSessionId(request, cookieName).ifPresent(sessionService::delete);

        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, sessionCookie("", Duration.ZERO).toString())
                .body(Map.of("message", "Logged out successfully"));
    }

    @GetMapping("/auth/check")
    public ResponseEntity<Map<String, Object>> checkAuth(HttpServletRequest request) {
        Optional<Long> userId = SessionAuthInterceptor.readSessionId(request, cookieName)
                .flatMap(sessionService::resolveUserId);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("authenticated", userId.isPresent());
        userId.ifPresent(id -> body.put("user", userService.profile(id, id)));
        return ResponseEntity.ok(body);
    }

    @GetMapping("/users/me")
    public ResponseEntity<UserProfile> currentUser(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId) {
        return ResponseEntity.ok(userService.profile(userId, userId));
    }

    private ResponseCookie sessionCookie(String value, Duration maxAge) {
        return ResponseCookie.from(cookieName, value)
                .httpOnly(true)
                .secure(secureCookie)
                .sameSite("Lax")
                .path("/")
                .maxAge(maxAge)
                .build();
    }
}
