package com.socialnetwork.infrastructure.security;

import com.socialnetwork.domain.exception.UnauthorizedException;
import com.socialnetwork.domain.service.SessionService;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.web.servlet.HandlerInterceptor;

import java.util.Arrays;
import java.util.Optional;

/**
 * Resolves the session cookie to a user id for every protected route.
 *
 * The id is exposed as the request attribute {@link #USER_ID_ATTRIBUTE}, which
 * controllers read with {@code @RequestAttribute}. Unknown or expired sessions
 * fail with 401 before the handler runs.
 */
@Slf4j
public class SessionAuthInterceptor implements HandlerInterceptor {

    public static final String USER_ID_ATTRIBUTE = "userId";

    private final SessionService sessionService;
    private final String cookieName;

    public SessionAuthInterceptor(SessionService sessionService, String cookieName) {
        this.sessionService = sessionService;
        this.cookieName = cookieName;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (HttpMethod.OPTIONS.matches(request.getMethod())) {
            return true;
        }

        Long userId = readSessionId(request, cookieName)
                .flatMap(sessionService::resolveUserId)
                .orElseThrow(() -> {
                    log.debug("Rejected unauthenticated request: {} {}", request.getMethod(), request.getRequestURI());
                    return new UnauthorizedException("Authentication required");
                });

        request.setAttribute(USER_ID_ATTRIBUTE, userId);
        return true;
    }

    public static Optional<String> readSessionId(HttpServletRequest request, String cookieName) {
        Cookie[] cookies = request.getCookies();
        if (cookies == null) {
            return Optional.empty();
        }
        return Arrays.stream(cookies)
                .filter(cookie -> cookieName.equals(cookie.getName()))
                .map(Cookie::getValue)
                .filter(value -> !value.isBlank())
                .findFirst();
    }
}
