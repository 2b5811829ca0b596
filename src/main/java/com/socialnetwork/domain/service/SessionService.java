package com.socialnetwork.domain.service;

import com.socialnetwork.infrastructure.persistence.entity.SessionEntity;
import com.socialnetwork.infrastructure.persistence.repository.SessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Optional;

/**
 * Database-backed login sessions.
 *
 * Session ids are 32 random bytes, URL-safe Base64 encoded, carried in an HttpOnly cookie.
 * Expired rows are ignored on lookup and purged by a scheduled job.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionService {

    private static final SecureRandom RANDOM = new SecureRandom();

    private final SessionRepository sessionRepository;

    @Value("${app.session.ttl-hours:168}")
    private long ttlHours;

    @Transactional
    public SessionEntity create(Long userId) {
        Instant now = Instant.now();

        SessionEntity session = SessionEntity.builder()
                .id(newSessionId())
                .userId(userId)
                .createdAt(now)
                .expiresAt(now.plus(getTtl()))
                .build();

        session = sessionRepository.save(session);
        log.info("Session created for user {}", userId);
        return session;
    }

    @Transactional(readOnly = true)
    public Optional<Long> resolveUserId(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return Optional.empty();
        }
        Instant now = Instant.now();
        return sessionRepository.findById(sessionId)
                .filter(session -> !session.isExpired(now))
                .map(SessionEntity::getUserId);
    }

    @Transactional
    public void delete(String sessionId) {
        if (sessionId == null) {
            return;
        }
        sessionRepository.findById(sessionId).ifPresent(session -> {
            sessionRepository.delete(session);
            log.info("Session ended for user {}", session.getUserId());
        });
    }

    public Duration getTtl() {
        return Duration.ofHours(ttlHours);
    }

    /**
     * Purge expired sessions.
     *
     * Runs hourly by default.
     */
    @Scheduled(fixedDelayString = "${app.session.cleanup-interval-ms:3600000}")
    @Transactional
    public void purgeExpiredSessions() {
        try {
            int removed = sessionRepository.deleteExpired(Instant.now());
            if (removed > 0) {
                log.info("Purged {} expired sessions", removed);
            }
        } catch (Exception e) {
            log.error("Error purging expired sessions: {}", e.getMessage(), e);
        }
    }

    private static String newSessionId() {
        byte[] bytes = new byte[32];
        RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
