package com.socialnetwork.domain.service;

import com.socialnetwork.infrastructure.persistence.entity.SessionEntity;
import com.socialnetwork.infrastructure.persistence.repository.SessionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SessionServiceTest {

    @Mock
    private SessionRepository sessionRepository;

    private SessionService sessionService;

    @BeforeEach
    void setUp() {
        sessionService = new SessionService(sessionRepository);
        ReflectionTestUtils.setField(sessionService, "ttlHours", 24L);
    }

    @Test
    void testCreate_RandomUrlSafeIdAndTtl() {
        // Given
        when(sessionRepository.save(any(SessionEntity.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // When
        SessionEntity first = sessionService.create(1L);
        SessionEntity second = sessionService.create(1L);

        // Then
        assertEquals(43, first.getId().length());
        assertTrue(first.getId().matches("[A-Za-z0-9_-]+"));
        assertNotEquals(first.getId(), second.getId());
        assertEquals(1L, first.getUserId());
        assertEquals(Duration.ofHours(24), Duration.between(first.getCreatedAt(), first.getExpiresAt()));
    }

    @Test
    void testResolveUserId_ValidSession() {
        // Given
        when(sessionRepository.findById("abc")).thenReturn(Optional.of(session(Instant.now().plusSeconds(60))));

        // When
        Optional<Long> userId = sessionService.resolveUserId("abc");

        // Then
        assertEquals(Optional.of(7L), userId);
    }

    @Test
    void testResolveUserId_ExpiredSession() {
        // Given
        when(sessionRepository.findById("abc")).thenReturn(Optional.of(session(Instant.now().minusSeconds(1))));

        // When / Then
        assertTrue(sessionService.resolveUserId("abc").isEmpty());
    }

    @Test
    void testResolveUserId_MissingCookie() {
        // When / Then
        assertTrue(sessionService.resolveUserId(null).isEmpty());
        assertTrue(sessionService.resolveUserId("").isEmpty());
        verifyNoInteractions(sessionRepository);
    }

    @Test
    void testDelete_RemovesSession() {
        // Given
        SessionEntity session = session(Instant.now().plusSeconds(60));
        when(sessionRepository.findById("abc")).thenReturn(Optional.of(session));

        // When
        sessionService.delete("abc");

        // Then
        verify(sessionRepository).delete(session);
    }

    @Test
    void testPurgeExpiredSessions() {
        // Given
        when(sessionRepository.deleteExpired(any(Instant.class))).thenReturn(3);

        // When
        sessionService.purgeExpiredSessions();

        // Then
        verify(sessionRepository).deleteExpired(any(Instant.class));
    }

    @Test
    void testPurgeExpiredSessions_ErrorIsLogged() {
        // Given
        when(sessionRepository.deleteExpired(any(Instant.class))).thenThrow(new RuntimeException("database is locked"));

        // When / Then
        assertDoesNotThrow(() -> sessionService.purgeExpiredSessions());
    }

    private static SessionEntity session(Instant expiresAt) {
        return SessionEntity.builder()
                .id("abc")
                .userId(7L)
                .createdAt(Instant.now().minusSeconds(3600))
                .expiresAt(expiresAt)
                .build();
    }
}
