package com.socialnetwork.domain.service;

import com.socialnetwork.domain.exception.BadRequestException;
import com.socialnetwork.domain.exception.ConflictException;
import com.socialnetwork.domain.exception.ForbiddenException;
import com.socialnetwork.domain.exception.NotFoundException;
import com.socialnetwork.domain.model.FollowCounts;
import com.socialnetwork.domain.model.FollowResult;
import com.socialnetwork.infrastructure.cache.SocialCacheService;
import com.socialnetwork.infrastructure.persistence.entity.FollowEntity;
import com.socialnetwork.infrastructure.persistence.entity.FollowRequestEntity;
import com.socialnetwork.infrastructure.persistence.entity.NotificationEntity;
import com.socialnetwork.infrastructure.persistence.entity.UserEntity;
import com.socialnetwork.infrastructure.persistence.repository.FollowRepository;
import com.socialnetwork.infrastructure.persistence.repository.FollowRequestRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FollowServiceTest {

    @Mock
    private FollowRepository followRepository;

    @Mock
    private FollowRequestRepository followRequestRepository;

    @Mock
    private UserLookupService userLookupService;

    @Mock
    private NotificationService notificationService;

    @Mock
    private SocialCacheService cacheService;

    private FollowService followService;

    private final UserEntity alice = user(1L, "Alice", true);
    private final UserEntity bob = user(2L, "Bob", true);
    private final UserEntity carol = user(3L, "Carol", false);

    @BeforeEach
    void setUp() {
        followService = new FollowService(followRepository, followRequestRepository,
                userLookupService, notificationService, cacheService);
    }

    @Test
    void testFollow_Self() {
        // When / Then
        assertThrows(BadRequestException.class, () -> followService.follow(1L, 1L));
        verifyNoInteractions(followRepository, followRequestRepository);
    }

    @Test
    void testFollow_PublicTargetFollowedDirectly() {
        // Given
        when(userLookupService.require(2L)).thenReturn(bob);
        when(userLookupService.require(1L)).thenReturn(alice);
        when(followRepository.existsByFollowerIdAndFollowingId(1L, 2L)).thenReturn(false);

        // When
        FollowResult result = followService.follow(1L, 2L);

        // Then
        assertEquals(FollowResult.FOLLOWED, result.getStatus());
        assertNull(result.getRequestId());

        ArgumentCaptor<FollowEntity> saved = ArgumentCaptor.forClass(FollowEntity.class);
        verify(followRepository).save(saved.capture());
        assertEquals(1L, saved.getValue().getFollowerId());
        assertEquals(2L, saved.getValue().getFollowingId());

        verify(notificationService).followed(alice, 2L);
        verify(followRequestRepository, never()).save(any());
    }

    @Test
    void testFollow_CountsEvictedOnlyAfterCommit() {
        // Given
        when(userLookupService.require(2L)).thenReturn(bob);
        when(userLookupService.require(1L)).thenReturn(alice);
        when(followRepository.existsByFollowerIdAndFollowingId(1L, 2L)).thenReturn(false);
        TransactionSynchronizationManager.initSynchronization();

        try {
            // When
            followService.follow(1L, 2L);

            // Then
            verifyNoInteractions(cacheService);
            TransactionSynchronizationManager.getSynchronizations().forEach(TransactionSynchronization::afterCommit);
            verify(cacheService).evict(SocialCacheService.Region.FOLLOW_COUNTS, 1L, 2L);
        } finally {
            TransactionSynchronizationManager.clearSynchronization();
        }
    }

    @Test
    void testFollow_PrivateTargetGetsRequest() {
        // Given
        when(userLookupService.require(3L)).thenReturn(carol);
        when(userLookupService.require(1L)).thenReturn(alice);
        when(followRepository.existsByFollowerIdAndFollowingId(1L, 3L)).thenReturn(false);
        when(followRequestRepository.findByRequesterIdAndRequestedId(1L, 3L)).thenReturn(Optional.empty());
        when(followRequestRepository.save(any(FollowRequestEntity.class))).thenAnswer(invocation -> {
            FollowRequestEntity request = invocation.getArgument(0);
            request.setId(9L);
            return request;
        });

        // When
        FollowResult result = followService.follow(1L, 3L);

        // Then
        assertEquals(FollowResult.REQUEST_SENT, result.getStatus());
        assertEquals(9L, result.getRequestId());
        verify(notificationService).followRequested(alice, 3L, 9L);
        verify(followRepository, never()).save(any());
    }

    @Test
    void testFollow_DuplicateRequestIsIdempotent() {
        // Given
        FollowRequestEntity existing = FollowRequestEntity.builder()
                .id(4L)
                .requesterId(1L)
                .requestedId(3L)
                .build();

        when(userLookupService.require(3L)).thenReturn(carol);
        when(userLookupService.require(1L)).thenReturn(alice);
        when(followRepository.existsByFollowerIdAndFollowingId(1L, 3L)).thenReturn(false);
        when(followRequestRepository.findByRequesterIdAndRequestedId(1L, 3L)).thenReturn(Optional.of(existing));

        // When
        FollowResult result = followService.follow(1L, 3L);

        // Then
        assertEquals(FollowResult.REQUEST_SENT, result.getStatus());
        assertEquals(4L, result.getRequestId());
        verify(followRequestRepository, never()).save(any());
        verifyNoInteractions(notificationService);
    }

    @Test
    void testFollow_AlreadyFollowing() {
        // Given
        when(userLookupService.require(2L)).thenReturn(bob);
        when(userLookupService.require(1L)).thenReturn(alice);
        when(followRepository.existsByFollowerIdAndFollowingId(1L, 2L)).thenReturn(true);

        // When / Then
        ConflictException e = assertThrows(ConflictException.class, () -> followService.follow(1L, 2L));
        assertEquals("You are already following this user", e.getMessage());
    }

    @Test
    void testUnfollow_NotFollowing() {
        // Given
        when(followRepository.deletePair(1L, 2L)).thenReturn(0);

        // When / Then
        assertThrows(NotFoundException.class, () -> followService.unfollow(1L, 2L));
        verifyNoInteractions(cacheService);
    }

    @Test
    void testAcceptRequest_CreatesFollowAndNotifies() {
        // Given
        FollowRequestEntity request = FollowRequestEntity.builder()
                .id(5L)
                .requesterId(1L)
                .requestedId(3L)
                .build();

        when(followRequestRepository.findById(5L)).thenReturn(Optional.of(request));
        when(userLookupService.require(3L)).thenReturn(carol);
        when(followRepository.existsByFollowerIdAndFollowingId(1L, 3L)).thenReturn(false);

        // When
        followService.acceptRequest(5L, 3L);

        // Then
        verify(followRepository).save(any(FollowEntity.class));
        verify(followRequestRepository).delete(request);
        verify(notificationService).deleteByReference(3L, NotificationEntity.Type.FOLLOW_REQUEST, 5L);
        verify(notificationService).followAccepted(carol, 1L);
        verify(notificationService).evictUnreadCount(3L);
    }

    @Test
    void testAcceptRequest_NotAddressedToUser() {
        // Given
        FollowRequestEntity request = FollowRequestEntity.builder()
                .id(5L)
                .requesterId(1L)
                .requestedId(3L)
                .build();
        when(followRequestRepository.findById(5L)).thenReturn(Optional.of(request));

        // When / Then
        assertThrows(ForbiddenException.class, () -> followService.acceptRequest(5L, 2L));
        verify(followRepository, never()).save(any());
        verify(followRequestRepository, never()).delete(any());
    }

    @Test
    void testApproveAllPending_ApprovesEveryRequest() {
        // Given
        List<FollowRequestEntity> pending = List.of(
                FollowRequestEntity.builder().id(6L).requesterId(1L).requestedId(3L).build(),
                FollowRequestEntity.builder().id(7L).requesterId(2L).requestedId(3L).build());

        when(followRequestRepository.findByRequestedIdOrderByCreatedAtDesc(3L)).thenReturn(pending);
        when(userLookupService.require(3L)).thenReturn(carol);

        // When
        int approved = followService.approveAllPending(3L);

        // Then
        assertEquals(2, approved);
        verify(followRepository, times(2)).save(any(FollowEntity.class));
        verify(notificationService).followAccepted(carol, 1L);
        verify(notificationService).followAccepted(carol, 2L);
    }

    @Test
    void testCounts_CacheHit() {
        // Given
        FollowCounts cached = FollowCounts.builder().followers(4).following(2).build();

        when(cacheService.lookup(SocialCacheService.Region.FOLLOW_COUNTS, 3L, FollowCounts.class)).thenReturn(Optional.of(cached));

        // When
        FollowCounts counts = followService.counts(3L);

        // Then
        assertEquals(4, counts.getFollowers());
        verify(followRepository, never()).countByFollowingId(any());
    }

    @Test
    void testCounts_CacheMissComputesAndStores() {
        // Given
        when(cacheService.lookup(SocialCacheService.Region.FOLLOW_COUNTS, 3L, FollowCounts.class)).thenReturn(Optional.empty());
        when(followRepository.countByFollowingId(3L)).thenReturn(5L);
        when(followRepository.countByFollowerId(3L)).thenReturn(1L);

        // When
        FollowCounts counts = followService.counts(3L);

        // Then
        assertEquals(5, counts.getFollowers());
        assertEquals(1, counts.getFollowing());
        verify(cacheService).store(eq(SocialCacheService.Region.FOLLOW_COUNTS), eq(3L), eq(counts), any(Duration.class));
    }

    private static UserEntity user(Long id, String firstName, boolean isPublic) {
        return UserEntity.builder()
                .id(id)
                .email(firstName.toLowerCase() + "@example.com")
                .passwordHash("hash")
                .firstName(firstName)
                .lastName("Test")
                .isPublic(isPublic)
                .build();
    }
}
