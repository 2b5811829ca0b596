package com.socialnetwork.domain.service;

import com.socialnetwork.domain.exception.BadRequestException;
import com.socialnetwork.domain.exception.ConflictException;
import com.socialnetwork.domain.exception.UnauthorizedException;
import com.socialnetwork.domain.model.FollowCounts;
import com.socialnetwork.domain.model.FollowStatus;
import com.socialnetwork.domain.model.LoginRequest;
import com.socialnetwork.domain.model.ProfileUpdateRequest;
import com.socialnetwork.domain.model.RegisterRequest;
import com.socialnetwork.domain.model.UserProfile;
import com.socialnetwork.infrastructure.persistence.entity.UserEntity;
import com.socialnetwork.infrastructure.persistence.repository.UserRepository;
import com.socialnetwork.infrastructure.security.PasswordHasher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for UserService.
 *
 * Uses a real BCrypt hasher with the minimum cost so credential checks run end to end.
 */
@ExtendWith(MockitoExtension.class)
class UserServiceTest {

    private static final String PASSWORD = "Secret#pass";

    @Mock
    private UserRepository userRepository;

    @Mock
    private UserLookupService userLookupService;

    @Mock
    private FollowService followService;

    private PasswordHasher passwordHasher;

    private UserService userService;

    @BeforeEach
    void setUp() {
        passwordHasher = new PasswordHasher(4);
        userService = new UserService(userRepository, userLookupService, followService, passwordHasher);
    }

    @Test
    void testValidatePassword_Rules() {
        assertTrue(UserService.validatePassword(PASSWORD).isEmpty());
        assertEquals(List.of("one uppercase letter", "one special character"),
                UserService.validatePassword("password"));
        assertTrue(UserService.validatePassword("Pass word!").contains("no spaces"));
        assertTrue(UserService.validatePassword("Ab!").contains("at least 8 characters"));
    }

    @Test
    void testRegister_Success() {
        // Given
        RegisterRequest request = registerRequest(" Ada@Example.com ");
        when(userRepository.existsByEmail("ada@example.com")).thenReturn(false);
        when(userRepository.save(any(UserEntity.class))).thenAnswer(invocation -> {
            UserEntity user = invocation.getArgument(0);
            user.setId(1L);
            return user;
        });

        // When
        UserProfile profile = userService.register(request);

        // Then
        ArgumentCaptor<UserEntity> saved = ArgumentCaptor.forClass(UserEntity.class);
        verify(userRepository).save(saved.capture());
        assertEquals("ada@example.com", saved.getValue().getEmail());
        assertNotEquals(PASSWORD, saved.getValue().getPasswordHash());
        assertTrue(passwordHasher.matches(PASSWORD, saved.getValue().getPasswordHash()));
        assertTrue(saved.getValue().isPublic());

        assertEquals(1L, profile.getId());
        assertEquals("ada@example.com", profile.getEmail());
        assertFalse(profile.getLimited());
    }

    @Test
    void testRegister_DuplicateEmail() {
        // Given
        when(userRepository.existsByEmail("ada@example.com")).thenReturn(true);

        // When / Then
        assertThrows(ConflictException.class, () -> userService.register(registerRequest("ada@example.com")));
        verify(userRepository, never()).save(any());
    }

    @Test
    void testRegister_WeakPassword() {
        // Given
        RegisterRequest request = registerRequest("ada@example.com");
        request.setPassword("weakpass");

        // When / Then
        BadRequestException error = assertThrows(BadRequestException.class, () -> userService.register(request));
        assertTrue(error.getMessage().contains("one uppercase letter"));
        verifyNoInteractions(userRepository);
    }

    @Test
    void testRegister_FutureDateOfBirth() {
        // Given
        RegisterRequest request = registerRequest("ada@example.com");
        request.setDateOfBirth(LocalDate.now().plusDays(1));

        // When / Then
        assertThrows(BadRequestException.class, () -> userService.register(request));
        verifyNoInteractions(userRepository);
    }

    @Test
    void testRegister_MissingFields() {
        // Given
        RegisterRequest request = registerRequest("ada@example.com");
        request.setFirstName(" ");

        // When / Then
        assertThrows(BadRequestException.class, () -> userService.register(request));
    }

    @Test
    void testAuthenticate_Success() {
        // Given
        UserEntity user = UserEntity.builder()
                .id(1L)
                .email("ada@example.com")
                .passwordHash(passwordHasher.hash(PASSWORD))
                .build();
        when(userRepository.findByEmail("ada@example.com")).thenReturn(Optional.of(user));

        // When
        UserEntity result = userService.authenticate(new LoginRequest("ADA@example.com", PASSWORD));

        // Then
        assertEquals(1L, result.getId());
    }

    @Test
    void testAuthenticate_WrongPasswordAndUnknownEmailFailAlike() {
        // Given
        UserEntity user = UserEntity.builder()
                .id(1L)
                .email("ada@example.com")
                .passwordHash(passwordHasher.hash(PASSWORD))
                .build();
        when(userRepository.findByEmail("ada@example.com")).thenReturn(Optional.of(user));
        when(userRepository.findByEmail("nobody@example.com")).thenReturn(Optional.empty());

        // When
        UnauthorizedException wrongPassword = assertThrows(UnauthorizedException.class,
                () -> userService.authenticate(new LoginRequest("ada@example.com", "Wrong#pass")));
        UnauthorizedException unknownEmail = assertThrows(UnauthorizedException.class,
                () -> userService.authenticate(new LoginRequest("nobody@example.com", PASSWORD)));

        // Then
        assertEquals(wrongPassword.getMessage(), unknownEmail.getMessage());
    }

    @Test
    void testProfile_PrivateProfileLimitedForStranger() {
        // Given
        UserEntity user = UserEntity.builder()
                .id(2L)
                .email("bob@example.com")
                .firstName("Bob")
                .lastName("Test")
                .aboutMe("hidden")
                .isPublic(false)
                .build();
        when(userLookupService.require(2L)).thenReturn(user);
        when(followService.status(3L, 2L)).thenReturn(FollowStatus.builder()
                .isFollowing(false)
                .followRequestSent(true)
                .build());
        when(followService.counts(2L)).thenReturn(FollowCounts.builder().followers(4).following(5).build());

        // When
        UserProfile profile = userService.profile(2L, 3L);

        // Then
        assertTrue(profile.getLimited());
        assertNull(profile.getEmail());
        assertNull(profile.getAboutMe());
        assertEquals("Bob", profile.getFirstName());
        assertEquals(4, profile.getFollowersCount());
        assertTrue(profile.getFollowRequestSent());
    }

    @Test
    void testProfile_PrivateProfileVisibleToFollower() {
        // Given
        UserEntity user = UserEntity.builder()
                .id(2L)
                .email("bob@example.com")
                .aboutMe("visible")
                .isPublic(false)
                .build();
        when(userLookupService.require(2L)).thenReturn(user);
        when(followService.status(3L, 2L)).thenReturn(FollowStatus.builder()
                .isFollowing(true)
                .followRequestSent(false)
                .build());
        when(followService.counts(2L)).thenReturn(FollowCounts.builder().build());

        // When
        UserProfile profile = userService.profile(2L, 3L);

        // Then
        assertFalse(profile.getLimited());
        assertEquals("visible", profile.getAboutMe());
    }

    @Test
    void testUpdateProfile_GoingPublicApprovesPendingRequests() {
        // Given
        UserEntity user = UserEntity.builder().id(1L).firstName("Ada").lastName("Test").isPublic(false).build();
        when(userLookupService.require(1L)).thenReturn(user);
        when(userRepository.save(user)).thenReturn(user);
        when(followService.approveAllPending(1L)).thenReturn(2);
        when(followService.counts(1L)).thenReturn(FollowCounts.builder().followers(2).build());

        // When
        UserProfile profile = userService.updateProfile(1L, ProfileUpdateRequest.builder().isPublic(true).build());

        // Then
        assertTrue(profile.getIsPublic());
        assertEquals(2, profile.getFollowersCount());
        verify(followService).approveAllPending(1L);
    }

    @Test
    void testUpdateProfile_NicknameTaken() {
        // Given
        UserEntity user = UserEntity.builder().id(1L).nickname("ada").build();
        when(userLookupService.require(1L)).thenReturn(user);
        when(userRepository.existsByNicknameIgnoreCase("bob")).thenReturn(true);

        // When / Then
        assertThrows(ConflictException.class,
                () -> userService.updateProfile(1L, ProfileUpdateRequest.builder().nickname("bob").build()));
        verify(userRepository, never()).save(any());
    }

    @Test
    void testSearch_BlankTerm() {
        // When
        assertTrue(userService.search("  ", 1L).isEmpty());

        // Then
        verifyNoInteractions(userRepository);
    }

    private static RegisterRequest registerRequest(String email) {
        return RegisterRequest.builder()
                .email(email)
                .password(PASSWORD)
                .firstName("Ada")
                .lastName("Lovelace")
                .dateOfBirth(LocalDate.of(1990, 12, 10))
                .build();
    }
}
