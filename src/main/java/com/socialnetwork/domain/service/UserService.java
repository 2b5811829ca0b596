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
import com.socialnetwork.domain.model.UserSummary;
import com.socialnetwork.infrastructure.persistence.entity.UserEntity;
import com.socialnetwork.infrastructure.persistence.repository.UserRepository;
import com.socialnetwork.infrastructure.security.PasswordHasher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Accounts: registration, credential checks, profiles and search.
 *
 * Profile visibility:
 * - own profile, public profiles and profiles the viewer follows are shown in full
 * - other private profiles are limited to name, avatar, nickname and counts
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserService {

    static final int SEARCH_LIMIT = 20;
    static final int MIN_PASSWORD_LENGTH = 8;

    private final UserRepository userRepository;
    private final UserLookupService userLookupService;
    private final FollowService followService;
    private final PasswordHasher passwordHasher;

    @Transactional
    public UserProfile register(RegisterRequest request) {
        String email = normalizeEmail(request.getEmail());
        if (email.isEmpty() || isBlank(request.getPassword())
                || isBlank(request.getFirstName()) || isBlank(request.getLastName())
                || request.getDateOfBirth() == null) {
            throw new BadRequestException("Missing required fields");
        }

        List<String> passwordErrors = validatePassword(request.getPassword());
        if (!passwordErrors.isEmpty()) {
            throw new BadRequestException("Password does not meet security requirements: "
                    + String.join(", ", passwordErrors));
        }

        if (request.getDateOfBirth().isAfter(LocalDate.now())) {
            throw new BadRequestException("Date of birth cannot be in the future");
        }

        if (userRepository.existsByEmail(email)) {
            throw new ConflictException("Email already exists");
        }

        String nickname = trimToNull(request.getNickname());
        if (nickname != null && userRepository.existsByNicknameIgnoreCase(nickname)) {
            throw new ConflictException("Nickname already taken");
        }

        UserEntity user = userRepository.save(UserEntity.builder()
                .email(email)
                .passwordHash(passwordHasher.hash(request.getPassword()))
                .firstName(request.getFirstName().trim())
                .lastName(request.getLastName().trim())
                .dateOfBirth(request.getDateOfBirth())
                .nickname(nickname)
                .aboutMe(trimToNull(request.getAboutMe()))
                .avatar(trimToNull(request.getAvatar()))
                .build());

        log.info("User registered: {}", user.getId());
        return toProfile(user, user.getId(), true, FollowCounts.builder().build(), null);
    }

    /**
     * Check credentials. Unknown email and wrong password fail the same way.
     */
    @Transactional(readOnly = true)
    public UserEntity authenticate(LoginRequest request) {
        return userRepository.findByEmail(normalizeEmail(request.getEmail()))
                .filter(user -> passwordHasher.matches(request.getPassword(), user.getPasswordHash()))
                .orElseThrow(() -> {
                    log.warn("Failed login attempt");
                    return new UnauthorizedException("Invalid email or password");
                });
    }

    @Transactional(readOnly = true)
    public UserProfile profile(Long userId, Long viewerId) {
        UserEntity user = userLookupService.require(userId);
        boolean own = user.getId().equals(viewerId);

        FollowStatus status = own ? null : followService.status(viewerId, userId);
        boolean full = own || user.isPublic() || Boolean.TRUE.equals(status.getIsFollowing());

        return toProfile(user, viewerId, full, followService.counts(userId), status);
    }

    @Transactional
    public UserProfile updateProfile(Long userId, ProfileUpdateRequest request) {
        UserEntity user = userLookupService.require(userId);
        boolean wasPublic = user.isPublic();

        if (request.getFirstName() != null) {
            user.setFirstName(requireNotBlank(request.getFirstName(), "First name"));
        }
        if (request.getLastName() != null) {
            user.setLastName(requireNotBlank(request.getLastName(), "Last name"));
        }
        if (request.getDateOfBirth() != null) {
            if (request.getDateOfBirth().isAfter(LocalDate.now())) {
                throw new BadRequestException("Date of birth cannot be in the future");
            }
            user.setDateOfBirth(request.getDateOfBirth());
        }
        if (request.getNickname() != null) {
            String nickname = trimToNull(request.getNickname());
            if (nickname != null && !nickname.equalsIgnoreCase(user.getNickname())
                    && userRepository.existsByNicknameIgnoreCase(nickname)) {
                throw new ConflictException("Nickname already taken");
            }
            user.setNickname(nickname);
        }
        if (request.getAboutMe() != null) {
            user.setAboutMe(trimToNull(request.getAboutMe()));
        }
        if (request.getAvatar() != null) {
            user.setAvatar(trimToNull(request.getAvatar()));
        }
        if (request.getIsPublic() != null) {
            user.setPublic(request.getIsPublic());
        }

        user = userRepository.save(user);

        if (!wasPublic && user.isPublic()) {
            int approved = followService.approveAllPending(userId);
            log.info("User {} switched to public profile, {} follow requests approved", userId, approved);
        }

        log.info("Profile updated: {}", userId);
        return toProfile(user, userId, true, followService.counts(userId), null);
    }

    @Transactional(readOnly = true)
    public List<UserSummary> search(String term, Long viewerId) {
        if (term == null || term.isBlank()) {
            return List.of();
        }
        String normalized = term.trim().toLowerCase(Locale.ROOT);

        return userRepository.search("%" + normalized + "%", normalized, viewerId, PageRequest.of(0, SEARCH_LIMIT))
                .stream()
                .map(UserLookupService::toSummary)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public boolean nicknameAvailable(String nickname) {
        String trimmed = trimToNull(nickname);
        return trimmed != null && !userRepository.existsByNicknameIgnoreCase(trimmed);
    }

    /**
     * Password rules: at least 8 characters, no whitespace, and at least one
     * uppercase letter, one lowercase letter and one special character.
     *
     * @return the unmet rules, empty when the password is acceptable
     */
    static List<String> validatePassword(String password) {
        List<String> errors = new ArrayList<>();
        if (password.length() < MIN_PASSWORD_LENGTH) {
            errors.add("at least " + MIN_PASSWORD_LENGTH + " characters");
        }
        if (password.chars().anyMatch(Character::isWhitespace)) {
            errors.add("no spaces");
        }
        if (password.chars().noneMatch(Character::isUpperCase)) {
            errors.add("one uppercase letter");
        }
        if (password.chars().noneMatch(Character::isLowerCase)) {
            errors.add("one lowercase letter");
        }
        if (password.chars().allMatch(c -> Character.isLetterOrDigit(c) || Character.isWhitespace(c))) {
            errors.add("one special character");
        }
        return errors;
    }

    private UserProfile toProfile(UserEntity user, Long viewerId, boolean full, FollowCounts counts, FollowStatus status) {
        boolean own = user.getId().equals(viewerId);

        UserProfile.UserProfileBuilder profile = UserProfile.builder()
                .id(user.getId())
                .firstName(user.getFirstName())
                .lastName(user.getLastName())
                .avatar(user.getAvatar())
                .nickname(user.getNickname())
                .isPublic(user.isPublic())
                .followersCount(counts.getFollowers())
                .followingCount(counts.getFollowing())
                .isOwnProfile(own)
                .limited(!full);

        if (full) {
            profile.email(user.getEmail())
                    .dateOfBirth(user.getDateOfBirth())
                    .aboutMe(user.getAboutMe())
                    .createdAt(user.getCreatedAt());
        }
        if (status != null) {
            profile.isFollowing(status.getIsFollowing())
                    .followRequestSent(status.getFollowRequestSent());
        }
        return profile.build();
    }

    private static String normalizeEmail(String email) {
        return email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
    }

    private static String requireNotBlank(String value, String field) {
        if (value.isBlank()) {
            throw new BadRequestException(field + " cannot be empty");
        }
        return value.trim();
    }

    private static String trimToNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
