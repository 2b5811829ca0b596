package com.socialnetwork.domain.service;

import com.socialnetwork.domain.exception.NotFoundException;
import com.socialnetwork.domain.model.UserSummary;
import com.socialnetwork.infrastructure.persistence.entity.UserEntity;
import com.socialnetwork.infrastructure.persistence.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read access to users for the other services: existence checks and the
 * compact author/sender summaries embedded in responses.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class UserLookupService {

    private final UserRepository userRepository;

    public UserEntity require(Long userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> new NotFoundException("User not found"));
    }

    public boolean exists(Long userId) {
        return userId != null && userRepository.existsById(userId);
    }

    /**
     * Summaries keyed by user id. Ids without a user are absent from the map.
     */
    public Map<Long, UserSummary> summaries(Collection<Long> userIds) {
        Collection<Long> ids = userIds.stream()
                .filter(Objects::nonNull)
                .collect(Collectors.toCollection(HashSet::new));
        if (ids.isEmpty()) {
            return Map.of();
        }
        return userRepository.findAllById(ids).stream()
                .map(UserLookupService::toSummary)
                .collect(Collectors.toMap(UserSummary::getId, Function.identity()));
    }

    public static UserSummary toSummary(UserEntity user) {
        return UserSummary.builder()
                .id(user.getId())
                .firstName(user.getFirstName())
                .lastName(user.getLastName())
                .avatar(user.getAvatar())
                .nickname(user.getNickname())
                .build();
    }
}
