package com.socialnetwork.infrastructure.persistence.repository;

import com.socialnetwork.infrastructure.persistence.entity.UserEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface UserRepository extends JpaRepository<UserEntity, Long> {

    Optional<UserEntity> findByEmail(String email);

    boolean existsByEmail(String email);

    boolean existsByNicknameIgnoreCase(String nickname);

    /**
     * Substring search over names, nickname and email.
     *
     * Exact first name, last name or nickname matches rank first.
     * {@code pattern} is the lower-cased term wrapped in '%'; {@code term} is the lower-cased term.
     */
    @Query("SELECT u FROM UserEntity u WHERE u.id <> :viewerId AND (" +
           "LOWER(u.firstName) LIKE :pattern OR " +
           "LOWER(u.lastName) LIKE :pattern OR " +
           "LOWER(CONCAT(u.firstName, ' ', u.lastName)) LIKE :pattern OR " +
           "LOWER(u.nickname) LIKE :pattern OR " +
           "LOWER(u.email) LIKE :pattern) " +
           "ORDER BY CASE WHEN LOWER(u.firstName) = :term OR LOWER(u.lastName) = :term " +
           "OR LOWER(u.nickname) = :term THEN 0 ELSE 1 END, u.firstName, u.lastName")
    List<UserEntity> search(
            @Param("pattern") String pattern,
            @Param("term") String term,
            @Param("viewerId") Long viewerId,
            Pageable pageable
    );
}
