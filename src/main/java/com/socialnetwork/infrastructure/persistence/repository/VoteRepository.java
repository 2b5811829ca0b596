package com.socialnetwork.infrastructure.persistence.repository;

import com.socialnetwork.infrastructure.persistence.entity.VoteEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface VoteRepository extends JpaRepository<VoteEntity, Long> {

    Optional<VoteEntity> findByUserIdAndContentIdAndContentType(
            Long userId, Long contentId, VoteEntity.ContentType contentType);

    /**
     * The user's votes on a batch of content, as (contentId, voteType) rows.
     */
    @Query("SELECT v.contentId, v.voteType FROM VoteEntity v " +
           "WHERE v.userId = :userId AND v.contentType = :contentType AND v.contentId IN :contentIds")
    List<Object[]> findUserVotes(
            @Param("userId") Long userId,
            @Param("contentType") VoteEntity.ContentType contentType,
            @Param("contentIds") Collection<Long> contentIds
    );

    @Modifying
    @Query("DELETE FROM VoteEntity v WHERE v.contentType = :contentType AND v.contentId IN :contentIds")
    int deleteByContent(
            @Param("contentType") VoteEntity.ContentType contentType,
            @Param("contentIds") Collection<Long> contentIds
    );
}
