package com.socialnetwork.infrastructure.persistence.repository;

import com.socialnetwork.infrastructure.persistence.entity.CommentEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface CommentRepository extends JpaRepository<CommentEntity, Long> {

    List<CommentEntity> findByPostIdOrderByCreatedAtAscIdAsc(Long postId);

    /**
     * Comment counts per post, as (postId, count) rows.
     */
    @Query("SELECT c.postId, COUNT(c) FROM CommentEntity c WHERE c.postId IN :postIds GROUP BY c.postId")
    List<Object[]> countByPostIds(@Param("postIds") Collection<Long> postIds);

    @Query("SELECT c.id FROM CommentEntity c WHERE c.postId = :postId")
    List<Long> findIdsByPostId(@Param("postId") Long postId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE CommentEntity c SET c.voteCount = c.voteCount + :delta WHERE c.id = :id")
    int adjustVoteCount(@Param("id") Long id, @Param("delta") int delta);
}
