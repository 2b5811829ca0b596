package com.socialnetwork.infrastructure.persistence.repository;

import com.socialnetwork.infrastructure.persistence.entity.GroupPostCommentEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface GroupPostCommentRepository extends JpaRepository<GroupPostCommentEntity, Long> {

    List<GroupPostCommentEntity> findByPostIdOrderByCreatedAtAscIdAsc(Long postId);

    @Query("SELECT c.id FROM GroupPostCommentEntity c WHERE c.postId IN :postIds")
    List<Long> findIdsByPostIds(@Param("postIds") Collection<Long> postIds);

    /**
     * Shift split counters and keep the net {@code voteCount} in step.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE GroupPostCommentEntity c SET c.upvotes = c.upvotes + :upDelta, " +
           "c.downvotes = c.downvotes + :downDelta, " +
           "c.voteCount = c.voteCount + :upDelta - :downDelta WHERE c.id = :id")
    int adjustVotes(@Param("id") Long id, @Param("upDelta") int upDelta, @Param("downDelta") int downDelta);
}
