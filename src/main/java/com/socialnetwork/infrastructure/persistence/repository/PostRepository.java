package com.socialnetwork.infrastructure.persistence.repository;

import com.socialnetwork.infrastructure.persistence.entity.PostEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for profile posts.
 *
 * The visibility predicate is shared by the feed and per-author queries:
 * own posts, PUBLIC posts, ALMOST_PRIVATE posts of followed authors,
 * and PRIVATE posts the viewer was granted in post_access.
 */
@Repository
public interface PostRepository extends JpaRepository<PostEntity, Long> {

    String VISIBLE_TO_VIEWER =
            "(p.userId = :viewerId " +
            "OR p.privacy = com.socialnetwork.infrastructure.persistence.entity.PostEntity$Privacy.PUBLIC " +
            "OR (p.privacy = com.socialnetwork.infrastructure.persistence.entity.PostEntity$Privacy.ALMOST_PRIVATE " +
            "AND EXISTS (SELECT f.id FROM FollowEntity f WHERE f.followerId = :viewerId AND f.followingId = p.userId)) " +
            "OR (p.privacy = com.socialnetwork.infrastructure.persistence.entity.PostEntity$Privacy.PRIVATE " +
            "AND EXISTS (SELECT a.id FROM PostAccessEntity a WHERE a.postId = p.id AND a.userId = :viewerId)))";

    @Query("SELECT p FROM PostEntity p WHERE " + VISIBLE_TO_VIEWER +
           " ORDER BY p.createdAt DESC, p.id DESC")
    List<PostEntity> findFeed(@Param("viewerId") Long viewerId, Pageable pageable);

    @Query("SELECT p FROM PostEntity p WHERE p.userId = :authorId AND " + VISIBLE_TO_VIEWER +
           " ORDER BY p.createdAt DESC, p.id DESC")
    List<PostEntity> findByAuthorVisibleTo(
            @Param("authorId") Long authorId,
            @Param("viewerId") Long viewerId
    );

    /**
     * Shift the denormalized vote counters. Deltas may be negative.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE PostEntity p SET p.upvotes = p.upvotes + :upDelta, " +
           "p.downvotes = p.downvotes + :downDelta WHERE p.id = :id")
    int adjustVotes(@Param("id") Long id, @Param("upDelta") int upDelta, @Param("downDelta") int downDelta);
}
