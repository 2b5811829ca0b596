package com.socialnetwork.infrastructure.persistence.repository;

import com.socialnetwork.infrastructure.persistence.entity.GroupPostEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface GroupPostRepository extends JpaRepository<GroupPostEntity, Long> {

    List<GroupPostEntity> findByGroupIdOrderByCreatedAtDescIdDesc(Long groupId, Pageable pageable);

    @Query("SELECT p.id FROM GroupPostEntity p WHERE p.groupId = :groupId")
    List<Long> findIdsByGroupId(@Param("groupId") Long groupId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE GroupPostEntity p SET p.upvotes = p.upvotes + :upDelta, " +
           "p.downvotes = p.downvotes + :downDelta WHERE p.id = :id")
    int adjustVotes(@Param("id") Long id, @Param("upDelta") int upDelta, @Param("downDelta") int downDelta);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE GroupPostEntity p SET p.commentsCount = p.commentsCount + :delta WHERE p.id = :id")
    int adjustCommentsCount(@Param("id") Long id, @Param("delta") int delta);
}
