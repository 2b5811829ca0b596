package com.socialnetwork.infrastructure.persistence.repository;

import com.socialnetwork.infrastructure.persistence.entity.GroupEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface GroupRepository extends JpaRepository<GroupEntity, Long> {

    /**
     * Groups a user can discover: public ones, plus private ones they created or joined.
     */
    @Query("SELECT g FROM GroupEntity g WHERE " +
           "g.privacy = com.socialnetwork.infrastructure.persistence.entity.GroupEntity$Privacy.PUBLIC " +
           "OR g.creatorId = :userId " +
           "OR EXISTS (SELECT m.id FROM GroupMemberEntity m WHERE m.groupId = g.id AND m.userId = :userId) " +
           "ORDER BY g.createdAt DESC, g.id DESC")
    List<GroupEntity> findVisibleTo(@Param("userId") Long userId, Pageable pageable);

    @Query("SELECT g FROM GroupEntity g, GroupMemberEntity m " +
           "WHERE m.groupId = g.id AND m.userId = :userId ORDER BY g.name ASC")
    List<GroupEntity> findByMember(@Param("userId") Long userId);
}
