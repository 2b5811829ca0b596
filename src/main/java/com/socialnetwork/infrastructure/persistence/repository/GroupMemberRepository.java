package com.socialnetwork.infrastructure.persistence.repository;

import com.socialnetwork.infrastructure.persistence.entity.GroupMemberEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface GroupMemberRepository extends JpaRepository<GroupMemberEntity, Long> {

    Optional<GroupMemberEntity> findByGroupIdAndUserId(Long groupId, Long userId);

    boolean existsByGroupIdAndUserId(Long groupId, Long userId);

    List<GroupMemberEntity> findByGroupIdOrderByJoinedAtAsc(Long groupId);

    List<GroupMemberEntity> findByUserIdAndGroupIdIn(Long userId, Collection<Long> groupIds);

    @Query("SELECT m.userId FROM GroupMemberEntity m WHERE m.groupId = :groupId")
    List<Long> findUserIdsByGroupId(@Param("groupId") Long groupId);

    /**
     * Member counts per group, as (groupId, count) rows.
     */
    @Query("SELECT m.groupId, COUNT(m) FROM GroupMemberEntity m WHERE m.groupId IN :groupIds GROUP BY m.groupId")
    List<Object[]> countByGroupIds(@Param("groupIds") Collection<Long> groupIds);

    @Modifying
    @Query("DELETE FROM GroupMemberEntity m WHERE m.groupId = :groupId AND m.userId = :userId")
    int deleteMembership(@Param("groupId") Long groupId, @Param("userId") Long userId);
}
