package com.socialnetwork.infrastructure.persistence.repository;

import com.socialnetwork.infrastructure.persistence.entity.GroupInvitationEntity;
import com.socialnetwork.infrastructure.persistence.entity.GroupJoinRequestEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface GroupJoinRequestRepository extends JpaRepository<GroupJoinRequestEntity, Long> {

    Optional<GroupJoinRequestEntity> findByGroupIdAndUserId(Long groupId, Long userId);

    List<GroupJoinRequestEntity> findByGroupIdAndStatusOrderByCreatedAtAsc(
            Long groupId, GroupInvitationEntity.Status status);

    List<GroupJoinRequestEntity> findByUserIdAndStatusAndGroupIdIn(
            Long userId, GroupInvitationEntity.Status status, Collection<Long> groupIds);
}
