package com.socialnetwork.infrastructure.persistence.repository;

import com.socialnetwork.infrastructure.persistence.entity.GroupInvitationEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface GroupInvitationRepository extends JpaRepository<GroupInvitationEntity, Long> {

    Optional<GroupInvitationEntity> findByGroupIdAndInviteeId(Long groupId, Long inviteeId);

    List<GroupInvitationEntity> findByInviteeIdAndStatusOrderByCreatedAtDesc(
            Long inviteeId, GroupInvitationEntity.Status status);

    List<GroupInvitationEntity> findByInviteeIdAndStatusAndGroupIdIn(
            Long inviteeId, GroupInvitationEntity.Status status, Collection<Long> groupIds);

    boolean existsByGroupIdAndInviteeIdAndStatus(
            Long groupId, Long inviteeId, GroupInvitationEntity.Status status);
}
