package com.socialnetwork.infrastructure.persistence.repository;

import com.socialnetwork.infrastructure.persistence.entity.FollowRequestEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface FollowRequestRepository extends JpaRepository<FollowRequestEntity, Long> {

    Optional<FollowRequestEntity> findByRequesterIdAndRequestedId(Long requesterId, Long requestedId);

    boolean existsByRequesterIdAndRequestedId(Long requesterId, Long requestedId);

    List<FollowRequestEntity> findByRequestedIdOrderByCreatedAtDesc(Long requestedId);

    long countByRequestedId(Long requestedId);
}
