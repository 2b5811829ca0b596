package com.socialnetwork.infrastructure.persistence.repository;

import com.socialnetwork.infrastructure.persistence.entity.PostAccessEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface PostAccessRepository extends JpaRepository<PostAccessEntity, Long> {

    boolean existsByPostIdAndUserId(Long postId, Long userId);
}
