package com.socialnetwork.infrastructure.persistence.repository;

import com.socialnetwork.infrastructure.persistence.entity.FollowEntity;
import com.socialnetwork.infrastructure.persistence.entity.UserEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface FollowRepository extends JpaRepository<FollowEntity, Long> {

    boolean existsByFollowerIdAndFollowingId(Long followerId, Long followingId);

    long countByFollowingId(Long followingId);

    long countByFollowerId(Long followerId);

    @Modifying
    @Query("DELETE FROM FollowEntity f WHERE f.followerId = :followerId AND f.followingId = :followingId")
    int deletePair(@Param("followerId") Long followerId, @Param("followingId") Long followingId);

    /**
     * Users following {@code userId}, most recent first.
     */
    @Query("SELECT u FROM UserEntity u, FollowEntity f " +
           "WHERE f.followingId = :userId AND u.id = f.followerId " +
           "ORDER BY f.createdAt DESC")
    List<UserEntity> findFollowers(@Param("userId") Long userId);

    /**
     * Users that {@code userId} follows, most recent first.
     */
    @Query("SELECT u FROM UserEntity u, FollowEntity f " +
           "WHERE f.followerId = :userId AND u.id = f.followingId " +
           "ORDER BY f.createdAt DESC")
    List<UserEntity> findFollowing(@Param("userId") Long userId);

    @Query("SELECT f.followerId FROM FollowEntity f WHERE f.followingId = :userId")
    List<Long> findFollowerIds(@Param("userId") Long userId);
}
