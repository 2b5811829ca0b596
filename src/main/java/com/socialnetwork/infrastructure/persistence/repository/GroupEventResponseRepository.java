package com.socialnetwork.infrastructure.persistence.repository;

import com.socialnetwork.infrastructure.persistence.entity.GroupEventResponseEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface GroupEventResponseRepository extends JpaRepository<GroupEventResponseEntity, Long> {

    Optional<GroupEventResponseEntity> findByEventIdAndUserId(Long eventId, Long userId);

    List<GroupEventResponseEntity> findByUserIdAndEventIdIn(Long userId, Collection<Long> eventIds);

    /**
     * Response tallies as (eventId, response, count) rows.
     */
    @Query("SELECT r.eventId, r.response, COUNT(r) FROM GroupEventResponseEntity r " +
           "WHERE r.eventId IN :eventIds GROUP BY r.eventId, r.response")
    List<Object[]> countByEventIds(@Param("eventIds") Collection<Long> eventIds);

    @Modifying
    @Query("DELETE FROM GroupEventResponseEntity r WHERE r.eventId = :eventId AND r.userId = :userId")
    int deleteResponse(@Param("eventId") Long eventId, @Param("userId") Long userId);
}
