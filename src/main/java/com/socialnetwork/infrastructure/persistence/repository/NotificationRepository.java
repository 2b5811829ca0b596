package com.socialnetwork.infrastructure.persistence.repository;

import com.socialnetwork.infrastructure.persistence.entity.NotificationEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface NotificationRepository extends JpaRepository<NotificationEntity, Long> {

    @Query("SELECT n FROM NotificationEntity n WHERE n.receiverId = :receiverId " +
           "AND (:type IS NULL OR n.type = :type) " +
           "ORDER BY n.createdAt DESC, n.id DESC")
    List<NotificationEntity> findForReceiver(
            @Param("receiverId") Long receiverId,
            @Param("type") NotificationEntity.Type type
    );

    Optional<NotificationEntity> findByIdAndReceiverId(Long id, Long receiverId);

    /**
     * Unread stored notifications, excluding one type.
     * Follow requests are counted from the follow_requests table instead.
     */
    @Query("SELECT COUNT(n) FROM NotificationEntity n WHERE n.receiverId = :receiverId " +
           "AND n.isRead = false AND n.type <> :excluded")
    long countUnreadExcluding(
            @Param("receiverId") Long receiverId,
            @Param("excluded") NotificationEntity.Type excluded
    );

    @Modifying
    @Query("UPDATE NotificationEntity n SET n.isRead = true WHERE n.receiverId = :receiverId AND n.isRead = false")
    int markAllRead(@Param("receiverId") Long receiverId);

    @Modifying
    @Query("UPDATE NotificationEntity n SET n.isRead = true WHERE n.receiverId = :receiverId AND n.id IN :ids")
    int markRead(@Param("receiverId") Long receiverId, @Param("ids") Collection<Long> ids);

    @Modifying
    @Query("DELETE FROM NotificationEntity n WHERE n.receiverId = :receiverId " +
           "AND n.type = :type AND n.referenceId = :referenceId")
    int deleteByReference(
            @Param("receiverId") Long receiverId,
            @Param("type") NotificationEntity.Type type,
            @Param("referenceId") Long referenceId
    );

    @Modifying
    @Query("DELETE FROM NotificationEntity n WHERE n.receiverId = :receiverId")
    int deleteAllForReceiver(@Param("receiverId") Long receiverId);
}
