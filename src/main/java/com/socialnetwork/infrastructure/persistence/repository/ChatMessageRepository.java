package com.socialnetwork.infrastructure.persistence.repository;

import com.socialnetwork.infrastructure.persistence.entity.ChatMessageEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ChatMessageRepository extends JpaRepository<ChatMessageEntity, Long> {

    /**
     * Newest first; callers reverse the page for display.
     */
    List<ChatMessageEntity> findByConversationIdOrderByIdDesc(Long conversationId, Pageable pageable);

    Optional<ChatMessageEntity> findTopByConversationIdOrderByIdDesc(Long conversationId);

    @Query("SELECT COUNT(m) FROM ChatMessageEntity m WHERE m.conversationId = :conversationId " +
           "AND m.senderId <> :userId AND m.id > :afterId")
    long countUnread(
            @Param("conversationId") Long conversationId,
            @Param("userId") Long userId,
            @Param("afterId") Long afterId
    );
}
