package com.socialnetwork.infrastructure.persistence.repository;

import com.socialnetwork.infrastructure.persistence.entity.ConversationParticipantEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ConversationParticipantRepository extends JpaRepository<ConversationParticipantEntity, Long> {

    Optional<ConversationParticipantEntity> findByConversationIdAndUserId(Long conversationId, Long userId);

    boolean existsByConversationIdAndUserId(Long conversationId, Long userId);

    List<ConversationParticipantEntity> findByConversationId(Long conversationId);

    @Modifying
    @Query("DELETE FROM ConversationParticipantEntity p WHERE p.conversationId = :conversationId AND p.userId = :userId")
    int deleteParticipant(@Param("conversationId") Long conversationId, @Param("userId") Long userId);
}
