package com.socialnetwork.infrastructure.persistence.repository;

import com.socialnetwork.infrastructure.persistence.entity.ConversationEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ConversationRepository extends JpaRepository<ConversationEntity, Long> {

    /**
     * Direct (non-group) conversations both users take part in.
     */
    @Query("SELECT c FROM ConversationEntity c WHERE c.isGroup = false " +
           "AND EXISTS (SELECT a.id FROM ConversationParticipantEntity a WHERE a.conversationId = c.id AND a.userId = :userA) " +
           "AND EXISTS (SELECT b.id FROM ConversationParticipantEntity b WHERE b.conversationId = c.id AND b.userId = :userB) " +
           "ORDER BY c.id ASC")
    List<ConversationEntity> findDirectBetween(@Param("userA") Long userA, @Param("userB") Long userB);

    @Query("SELECT c FROM ConversationEntity c, ConversationParticipantEntity p " +
           "WHERE p.conversationId = c.id AND p.userId = :userId AND c.isGroup = false " +
           "ORDER BY c.updatedAt DESC, c.id DESC")
    List<ConversationEntity> findDirectForUser(@Param("userId") Long userId);

    Optional<ConversationEntity> findFirstByGroupId(Long groupId);
}
