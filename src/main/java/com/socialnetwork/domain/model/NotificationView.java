package com.socialnetwork.domain.model;

import com.socialnetwork.infrastructure.persistence.entity.NotificationEntity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Notification as returned to the client, stored or synthesized from a pending follow request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationView {

    private Long id;
    private NotificationEntity.Type type;
    private String content;
    private Long referenceId;
    private Boolean isRead;
    private Instant createdAt;
    private UserSummary sender;

    // Type-specific links, derived from referenceId and senderId
    private Long conversationId;
    private Long followerId;
    private Long requestId;
    private Long groupId;
    private Long postId;
}
