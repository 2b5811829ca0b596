package com.socialnetwork.infrastructure.persistence.entity;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Stored notification.
 *
 * senderId is null for system notifications and becomes null when the sender is deleted.
 * referenceId points at the related row, interpreted by type
 * (conversation, follow request, group, post, event).
 */
@Entity
@Table(name = "notifications", indexes = {
    @Index(name = "idx_notifications_receiver", columnList = "receiverId,isRead")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long receiverId;

    @Column
    private Long senderId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private Type type;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String content;

    @Column
    private Long referenceId;

    @Column(nullable = false)
    @Builder.Default
    private boolean isRead = false;

    @Column(nullable = false)
    private Instant createdAt;

    public enum Type {
        @JsonProperty("message") MESSAGE,
        @JsonProperty("follow") FOLLOW,
        @JsonProperty("follow_request") FOLLOW_REQUEST,
        @JsonProperty("follow_accepted") FOLLOW_ACCEPTED,
        @JsonProperty("group_invitation") GROUP_INVITATION,
        @JsonProperty("group_join_request") GROUP_JOIN_REQUEST,
        @JsonProperty("group_join_accepted") GROUP_JOIN_ACCEPTED,
        @JsonProperty("group_event") GROUP_EVENT,
        @JsonProperty("post_comment") POST_COMMENT,
        @JsonProperty("group_post_comment") GROUP_POST_COMMENT,
        @JsonProperty("system") SYSTEM
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
