package com.socialnetwork.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One user's vote on one piece of content.
 *
 * A user holds at most one vote per (contentId, contentType); voteType is +1 or -1.
 * contentId is polymorphic over contentType, so the database cannot cascade
 * deletes from the voted content. Services delete votes explicitly.
 */
@Entity
@Table(name = "votes",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_votes_user_content", columnNames = {"user_id", "content_id", "content_type"})
    },
    indexes = {
        @Index(name = "idx_votes_content", columnList = "contentType,contentId")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VoteEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long userId;

    @Column(nullable = false)
    private Long contentId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ContentType contentType;

    @Column(nullable = false)
    private int voteType;

    @Column(nullable = false)
    private Instant createdAt;

    public enum ContentType {
        POST,
        COMMENT,
        GROUP_POST,
        GROUP_POST_COMMENT
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
