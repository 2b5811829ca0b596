package com.socialnetwork.infrastructure.persistence.entity;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Profile post.
 *
 * Visibility:
 * - PUBLIC: everyone
 * - ALMOST_PRIVATE: followers of the author
 * - PRIVATE: followers listed in post_access
 *
 * upvotes/downvotes are denormalized from the votes table and maintained by VoteService.
 */
@Entity
@Table(name = "posts", indexes = {
    @Index(name = "idx_posts_user_created", columnList = "userId,createdAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PostEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long userId;

    @Column
    private String title;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String content;

    @Column
    private String imageUrl;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private Privacy privacy = Privacy.PUBLIC;

    @Column(nullable = false)
    @Builder.Default
    private int upvotes = 0;

    @Column(nullable = false)
    @Builder.Default
    private int downvotes = 0;

    @Column(nullable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    public enum Privacy {
        @JsonProperty("public") PUBLIC,
        @JsonProperty("almost_private") ALMOST_PRIVATE,
        @JsonProperty("private") PRIVATE
    }

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
