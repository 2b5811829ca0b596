package com.socialnetwork.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "group_posts", indexes = {
    @Index(name = "idx_group_posts_group", columnList = "groupId,createdAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GroupPostEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long groupId;

    @Column(nullable = false)
    private Long authorId;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String content;

    @Column
    private String imagePath;

    @Column(nullable = false)
    @Builder.Default
    private int commentsCount = 0;

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
