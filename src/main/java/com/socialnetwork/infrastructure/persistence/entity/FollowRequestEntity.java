package com.socialnetwork.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Pending request to follow a private account. Deleted once accepted or rejected.
 */
@Entity
@Table(name = "follow_requests", uniqueConstraints = {
    @UniqueConstraint(name = "uk_follow_requests_pair", columnNames = {"requester_id", "requested_id"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FollowRequestEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long requesterId;

    @Column(nullable = false)
    private Long requestedId;

    @Column(nullable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
