package com.socialnetwork.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Invitation to join a group. One row per (group, invitee); a declined
 * invitation is reset to PENDING when the user is invited again.
 */
@Entity
@Table(name = "group_invitations", uniqueConstraints = {
    @UniqueConstraint(name = "uk_group_invitations", columnNames = {"group_id", "invitee_id"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GroupInvitationEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long groupId;

    @Column(nullable = false)
    private Long inviterId;

    @Column(nullable = false)
    private Long inviteeId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    @Builder.Default
    private Status status = Status.PENDING;

    @Column(nullable = false)
    private Instant createdAt;

    public enum Status {
        PENDING,
        ACCEPTED,
        DECLINED
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
