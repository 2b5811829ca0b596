package com.socialnetwork.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GroupInvitationView {

    private Long id;
    private Long groupId;
    private String groupName;
    private UserSummary inviter;
    private Instant createdAt;
}
