package com.socialnetwork.domain.model;

import com.socialnetwork.infrastructure.persistence.entity.GroupEntity;
import com.socialnetwork.infrastructure.persistence.entity.GroupMemberEntity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Group with membership state of the requesting user.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GroupView {

    private Long id;
    private String name;
    private String description;
    private String avatar;
    private GroupEntity.Privacy privacy;
    private Long creatorId;
    private String creatorName;
    private long memberCount;
    private Long conversationId;
    private Instant createdAt;

    private Boolean isJoined;
    private Boolean isPending;
    private Boolean hasJoinRequest;
    private GroupMemberEntity.Role userRole;
}
