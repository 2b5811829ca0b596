package com.socialnetwork.domain.model;

import com.socialnetwork.infrastructure.persistence.entity.GroupEntity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Create or update payload for a group. On update, null fields are left unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GroupRequest {

    private String name;
    private String description;
    private String avatar;
    private GroupEntity.Privacy privacy;

    // Create only
    private List<Long> inviteeIds;
}
