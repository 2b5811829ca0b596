package com.socialnetwork.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Single ({@code user_id}) or batch ({@code user_ids}) target users for invitations.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MemberIdsRequest {

    private Long userId;
    private List<Long> userIds;

    public List<Long> allUserIds() {
        List<Long> ids = new ArrayList<>();
        if (userId != null) {
            ids.add(userId);
        }
        if (userIds != null) {
            ids.addAll(userIds);
        }
        return ids;
    }
}
