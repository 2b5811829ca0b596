package com.socialnetwork.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FollowStatus {

    private Boolean isFollowing;
    private Boolean followRequestSent;
    private Boolean isFollowedBy;
}
