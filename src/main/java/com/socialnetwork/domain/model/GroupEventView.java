package com.socialnetwork.domain.model;

import com.socialnetwork.infrastructure.persistence.entity.GroupEventResponseEntity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GroupEventView {

    private Long id;
    private Long groupId;
    private Long creatorId;
    private String title;
    private String description;
    private Instant eventDate;
    private long goingCount;
    private long notGoingCount;
    private GroupEventResponseEntity.Response userResponse;
    private UserSummary creator;
    private Instant createdAt;
}
