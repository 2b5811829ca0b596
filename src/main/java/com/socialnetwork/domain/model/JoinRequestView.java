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
public class JoinRequestView {

    private Long id;
    private Long groupId;
    private UserSummary user;
    private String message;
    private Instant createdAt;
}
