package com.socialnetwork.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of a follow attempt: {@code followed} or {@code request_sent}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FollowResult {

    public static final String FOLLOWED = "followed";
    public static final String REQUEST_SENT = "request_sent";

    private String status;
    private Long requestId;
    private String message;
}
