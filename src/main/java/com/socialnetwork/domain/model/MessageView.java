package com.socialnetwork.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Chat message. Exactly one of conversationId and groupId is set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessageView {

    private Long id;
    private Long conversationId;
    private Long groupId;
    private Long senderId;
    private UserSummary sender;
    private String content;
    private Boolean isDeleted;
    private Instant createdAt;
}
