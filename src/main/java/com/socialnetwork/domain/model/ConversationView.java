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
public class ConversationView {

    private Long id;
    private String name;
    private Boolean isGroup;
    private Long groupId;
    private UserSummary otherUser;
    private MessageView lastMessage;
    private long unreadCount;
    private Instant updatedAt;
}
