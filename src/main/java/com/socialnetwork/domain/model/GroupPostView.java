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
public class GroupPostView {

    private Long id;
    private Long groupId;
    private String content;
    private String imagePath;
    private int commentsCount;
    private int upvotes;
    private int downvotes;
    private int userVote;
    private UserSummary author;
    private Instant createdAt;
}
