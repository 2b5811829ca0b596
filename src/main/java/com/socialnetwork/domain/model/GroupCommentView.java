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
public class GroupCommentView {

    private Long id;
    private Long postId;
    private String content;
    private String imagePath;
    private int voteCount;
    private int upvotes;
    private int downvotes;
    private int userVote;
    private UserSummary author;
    private Instant createdAt;
}
