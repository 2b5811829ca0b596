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
public class CommentView {

    private Long id;
    private Long postId;
    private Long userId;
    private String content;
    private String imageUrl;
    private int voteCount;
    private int userVote;
    private UserSummary author;
    private Instant createdAt;
}
