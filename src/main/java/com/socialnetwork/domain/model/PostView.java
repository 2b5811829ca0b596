package com.socialnetwork.domain.model;

import com.socialnetwork.infrastructure.persistence.entity.PostEntity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Post with author, counters and the viewer's vote. {@code comments} is only filled for single-post reads.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PostView {

    private Long id;
    private Long userId;
    private String title;
    private String content;
    private String imageUrl;
    private PostEntity.Privacy privacy;
    private int upvotes;
    private int downvotes;
    private long commentCount;
    private int userVote;
    private UserSummary author;
    private Instant createdAt;
    private Instant updatedAt;
    private List<CommentView> comments;
}
