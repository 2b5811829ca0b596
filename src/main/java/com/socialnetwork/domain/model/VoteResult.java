package com.socialnetwork.domain.model;

import com.socialnetwork.infrastructure.persistence.entity.VoteEntity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Counters after a vote. Fields that do not apply to the content type are null.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VoteResult {

    private VoteEntity.ContentType contentType;
    private Long contentId;
    private VoteOutcome action;

    // 1, -1, or 0 when the vote was toggled off
    private int userVote;

    private Integer upvotes;
    private Integer downvotes;
    private Integer voteCount;
}
