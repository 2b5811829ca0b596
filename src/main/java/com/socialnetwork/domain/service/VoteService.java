package com.socialnetwork.domain.service;

import com.socialnetwork.domain.exception.BadRequestException;
import com.socialnetwork.domain.exception.NotFoundException;
import com.socialnetwork.domain.model.VoteOutcome;
import com.socialnetwork.domain.model.VoteResult;
import com.socialnetwork.infrastructure.persistence.entity.VoteEntity;
import com.socialnetwork.infrastructure.persistence.repository.CommentRepository;
import com.socialnetwork.infrastructure.persistence.repository.GroupPostCommentRepository;
import com.socialnetwork.infrastructure.persistence.repository.GroupPostRepository;
import com.socialnetwork.infrastructure.persistence.repository.PostRepository;
import com.socialnetwork.infrastructure.persistence.repository.VoteRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Vote bookkeeping for posts, comments, group posts and group post comments.
 *
 * Toggle semantics, applied in one transaction:
 * - no existing vote: insert it (ADDED)
 * - same vote again: delete it (REMOVED)
 * - opposite vote: flip it (SWITCHED)
 *
 * Counter deltas are computed as (contribution of the new vote) - (contribution of the old one),
 * so a switch moves one unit from upvotes to downvotes (or back) and shifts a net count by 2.
 * After every call the content's counters equal the sum of its vote rows.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VoteService {

    private final VoteRepository voteRepository;
    private final PostRepository postRepository;
    private final CommentRepository commentRepository;
    private final GroupPostRepository groupPostRepository;
    private final GroupPostCommentRepository groupPostCommentRepository;
    private final MeterRegistry meterRegistry;

    @Transactional
    public VoteResult vote(Long userId, VoteEntity.ContentType contentType, Long contentId, Integer voteType) {
        if (voteType == null || (voteType != 1 && voteType != -1)) {
            throw new BadRequestException("Invalid vote type, must be 1 or -1");
        }
        if (!contentExists(contentType, contentId)) {
            throw new NotFoundException(describe(contentType) + " not found");
        }

        VoteEntity existing = voteRepository.findByUserIdAndContentIdAndContentType(userId, contentId, contentType)
                .orElse(null);

        int previous = existing == null ? 0 : existing.getVoteType();
        int current;
        VoteOutcome outcome;

        if (existing == null) {
            voteRepository.save(VoteEntity.builder()
                    .userId(userId)
                    .contentId(contentId)
                    .contentType(contentType)
                    .voteType(voteType)
                    .build());
            current = voteType;
            outcome = VoteOutcome.ADDED;
        } else if (previous == voteType) {
            voteRepository.delete(existing);
            current = 0;
            outcome = VoteOutcome.REMOVED;
        } else {
            existing.setVoteType(voteType);
            voteRepository.save(existing);
            current = voteType;
            outcome = VoteOutcome.SWITCHED;
        }

        int upDelta = (current == 1 ? 1 : 0) - (previous == 1 ? 1 : 0);
        int downDelta = (current == -1 ? 1 : 0) - (previous == -1 ? 1 : 0);
        applyCounters(contentType, contentId, upDelta, downDelta);

        Counter.builder("votes.applied")
                .tag("content", contentType.name().toLowerCase(Locale.ROOT))
                .tag("action", outcome.name().toLowerCase(Locale.ROOT))
                .register(meterRegistry)
                .increment();

        log.info("Vote {} by user {} on {} {} ({} -> {})", outcome, userId, contentType, contentId, previous, current);

        return buildResult(contentType, contentId, outcome, current);
    }

    /**
     * The user's vote per content id. Content without a vote is absent.
     */
    @Transactional(readOnly = true)
    public Map<Long, Integer> userVotes(Long userId, VoteEntity.ContentType contentType, Collection<Long> contentIds) {
        if (userId == null || contentIds.isEmpty()) {
            return Map.of();
        }
        Map<Long, Integer> votes = new HashMap<>();
        for (Object[] row : voteRepository.findUserVotes(userId, contentType, contentIds)) {
            votes.put((Long) row[0], ((Number) row[1]).intValue());
        }
        return votes;
    }

    /**
     * Drop the votes on deleted content. The votes table cannot cascade from polymorphic ids.
     */
    @Transactional
    public void deleteVotes(VoteEntity.ContentType contentType, Collection<Long> contentIds) {
        if (contentIds.isEmpty()) {
            return;
        }
        int deleted = voteRepository.deleteByContent(contentType, contentIds);
        log.debug("Deleted {} votes on {} {}", deleted, contentType, contentIds);
    }

    private boolean contentExists(VoteEntity.ContentType contentType, Long contentId) {
        return switch (contentType) {
            case POST -> postRepository.existsById(contentId);
            case COMMENT -> commentRepository.existsById(contentId);
            case GROUP_POST -> groupPostRepository.existsById(contentId);
            case GROUP_POST_COMMENT -> groupPostCommentRepository.existsById(contentId);
        };
    }

    private void applyCounters(VoteEntity.ContentType contentType, Long contentId, int upDelta, int downDelta) {
        switch (contentType) {
            case POST -> postRepository.adjustVotes(contentId, upDelta, downDelta);
            case COMMENT -> commentRepository.adjustVoteCount(contentId, upDelta - downDelta);
            case GROUP_POST -> groupPostRepository.adjustVotes(contentId, upDelta, downDelta);
            case GROUP_POST_COMMENT -> groupPostCommentRepository.adjustVotes(contentId, upDelta, downDelta);
        }
    }

    private VoteResult buildResult(VoteEntity.ContentType contentType, Long contentId, VoteOutcome outcome, int userVote) {
        VoteResult.VoteResultBuilder result = VoteResult.builder()
                .contentType(contentType)
                .contentId(contentId)
                .action(outcome)
                .userVote(userVote);

        switch (contentType) {
            case POST -> postRepository.findById(contentId).ifPresent(post -> result
                    .upvotes(post.getUpvotes())
                    .downvotes(post.getDownvotes()));
            case COMMENT -> commentRepository.findById(contentId).ifPresent(comment -> result
                    .voteCount(comment.getVoteCount()));
            case GROUP_POST -> groupPostRepository.findById(contentId).ifPresent(post -> result
                    .upvotes(post.getUpvotes())
                    .downvotes(post.getDownvotes()));
            case GROUP_POST_COMMENT -> groupPostCommentRepository.findById(contentId).ifPresent(comment -> result
                    .upvotes(comment.getUpvotes())
                    .downvotes(comment.getDownvotes())
                    .voteCount(comment.getVoteCount()));
        }
        return result.build();
    }

    private static String describe(VoteEntity.ContentType contentType) {
        return switch (contentType) {
            case POST -> "Post";
            case COMMENT -> "Comment";
            case GROUP_POST -> "Group post";
            case GROUP_POST_COMMENT -> "Group comment";
        };
    }
}
