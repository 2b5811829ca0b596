package com.socialnetwork.domain.service;

import com.socialnetwork.domain.exception.BadRequestException;
import com.socialnetwork.domain.exception.NotFoundException;
import com.socialnetwork.domain.model.VoteOutcome;
import com.socialnetwork.domain.model.VoteResult;
import com.socialnetwork.infrastructure.persistence.entity.CommentEntity;
import com.socialnetwork.infrastructure.persistence.entity.GroupPostCommentEntity;
import com.socialnetwork.infrastructure.persistence.entity.PostEntity;
import com.socialnetwork.infrastructure.persistence.entity.VoteEntity;
import com.socialnetwork.infrastructure.persistence.repository.CommentRepository;
import com.socialnetwork.infrastructure.persistence.repository.GroupPostCommentRepository;
import com.socialnetwork.infrastructure.persistence.repository.GroupPostRepository;
import com.socialnetwork.infrastructure.persistence.repository.PostRepository;
import com.socialnetwork.infrastructure.persistence.repository.VoteRepository;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for VoteService.
 *
 * Covers the add / remove / switch toggle and the counter deltas per content type.
 */
@ExtendWith(MockitoExtension.class)
class VoteServiceTest {

    @Mock
    private VoteRepository voteRepository;

    @Mock
    private PostRepository postRepository;

    @Mock
    private CommentRepository commentRepository;

    @Mock
    private GroupPostRepository groupPostRepository;

    @Mock
    private GroupPostCommentRepository groupPostCommentRepository;

    private MeterRegistry meterRegistry;
    private VoteService voteService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        voteService = new VoteService(voteRepository, postRepository, commentRepository,
                groupPostRepository, groupPostCommentRepository, meterRegistry);
    }

    @Test
    void testVote_NewUpvoteIsAdded() {
        // Given
        when(postRepository.existsById(1L)).thenReturn(true);
        when(voteRepository.findByUserIdAndContentIdAndContentType(10L, 1L, VoteEntity.ContentType.POST))
                .thenReturn(Optional.empty());
        when(postRepository.findById(1L)).thenReturn(Optional.of(post(1L, 1, 0)));

        // When
        VoteResult result = voteService.vote(10L, VoteEntity.ContentType.POST, 1L, 1);

        // Then
        assertEquals(VoteOutcome.ADDED, result.getAction());
        assertEquals(1, result.getUserVote());
        assertEquals(1, result.getUpvotes());
        assertEquals(0, result.getDownvotes());

        ArgumentCaptor<VoteEntity> saved = ArgumentCaptor.forClass(VoteEntity.class);
        verify(voteRepository).save(saved.capture());
        assertEquals(10L, saved.getValue().getUserId());
        assertEquals(1, saved.getValue().getVoteType());
        verify(postRepository).adjustVotes(1L, 1, 0);

        assertEquals(1.0, meterRegistry.counter("votes.applied", "content", "post", "action", "added").count());
    }

    @Test
    void testVote_SameVoteTwiceRemovesIt() {
        // Given
        VoteEntity existing = VoteEntity.builder()
                .id(3L)
                .userId(10L)
                .contentId(1L)
                .contentType(VoteEntity.ContentType.POST)
                .voteType(1)
                .build();

        when(postRepository.existsById(1L)).thenReturn(true);
        when(voteRepository.findByUserIdAndContentIdAndContentType(10L, 1L, VoteEntity.ContentType.POST))
                .thenReturn(Optional.of(existing));
        when(postRepository.findById(1L)).thenReturn(Optional.of(post(1L, 0, 0)));

        // When
        VoteResult result = voteService.vote(10L, VoteEntity.ContentType.POST, 1L, 1);

        // Then
        assertEquals(VoteOutcome.REMOVED, result.getAction());
        assertEquals(0, result.getUserVote());
        verify(voteRepository).delete(existing);
        verify(postRepository).adjustVotes(1L, -1, 0);
    }

    @Test
    void testVote_OppositeVoteSwitchesNetCountByTwo() {
        // Given
        VoteEntity existing = VoteEntity.builder()
                .id(4L)
                .userId(10L)
                .contentId(5L)
                .contentType(VoteEntity.ContentType.COMMENT)
                .voteType(1)
                .build();
        CommentEntity comment = CommentEntity.builder()
                .id(5L)
                .postId(1L)
                .userId(2L)
                .content("nice")
                .voteCount(-1)
                .build();

        when(commentRepository.existsById(5L)).thenReturn(true);
        when(voteRepository.findByUserIdAndContentIdAndContentType(10L, 5L, VoteEntity.ContentType.COMMENT))
                .thenReturn(Optional.of(existing));
        when(commentRepository.findById(5L)).thenReturn(Optional.of(comment));

        // When
        VoteResult result = voteService.vote(10L, VoteEntity.ContentType.COMMENT, 5L, -1);

        // Then
        assertEquals(VoteOutcome.SWITCHED, result.getAction());
        assertEquals(-1, result.getUserVote());
        assertEquals(-1, result.getVoteCount());
        assertEquals(-1, existing.getVoteType());
        verify(voteRepository).save(existing);
        verify(commentRepository).adjustVoteCount(5L, -2);
    }

    @Test
    void testVote_GroupCommentSwitchMovesSplitCounters() {
        // Given
        VoteEntity existing = VoteEntity.builder()
                .id(6L)
                .userId(10L)
                .contentId(7L)
                .contentType(VoteEntity.ContentType.GROUP_POST_COMMENT)
                .voteType(-1)
                .build();
        GroupPostCommentEntity comment = GroupPostCommentEntity.builder()
                .id(7L)
                .postId(2L)
                .authorId(3L)
                .content("agreed")
                .upvotes(1)
                .downvotes(0)
                .voteCount(1)
                .build();

        when(groupPostCommentRepository.existsById(7L)).thenReturn(true);
        when(voteRepository.findByUserIdAndContentIdAndContentType(10L, 7L, VoteEntity.ContentType.GROUP_POST_COMMENT))
                .thenReturn(Optional.of(existing));
        when(groupPostCommentRepository.findById(7L)).thenReturn(Optional.of(comment));

        // When
        VoteResult result = voteService.vote(10L, VoteEntity.ContentType.GROUP_POST_COMMENT, 7L, 1);

        // Then
        assertEquals(VoteOutcome.SWITCHED, result.getAction());
        assertEquals(1, result.getUpvotes());
        assertEquals(0, result.getDownvotes());
        assertEquals(1, result.getVoteCount());
        verify(groupPostCommentRepository).adjustVotes(7L, 1, -1);
    }

    @Test
    void testVote_InvalidVoteType() {
        // When / Then
        assertThrows(BadRequestException.class,
                () -> voteService.vote(10L, VoteEntity.ContentType.POST, 1L, 0));
        assertThrows(BadRequestException.class,
                () -> voteService.vote(10L, VoteEntity.ContentType.POST, 1L, null));

        verifyNoInteractions(voteRepository, postRepository);
    }

    @Test
    void testVote_MissingContent() {
        // Given
        when(groupPostRepository.existsById(99L)).thenReturn(false);

        // When / Then
        NotFoundException e = assertThrows(NotFoundException.class,
                () -> voteService.vote(10L, VoteEntity.ContentType.GROUP_POST, 99L, 1));
        assertEquals("Group post not found", e.getMessage());
        verifyNoInteractions(voteRepository);
    }

    @Test
    void testUserVotes_MapsRows() {
        // Given
        when(voteRepository.findUserVotes(10L, VoteEntity.ContentType.POST, List.of(1L, 2L)))
                .thenReturn(List.<Object[]>of(new Object[]{1L, -1}));

        // When
        Map<Long, Integer> votes = voteService.userVotes(10L, VoteEntity.ContentType.POST, List.of(1L, 2L));

        // Then
        assertEquals(1, votes.size());
        assertEquals(-1, votes.get(1L));
        assertFalse(votes.containsKey(2L));
    }

    @Test
    void testDeleteVotes_NoIdsSkipsQuery() {
        // When
        voteService.deleteVotes(VoteEntity.ContentType.COMMENT, List.of());

        // Then
        verify(voteRepository, never()).deleteByContent(any(), anyCollection());
    }

    private static PostEntity post(Long id, int upvotes, int downvotes) {
        return PostEntity.builder()
                .id(id)
                .userId(2L)
                .content("hello")
                .upvotes(upvotes)
                .downvotes(downvotes)
                .build();
    }
}
