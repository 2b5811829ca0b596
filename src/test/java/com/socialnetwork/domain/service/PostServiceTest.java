package com.socialnetwork.domain.service;

import com.socialnetwork.domain.exception.BadRequestException;
import com.socialnetwork.domain.exception.ForbiddenException;
import com.socialnetwork.domain.exception.NotFoundException;
import com.socialnetwork.domain.model.CommentView;
import com.socialnetwork.domain.model.ContentRequest;
import com.socialnetwork.domain.model.CreatePostRequest;
import com.socialnetwork.domain.model.FeedPage;
import com.socialnetwork.domain.model.PostView;
import com.socialnetwork.infrastructure.persistence.entity.CommentEntity;
import com.socialnetwork.infrastructure.persistence.entity.PostAccessEntity;
import com.socialnetwork.infrastructure.persistence.entity.PostEntity;
import com.socialnetwork.infrastructure.persistence.entity.UserEntity;
import com.socialnetwork.infrastructure.persistence.entity.VoteEntity;
import com.socialnetwork.infrastructure.persistence.repository.CommentRepository;
import com.socialnetwork.infrastructure.persistence.repository.PostAccessRepository;
import com.socialnetwork.infrastructure.persistence.repository.PostRepository;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Pageable;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for PostService.
 *
 * Visibility checks, feed paging and the cleanup done on delete.
 */
@ExtendWith(MockitoExtension.class)
class PostServiceTest {

    @Mock
    private PostRepository postRepository;

    @Mock
    private PostAccessRepository postAccessRepository;

    @Mock
    private CommentRepository commentRepository;

    @Mock
    private FollowService followService;

    @Mock
    private VoteService voteService;

    @Mock
    private NotificationService notificationService;

    @Mock
    private UserLookupService userLookupService;

    private MeterRegistry meterRegistry;
    private PostService postService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        postService = new PostService(postRepository, postAccessRepository, commentRepository,
                followService, voteService, notificationService, userLookupService, meterRegistry);
        ReflectionTestUtils.setField(postService, "defaultPageSize", 10);
        ReflectionTestUtils.setField(postService, "maxPageSize", 50);
    }

    @Test
    void testCreatePost_PrivateStoresAccessForSelectedFollowers() {
        // Given
        CreatePostRequest request = CreatePostRequest.builder()
                .content("  just for you  ")
                .privacy(PostEntity.Privacy.PRIVATE)
                .allowedFollowers(List.of(5L, 1L))
                .build();

        when(followService.followerIds(1L)).thenReturn(List.of(5L, 6L));
        when(postRepository.save(any(PostEntity.class))).thenAnswer(invocation -> {
            PostEntity post = invocation.getArgument(0);
            post.setId(11L);
            return post;
        });

        // When
        PostView view = postService.createPost(1L, request);

        // Then
        assertEquals(11L, view.getId());
        assertEquals("just for you", view.getContent());
        assertEquals(PostEntity.Privacy.PRIVATE, view.getPrivacy());

        ArgumentCaptor<PostAccessEntity> access = ArgumentCaptor.forClass(PostAccessEntity.class);
        verify(postAccessRepository, times(1)).save(access.capture());
        assertEquals(5L, access.getValue().getUserId());
        assertEquals(11L, access.getValue().getPostId());
    }

    @Test
    void testCreatePost_PrivateRejectsNonFollowers() {
        // Given
        CreatePostRequest request = CreatePostRequest.builder()
                .content("secret")
                .privacy(PostEntity.Privacy.PRIVATE)
                .allowedFollowers(List.of(7L))
                .build();

        when(followService.followerIds(1L)).thenReturn(List.of(5L));

        // When / Then
        assertThrows(BadRequestException.class, () -> postService.createPost(1L, request));
        verify(postRepository, never()).save(any());
    }

    @Test
    void testCreatePost_ContentRequired() {
        // Given
        CreatePostRequest request = CreatePostRequest.builder().content("   ").build();

        // When / Then
        assertThrows(BadRequestException.class, () -> postService.createPost(1L, request));
    }

    @Test
    void testFeed_HasMore() {
        // Given
        List<PostEntity> posts = new ArrayList<>();
        for (long i = 3; i >= 1; i--) {
            posts.add(post(i, 2L, PostEntity.Privacy.PUBLIC));
        }
        ArgumentCaptor<Pageable> pageable = ArgumentCaptor.forClass(Pageable.class);
        when(postRepository.findFeed(eq(1L), pageable.capture())).thenReturn(posts);

        // When
        FeedPage feed = postService.feed(1L, 1, 2);

        // Then
        assertTrue(feed.isHasMore());
        assertEquals(2, feed.getPosts().size()); // trimmed to the requested limit
        assertEquals(3L, feed.getPosts().get(0).getId());
        assertEquals(1, feed.getPage());
        assertEquals(0, pageable.getValue().getOffset());
        assertEquals(3, pageable.getValue().getPageSize());
        assertEquals(1, meterRegistry.find("feed.query.latency").timer().count());
    }

    @Test
    void testFeed_LaterPageStartsAtLookAheadRow() {
        // Given
        ArgumentCaptor<Pageable> pageable = ArgumentCaptor.forClass(Pageable.class);
        when(postRepository.findFeed(eq(1L), pageable.capture()))
                .thenReturn(List.of(post(5L, 2L, PostEntity.Privacy.PUBLIC)));

        // When
        FeedPage feed = postService.feed(1L, 3, 10);

        // Then
        assertEquals(20, pageable.getValue().getOffset()); // pages 1 and 2 showed 10 rows each
        assertEquals(11, pageable.getValue().getPageSize());
        assertEquals(3, feed.getPage());
        assertFalse(feed.isHasMore());
        assertEquals(1, feed.getPosts().size());
    }

    @Test
    void testFeed_ClampsLimitAndPage() {
        // Given
        ArgumentCaptor<Pageable> pageable = ArgumentCaptor.forClass(Pageable.class);
        when(postRepository.findFeed(eq(1L), pageable.capture())).thenReturn(List.of());

        // When
        FeedPage feed = postService.feed(1L, -4, 500);

        // Then
        assertFalse(feed.isHasMore());
        assertEquals(50, feed.getLimit());
        assertEquals(1, feed.getPage());
        assertEquals(0, pageable.getValue().getOffset());
        assertEquals(51, pageable.getValue().getPageSize());
    }

    @Test
    void testGetPost_PrivatePostHiddenFromOthers() {
        // Given
        when(postRepository.findById(1L)).thenReturn(Optional.of(post(1L, 2L, PostEntity.Privacy.PRIVATE)));
        when(postAccessRepository.existsByPostIdAndUserId(1L, 3L)).thenReturn(false);

        // When / Then
        assertThrows(NotFoundException.class, () -> postService.getPost(1L, 3L));
    }

    @Test
    void testGetPost_AlmostPrivateVisibleToFollower() {
        // Given
        when(postRepository.findById(1L)).thenReturn(Optional.of(post(1L, 2L, PostEntity.Privacy.ALMOST_PRIVATE)));
        when(followService.isFollowing(3L, 2L)).thenReturn(true);
        when(commentRepository.findByPostIdOrderByCreatedAtAscIdAsc(1L)).thenReturn(List.of(
                CommentEntity.builder().id(4L).postId(1L).userId(3L).content("first").build()));

        // When
        PostView view = postService.getPost(1L, 3L);

        // Then
        assertEquals(1L, view.getId());
        assertEquals(1, view.getComments().size());
        assertEquals("first", view.getComments().get(0).getContent());
    }

    @Test
    void testDeletePost_OnlyAuthor() {
        // Given
        when(postRepository.findById(1L)).thenReturn(Optional.of(post(1L, 2L, PostEntity.Privacy.PUBLIC)));

        // When / Then
        assertThrows(ForbiddenException.class, () -> postService.deletePost(1L, 3L));
        verify(postRepository, never()).delete(any());
    }

    @Test
    void testDeletePost_RemovesVotesOnPostAndComments() {
        // Given
        PostEntity post = post(1L, 2L, PostEntity.Privacy.PUBLIC);
        when(postRepository.findById(1L)).thenReturn(Optional.of(post));
        when(commentRepository.findIdsByPostId(1L)).thenReturn(List.of(7L, 8L));

        // When
        postService.deletePost(1L, 2L);

        // Then
        verify(voteService).deleteVotes(VoteEntity.ContentType.COMMENT, List.of(7L, 8L));
        verify(voteService).deleteVotes(VoteEntity.ContentType.POST, List.of(1L));
        verify(postRepository).delete(post);
    }

    @Test
    void testAddComment_NotifiesPostAuthor() {
        // Given
        UserEntity commenter = UserEntity.builder().id(3L).firstName("Cara").lastName("Test").build();

        when(postRepository.findById(1L)).thenReturn(Optional.of(post(1L, 2L, PostEntity.Privacy.PUBLIC)));
        when(commentRepository.save(any(CommentEntity.class))).thenAnswer(invocation -> {
            CommentEntity comment = invocation.getArgument(0);
            comment.setId(9L);
            return comment;
        });
        when(userLookupService.require(3L)).thenReturn(commenter);

        // When
        CommentView view = postService.addComment(1L, 3L, ContentRequest.builder().content("nice").build());

        // Then
        assertEquals(9L, view.getId());
        verify(notificationService).postCommented(commenter, 2L, 1L);
    }

    @Test
    void testAddComment_OwnPostDoesNotNotify() {
        // Given
        when(postRepository.findById(1L)).thenReturn(Optional.of(post(1L, 2L, PostEntity.Privacy.PUBLIC)));
        when(commentRepository.save(any(CommentEntity.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // When
        postService.addComment(1L, 2L, ContentRequest.builder().imageUrl("/img/a.png").build());

        // Then
        verifyNoInteractions(notificationService);
    }

    @Test
    void testAddComment_EmptyRejected() {
        // Given
        when(postRepository.findById(1L)).thenReturn(Optional.of(post(1L, 2L, PostEntity.Privacy.PUBLIC)));

        // When / Then
        assertThrows(BadRequestException.class,
                () -> postService.addComment(1L, 3L, ContentRequest.builder().content(" ").build()));
        verify(commentRepository, never()).save(any());
    }

    @Test
    void testDeleteComment_PostAuthorMayDelete() {
        // Given
        CommentEntity comment = CommentEntity.builder().id(4L).postId(1L).userId(3L).content("spam").build();
        when(commentRepository.findById(4L)).thenReturn(Optional.of(comment));
        when(postRepository.findById(1L)).thenReturn(Optional.of(post(1L, 2L, PostEntity.Privacy.PUBLIC)));

        // When
        postService.deleteComment(1L, 4L, 2L);

        // Then
        verify(voteService).deleteVotes(VoteEntity.ContentType.COMMENT, List.of(4L));
        verify(commentRepository).delete(comment);
    }

    @Test
    void testDeleteComment_StrangerForbidden() {
        // Given
        CommentEntity comment = CommentEntity.builder().id(4L).postId(1L).userId(3L).content("hi").build();
        when(commentRepository.findById(4L)).thenReturn(Optional.of(comment));
        when(postRepository.findById(1L)).thenReturn(Optional.of(post(1L, 2L, PostEntity.Privacy.PUBLIC)));

        // When / Then
        assertThrows(ForbiddenException.class, () -> postService.deleteComment(1L, 4L, 5L));
    }

    private static PostEntity post(Long id, Long authorId, PostEntity.Privacy privacy) {
        return PostEntity.builder()
                .id(id)
                .userId(authorId)
                .content("post " + id)
                .privacy(privacy)
                .createdAt(Instant.now())
                .build();
    }
}
