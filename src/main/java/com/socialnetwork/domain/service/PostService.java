package com.socialnetwork.domain.service;

import com.socialnetwork.domain.exception.BadRequestException;
import com.socialnetwork.domain.exception.ForbiddenException;
import com.socialnetwork.domain.exception.NotFoundException;
import com.socialnetwork.domain.model.CommentView;
import com.socialnetwork.domain.model.ContentRequest;
import com.socialnetwork.domain.model.CreatePostRequest;
import com.socialnetwork.domain.model.FeedPage;
import com.socialnetwork.domain.model.PostView;
import com.socialnetwork.domain.model.UserSummary;
import com.socialnetwork.domain.model.VoteResult;
import com.socialnetwork.infrastructure.persistence.entity.CommentEntity;
import com.socialnetwork.infrastructure.persistence.entity.PostAccessEntity;
import com.socialnetwork.infrastructure.persistence.entity.PostEntity;
import com.socialnetwork.infrastructure.persistence.entity.UserEntity;
import com.socialnetwork.infrastructure.persistence.entity.VoteEntity;
import com.socialnetwork.infrastructure.persistence.repository.CommentRepository;
import com.socialnetwork.infrastructure.persistence.repository.OffsetPageRequest;
import com.socialnetwork.infrastructure.persistence.repository.PostAccessRepository;
import com.socialnetwork.infrastructure.persistence.repository.PostRepository;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Profile posts and their comments.
 *
 * Visibility rules (also encoded in PostRepository queries):
 * - the author always sees their posts
 * - PUBLIC: everyone
 * - ALMOST_PRIVATE: the author's followers
 * - PRIVATE: only followers the author selected (post_access)
 *
 * A post the viewer cannot see is reported as not found.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PostService {

    private final PostRepository postRepository;
    private final PostAccessRepository postAccessRepository;
    private final CommentRepository commentRepository;
    private final FollowService followService;
    private final VoteService voteService;
    private final NotificationService notificationService;
    private final UserLookupService userLookupService;
    private final MeterRegistry meterRegistry;

    @Value("${app.feed.default-page-size:10}")
    private int defaultPageSize;

    @Value("${app.feed.max-page-size:50}")
    private int maxPageSize;

    @Transactional
    public PostView createPost(Long userId, CreatePostRequest request) {
        if (request.getContent() == null || request.getContent().isBlank()) {
            throw new BadRequestException("Content is required");
        }
        PostEntity.Privacy privacy = request.getPrivacy() != null ? request.getPrivacy() : PostEntity.Privacy.PUBLIC;

        Set<Long> allowed = new LinkedHashSet<>();
        if (privacy == PostEntity.Privacy.PRIVATE && request.getAllowedFollowers() != null) {
            allowed.addAll(request.getAllowedFollowers());
            allowed.remove(userId);
            Set<Long> followers = new HashSet<>(followService.followerIds(userId));
            if (!followers.containsAll(allowed)) {
                throw new BadRequestException("Private posts can only be shared with your followers");
            }
        }

        PostEntity post = postRepository.save(PostEntity.builder()
                .userId(userId)
                .title(request.getTitle() == null || request.getTitle().isBlank() ? null : request.getTitle().trim())
                .content(request.getContent().trim())
                .imageUrl(request.getImageUrl())
                .privacy(privacy)
                .build());

        for (Long followerId : allowed) {
            postAccessRepository.save(PostAccessEntity.builder()
                    .postId(post.getId())
                    .userId(followerId)
                    .build());
        }

        log.info("Post {} created by user {} ({}, {} allowed followers)", post.getId(), userId, privacy, allowed.size());
        return toViews(List.of(post), userId).get(0);
    }

    /**
     * Posts visible to the viewer, newest first.
     *
     * Page N starts at offset (N - 1) * limit and fetches limit + 1 rows; the extra row only
     * signals that another page exists and is shown again at the top of the next page.
     */
    @Transactional(readOnly = true)
    public FeedPage feed(Long viewerId, Integer page, Integer limit) {
        Timer.Sample sample = Timer.start(meterRegistry);

        int pageNumber = page == null || page < 1 ? 1 : page;
        int pageSize = limit == null || limit < 1 ? defaultPageSize : Math.min(limit, maxPageSize);

        List<PostEntity> posts = postRepository.findFeed(
                viewerId, OffsetPageRequest.of((long) (pageNumber - 1) * pageSize, pageSize + 1));

        boolean hasMore = posts.size() > pageSize;
        if (hasMore) {
            posts = posts.subList(0, pageSize);
        }

        FeedPage feed = FeedPage.builder()
                .posts(toViews(posts, viewerId))
                .page(pageNumber)
                .limit(pageSize)
                .hasMore(hasMore)
                .build();

        sample.stop(Timer.builder("feed.query.latency")
                .tag("type", "feed")
                .register(meterRegistry));

        log.debug("Feed for user {}: page {}, {} posts", viewerId, pageNumber, posts.size());
        return feed;
    }

    @Transactional(readOnly = true)
    public List<PostView> userPosts(Long authorId, Long viewerId) {
        userLookupService.require(authorId);
        return toViews(postRepository.findByAuthorVisibleTo(authorId, viewerId), viewerId);
    }

    @Transactional(readOnly = true)
    public PostView getPost(Long postId, Long viewerId) {
        PostEntity post = requireVisible(postId, viewerId);

        PostView view = toViews(List.of(post), viewerId).get(0);
        view.setComments(commentViews(commentRepository.findByPostIdOrderByCreatedAtAscIdAsc(postId), viewerId));
        return view;
    }

    @Transactional(readOnly = true)
    public boolean canView(PostEntity post, Long viewerId) {
        if (post.getUserId().equals(viewerId)) {
            return true;
        }
        return switch (post.getPrivacy()) {
            case PUBLIC -> true;
            case ALMOST_PRIVATE -> followService.isFollowing(viewerId, post.getUserId());
            case PRIVATE -> postAccessRepository.existsByPostIdAndUserId(post.getId(), viewerId);
        };
    }

    /**
     * Delete a post. Comments and access rows cascade in the database; votes are removed here.
     */
    @Transactional
    public void deletePost(Long postId, Long userId) {
        PostEntity post = postRepository.findById(postId)
                .orElseThrow(() -> new NotFoundException("Post not found"));
        if (!post.getUserId().equals(userId)) {
            throw new ForbiddenException("You can only delete your own posts");
        }

        voteService.deleteVotes(VoteEntity.ContentType.COMMENT, commentRepository.findIdsByPostId(postId));
        voteService.deleteVotes(VoteEntity.ContentType.POST, List.of(postId));
        postRepository.delete(post);

        log.info("Post {} deleted by user {}", postId, userId);
    }

    @Transactional
    public CommentView addComment(Long postId, Long userId, ContentRequest request) {
        PostEntity post = requireVisible(postId, userId);

        String content = request.getContent() == null ? "" : request.getContent().trim();
        String imageUrl = request.getImageUrl() == null || request.getImageUrl().isBlank() ? null : request.getImageUrl();
        if (content.isEmpty() && imageUrl == null) {
            throw new BadRequestException("Comment content is required");
        }

        CommentEntity comment = commentRepository.save(CommentEntity.builder()
                .postId(postId)
                .userId(userId)
                .content(content)
                .imageUrl(imageUrl)
                .build());

        if (!post.getUserId().equals(userId)) {
            UserEntity commenter = userLookupService.require(userId);
            notificationService.postCommented(commenter, post.getUserId(), postId);
        }

        log.info("Comment {} added to post {} by user {}", comment.getId(), postId, userId);
        return commentViews(List.of(comment), userId).get(0);
    }

    /**
     * Delete a comment. Allowed for the comment author and the post author.
     */
    @Transactional
    public void deleteComment(Long postId, Long commentId, Long userId) {
        CommentEntity comment = commentRepository.findById(commentId)
                .filter(c -> c.getPostId().equals(postId))
                .orElseThrow(() -> new NotFoundException("Comment not found"));
        PostEntity post = postRepository.findById(postId)
                .orElseThrow(() -> new NotFoundException("Post not found"));

        if (!comment.getUserId().equals(userId) && !post.getUserId().equals(userId)) {
            throw new ForbiddenException("You can only delete your own comments or comments on your posts");
        }

        voteService.deleteVotes(VoteEntity.ContentType.COMMENT, List.of(commentId));
        commentRepository.delete(comment);
        log.info("Comment {} deleted by user {}", commentId, userId);
    }

    @Transactional
    public VoteResult votePost(Long postId, Long userId, Integer voteType) {
        requireVisible(postId, userId);
        return voteService.vote(userId, VoteEntity.ContentType.POST, postId, voteType);
    }

    @Transactional
    public VoteResult voteComment(Long postId, Long commentId, Long userId, Integer voteType) {
        requireVisible(postId, userId);
        commentRepository.findById(commentId)
                .filter(c -> c.getPostId().equals(postId))
                .orElseThrow(() -> new NotFoundException("Comment not found"));
        return voteService.vote(userId, VoteEntity.ContentType.COMMENT, commentId, voteType);
    }

    private PostEntity requireVisible(Long postId, Long viewerId) {
        return postRepository.findById(postId)
                .filter(post -> canView(post, viewerId))
                .orElseThrow(() -> new NotFoundException("Post not found"));
    }

    private List<PostView> toViews(List<PostEntity> posts, Long viewerId) {
        if (posts.isEmpty()) {
            return List.of();
        }
        List<Long> postIds = posts.stream().map(PostEntity::getId).collect(Collectors.toList());

        Map<Long, UserSummary> authors = userLookupService.summaries(
                posts.stream().map(PostEntity::getUserId).collect(Collectors.toList()));
        Map<Long, Integer> votes = voteService.userVotes(viewerId, VoteEntity.ContentType.POST, postIds);

        Map<Long, Long> commentCounts = new HashMap<>();
        for (Object[] row : commentRepository.countByPostIds(postIds)) {
            commentCounts.put((Long) row[0], ((Number) row[1]).longValue());
        }

        return posts.stream()
                .map(post -> PostView.builder()
                        .id(post.getId())
                        .userId(post.getUserId())
                        .title(post.getTitle())
                        .content(post.getContent())
                        .imageUrl(post.getImageUrl())
                        .privacy(post.getPrivacy())
                        .upvotes(post.getUpvotes())
                        .downvotes(post.getDownvotes())
                        .commentCount(commentCounts.getOrDefault(post.getId(), 0L))
                        .userVote(votes.getOrDefault(post.getId(), 0))
                        .author(authors.get(post.getUserId()))
                        .createdAt(post.getCreatedAt())
                        .updatedAt(post.getUpdatedAt())
                        .build())
                .collect(Collectors.toList());
    }

    private List<CommentView> commentViews(List<CommentEntity> comments, Long viewerId) {
        if (comments.isEmpty()) {
            return List.of();
        }
        Map<Long, UserSummary> authors = userLookupService.summaries(
                comments.stream().map(CommentEntity::getUserId).collect(Collectors.toList()));
        Map<Long, Integer> votes = voteService.userVotes(viewerId, VoteEntity.ContentType.COMMENT,
                comments.stream().map(CommentEntity::getId).collect(Collectors.toList()));

        return comments.stream()
                .map(comment -> CommentView.builder()
                        .id(comment.getId())
                        .postId(comment.getPostId())
                        .userId(comment.getUserId())
                        .content(comment.getContent())
                        .imageUrl(comment.getImageUrl())
                        .voteCount(comment.getVoteCount())
                        .userVote(votes.getOrDefault(comment.getId(), 0))
                        .author(authors.get(comment.getUserId()))
                        .createdAt(comment.getCreatedAt())
                        .build())
                .collect(Collectors.toList());
    }
}
