package com.memehub.engagement.service;

import com.memehub.engagement.config.EngagementProperties;
import com.memehub.engagement.dto.CommentDTO;
import com.memehub.engagement.dto.LikeDTO;
import com.memehub.engagement.entity.ActivityKind;
import com.memehub.engagement.entity.Meme;
import com.memehub.engagement.entity.MemeComment;
import com.memehub.engagement.entity.MemeLike;
import com.memehub.engagement.entity.PointReason;
import com.memehub.engagement.entity.PointTransaction;
import com.memehub.engagement.event.EngagementUpdateEvent;
import com.memehub.engagement.exception.DuplicateActionException;
import com.memehub.engagement.exception.InvalidReferenceException;
import com.memehub.engagement.exception.PolicyViolationException;
import com.memehub.engagement.repository.AppUserRepository;
import com.memehub.engagement.repository.MemeCommentRepository;
import com.memehub.engagement.repository.MemeLikeRepository;
import com.memehub.engagement.repository.MemeRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Write path for likes and comments.
 *
 * Each mutating call locks the meme row first and the owner's user row
 * second (inside the ledger), so interactions on one meme are serialised and
 * the lock order is the same everywhere. The (user_id, meme_id) unique
 * constraint on meme_like backs up the duplicate check.
 */
@Service
public class InteractionService {

    private static final Logger log = LoggerFactory.getLogger(InteractionService.class);

    private static final int DEFAULT_COMMENT_COUNT = 10;
    private static final int MAX_COMMENT_COUNT = 100;

    private final MemeRepository memeRepository;
    private final MemeLikeRepository likeRepository;
    private final MemeCommentRepository commentRepository;
    private final AppUserRepository userRepository;
    private final PointsLedgerService ledgerService;
    private final ActivityLogService activityLogService;
    private final ApplicationEventPublisher eventPublisher;
    private final EngagementProperties properties;
    private final Clock clock;

    public InteractionService(MemeRepository memeRepository,
                              MemeLikeRepository likeRepository,
                              MemeCommentRepository commentRepository,
                              AppUserRepository userRepository,
                              PointsLedgerService ledgerService,
                              ActivityLogService activityLogService,
                              ApplicationEventPublisher eventPublisher,
                              EngagementProperties properties,
                              Clock clock) {
        this.memeRepository = memeRepository;
        this.likeRepository = likeRepository;
        this.commentRepository = commentRepository;
        this.userRepository = userRepository;
        this.ledgerService = ledgerService;
        this.activityLogService = activityLogService;
        this.eventPublisher = eventPublisher;
        this.properties = properties;
        this.clock = clock;
    }

    // ==================== Likes ====================

    /**
     * @throws DuplicateActionException ALREADY_LIKED
     * @throws PolicyViolationException SELF_LIKE
     * @throws InvalidReferenceException UNKNOWN_USER, UNKNOWN_MEME
     */
    @Transactional
    public LikeDTO addLike(Long userId, Long memeId) {
        requireUser(userId);
        Meme meme = lockMeme(memeId);

        if (!properties.getLikes().isAllowSelfLike() && meme.getOwnerId().equals(userId)) {
            throw new PolicyViolationException(PolicyViolationException.SELF_LIKE, "Users cannot like their own meme");
        }
        if (likeRepository.existsByUserIdAndMemeId(userId, memeId)) {
            throw alreadyLiked(userId, memeId, null);
        }

        MemeLike like;
        try {
            like = likeRepository.saveAndFlush(new MemeLike(null, userId, memeId, LocalDateTime.now(clock)));
        } catch (DataIntegrityViolationException e) {
            throw alreadyLiked(userId, memeId, e);
        }
        meme.setLikeCount((int) likeRepository.countByMemeId(memeId));

        ledgerService.record(PointEvent.of(meme.getOwnerId(), PointReason.LIKE_RECEIVED,
                properties.getPoints().getLikeReceived(), IdempotencyKeys.likeReceived(like.getLikeId())));
        String reference = "like:" + like.getLikeId();
        activityLogService.append(userId, ActivityKind.LIKE_ADDED, reference);
        eventPublisher.publishEvent(new EngagementUpdateEvent(ActivityKind.LIKE_ADDED, userId, memeId, reference));

        log.debug("User {} liked meme {} (like {})", userId, memeId, like.getLikeId());
        return LikeDTO.from(like);
    }

    /**
     * Deletes the like and reverses the owner's like_received credit by the
     * amount that was credited for it.
     *
     * @throws InvalidReferenceException NOT_LIKED, UNKNOWN_MEME
     */
    @Transactional
    public void removeLike(Long userId, Long memeId) {
        Meme meme = lockMeme(memeId);
        MemeLike like = likeRepository.findByUserIdAndMemeId(userId, memeId)
                .orElseThrow(() -> new InvalidReferenceException(InvalidReferenceException.NOT_LIKED,
                        "User " + userId + " has not liked meme " + memeId));

        likeRepository.delete(like);
        likeRepository.flush();
        meme.setLikeCount((int) likeRepository.countByMemeId(memeId));

        // 按当初实际入账的金额冲正, the configured value may have changed since
        Optional<PointTransaction> credited = ledgerService.findByKey(IdempotencyKeys.likeReceived(like.getLikeId()));
        if (credited.isPresent()) {
            ledgerService.record(PointEvent.of(meme.getOwnerId(), PointReason.LIKE_REMOVED_REVERSAL,
                    -credited.get().getAmount(), IdempotencyKeys.likeRemoved(like.getLikeId())));
        } else {
            log.warn("No like_received entry for like {}, nothing to reverse", like.getLikeId());
        }
        String reference = "like:" + like.getLikeId();
        activityLogService.append(userId, ActivityKind.LIKE_REMOVED, reference);
        eventPublisher.publishEvent(new EngagementUpdateEvent(ActivityKind.LIKE_REMOVED, userId, memeId, reference));

        log.debug("User {} removed like {} from meme {}", userId, like.getLikeId(), memeId);
    }

    @Transactional(readOnly = true)
    public boolean hasLiked(Long userId, Long memeId) {
        return likeRepository.existsByUserIdAndMemeId(userId, memeId);
    }

    // ==================== Comments ====================

    /**
     * @param parentCommentId optional, must be a comment on the same meme
     * @throws PolicyViolationException EMPTY_BODY, BODY_TOO_LONG
     * @throws InvalidReferenceException INVALID_PARENT, UNKNOWN_MEME, UNKNOWN_USER
     */
    @Transactional
    public CommentDTO addComment(Long userId, Long memeId, String body, Long parentCommentId) {
        String text = body == null ? "" : body.trim();
        if (text.isEmpty()) {
            throw new PolicyViolationException(PolicyViolationException.EMPTY_BODY, "Comment body must not be empty");
        }
        int maxLength = properties.getComments().getMaxLength();
        if (text.length() > maxLength) {
            throw new PolicyViolationException(PolicyViolationException.BODY_TOO_LONG,
                    "Comment body exceeds " + maxLength + " characters");
        }
        requireUser(userId);
        Meme meme = lockMeme(memeId);

        // A parent has to exist before its child, so no comment can become its own ancestor
        if (parentCommentId != null) {
            commentRepository.findById(parentCommentId)
                    .filter(parent -> parent.getMemeId().equals(memeId))
                    .orElseThrow(() -> new InvalidReferenceException(InvalidReferenceException.INVALID_PARENT,
                            "Comment " + parentCommentId + " is not a comment on meme " + memeId));
        }

        MemeComment comment = commentRepository.saveAndFlush(
                new MemeComment(null, memeId, userId, parentCommentId, text, LocalDateTime.now(clock)));
        meme.setCommentCount((int) commentRepository.countByMemeId(memeId));

        String key = IdempotencyKeys.commentMade(comment.getCommentId());
        ledgerService.record(PointEvent.of(userId, PointReason.COMMENT_MADE, properties.getPoints().getCommentMade(), key));
        activityLogService.append(userId, ActivityKind.COMMENT_ADDED, key);
        eventPublisher.publishEvent(new EngagementUpdateEvent(ActivityKind.COMMENT_ADDED, userId, memeId, key));

        log.debug("User {} commented on meme {} (comment {})", userId, memeId, comment.getCommentId());
        return CommentDTO.from(comment);
    }

    /**
     * Newest first.
     */
    @Transactional(readOnly = true)
    public List<CommentDTO> listComments(Long memeId, Integer count) {
        if (!memeRepository.existsById(memeId)) {
            throw new InvalidReferenceException(InvalidReferenceException.UNKNOWN_MEME, "Meme " + memeId + " does not exist");
        }
        int limit = (count == null || count < 1) ? DEFAULT_COMMENT_COUNT : Math.min(count, MAX_COMMENT_COUNT);
        return commentRepository.findByMemeIdOrderByCreatedAtDescCommentIdDesc(memeId, PageRequest.of(0, limit)).stream()
                .map(CommentDTO::from)
                .collect(Collectors.toList());
    }

    // ==================== helpers ====================

    private void requireUser(Long userId) {
        if (!userRepository.existsById(userId)) {
            throw new InvalidReferenceException(InvalidReferenceException.UNKNOWN_USER, "User " + userId + " does not exist");
        }
    }

    private Meme lockMeme(Long memeId) {
        return memeRepository.findByIdForUpdate(memeId)
                .orElseThrow(() -> new InvalidReferenceException(InvalidReferenceException.UNKNOWN_MEME,
                        "Meme " + memeId + " does not exist"));
    }

    private DuplicateActionException alreadyLiked(Long userId, Long memeId, Throwable cause) {
        String message = "User " + userId + " already likes meme " + memeId;
        return cause == null
                ? new DuplicateActionException(DuplicateActionException.ALREADY_LIKED, message)
                : new DuplicateActionException(DuplicateActionException.ALREADY_LIKED, message, cause);
    }
}
