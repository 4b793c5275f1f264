package com.memehub.engagement.service;

import com.memehub.engagement.badge.BadgeTrigger;
import com.memehub.engagement.dto.ActivityDTO;
import com.memehub.engagement.dto.BadgeDTO;
import com.memehub.engagement.dto.BadgeStatsDTO;
import com.memehub.engagement.dto.CommentDTO;
import com.memehub.engagement.dto.CreatorAnalyticsDTO;
import com.memehub.engagement.dto.LeaderboardEntryDTO;
import com.memehub.engagement.dto.LedgerResultDTO;
import com.memehub.engagement.dto.LikeDTO;
import com.memehub.engagement.dto.MemeDTO;
import com.memehub.engagement.dto.MemeStatsDTO;
import com.memehub.engagement.dto.PointTransactionDTO;
import com.memehub.engagement.dto.ProfileDTO;
import com.memehub.engagement.dto.TrendingScoreDTO;
import com.memehub.engagement.dto.UserDTO;
import com.memehub.engagement.entity.Badge;
import com.memehub.engagement.exception.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.TransactionException;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * 【EngagementService】
 * Entry point for every engagement operation.
 *
 * Each write runs in its own transaction inside the delegate service and has
 * committed when the delegate returns; badge evaluation follows for the user
 * whose statistics changed. Transient store failures come out as
 * {@link StoreUnavailableException}, which is safe to retry.
 */
@Service
public class EngagementService {

    private static final Logger log = LoggerFactory.getLogger(EngagementService.class);

    private final UserService userService;
    private final MemeService memeService;
    private final InteractionService interactionService;
    private final PointsLedgerService ledgerService;
    private final BadgeEvaluationService badgeEvaluationService;
    private final BadgeService badgeService;
    private final ActivityLogService activityLogService;
    private final LeaderboardService leaderboardService;
    private final TrendingService trendingService;
    private final TrendingAggregator trendingAggregator;
    private final ProfileService profileService;
    private final CreatorAnalyticsService analyticsService;

    public EngagementService(UserService userService,
                             MemeService memeService,
                             InteractionService interactionService,
                             PointsLedgerService ledgerService,
                             BadgeEvaluationService badgeEvaluationService,
                             BadgeService badgeService,
                             ActivityLogService activityLogService,
                             LeaderboardService leaderboardService,
                             TrendingService trendingService,
                             TrendingAggregator trendingAggregator,
                             ProfileService profileService,
                             CreatorAnalyticsService analyticsService) {
        this.userService = userService;
        this.memeService = memeService;
        this.interactionService = interactionService;
        this.ledgerService = ledgerService;
        this.badgeEvaluationService = badgeEvaluationService;
        this.badgeService = badgeService;
        this.activityLogService = activityLogService;
        this.leaderboardService = leaderboardService;
        this.trendingService = trendingService;
        this.trendingAggregator = trendingAggregator;
        this.profileService = profileService;
        this.analyticsService = analyticsService;
    }

    // ==================== Users & points ====================

    public UserDTO registerUser(Long userId, String displayName) {
        return withStore("registerUser", () -> {
            try {
                return userService.registerUser(userId, displayName);
            } catch (DataIntegrityViolationException e) {
                // 并发注册同一 id: the other call won, return its row
                log.debug("User {} registered concurrently, returning existing row", userId);
                return userService.findUser(userId).orElseThrow(() -> e);
            }
        });
    }

    public LedgerResultDTO recordDailyLogin(Long userId) {
        LedgerResult result = withStore("recordDailyLogin", () -> ledgerService.recordDailyLogin(userId));
        if (result.isApplied()) {
            evaluateBadges(userId, BadgeTrigger.LOGIN);
        }
        return LedgerResultDTO.from(result);
    }

    public LedgerResultDTO grantBonus(Long userId, Integer amount, String idempotencyKey, Long grantedBy, String note) {
        LedgerResult result = withStore("grantBonus",
                () -> ledgerService.grantBonus(userId, amount, idempotencyKey, grantedBy, note));
        if (result.isApplied()) {
            evaluateBadges(userId, BadgeTrigger.POINTS_CHANGED);
        }
        return LedgerResultDTO.from(result);
    }

    public List<PointTransactionDTO> pointsHistory(Long userId) {
        return withStore("pointsHistory", () -> {
            userService.requireUser(userId);
            return ledgerService.history(userId);
        });
    }

    public boolean reconcile(Long userId) {
        return withStore("reconcile", () -> ledgerService.reconcile(userId));
    }

    public Map<String, Integer> pointTable() {
        return ledgerService.pointTable();
    }

    public ProfileDTO profile(Long userId) {
        return withStore("profile", () -> profileService.profile(userId));
    }

    public CreatorAnalyticsDTO creatorAnalytics(Long userId) {
        return withStore("creatorAnalytics", () -> {
            userService.requireUser(userId);
            return analyticsService.analytics(userId);
        });
    }

    public List<ActivityDTO> recentActivity(Long userId, Integer count) {
        return withStore("recentActivity", () -> {
            userService.requireUser(userId);
            return activityLogService.recent(userId, count);
        });
    }

    // ==================== Memes & interactions ====================

    public MemeDTO createMeme(Long userId, String contentRef) {
        MemeDTO meme = withStore("createMeme", () -> memeService.createMeme(userId, contentRef));
        evaluateBadges(userId, BadgeTrigger.MEME_CREATED);
        return meme;
    }

    public MemeStatsDTO memeStats(Long memeId) {
        return withStore("memeStats", () -> memeService.getMemeStats(memeId));
    }

    public LikeDTO addLike(Long userId, Long memeId) {
        LikeDTO like = withStore("addLike", () -> interactionService.addLike(userId, memeId));
        evaluateOwnerBadges(memeId, BadgeTrigger.LIKE_RECEIVED);
        return like;
    }

    public void removeLike(Long userId, Long memeId) {
        withStore("removeLike", () -> {
            interactionService.removeLike(userId, memeId);
            return null;
        });
    }

    public boolean hasLiked(Long userId, Long memeId) {
        return withStore("hasLiked", () -> interactionService.hasLiked(userId, memeId));
    }

    public CommentDTO addComment(Long userId, Long memeId, String body, Long parentCommentId) {
        CommentDTO comment = withStore("addComment",
                () -> interactionService.addComment(userId, memeId, body, parentCommentId));
        evaluateBadges(userId, BadgeTrigger.COMMENT_MADE);
        return comment;
    }

    public List<CommentDTO> listComments(Long memeId, Integer count) {
        return withStore("listComments", () -> interactionService.listComments(memeId, count));
    }

    // ==================== Leaderboard & trending ====================

    public List<LeaderboardEntryDTO> leaderboard(Integer count, Integer offset) {
        return withStore("leaderboard", () -> leaderboardService.topByPoints(count, offset));
    }

    public List<TrendingScoreDTO> trending(Integer hours, Integer count) {
        return withStore("trending", () -> trendingService.trending(hours, count));
    }

    public List<TrendingScoreDTO> currentTrending(Integer count) {
        return trendingAggregator.current(count);
    }

    // ==================== Badges ====================

    public List<BadgeDTO> userBadges(Long userId) {
        return withStore("userBadges", () -> {
            userService.requireUser(userId);
            return badgeService.userBadges(userId);
        });
    }

    public List<BadgeStatsDTO> badgeList() {
        return withStore("badgeList", badgeService::getBadgeList);
    }

    public List<BadgeStatsDTO> badgeRanking(Integer count, String sortOrder) {
        return withStore("badgeRanking", () -> badgeService.getBadgeRanking(count, sortOrder));
    }

    // ==================== helpers ====================

    /**
     * Runs after the triggering write committed. A failure here is logged and
     * the write still stands; the next event for the user evaluates again.
     */
    private void evaluateBadges(Long userId, BadgeTrigger trigger) {
        try {
            Set<Badge> awarded = badgeEvaluationService.evaluate(userId, trigger);
            if (!awarded.isEmpty()) {
                log.debug("{} badge(s) awarded to user {} after {}", awarded.size(), userId, trigger);
            }
        } catch (DataAccessException | TransactionException e) {
            log.warn("Badge evaluation for user {} after {} failed: {}", userId, trigger, e.getMessage());
        }
    }

    private void evaluateOwnerBadges(Long memeId, BadgeTrigger trigger) {
        Long ownerId;
        try {
            ownerId = memeService.getMeme(memeId).getOwnerId();
        } catch (DataAccessException | TransactionException e) {
            log.warn("Could not load owner of meme {} for badge evaluation: {}", memeId, e.getMessage());
            return;
        }
        evaluateBadges(ownerId, trigger);
    }

    private <T> T withStore(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (TransientDataAccessException | DataAccessResourceFailureException | CannotCreateTransactionException e) {
            log.warn("{} failed, store unavailable: {}", operation, e.getMessage());
            throw new StoreUnavailableException("Store unavailable during " + operation + ", retry later", e);
        }
    }
}
