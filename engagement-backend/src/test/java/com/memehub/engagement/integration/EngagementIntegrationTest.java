package com.memehub.engagement.integration;

import com.memehub.engagement.badge.BadgeTrigger;
import com.memehub.engagement.config.EngagementProperties;
import com.memehub.engagement.dto.CommentDTO;
import com.memehub.engagement.dto.CreatorAnalyticsDTO;
import com.memehub.engagement.dto.LeaderboardEntryDTO;
import com.memehub.engagement.dto.LedgerResultDTO;
import com.memehub.engagement.dto.MemeDTO;
import com.memehub.engagement.dto.MilestoneProgressDTO;
import com.memehub.engagement.dto.ProfileDTO;
import com.memehub.engagement.dto.TrendingScoreDTO;
import com.memehub.engagement.entity.AppUser;
import com.memehub.engagement.entity.Badge;
import com.memehub.engagement.entity.Rank;
import com.memehub.engagement.exception.DuplicateActionException;
import com.memehub.engagement.exception.InvalidReferenceException;
import com.memehub.engagement.exception.PolicyViolationException;
import com.memehub.engagement.repository.ActivityRepository;
import com.memehub.engagement.repository.AppUserRepository;
import com.memehub.engagement.repository.BadgeAwardRepository;
import com.memehub.engagement.repository.BadgeRepository;
import com.memehub.engagement.repository.MemeCommentRepository;
import com.memehub.engagement.repository.MemeLikeRepository;
import com.memehub.engagement.repository.MemeRepository;
import com.memehub.engagement.repository.PointTransactionRepository;
import com.memehub.engagement.service.BadgeEvaluationService;
import com.memehub.engagement.service.EngagementService;
import com.memehub.engagement.service.TrendingAggregator;
import com.memehub.engagement.service.TrendingService;
import com.memehub.engagement.service.TrendingView;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * 【集成测试】互动、积分、徽章与排行榜
 *
 * 测试环境：H2 内存库 (profile "test")，真实事务与行锁
 */
@Slf4j
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("互动积分系统集成测试")
class EngagementIntegrationTest {

    private static final Long ALICE = 1L;
    private static final Long BOB = 2L;
    private static final Long CAROL = 3L;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private EngagementService engagementService;

    @Autowired
    private BadgeEvaluationService badgeEvaluationService;

    @Autowired
    private TrendingAggregator trendingAggregator;

    @Autowired
    private TrendingService trendingService;

    @Autowired
    private AppUserRepository userRepository;

    @Autowired
    private MemeRepository memeRepository;

    @Autowired
    private MemeLikeRepository likeRepository;

    @Autowired
    private MemeCommentRepository commentRepository;

    @Autowired
    private PointTransactionRepository transactionRepository;

    @Autowired
    private BadgeRepository badgeRepository;

    @Autowired
    private BadgeAwardRepository awardRepository;

    @Autowired
    private ActivityRepository activityRepository;

    @Autowired
    private EngagementProperties properties;

    /**
     * 清理历史数据 (徽章目录保留), 注册三个用户
     */
    @BeforeEach
    void setUp() {
        activityRepository.deleteAllInBatch();
        awardRepository.deleteAllInBatch();
        transactionRepository.deleteAllInBatch();
        commentRepository.deleteAllInBatch();
        likeRepository.deleteAllInBatch();
        memeRepository.deleteAllInBatch();
        userRepository.deleteAllInBatch();

        engagementService.registerUser(ALICE, "alice");
        engagementService.registerUser(BOB, "bob");
        engagementService.registerUser(CAROL, "carol");
    }

    private long pointsOf(Long userId) {
        return userRepository.findById(userId).map(AppUser::getTotalPoints).orElseThrow();
    }

    @Test
    @DisplayName("T1: 发图、点赞、重复点赞、取消点赞、评论与排行榜")
    void testCreateLikeUnlikeCommentScenario() {
        MemeDTO meme = engagementService.createMeme(ALICE, "img/cat.png");
        assertThat(pointsOf(ALICE)).isEqualTo(10L);
        assertThat(userRepository.findById(ALICE).orElseThrow().getRank()).isEqualTo(Rank.NEWBIE);

        engagementService.addLike(BOB, meme.getMemeId());
        assertThat(pointsOf(ALICE)).isEqualTo(15L);
        assertThat(memeRepository.findById(meme.getMemeId()).orElseThrow().getLikeCount()).isEqualTo(1);

        assertThatThrownBy(() -> engagementService.addLike(BOB, meme.getMemeId()))
                .isInstanceOf(DuplicateActionException.class)
                .extracting("reason").isEqualTo(DuplicateActionException.ALREADY_LIKED);
        assertThat(pointsOf(ALICE)).isEqualTo(15L);

        engagementService.removeLike(BOB, meme.getMemeId());
        assertThat(pointsOf(ALICE)).isEqualTo(10L);
        assertThat(memeRepository.findById(meme.getMemeId()).orElseThrow().getLikeCount()).isZero();

        engagementService.addComment(CAROL, meme.getMemeId(), "this one is good", null);
        assertThat(pointsOf(CAROL)).isEqualTo(2L);

        List<LeaderboardEntryDTO> top = engagementService.leaderboard(2, 0);
        assertThat(top).extracting(LeaderboardEntryDTO::getUserId).containsExactly(ALICE, CAROL);
        assertThat(top).extracting(LeaderboardEntryDTO::getTotalPoints).containsExactly(10L, 2L);

        // 积分总和不变式
        for (Long userId : List.of(ALICE, BOB, CAROL)) {
            assertThat(engagementService.reconcile(userId)).isTrue();
        }
    }

    @Test
    @DisplayName("T2: 同一天两次登录只加 1 分")
    void testDailyLoginOncePerDay() {
        LedgerResultDTO first = engagementService.recordDailyLogin(BOB);
        LedgerResultDTO second = engagementService.recordDailyLogin(BOB);

        assertThat(first.getApplied()).isTrue();
        assertThat(second.getApplied()).isFalse();
        assertThat(pointsOf(BOB)).isEqualTo(1L);
        assertThat(transactionRepository.findByUserIdOrderByCreatedAtDescTransactionIdDesc(BOB)).hasSize(1);
    }

    @Test
    @DisplayName("T3: 首个作品徽章只颁发一次")
    void testFirstMemeBadgeAwardedOnce() {
        Badge firstSteps = badgeRepository.findByBadgeKey("first-steps").orElseThrow();

        engagementService.createMeme(ALICE, "img/1.png");
        assertThat(awardRepository.countByUserIdAndBadgeId(ALICE, firstSteps.getBadgeId())).isEqualTo(1L);

        engagementService.createMeme(ALICE, "img/2.png");
        assertThat(awardRepository.countByUserIdAndBadgeId(ALICE, firstSteps.getBadgeId())).isEqualTo(1L);
        assertThat(engagementService.userBadges(ALICE))
                .extracting("badgeKey").containsExactly("first-steps");
    }

    @Test
    @DisplayName("T4: 并发点赞同一作品只成功一次")
    void testConcurrentLikeSucceedsOnce() throws Exception {
        MemeDTO meme = engagementService.createMeme(ALICE, "img/race.png");

        List<Object> outcomes = runConcurrently(4, () -> engagementService.addLike(BOB, meme.getMemeId()));

        assertThat(outcomes.stream().filter(o -> !(o instanceof Throwable)).count()).isEqualTo(1L);
        assertThat(outcomes.stream().filter(o -> o instanceof DuplicateActionException).count()).isEqualTo(3L);
        assertThat(likeRepository.countByMemeId(meme.getMemeId())).isEqualTo(1L);
        assertThat(pointsOf(ALICE)).isEqualTo(15L);
        assertThat(engagementService.reconcile(ALICE)).isTrue();
    }

    @Test
    @DisplayName("T5: 并发使用同一幂等键只记一笔")
    void testConcurrentSameKeyRecordedOnce() throws Exception {
        List<Object> outcomes = runConcurrently(4,
                () -> engagementService.grantBonus(CAROL, 50, "contest-7", ALICE, "weekly winner"));

        List<LedgerResultDTO> results = outcomes.stream()
                .filter(o -> o instanceof LedgerResultDTO)
                .map(o -> (LedgerResultDTO) o)
                .collect(Collectors.toList());
        assertThat(results).hasSize(4);
        assertThat(results).filteredOn(r -> Boolean.TRUE.equals(r.getApplied())).hasSize(1);
        assertThat(transactionRepository.findByIdempotencyKey("bonus:contest-7")).isPresent();
        assertThat(pointsOf(CAROL)).isEqualTo(50L);
        assertThat(userRepository.findById(CAROL).orElseThrow().getRank()).isEqualTo(Rank.ROOKIE_MEMER);
    }

    @Test
    @DisplayName("T6: 并发徽章评估不会重复颁发")
    void testConcurrentBadgeEvaluation() throws Exception {
        engagementService.createMeme(ALICE, "img/1.png");
        awardRepository.deleteAllInBatch();
        Badge firstSteps = badgeRepository.findByBadgeKey("first-steps").orElseThrow();

        List<Object> outcomes = runConcurrently(4,
                () -> badgeEvaluationService.evaluate(ALICE, BadgeTrigger.MEME_CREATED));

        assertThat(outcomes).noneMatch(o -> o instanceof Throwable);
        assertThat(awardRepository.countByUserIdAndBadgeId(ALICE, firstSteps.getBadgeId())).isEqualTo(1L);
    }

    @Test
    @DisplayName("T7: 回复只能指向同一作品下的评论")
    void testCommentParentMustBelongToSameMeme() {
        MemeDTO first = engagementService.createMeme(ALICE, "img/1.png");
        MemeDTO second = engagementService.createMeme(ALICE, "img/2.png");
        CommentDTO parent = engagementService.addComment(BOB, first.getMemeId(), "first!", null);

        assertThatThrownBy(() -> engagementService.addComment(CAROL, second.getMemeId(), "reply", parent.getCommentId()))
                .isInstanceOf(InvalidReferenceException.class)
                .extracting("reason").isEqualTo(InvalidReferenceException.INVALID_PARENT);

        CommentDTO reply = engagementService.addComment(CAROL, first.getMemeId(), "reply", parent.getCommentId());
        assertThat(reply.getParentCommentId()).isEqualTo(parent.getCommentId());
        assertThat(engagementService.listComments(first.getMemeId(), 10))
                .extracting(CommentDTO::getCommentId)
                .containsExactly(reply.getCommentId(), parent.getCommentId());
    }

    @Test
    @DisplayName("T8: 热门榜缓存视图与实时计算一致")
    void testTrendingViewMatchesLiveComputation() {
        MemeDTO quiet = engagementService.createMeme(ALICE, "img/quiet.png");
        MemeDTO busy = engagementService.createMeme(BOB, "img/busy.png");
        engagementService.addLike(BOB, quiet.getMemeId());
        engagementService.addLike(ALICE, busy.getMemeId());
        engagementService.addLike(CAROL, busy.getMemeId());
        engagementService.addComment(CAROL, busy.getMemeId(), "lol", null);

        assertThat(trendingAggregator.refresh()).isTrue();
        TrendingView view = trendingAggregator.currentView();
        TrendingView live = trendingService.computeView(Duration.ofHours(24), view.getWindowEnd());

        assertThat(view.getScores()).isEqualTo(live.getScores());
        assertThat(view.getScores()).extracting(TrendingScoreDTO::getMemeId)
                .containsExactly(busy.getMemeId(), quiet.getMemeId());
        assertThat(view.getScores().get(0).getScore()).isEqualTo(4L);
        assertThat(engagementService.trending(24, 10)).extracting(TrendingScoreDTO::getMemeId)
                .containsExactly(busy.getMemeId(), quiet.getMemeId());
    }

    @Test
    @DisplayName("T9: 用户主页")
    void testProfile() {
        engagementService.createMeme(ALICE, "img/1.png");
        engagementService.recordDailyLogin(ALICE);

        ProfileDTO profile = engagementService.profile(ALICE);

        assertThat(profile.getUser().getTotalPoints()).isEqualTo(11L);
        assertThat(profile.getMemesCreated()).isEqualTo(1L);
        assertThat(profile.getLoginStreak()).isEqualTo(1);
        assertThat(profile.getLeaderboardPosition()).isEqualTo(1);
        assertThat(profile.getRankProgress().getNextRank()).isEqualTo("Rookie Memer");
        assertThat(profile.getRankProgress().getPointsNeeded()).isEqualTo(39L);
        assertThat(profile.getLevel().getLevel()).isEqualTo(1);
        assertThat(profile.getBadges()).extracting("badgeKey").containsExactly("first-steps");
        assertThat(profile.getBadgeCompletion()).isGreaterThan(0.0);
        assertThat(profile.getMilestones()).hasSize(3);
        MilestoneProgressDTO creator = profile.getMilestones().get(0);
        assertThat(creator.getTrack()).isEqualTo("MEME_CREATOR");
        assertThat(creator.getCurrent()).isEqualTo(1L);
        assertThat(creator.getNextMilestone()).isEqualTo(5L);
        assertThat(creator.getProgressPercentage()).isEqualTo(0.0);
        assertThat(engagementService.recentActivity(ALICE, 10)).isNotEmpty();
    }

    @Test
    @DisplayName("T10: REST 接口")
    void testRestEndpoints() throws Exception {
        mockMvc.perform(post("/api/Meme").header("X-User-Id", "1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"contentRef\":\"img/rest.png\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.ownerId").value(1));

        mockMvc.perform(get("/api/Leaderboard").param("count", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].userId").value(1))
                .andExpect(jsonPath("$.data[0].position").value(1));

        mockMvc.perform(post("/api/Meme/999999/like").header("X-User-Id", "2"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.data").value("UNKNOWN_MEME"));

        mockMvc.perform(get("/api/Points/table"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.MEME_CREATED").value(10));

        mockMvc.perform(get("/api/Badge/getBadgeRanking").param("count", "3"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].badgeKey").value("first-steps"))
                .andExpect(jsonPath("$.data[0].rank").value(1));
    }

    @Test
    @DisplayName("T11: 超长输入返回明确的策略错误, 不写入任何数据")
    void testOverlongInputRejectedWithNamedError() {
        assertThatThrownBy(() -> engagementService.grantBonus(ALICE, 50, "k".repeat(200), BOB, null))
                .isInstanceOf(PolicyViolationException.class)
                .extracting("reason").isEqualTo(PolicyViolationException.KEY_TOO_LONG);
        assertThatThrownBy(() -> engagementService.grantBonus(ALICE, 50, "contest-8", BOB, "n".repeat(300)))
                .isInstanceOf(PolicyViolationException.class)
                .extracting("reason").isEqualTo(PolicyViolationException.NOTE_TOO_LONG);
        assertThat(pointsOf(ALICE)).isZero();

        assertThatThrownBy(() -> engagementService.registerUser(502L, "n".repeat(150)))
                .isInstanceOf(PolicyViolationException.class)
                .extracting("reason").isEqualTo(PolicyViolationException.NAME_TOO_LONG);
        assertThat(userRepository.existsById(502L)).isFalse();

        assertThatThrownBy(() -> engagementService.createMeme(ALICE, "c".repeat(600)))
                .isInstanceOf(PolicyViolationException.class)
                .extracting("reason").isEqualTo(PolicyViolationException.CONTENT_TOO_LONG);
        assertThat(memeRepository.countByOwnerId(ALICE)).isZero();
    }

    @Test
    @DisplayName("T12: 调整点赞积分后取消点赞, 按原入账金额冲正")
    void testUnlikeAfterPointValueChange() {
        MemeDTO meme = engagementService.createMeme(ALICE, "img/cat.png");
        engagementService.addLike(BOB, meme.getMemeId());
        assertThat(pointsOf(ALICE)).isEqualTo(15L);

        int original = properties.getPoints().getLikeReceived();
        properties.getPoints().setLikeReceived(8);
        try {
            engagementService.removeLike(BOB, meme.getMemeId());
        } finally {
            properties.getPoints().setLikeReceived(original);
        }

        assertThat(pointsOf(ALICE)).isEqualTo(10L);
        assertThat(engagementService.reconcile(ALICE)).isTrue();
    }

    @Test
    @DisplayName("T13: 创作者数据")
    void testCreatorAnalytics() throws Exception {
        MemeDTO first = engagementService.createMeme(ALICE, "img/1.png");
        MemeDTO second = engagementService.createMeme(ALICE, "img/2.png");
        engagementService.addLike(BOB, first.getMemeId());
        engagementService.addLike(CAROL, first.getMemeId());
        engagementService.addLike(BOB, second.getMemeId());
        engagementService.addComment(CAROL, second.getMemeId(), "ha", null);

        CreatorAnalyticsDTO analytics = engagementService.creatorAnalytics(ALICE);

        assertThat(analytics.getTotalMemes()).isEqualTo(2);
        assertThat(analytics.getTotalLikes()).isEqualTo(3L);
        assertThat(analytics.getTotalComments()).isEqualTo(1L);
        assertThat(analytics.getAverageLikes()).isEqualTo(1.5);
        assertThat(analytics.getBestMeme().getMemeId()).isEqualTo(first.getMemeId());
        assertThat(analytics.getEngagementTrend()).isEqualTo(CreatorAnalyticsDTO.Trend.STABLE);

        mockMvc.perform(get("/api/User/2/analytics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.totalMemes").value(0))
                .andExpect(jsonPath("$.data.engagementTrend").value("STABLE"));
        mockMvc.perform(get("/api/User/404/analytics"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.data").value("UNKNOWN_USER"));
    }

    /**
     * 同时启动 threads 个任务，返回每个任务的结果或抛出的异常
     */
    private List<Object> runConcurrently(int threads, Callable<?> task) throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Object>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    try {
                        return task.call();
                    } catch (Exception e) {
                        log.info("Concurrent task failed: {}", e.toString());
                        return e;
                    }
                }));
            }
            start.countDown();
            List<Object> outcomes = new ArrayList<>();
            for (Future<Object> future : futures) {
                outcomes.add(future.get(30, TimeUnit.SECONDS));
            }
            return outcomes;
        } finally {
            executor.shutdownNow();
        }
    }
}
