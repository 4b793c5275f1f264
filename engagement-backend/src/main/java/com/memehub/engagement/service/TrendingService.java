package com.memehub.engagement.service;

import com.memehub.engagement.config.EngagementProperties;
import com.memehub.engagement.dto.TrendingScoreDTO;
import com.memehub.engagement.entity.Meme;
import com.memehub.engagement.repository.MemeCommentRepository;
import com.memehub.engagement.repository.MemeLikeRepository;
import com.memehub.engagement.repository.MemeRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Trending memes: likes and comments created inside a sliding window,
 * weighted by engagement.trending.like-weight / comment-weight.
 *
 * Read-only. Never writes user or meme rows.
 */
@Service
@Transactional(readOnly = true)
public class TrendingService {

    private static final int DEFAULT_COUNT = 10;
    private static final int MAX_HOURS = 24 * 30;

    private final MemeRepository memeRepository;
    private final MemeLikeRepository likeRepository;
    private final MemeCommentRepository commentRepository;
    private final EngagementProperties properties;
    private final Clock clock;

    public TrendingService(MemeRepository memeRepository,
                           MemeLikeRepository likeRepository,
                           MemeCommentRepository commentRepository,
                           EngagementProperties properties,
                           Clock clock) {
        this.memeRepository = memeRepository;
        this.likeRepository = likeRepository;
        this.commentRepository = commentRepository;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * On-demand trending for the last {@code hours} hours (default window if null).
     */
    public List<TrendingScoreDTO> trending(Integer hours, Integer count) {
        Duration window = (hours == null || hours < 1)
                ? properties.getTrending().getDefaultWindow()
                : Duration.ofHours(Math.min(hours, MAX_HOURS));
        int limit = (count == null || count < 1) ? DEFAULT_COUNT : count;
        return computeView(window, LocalDateTime.now(clock)).top(limit);
    }

    /**
     * Scores every meme with engagement inside (until - window, until].
     * Memes with a zero score are left out.
     *
     * @throws CancellationException if the calling thread is interrupted
     */
    public TrendingView computeView(Duration window, LocalDateTime until) {
        LocalDateTime since = until.minus(window);
        long likeWeight = properties.getTrending().getLikeWeight();
        long commentWeight = properties.getTrending().getCommentWeight();

        Map<Long, Long> likes = toCountMap(likeRepository.countByMemeCreatedBetween(since, until));
        checkInterrupted();
        Map<Long, Long> comments = toCountMap(commentRepository.countByMemeCreatedBetween(since, until));
        checkInterrupted();

        Set<Long> memeIds = new HashSet<>(likes.keySet());
        memeIds.addAll(comments.keySet());
        Map<Long, Meme> memes = memeRepository.findAllById(memeIds).stream()
                .collect(Collectors.toMap(Meme::getMemeId, Function.identity()));

        List<TrendingScoreDTO> scores = new ArrayList<>();
        for (Long memeId : memeIds) {
            long likeCount = likes.getOrDefault(memeId, 0L);
            long commentCount = comments.getOrDefault(memeId, 0L);
            long score = likeCount * likeWeight + commentCount * commentWeight;
            Meme meme = memes.get(memeId);
            if (score <= 0 || meme == null) {
                continue;
            }
            scores.add(new TrendingScoreDTO(memeId, meme.getOwnerId(), likeCount, commentCount, score));
        }
        scores.sort(Comparator.comparing(TrendingScoreDTO::getScore).reversed()
                .thenComparing(TrendingScoreDTO::getMemeId));
        checkInterrupted();
        return new TrendingView(since, until, LocalDateTime.now(clock), scores);
    }

    // [0:meme_id, 1:count]
    private Map<Long, Long> toCountMap(List<Object[]> rows) {
        Map<Long, Long> counts = new HashMap<>();
        for (Object[] row : rows) {
            counts.put(((Number) row[0]).longValue(), ((Number) row[1]).longValue());
        }
        return counts;
    }

    private void checkInterrupted() {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Trending computation interrupted");
        }
    }
}
