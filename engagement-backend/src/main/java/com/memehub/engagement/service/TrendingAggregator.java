package com.memehub.engagement.service;

import com.memehub.engagement.config.EngagementProperties;
import com.memehub.engagement.dto.TrendingScoreDTO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 【TrendingAggregator】
 * 定时重算默认窗口的热门榜，结果整体替换 (AtomicReference)。
 * Readers always see a complete view; a failed or interrupted run keeps the
 * previous one.
 */
@Service
public class TrendingAggregator {

    private static final Logger log = LoggerFactory.getLogger(TrendingAggregator.class);

    private final TrendingService trendingService;
    private final EngagementProperties properties;
    private final Clock clock;

    private final AtomicReference<TrendingView> current;

    public TrendingAggregator(TrendingService trendingService, EngagementProperties properties, Clock clock) {
        this.trendingService = trendingService;
        this.properties = properties;
        this.clock = clock;
        this.current = new AtomicReference<>(TrendingView.empty(LocalDateTime.now(clock)));
    }

    @Scheduled(fixedDelayString = "${engagement.trending.refresh-delay:PT1M}",
               initialDelayString = "${engagement.trending.initial-delay:PT5S}")
    public void scheduledRefresh() {
        refresh();
    }

    /**
     * Recomputes the default window ending now and swaps it in.
     *
     * @return true if a new view was installed
     */
    public boolean refresh() {
        long startTime = System.currentTimeMillis();
        Duration window = properties.getTrending().getDefaultWindow();
        try {
            TrendingView view = trendingService.computeView(window, LocalDateTime.now(clock));
            current.set(view);
            log.debug("Trending view refreshed: {} memes scored in {} ms",
                    view.getScores().size(), System.currentTimeMillis() - startTime);
            return true;
        } catch (CancellationException e) {
            log.warn("Trending refresh interrupted, keeping view computed at {}", current.get().getComputedAt());
            Thread.currentThread().interrupt();
            return false;
        } catch (RuntimeException e) {
            log.warn("Trending refresh failed, keeping view computed at {}: {}",
                    current.get().getComputedAt(), e.getMessage());
            return false;
        }
    }

    public TrendingView currentView() {
        return current.get();
    }

    public List<TrendingScoreDTO> current(Integer count) {
        int limit = (count == null || count < 1) ? 10 : count;
        int size = Math.min(limit, properties.getTrending().getViewSize());
        return current.get().top(size);
    }
}
