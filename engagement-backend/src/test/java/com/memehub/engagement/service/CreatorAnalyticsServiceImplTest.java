package com.memehub.engagement.service;

import com.memehub.engagement.dto.CreatorAnalyticsDTO;
import com.memehub.engagement.entity.Meme;
import com.memehub.engagement.repository.MemeRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class CreatorAnalyticsServiceImplTest {

    @Mock
    private MemeRepository memeRepository;

    @InjectMocks
    private CreatorAnalyticsServiceImpl analyticsService;

    private final LocalDateTime base = LocalDateTime.of(2024, 5, 1, 12, 0);

    private Meme meme(long id, int likes, int comments, int daysAgo) {
        return new Meme(id, 7L, "img/" + id + ".png", base.minusDays(daysAgo), likes, comments);
    }

    @Test
    void testAnalytics_NoMemes() {
        when(memeRepository.findByOwnerIdOrderByCreatedAtDescMemeIdDesc(7L)).thenReturn(List.of());

        CreatorAnalyticsDTO dto = analyticsService.analytics(7L);

        assertEquals(0, dto.getTotalMemes());
        assertEquals(0L, dto.getTotalLikes());
        assertEquals(0.0, dto.getAverageLikes());
        assertNull(dto.getBestMeme());
        assertEquals(CreatorAnalyticsDTO.Trend.STABLE, dto.getEngagementTrend());
    }

    @Test
    void testAnalytics_TotalsAndBestMeme() {
        when(memeRepository.findByOwnerIdOrderByCreatedAtDescMemeIdDesc(7L)).thenReturn(List.of(
                meme(3L, 4, 1, 0), meme(2L, 4, 0, 1)));

        CreatorAnalyticsDTO dto = analyticsService.analytics(7L);

        assertEquals(2, dto.getTotalMemes());
        assertEquals(8L, dto.getTotalLikes());
        assertEquals(1L, dto.getTotalComments());
        assertEquals(4.0, dto.getAverageLikes());
        // 点赞数相同时取较新的作品
        assertEquals(3L, dto.getBestMeme().getMemeId());
        // 少于 3 个作品不判断趋势
        assertEquals(CreatorAnalyticsDTO.Trend.STABLE, dto.getEngagementTrend());
    }

    @Test
    void testAnalytics_AverageRoundedToOneDecimal() {
        when(memeRepository.findByOwnerIdOrderByCreatedAtDescMemeIdDesc(7L)).thenReturn(List.of(
                meme(3L, 1, 0, 0), meme(2L, 1, 0, 1), meme(1L, 0, 0, 2)));

        assertEquals(0.7, analyticsService.analytics(7L).getAverageLikes());
    }

    // 较新的一半平均点赞高于较早一半的 1.2 倍 -> UP
    @Test
    void testAnalytics_TrendUp() {
        when(memeRepository.findByOwnerIdOrderByCreatedAtDescMemeIdDesc(7L)).thenReturn(List.of(
                meme(4L, 10, 0, 0), meme(3L, 8, 0, 1), meme(2L, 2, 0, 2), meme(1L, 1, 0, 3)));

        CreatorAnalyticsDTO dto = analyticsService.analytics(7L);

        assertEquals(CreatorAnalyticsDTO.Trend.UP, dto.getEngagementTrend());
        assertEquals(4L, dto.getBestMeme().getMemeId());
    }

    @Test
    void testAnalytics_TrendDown() {
        when(memeRepository.findByOwnerIdOrderByCreatedAtDescMemeIdDesc(7L)).thenReturn(List.of(
                meme(3L, 0, 0, 0), meme(2L, 5, 0, 1), meme(1L, 5, 0, 2)));

        assertEquals(CreatorAnalyticsDTO.Trend.DOWN, analyticsService.analytics(7L).getEngagementTrend());
    }

    @Test
    void testAnalytics_TrendStableWithinTwentyPercent() {
        when(memeRepository.findByOwnerIdOrderByCreatedAtDescMemeIdDesc(7L)).thenReturn(List.of(
                meme(4L, 11, 0, 0), meme(3L, 10, 0, 1), meme(2L, 10, 0, 2), meme(1L, 10, 0, 3)));

        assertEquals(CreatorAnalyticsDTO.Trend.STABLE, analyticsService.analytics(7L).getEngagementTrend());
    }
}
