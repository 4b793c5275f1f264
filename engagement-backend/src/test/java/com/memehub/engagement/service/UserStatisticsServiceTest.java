package com.memehub.engagement.service;

import com.memehub.engagement.badge.UserStatistics;
import com.memehub.engagement.entity.AppUser;
import com.memehub.engagement.entity.PointReason;
import com.memehub.engagement.entity.Rank;
import com.memehub.engagement.exception.InvalidReferenceException;
import com.memehub.engagement.repository.AppUserRepository;
import com.memehub.engagement.repository.MemeCommentRepository;
import com.memehub.engagement.repository.MemeLikeRepository;
import com.memehub.engagement.repository.MemeRepository;
import com.memehub.engagement.repository.PointTransactionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class UserStatisticsServiceTest {

    @Mock
    private AppUserRepository userRepository;

    @Mock
    private MemeRepository memeRepository;

    @Mock
    private MemeLikeRepository likeRepository;

    @Mock
    private MemeCommentRepository commentRepository;

    @Mock
    private PointTransactionRepository transactionRepository;

    private UserStatisticsService statisticsService;

    @BeforeEach
    void setUp() {
        // 今天: 2024-05-10
        Clock clock = Clock.fixed(Instant.parse("2024-05-10T09:00:00Z"), ZoneOffset.UTC);
        statisticsService = new UserStatisticsService(userRepository, memeRepository, likeRepository,
                commentRepository, transactionRepository, clock);
    }

    private void loginsOn(LocalDateTime... days) {
        when(transactionRepository.findCreatedAtByUserIdAndReason(1L, PointReason.DAILY_LOGIN))
                .thenReturn(List.of(days));
    }

    @Test
    void testLoginStreak_ConsecutiveDaysEndingToday() {
        loginsOn(LocalDateTime.of(2024, 5, 10, 8, 0),
                LocalDateTime.of(2024, 5, 9, 23, 59),
                LocalDateTime.of(2024, 5, 8, 0, 1),
                LocalDateTime.of(2024, 5, 6, 12, 0));

        assertEquals(3, statisticsService.currentLoginStreak(1L));
    }

    @Test
    void testLoginStreak_EndingYesterdayStillCounts() {
        loginsOn(LocalDateTime.of(2024, 5, 9, 8, 0),
                LocalDateTime.of(2024, 5, 8, 8, 0));

        assertEquals(2, statisticsService.currentLoginStreak(1L));
    }

    @Test
    void testLoginStreak_BrokenStreakIsZero() {
        loginsOn(LocalDateTime.of(2024, 5, 7, 8, 0),
                LocalDateTime.of(2024, 5, 6, 8, 0));

        assertEquals(0, statisticsService.currentLoginStreak(1L));
    }

    @Test
    void testLoginStreak_NoLogins() {
        loginsOn();

        assertEquals(0, statisticsService.currentLoginStreak(1L));
    }

    @Test
    void testSnapshot() {
        AppUser user = new AppUser(1L, "alice", 215L, Rank.MEME_ENTHUSIAST, LocalDateTime.of(2024, 1, 1, 0, 0));
        when(userRepository.findById(1L)).thenReturn(Optional.of(user));
        when(memeRepository.countByOwnerId(1L)).thenReturn(6L);
        when(likeRepository.countLikesReceivedByOwner(1L)).thenReturn(31L);
        when(commentRepository.countByAuthorId(1L)).thenReturn(12L);
        loginsOn(LocalDateTime.of(2024, 5, 10, 8, 0));

        UserStatistics statistics = statisticsService.snapshot(1L);

        assertEquals(6L, statistics.getMemesCreated());
        assertEquals(31L, statistics.getLikesReceived());
        assertEquals(12L, statistics.getCommentsMade());
        assertEquals(1, statistics.getLoginStreak());
        assertEquals(215L, statistics.getTotalPoints());
        assertEquals(Rank.MEME_ENTHUSIAST, statistics.getRank());
    }

    @Test
    void testSnapshot_UnknownUser() {
        when(userRepository.findById(5L)).thenReturn(Optional.empty());

        assertThrows(InvalidReferenceException.class, () -> statisticsService.snapshot(5L));
    }
}
