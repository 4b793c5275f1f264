package com.memehub.engagement.service;

import com.memehub.engagement.badge.UserStatistics;
import com.memehub.engagement.entity.AppUser;
import com.memehub.engagement.entity.PointReason;
import com.memehub.engagement.exception.InvalidReferenceException;
import com.memehub.engagement.repository.AppUserRepository;
import com.memehub.engagement.repository.MemeCommentRepository;
import com.memehub.engagement.repository.MemeLikeRepository;
import com.memehub.engagement.repository.MemeRepository;
import com.memehub.engagement.repository.PointTransactionRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Builds the statistics snapshot badge criteria are evaluated against.
 * Every counter is read from the interaction tables or the ledger, never
 * from the activity log.
 */
@Service
public class UserStatisticsService {

    private final AppUserRepository userRepository;
    private final MemeRepository memeRepository;
    private final MemeLikeRepository likeRepository;
    private final MemeCommentRepository commentRepository;
    private final PointTransactionRepository transactionRepository;
    private final Clock clock;

    public UserStatisticsService(AppUserRepository userRepository,
                                 MemeRepository memeRepository,
                                 MemeLikeRepository likeRepository,
                                 MemeCommentRepository commentRepository,
                                 PointTransactionRepository transactionRepository,
                                 Clock clock) {
        this.userRepository = userRepository;
        this.memeRepository = memeRepository;
        this.likeRepository = likeRepository;
        this.commentRepository = commentRepository;
        this.transactionRepository = transactionRepository;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public UserStatistics snapshot(Long userId) {
        AppUser user = userRepository.findById(userId)
                .orElseThrow(() -> new InvalidReferenceException(InvalidReferenceException.UNKNOWN_USER,
                        "User " + userId + " does not exist"));
        return new UserStatistics(
                userId,
                memeRepository.countByOwnerId(userId),
                likeRepository.countLikesReceivedByOwner(userId),
                commentRepository.countByAuthorId(userId),
                currentLoginStreak(userId),
                user.getTotalPoints(),
                user.getRank());
    }

    /**
     * Consecutive calendar days with a daily-login entry, counting back from
     * the latest one. A streak whose latest day is before yesterday is over (0).
     */
    @Transactional(readOnly = true)
    public int currentLoginStreak(Long userId) {
        List<LocalDateTime> logins = transactionRepository.findCreatedAtByUserIdAndReason(userId, PointReason.DAILY_LOGIN);
        if (logins.isEmpty()) {
            return 0;
        }
        LocalDate yesterday = LocalDate.now(clock).minusDays(1);
        LocalDate previous = logins.get(0).toLocalDate();
        if (previous.isBefore(yesterday)) {
            return 0;
        }
        int streak = 1;
        for (int i = 1; i < logins.size(); i++) {
            LocalDate day = logins.get(i).toLocalDate();
            if (day.equals(previous)) {
                continue;
            }
            if (!day.equals(previous.minusDays(1))) {
                break;
            }
            streak++;
            previous = day;
        }
        return streak;
    }
}
