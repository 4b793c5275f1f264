package com.memehub.engagement.service;

import com.memehub.engagement.entity.ActivityKind;
import com.memehub.engagement.entity.Badge;
import com.memehub.engagement.event.EngagementUpdateEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * 徽章颁发：条件插入 badge_award, one transaction per award.
 * The (user_id, badge_id) unique key decides concurrent awards; the loser
 * gets false back and nothing else happens.
 */
@Service
public class BadgeAwardWriter {

    private static final Logger log = LoggerFactory.getLogger(BadgeAwardWriter.class);

    private static final String INSERT_AWARD_SQL =
            "INSERT INTO badge_award (user_id, badge_id, awarded_at) VALUES (?, ?, ?)";

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final ActivityLogService activityLogService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public BadgeAwardWriter(JdbcTemplate jdbcTemplate,
                            @Qualifier("awardTransactionTemplate") TransactionTemplate transactionTemplate,
                            ActivityLogService activityLogService,
                            ApplicationEventPublisher eventPublisher,
                            Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.activityLogService = activityLogService;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    /**
     * @return true if this call awarded the badge, false if the user already held it
     */
    public boolean tryAward(Long userId, Badge badge) {
        try {
            Boolean awarded = transactionTemplate.execute(status -> {
                jdbcTemplate.update(INSERT_AWARD_SQL, userId, badge.getBadgeId(), LocalDateTime.now(clock));
                String reference = "badge:" + badge.getBadgeKey();
                activityLogService.append(userId, ActivityKind.BADGE_AWARDED, reference);
                eventPublisher.publishEvent(new EngagementUpdateEvent(ActivityKind.BADGE_AWARDED, userId, null, reference));
                return Boolean.TRUE;
            });
            log.info("Awarded badge {} to user {}", badge.getBadgeKey(), userId);
            return Boolean.TRUE.equals(awarded);
        } catch (DuplicateKeyException e) {
            log.debug("User {} already holds badge {}, skipping", userId, badge.getBadgeKey());
            return false;
        }
    }
}
