package com.memehub.engagement.service;

import com.memehub.engagement.badge.BadgeCriteria;
import com.memehub.engagement.badge.BadgeCriteriaParser;
import com.memehub.engagement.badge.BadgeTrigger;
import com.memehub.engagement.badge.UserStatistics;
import com.memehub.engagement.entity.Badge;
import com.memehub.engagement.repository.BadgeAwardRepository;
import com.memehub.engagement.repository.BadgeRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 徽章检测服务：对一个用户按徽章目录逐条检测，颁发新达成的徽章。
 *
 * Runs outside the triggering write transaction, after it committed. Each
 * award is written by {@link BadgeAwardWriter} in its own transaction.
 */
@Service
public class BadgeEvaluationService {

    private static final Logger log = LoggerFactory.getLogger(BadgeEvaluationService.class);

    private final BadgeRepository badgeRepository;
    private final BadgeAwardRepository awardRepository;
    private final BadgeCriteriaParser criteriaParser;
    private final UserStatisticsService statisticsService;
    private final BadgeAwardWriter awardWriter;

    public BadgeEvaluationService(BadgeRepository badgeRepository,
                                  BadgeAwardRepository awardRepository,
                                  BadgeCriteriaParser criteriaParser,
                                  UserStatisticsService statisticsService,
                                  BadgeAwardWriter awardWriter) {
        this.badgeRepository = badgeRepository;
        this.awardRepository = awardRepository;
        this.criteriaParser = criteriaParser;
        this.statisticsService = statisticsService;
        this.awardWriter = awardWriter;
    }

    /**
     * @return badges newly awarded by this call (empty if nothing changed)
     */
    public Set<Badge> evaluate(Long userId, BadgeTrigger trigger) {
        UserStatistics statistics = statisticsService.snapshot(userId);
        Set<Long> held = new HashSet<>(awardRepository.findBadgeIdsByUserId(userId));

        List<Badge> catalogue = badgeRepository.findAll();
        Set<Badge> awarded = new LinkedHashSet<>();
        for (Badge badge : catalogue) {
            if (held.contains(badge.getBadgeId())) {
                continue;
            }
            BadgeCriteria criteria = criteriaParser.parse(badge.getCriteria());
            if (criteria.isSatisfiedBy(statistics) && awardWriter.tryAward(userId, badge)) {
                log.debug("User {} met '{}' for badge {}", userId, criteria.describe(), badge.getBadgeKey());
                awarded.add(badge);
            }
        }
        log.debug("Badge evaluation for user {} ({}): {} checked, {} already held, {} awarded",
                userId, trigger, catalogue.size(), held.size(), awarded.size());
        return awarded;
    }
}
