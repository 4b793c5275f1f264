package com.memehub.engagement.service;

import com.memehub.engagement.dto.BadgeDTO;
import com.memehub.engagement.dto.BadgeStatsDTO;
import com.memehub.engagement.entity.Badge;
import com.memehub.engagement.entity.BadgeAward;
import com.memehub.engagement.repository.AppUserRepository;
import com.memehub.engagement.repository.BadgeAwardRepository;
import com.memehub.engagement.repository.BadgeRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@Transactional(readOnly = true)
public class BadgeServiceImpl implements BadgeService {

    private final BadgeRepository badgeRepository;
    private final BadgeAwardRepository awardRepository;
    private final AppUserRepository userRepository;

    public BadgeServiceImpl(BadgeRepository badgeRepository,
                            BadgeAwardRepository awardRepository,
                            AppUserRepository userRepository) {
        this.badgeRepository = badgeRepository;
        this.awardRepository = awardRepository;
        this.userRepository = userRepository;
    }

    /**
     * 辅助方法：将 Object[] 结果集转换为 BadgeStatsDTO
     * 索引顺序: [0:badge_key, 1:name, 2:category, 3:description, 4:holder_count]
     */
    private BadgeStatsDTO mapToStatsDTO(Object[] result, double totalUsers) {
        BadgeStatsDTO dto = new BadgeStatsDTO();
        dto.setBadgeKey((String) result[0]);
        dto.setName((String) result[1]);
        dto.setCategory((String) result[2]);
        dto.setDescription((String) result[3]);

        // COUNT 在不同数据库返回 Long 或 BigInteger
        int holders = ((Number) result[4]).intValue();
        dto.setHolderCount(holders);
        dto.setCompletionRate(holders / totalUsers);
        dto.setRank(null);
        return dto;
    }

    private List<BadgeStatsDTO> buildAllBadgeStats() {
        long totalUsers = userRepository.count();
        final double finalTotalUsers = (totalUsers == 0) ? 1.0 : (double) totalUsers;
        return awardRepository.findAllBadgesWithHolderCounts().stream()
                .map(result -> mapToStatsDTO(result, finalTotalUsers))
                .sorted(Comparator.comparing(BadgeStatsDTO::getBadgeKey))
                .collect(Collectors.toList());
    }

    @Override
    public List<BadgeStatsDTO> getBadgeList() {
        return buildAllBadgeStats();
    }

    /**
     * Badges ranked by number of holders.
     *
     * @param count     结果数量, default 10
     * @param sortOrder "asc" or "desc" (default)
     */
    @Override
    public List<BadgeStatsDTO> getBadgeRanking(Integer count, String sortOrder) {
        final int finalCount = (count == null || count < 1) ? 10 : count;

        Comparator<BadgeStatsDTO> comparator = Comparator.comparing(BadgeStatsDTO::getHolderCount);
        if (sortOrder == null || sortOrder.equalsIgnoreCase("desc")) {
            comparator = comparator.reversed();
        }
        List<BadgeStatsDTO> ranked = buildAllBadgeStats().stream()
                .sorted(comparator.thenComparing(BadgeStatsDTO::getBadgeKey))
                .limit(finalCount)
                .collect(Collectors.toList());

        for (int i = 0; i < ranked.size(); i++) {
            ranked.get(i).setRank(i + 1);
        }
        return ranked;
    }

    /**
     * Badges held by a user, in award order.
     */
    @Override
    public List<BadgeDTO> userBadges(Long userId) {
        List<BadgeAward> awards = awardRepository.findByUserIdOrderByAwardedAtAsc(userId);
        if (awards.isEmpty()) {
            return List.of();
        }
        Map<Long, Badge> badges = badgeRepository.findAllById(
                        awards.stream().map(BadgeAward::getBadgeId).collect(Collectors.toList()))
                .stream()
                .collect(Collectors.toMap(Badge::getBadgeId, Function.identity()));
        return awards.stream()
                .filter(award -> badges.containsKey(award.getBadgeId()))
                .map(award -> {
                    Badge badge = badges.get(award.getBadgeId());
                    return new BadgeDTO(badge.getBadgeKey(), badge.getName(), badge.getDescription(),
                            badge.getCategory().name(), award.getAwardedAt());
                })
                .collect(Collectors.toList());
    }

    /**
     * Percentage of the catalogue a user holds, 0-100 with one decimal.
     */
    @Override
    public double completionPercentage(Long userId) {
        long total = badgeRepository.count();
        if (total == 0) {
            return 0.0;
        }
        long held = awardRepository.findBadgeIdsByUserId(userId).size();
        return Math.round(held * 1000.0 / total) / 10.0;
    }
}
