package com.memehub.engagement.service;

import com.memehub.engagement.dto.LeaderboardEntryDTO;
import com.memehub.engagement.entity.AppUser;
import com.memehub.engagement.exception.InvalidReferenceException;
import com.memehub.engagement.repository.AppUserRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

/**
 * 积分排行榜. Ordering: total points desc, earlier registration first, then user id.
 */
@Service
@Transactional(readOnly = true)
public class LeaderboardServiceImpl implements LeaderboardService {

    private static final int DEFAULT_COUNT = 10;
    private static final int MAX_COUNT = 100;

    private final AppUserRepository userRepository;

    public LeaderboardServiceImpl(AppUserRepository userRepository) {
        this.userRepository = userRepository;
    }

    @Override
    public List<LeaderboardEntryDTO> topByPoints(Integer count, Integer offset) {
        int limit = (count == null || count < 1) ? DEFAULT_COUNT : Math.min(count, MAX_COUNT);
        int start = (offset == null || offset < 0) ? 0 : offset;

        List<AppUser> page = userRepository.findLeaderboardPage(limit, start);
        List<LeaderboardEntryDTO> entries = new ArrayList<>(page.size());
        for (int i = 0; i < page.size(); i++) {
            AppUser user = page.get(i);
            entries.add(new LeaderboardEntryDTO(start + i + 1, user.getUserId(), user.getDisplayName(),
                    user.getTotalPoints(), user.getRank().getDisplayName()));
        }
        return entries;
    }

    @Override
    public int positionOf(Long userId) {
        AppUser user = userRepository.findById(userId)
                .orElseThrow(() -> new InvalidReferenceException(InvalidReferenceException.UNKNOWN_USER,
                        "User " + userId + " does not exist"));
        return (int) userRepository.countRankedAhead(user.getTotalPoints(), user.getCreatedAt(), user.getUserId()) + 1;
    }
}
