package com.memehub.engagement.service;

import com.memehub.engagement.dto.CreatorAnalyticsDTO;
import com.memehub.engagement.dto.MemeDTO;
import com.memehub.engagement.entity.Meme;
import com.memehub.engagement.repository.MemeRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@Transactional(readOnly = true)
public class CreatorAnalyticsServiceImpl implements CreatorAnalyticsService {

    // 近期均值超过早期 20% 视为上升, 低于 20% 视为下降
    private static final double UP_FACTOR = 1.2;
    private static final double DOWN_FACTOR = 0.8;
    private static final int MIN_MEMES_FOR_TREND = 3;

    private final MemeRepository memeRepository;

    public CreatorAnalyticsServiceImpl(MemeRepository memeRepository) {
        this.memeRepository = memeRepository;
    }

    @Override
    public CreatorAnalyticsDTO analytics(Long userId) {
        List<Meme> memes = memeRepository.findByOwnerIdOrderByCreatedAtDescMemeIdDesc(userId);

        long likes = 0;
        long comments = 0;
        Meme best = null;
        for (Meme meme : memes) {
            likes += meme.getLikeCount();
            comments += meme.getCommentCount();
            // newest first, so a tie keeps the newer meme
            if (best == null || meme.getLikeCount() > best.getLikeCount()) {
                best = meme;
            }
        }

        CreatorAnalyticsDTO dto = new CreatorAnalyticsDTO();
        dto.setUserId(userId);
        dto.setTotalMemes(memes.size());
        dto.setTotalLikes(likes);
        dto.setTotalComments(comments);
        dto.setAverageLikes(memes.isEmpty() ? 0.0 : Math.round(likes * 10.0 / memes.size()) / 10.0);
        dto.setBestMeme(best == null ? null : MemeDTO.from(best));
        dto.setEngagementTrend(trend(memes));
        return dto;
    }

    /**
     * Compares average likes of the newer half with the older half.
     * @param memes newest first
     */
    private CreatorAnalyticsDTO.Trend trend(List<Meme> memes) {
        if (memes.size() < MIN_MEMES_FOR_TREND) {
            return CreatorAnalyticsDTO.Trend.STABLE;
        }
        int half = memes.size() / 2;
        double recent = averageLikes(memes.subList(0, half));
        double older = averageLikes(memes.subList(half, memes.size()));
        if (recent > older * UP_FACTOR) {
            return CreatorAnalyticsDTO.Trend.UP;
        }
        if (recent < older * DOWN_FACTOR) {
            return CreatorAnalyticsDTO.Trend.DOWN;
        }
        return CreatorAnalyticsDTO.Trend.STABLE;
    }

    private double averageLikes(List<Meme> memes) {
        long total = 0;
        for (Meme meme : memes) {
            total += meme.getLikeCount();
        }
        return (double) total / memes.size();
    }
}
