package com.memehub.engagement.controller;

import com.memehub.engagement.dto.CommonResponse;
import com.memehub.engagement.dto.LeaderboardEntryDTO;
import com.memehub.engagement.dto.TrendingScoreDTO;
import com.memehub.engagement.service.EngagementService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/Leaderboard")
public class LeaderboardController {

    private final EngagementService engagementService;

    public LeaderboardController(EngagementService engagementService) {
        this.engagementService = engagementService;
    }

    /**
     * **路径: /api/Leaderboard?count=10&offset=0**
     * 按总积分排名
     */
    @GetMapping
    public ResponseEntity<CommonResponse<List<LeaderboardEntryDTO>>> getLeaderboard(
            @RequestParam(required = false) Integer count,
            @RequestParam(required = false) Integer offset) {
        return ResponseEntity.ok(CommonResponse.success(engagementService.leaderboard(count, offset)));
    }

    /**
     * **路径: /api/Leaderboard/trending?hours=24&count=10**
     * Computed on request for the given window.
     */
    @GetMapping("/trending")
    public ResponseEntity<CommonResponse<List<TrendingScoreDTO>>> getTrending(
            @RequestParam(required = false) Integer hours,
            @RequestParam(required = false) Integer count) {
        return ResponseEntity.ok(CommonResponse.success(engagementService.trending(hours, count)));
    }

    /**
     * Last view computed by the background refresh (default window).
     */
    @GetMapping("/trending/current")
    public ResponseEntity<CommonResponse<List<TrendingScoreDTO>>> getCurrentTrending(
            @RequestParam(required = false) Integer count) {
        return ResponseEntity.ok(CommonResponse.success(engagementService.currentTrending(count)));
    }
}
