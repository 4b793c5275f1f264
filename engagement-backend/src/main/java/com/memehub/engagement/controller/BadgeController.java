package com.memehub.engagement.controller;

import com.memehub.engagement.dto.BadgeStatsDTO;
import com.memehub.engagement.dto.CommonResponse;
import com.memehub.engagement.service.EngagementService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/Badge")
public class BadgeController {

    private final EngagementService engagementService;

    public BadgeController(EngagementService engagementService) {
        this.engagementService = engagementService;
    }

    /**
     * **路径: /api/Badge/getBadgeList**
     * 功能: 徽章目录, with holder counts and completion rate
     */
    @GetMapping("/getBadgeList")
    public ResponseEntity<CommonResponse<List<BadgeStatsDTO>>> getBadgeList() {
        return ResponseEntity.ok(CommonResponse.success(engagementService.badgeList()));
    }

    /**
     * **路径: /api/Badge/getBadgeRanking?count=5&sort_order=desc**
     * 功能: 按持有人数排序
     */
    @GetMapping("/getBadgeRanking")
    public ResponseEntity<CommonResponse<List<BadgeStatsDTO>>> getBadgeRanking(
            @RequestParam(value = "count", required = false) Integer count,
            @RequestParam(value = "sort_order", required = false) String sortOrder) {
        return ResponseEntity.ok(CommonResponse.success(engagementService.badgeRanking(count, sortOrder)));
    }
}
