package com.memehub.engagement.controller;

import com.memehub.engagement.dto.CommonResponse;
import com.memehub.engagement.service.EngagementService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/Points")
public class PointsController {

    private final EngagementService engagementService;

    public PointsController(EngagementService engagementService) {
        this.engagementService = engagementService;
    }

    // 积分规则表
    @GetMapping("/table")
    public ResponseEntity<CommonResponse<Map<String, Integer>>> getPointTable() {
        return ResponseEntity.ok(CommonResponse.success(engagementService.pointTable()));
    }
}
