package com.memehub.engagement.controller;

import com.memehub.engagement.dto.ActivityDTO;
import com.memehub.engagement.dto.BadgeDTO;
import com.memehub.engagement.dto.BonusRequest;
import com.memehub.engagement.dto.CommonResponse;
import com.memehub.engagement.dto.CreatorAnalyticsDTO;
import com.memehub.engagement.dto.LedgerResultDTO;
import com.memehub.engagement.dto.PointTransactionDTO;
import com.memehub.engagement.dto.ProfileDTO;
import com.memehub.engagement.dto.RegisterUserRequest;
import com.memehub.engagement.dto.UserDTO;
import com.memehub.engagement.service.EngagementService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/User")
public class UserController {

    static final String USER_HEADER = "X-User-Id";

    private final EngagementService engagementService;

    public UserController(EngagementService engagementService) {
        this.engagementService = engagementService;
    }

    /**
     * **路径: POST /api/User**
     * 注册用户 (id 来自身份服务). Registering an existing id returns it unchanged.
     */
    @PostMapping
    public ResponseEntity<CommonResponse<UserDTO>> registerUser(@RequestBody RegisterUserRequest request) {
        UserDTO user = engagementService.registerUser(request.getUserId(), request.getDisplayName());
        return ResponseEntity.ok(CommonResponse.success(user));
    }

    @GetMapping("/{user_id}/profile")
    public ResponseEntity<CommonResponse<ProfileDTO>> getProfile(@PathVariable("user_id") Long userId) {
        return ResponseEntity.ok(CommonResponse.success(engagementService.profile(userId)));
    }

    /**
     * 积分流水, newest first
     */
    @GetMapping("/{user_id}/points")
    public ResponseEntity<CommonResponse<List<PointTransactionDTO>>> getPointsHistory(@PathVariable("user_id") Long userId) {
        return ResponseEntity.ok(CommonResponse.success(engagementService.pointsHistory(userId)));
    }

    @GetMapping("/{user_id}/activity")
    public ResponseEntity<CommonResponse<List<ActivityDTO>>> getActivity(@PathVariable("user_id") Long userId,
                                                                         @RequestParam(required = false) Integer count) {
        return ResponseEntity.ok(CommonResponse.success(engagementService.recentActivity(userId, count)));
    }

    /**
     * 创作者数据: totals, average likes, best meme and engagement trend
     */
    @GetMapping("/{user_id}/analytics")
    public ResponseEntity<CommonResponse<CreatorAnalyticsDTO>> getAnalytics(@PathVariable("user_id") Long userId) {
        return ResponseEntity.ok(CommonResponse.success(engagementService.creatorAnalytics(userId)));
    }

    @GetMapping("/{user_id}/badges")
    public ResponseEntity<CommonResponse<List<BadgeDTO>>> getBadges(@PathVariable("user_id") Long userId) {
        return ResponseEntity.ok(CommonResponse.success(engagementService.userBadges(userId)));
    }

    /**
     * **路径: POST /api/User/login**
     * 每日登录奖励, at most once per calendar day
     */
    @PostMapping("/login")
    public ResponseEntity<CommonResponse<LedgerResultDTO>> login(@RequestHeader(USER_HEADER) Long userId) {
        return ResponseEntity.ok(CommonResponse.success(engagementService.recordDailyLogin(userId)));
    }

    /**
     * Grants a bonus to {user_id}; the caller in X-User-Id is recorded as grantor.
     */
    @PostMapping("/{user_id}/bonus")
    public ResponseEntity<CommonResponse<LedgerResultDTO>> grantBonus(@PathVariable("user_id") Long userId,
                                                                      @RequestHeader(USER_HEADER) Long grantedBy,
                                                                      @RequestBody BonusRequest request) {
        LedgerResultDTO result = engagementService.grantBonus(userId, request.getAmount(),
                request.getIdempotencyKey(), grantedBy, request.getNote());
        return ResponseEntity.ok(CommonResponse.success(result));
    }
}
