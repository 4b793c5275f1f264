package com.memehub.engagement.controller;

import com.memehub.engagement.dto.AddCommentRequest;
import com.memehub.engagement.dto.CommentDTO;
import com.memehub.engagement.dto.CommonResponse;
import com.memehub.engagement.dto.CreateMemeRequest;
import com.memehub.engagement.dto.LikeDTO;
import com.memehub.engagement.dto.MemeDTO;
import com.memehub.engagement.dto.MemeStatsDTO;
import com.memehub.engagement.service.EngagementService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

import static com.memehub.engagement.controller.UserController.USER_HEADER;

@RestController
@RequestMapping("/api/Meme")
public class MemeController {

    private final EngagementService engagementService;

    public MemeController(EngagementService engagementService) {
        this.engagementService = engagementService;
    }

    @PostMapping
    public ResponseEntity<CommonResponse<MemeDTO>> createMeme(@RequestHeader(USER_HEADER) Long userId,
                                                              @RequestBody CreateMemeRequest request) {
        return ResponseEntity.ok(CommonResponse.success(engagementService.createMeme(userId, request.getContentRef())));
    }

    @GetMapping("/{meme_id}/stats")
    public ResponseEntity<CommonResponse<MemeStatsDTO>> getStats(@PathVariable("meme_id") Long memeId) {
        return ResponseEntity.ok(CommonResponse.success(engagementService.memeStats(memeId)));
    }

    // ==================== 点赞 ====================

    @PostMapping("/{meme_id}/like")
    public ResponseEntity<CommonResponse<LikeDTO>> addLike(@RequestHeader(USER_HEADER) Long userId,
                                                           @PathVariable("meme_id") Long memeId) {
        return ResponseEntity.ok(CommonResponse.success(engagementService.addLike(userId, memeId)));
    }

    @DeleteMapping("/{meme_id}/like")
    public ResponseEntity<CommonResponse<Void>> removeLike(@RequestHeader(USER_HEADER) Long userId,
                                                           @PathVariable("meme_id") Long memeId) {
        engagementService.removeLike(userId, memeId);
        return ResponseEntity.ok(CommonResponse.success());
    }

    /**
     * Whether the caller currently likes the meme
     */
    @GetMapping("/{meme_id}/like")
    public ResponseEntity<CommonResponse<Boolean>> hasLiked(@RequestHeader(USER_HEADER) Long userId,
                                                            @PathVariable("meme_id") Long memeId) {
        return ResponseEntity.ok(CommonResponse.success(engagementService.hasLiked(userId, memeId)));
    }

    // ==================== 评论 ====================

    @PostMapping("/{meme_id}/comments")
    public ResponseEntity<CommonResponse<CommentDTO>> addComment(@RequestHeader(USER_HEADER) Long userId,
                                                                 @PathVariable("meme_id") Long memeId,
                                                                 @RequestBody AddCommentRequest request) {
        CommentDTO comment = engagementService.addComment(userId, memeId, request.getBody(), request.getParentCommentId());
        return ResponseEntity.ok(CommonResponse.success(comment));
    }

    @GetMapping("/{meme_id}/comments")
    public ResponseEntity<CommonResponse<List<CommentDTO>>> listComments(@PathVariable("meme_id") Long memeId,
                                                                         @RequestParam(required = false) Integer count) {
        return ResponseEntity.ok(CommonResponse.success(engagementService.listComments(memeId, count)));
    }
}
