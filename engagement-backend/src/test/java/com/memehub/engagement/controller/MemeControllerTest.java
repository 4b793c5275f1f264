package com.memehub.engagement.controller;

import com.memehub.engagement.dto.LikeDTO;
import com.memehub.engagement.exception.DuplicateActionException;
import com.memehub.engagement.exception.InvalidReferenceException;
import com.memehub.engagement.exception.PolicyViolationException;
import com.memehub.engagement.exception.StoreUnavailableException;
import com.memehub.engagement.service.EngagementService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * 错误映射: engine exceptions -> HTTP status and CommonResponse body
 */
@WebMvcTest(controllers = {MemeController.class, UserController.class})
class MemeControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private EngagementService engagementService;

    @Test
    void testAddLike_Ok() throws Exception {
        LikeDTO like = new LikeDTO();
        like.setLikeId(7L);
        like.setUserId(2L);
        like.setMemeId(10L);
        like.setCreatedAt(LocalDateTime.of(2024, 5, 1, 12, 0));
        when(engagementService.addLike(2L, 10L)).thenReturn(like);

        mockMvc.perform(post("/api/Meme/10/like").header("X-User-Id", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(200))
                .andExpect(jsonPath("$.data.likeId").value(7));
    }

    @Test
    void testAddLike_DuplicateIs409() throws Exception {
        when(engagementService.addLike(2L, 10L)).thenThrow(
                new DuplicateActionException(DuplicateActionException.ALREADY_LIKED, "User 2 already likes meme 10"));

        mockMvc.perform(post("/api/Meme/10/like").header("X-User-Id", "2"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value(409))
                .andExpect(jsonPath("$.data").value("ALREADY_LIKED"));
    }

    @Test
    void testAddLike_SelfLikeIs422() throws Exception {
        when(engagementService.addLike(1L, 10L)).thenThrow(
                new PolicyViolationException(PolicyViolationException.SELF_LIKE, "Users cannot like their own meme"));

        mockMvc.perform(post("/api/Meme/10/like").header("X-User-Id", "1"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.data").value("SELF_LIKE"));
    }

    @Test
    void testRemoveLike_NotLikedIs404() throws Exception {
        doThrow(new InvalidReferenceException(InvalidReferenceException.NOT_LIKED, "User 2 has not liked meme 10"))
                .when(engagementService).removeLike(2L, 10L);

        mockMvc.perform(delete("/api/Meme/10/like").header("X-User-Id", "2"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.data").value("NOT_LIKED"));
    }

    // 存储不可用: 503, 不暴露底层异常信息
    @Test
    void testAddComment_StoreUnavailableIs503() throws Exception {
        when(engagementService.addComment(eq(2L), eq(10L), eq("nice"), any()))
                .thenThrow(new StoreUnavailableException("Store unavailable during addComment, retry later",
                        new CannotAcquireLockException("lock wait timeout on meme row")));

        mockMvc.perform(post("/api/Meme/10/comments").header("X-User-Id", "2")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"body\":\"nice\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.message").value("Service temporarily unavailable, retry later"))
                .andExpect(jsonPath("$.data").value("STORE_UNAVAILABLE"));
    }

    @Test
    void testMissingIdentityHeaderIs400() throws Exception {
        mockMvc.perform(post("/api/Meme/10/like"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.data").value("BAD_REQUEST"));
        verifyNoInteractions(engagementService);
    }

    @Test
    void testGrantBonus_OutOfRangeIs422() throws Exception {
        when(engagementService.grantBonus(eq(1L), eq(500), eq("promo-1"), eq(9L), any()))
                .thenThrow(new PolicyViolationException(PolicyViolationException.BONUS_OUT_OF_RANGE,
                        "Bonus must be between 20 and 100 points, got 500"));

        mockMvc.perform(post("/api/User/1/bonus").header("X-User-Id", "9")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\":500,\"idempotencyKey\":\"promo-1\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.data").value("BONUS_OUT_OF_RANGE"));
    }
}
