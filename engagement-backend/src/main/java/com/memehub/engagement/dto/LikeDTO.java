package com.memehub.engagement.dto;

import com.memehub.engagement.entity.MemeLike;
import lombok.Data;

import java.time.LocalDateTime;

@Data
public class LikeDTO {
    private Long likeId;
    private Long userId;
    private Long memeId;
    private LocalDateTime createdAt;

    public static LikeDTO from(MemeLike like) {
        LikeDTO dto = new LikeDTO();
        dto.setLikeId(like.getLikeId());
        dto.setUserId(like.getUserId());
        dto.setMemeId(like.getMemeId());
        dto.setCreatedAt(like.getCreatedAt());
        return dto;
    }
}
