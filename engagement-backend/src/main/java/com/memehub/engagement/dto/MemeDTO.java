package com.memehub.engagement.dto;

import com.memehub.engagement.entity.Meme;
import lombok.Data;

import java.time.LocalDateTime;

@Data
public class MemeDTO {
    private Long memeId;
    private Long ownerId;
    private String contentRef;
    private Integer likeCount;
    private Integer commentCount;
    private LocalDateTime createdAt;

    public static MemeDTO from(Meme meme) {
        MemeDTO dto = new MemeDTO();
        dto.setMemeId(meme.getMemeId());
        dto.setOwnerId(meme.getOwnerId());
        dto.setContentRef(meme.getContentRef());
        dto.setLikeCount(meme.getLikeCount());
        dto.setCommentCount(meme.getCommentCount());
        dto.setCreatedAt(meme.getCreatedAt());
        return dto;
    }
}
