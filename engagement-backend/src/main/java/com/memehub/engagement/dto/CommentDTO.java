package com.memehub.engagement.dto;

import com.memehub.engagement.entity.MemeComment;
import lombok.Data;

import java.time.LocalDateTime;

@Data
public class CommentDTO {
    private Long commentId;
    private Long memeId;
    private Long authorId;
    private Long parentCommentId;
    private String body;
    private LocalDateTime createdAt;

    public static CommentDTO from(MemeComment comment) {
        CommentDTO dto = new CommentDTO();
        dto.setCommentId(comment.getCommentId());
        dto.setMemeId(comment.getMemeId());
        dto.setAuthorId(comment.getAuthorId());
        dto.setParentCommentId(comment.getParentCommentId());
        dto.setBody(comment.getBody());
        dto.setCreatedAt(comment.getCreatedAt());
        return dto;
    }
}
