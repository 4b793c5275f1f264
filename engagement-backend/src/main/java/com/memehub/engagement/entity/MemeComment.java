package com.memehub.engagement.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import java.time.LocalDateTime;

/**
 * MemeComment Entity: a comment on a meme, optionally replying to another
 * comment on the same meme.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "meme_comment", indexes = {
        @Index(name = "idx_meme_comment_meme", columnList = "meme_id"),
        @Index(name = "idx_meme_comment_author", columnList = "author_id"),
        @Index(name = "idx_meme_comment_created", columnList = "created_at")
})
public class MemeComment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "comment_id")
    private Long commentId;

    @Column(name = "meme_id", nullable = false)
    private Long memeId;

    @Column(name = "author_id", nullable = false)
    private Long authorId;

    /**
     * parent_comment_id: must reference an existing comment of the same meme (nullable)
     */
    @Column(name = "parent_comment_id")
    private Long parentCommentId;

    @Column(name = "body", nullable = false, length = 1000)
    private String body;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
