package com.memehub.engagement.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import java.time.LocalDateTime;

/**
 * Meme Entity: a piece of shared content.
 * content_ref points at storage owned by another service and is opaque here.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "meme", indexes = {
        @Index(name = "idx_meme_owner", columnList = "owner_id")
})
public class Meme {

    public static final int CONTENT_REF_LENGTH = 500;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "meme_id")
    private Long memeId;

    @Column(name = "owner_id", nullable = false)
    private Long ownerId;

    @Column(name = "content_ref", nullable = false, length = CONTENT_REF_LENGTH)
    private String contentRef;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    /** like_count: recounted from meme_like whenever a like is added or removed */
    @Column(name = "like_count", nullable = false)
    private Integer likeCount;

    /** comment_count: recounted from meme_comment whenever a comment is added */
    @Column(name = "comment_count", nullable = false)
    private Integer commentCount;
}
