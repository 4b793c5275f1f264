package com.memehub.engagement.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "meme_like",
        uniqueConstraints = @UniqueConstraint(name = "uk_meme_like_user_meme", columnNames = {"user_id", "meme_id"}),
        indexes = @Index(name = "idx_meme_like_created", columnList = "created_at"))
public class MemeLike {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "like_id")
    private Long likeId;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "meme_id", nullable = false)
    private Long memeId;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
