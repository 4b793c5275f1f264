package com.memehub.engagement.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import java.time.LocalDateTime;

/**
 * Activity Entity: append-only audit trail shown on profiles.
 * Never read by the point or badge computations.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "activity_log", indexes = @Index(name = "idx_activity_user", columnList = "user_id, created_at"))
public class Activity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "activity_id")
    private Long activityId;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, length = 30)
    private ActivityKind kind;

    /** reference: "meme:12", "like:7", "badge:first-steps", ... */
    @Column(name = "reference", nullable = false, length = 150)
    private String reference;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
