package com.memehub.engagement.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import java.time.LocalDateTime;

/**
 * AppUser Entity: user account as seen by the engagement engine.
 * The id comes from the identity provider and is never generated here.
 * total_points and user_rank are derived from the point ledger and are only
 * written by the points ledger service inside the ledger transaction.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "app_user")
public class AppUser {

    public static final int DISPLAY_NAME_LENGTH = 100;

    @Id
    @Column(name = "user_id")
    private Long userId;

    @Column(name = "display_name", nullable = false, length = DISPLAY_NAME_LENGTH)
    private String displayName;

    /**
     * total_points: SUM(point_transaction.amount) for this user
     */
    @Column(name = "total_points", nullable = false)
    private Long totalPoints;

    @Enumerated(EnumType.STRING)
    @Column(name = "user_rank", nullable = false, length = 20)
    private Rank rank;

    /**
     * created_at: account creation time, also the leaderboard tie-breaker
     */
    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
