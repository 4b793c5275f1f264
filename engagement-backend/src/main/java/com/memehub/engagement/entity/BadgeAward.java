package com.memehub.engagement.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import java.time.LocalDateTime;

@Entity
@Table(name = "badge_award",
        uniqueConstraints = @UniqueConstraint(name = "uk_badge_award_user_badge", columnNames = {"user_id", "badge_id"}))
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BadgeAward {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "award_id")
    private Long awardId;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "badge_id", nullable = false)
    private Long badgeId;

    @Column(name = "awarded_at", nullable = false)
    private LocalDateTime awardedAt;
}
