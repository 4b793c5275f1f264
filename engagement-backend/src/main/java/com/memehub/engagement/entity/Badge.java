package com.memehub.engagement.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 对应数据库表 badge
 * Rows are synchronised from the configured badge catalogue at start-up.
 */
@Entity
@Table(name = "badge")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Badge {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "badge_id")
    private Long badgeId;

    /**
     * 徽章唯一 KEY, e.g. "first-steps"
     */
    @Column(name = "badge_key", nullable = false, unique = true, length = 50)
    private String badgeKey;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "description", nullable = false, length = 255)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "category", nullable = false, length = 20)
    private BadgeCategory category;

    /**
     * criteria: descriptor parsed by BadgeCriteriaParser, e.g. "memes_created >= 5"
     */
    @Column(name = "criteria", nullable = false, length = 255)
    private String criteria;
}
