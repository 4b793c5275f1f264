package com.memehub.engagement.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * A badge held by a user
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BadgeDTO {
    private String badgeKey;
    private String name;
    private String description;
    private String category;
    private LocalDateTime awardedAt;
}
