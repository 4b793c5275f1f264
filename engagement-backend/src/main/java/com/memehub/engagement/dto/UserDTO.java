package com.memehub.engagement.dto;

import com.memehub.engagement.entity.AppUser;
import lombok.Data;

import java.time.LocalDateTime;

@Data
public class UserDTO {
    private Long userId;
    private String displayName;
    private Long totalPoints;
    private String rank;              // 展示名称, e.g. "Rookie Memer"
    private LocalDateTime createdAt;

    public static UserDTO from(AppUser user) {
        UserDTO dto = new UserDTO();
        dto.setUserId(user.getUserId());
        dto.setDisplayName(user.getDisplayName());
        dto.setTotalPoints(user.getTotalPoints());
        dto.setRank(user.getRank().getDisplayName());
        dto.setCreatedAt(user.getCreatedAt());
        return dto;
    }
}
