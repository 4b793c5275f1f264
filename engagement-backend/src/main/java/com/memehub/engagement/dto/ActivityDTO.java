package com.memehub.engagement.dto;

import com.memehub.engagement.entity.Activity;
import lombok.Data;

import java.time.LocalDateTime;

@Data
public class ActivityDTO {
    private Long activityId;
    private Long userId;
    private String kind;
    private String reference;
    private LocalDateTime createdAt;

    public static ActivityDTO from(Activity activity) {
        ActivityDTO dto = new ActivityDTO();
        dto.setActivityId(activity.getActivityId());
        dto.setUserId(activity.getUserId());
        dto.setKind(activity.getKind().name());
        dto.setReference(activity.getReference());
        dto.setCreatedAt(activity.getCreatedAt());
        return dto;
    }
}
