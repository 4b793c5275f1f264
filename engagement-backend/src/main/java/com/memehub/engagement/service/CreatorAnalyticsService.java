package com.memehub.engagement.service;

import com.memehub.engagement.dto.CreatorAnalyticsDTO;

public interface CreatorAnalyticsService {
    CreatorAnalyticsDTO analytics(Long userId);
}
