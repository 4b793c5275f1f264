package com.memehub.engagement.service;

import com.memehub.engagement.dto.ActivityDTO;
import com.memehub.engagement.entity.Activity;
import com.memehub.engagement.entity.ActivityKind;
import com.memehub.engagement.repository.ActivityRepository;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Append-only activity trail for profile and history pages.
 * append() joins the caller's transaction, so an activity row commits or
 * rolls back together with the change it describes.
 */
@Service
public class ActivityLogService {

    private static final int DEFAULT_COUNT = 20;
    private static final int MAX_COUNT = 200;

    private final ActivityRepository activityRepository;
    private final Clock clock;

    public ActivityLogService(ActivityRepository activityRepository, Clock clock) {
        this.activityRepository = activityRepository;
        this.clock = clock;
    }

    @Transactional
    public Activity append(Long userId, ActivityKind kind, String reference) {
        if (userId == null || kind == null || reference == null) {
            throw new IllegalArgumentException("userId, kind and reference are required");
        }
        Activity activity = new Activity(null, userId, kind, reference, LocalDateTime.now(clock));
        return activityRepository.save(activity);
    }

    @Transactional(readOnly = true)
    public List<ActivityDTO> recent(Long userId, Integer count) {
        int limit = (count == null || count < 1) ? DEFAULT_COUNT : Math.min(count, MAX_COUNT);
        return activityRepository.findByUserIdOrderByCreatedAtDescActivityIdDesc(userId, PageRequest.of(0, limit))
                .stream()
                .map(ActivityDTO::from)
                .collect(Collectors.toList());
    }
}
