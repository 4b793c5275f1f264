package com.memehub.engagement.entity;

/**
 * Display classification only, evaluation ignores it.
 */
public enum BadgeCategory {
    CREATOR,
    SOCIAL,
    ACHIEVEMENT,
    TIME_BASED,
    QUALITY
}
