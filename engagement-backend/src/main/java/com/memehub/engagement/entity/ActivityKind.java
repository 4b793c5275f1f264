package com.memehub.engagement.entity;

public enum ActivityKind {
    MEME_CREATED,
    LIKE_ADDED,
    LIKE_REMOVED,
    COMMENT_ADDED,
    DAILY_LOGIN,
    BONUS_GRANTED,
    RANK_CHANGED,
    BADGE_AWARDED
}
