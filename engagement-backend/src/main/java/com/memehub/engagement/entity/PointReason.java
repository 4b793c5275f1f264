package com.memehub.engagement.entity;

public enum PointReason {
    MEME_CREATED,
    LIKE_RECEIVED,
    COMMENT_MADE,
    DAILY_LOGIN,
    BONUS,
    LIKE_REMOVED_REVERSAL
}
