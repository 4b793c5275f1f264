package com.memehub.engagement.badge;

/**
 * What caused a badge evaluation. Only used for logging; every evaluation
 * checks the whole catalogue.
 */
public enum BadgeTrigger {
    MEME_CREATED,
    LIKE_RECEIVED,
    COMMENT_MADE,
    LOGIN,
    POINTS_CHANGED
}
