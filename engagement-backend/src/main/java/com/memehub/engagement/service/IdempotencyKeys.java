package com.memehub.engagement.service;

import java.time.LocalDate;

/**
 * Idempotency keys of the ledger, one per originating action.
 */
public final class IdempotencyKeys {

    private IdempotencyKeys() {
    }

    public static String memeCreated(Long memeId) {
        return "meme:" + memeId;
    }

    public static String likeReceived(Long likeId) {
        return "like:" + likeId;
    }

    public static String likeRemoved(Long likeId) {
        return "unlike:" + likeId;
    }

    public static String commentMade(Long commentId) {
        return "comment:" + commentId;
    }

    // one per user and calendar day
    public static String dailyLogin(Long userId, LocalDate day) {
        return "login:" + userId + ":" + day;
    }

    public static String bonus(String callerKey) {
        return "bonus:" + callerKey;
    }
}
