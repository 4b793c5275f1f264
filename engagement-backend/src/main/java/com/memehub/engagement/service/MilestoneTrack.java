package com.memehub.engagement.service;

import com.memehub.engagement.badge.Counter;

/**
 * 里程碑进度条: one counter and its ascending milestones.
 */
public enum MilestoneTrack {
    MEME_CREATOR("Meme Creator", "Create memes", Counter.MEMES_CREATED, 1, 5, 10, 25, 50, 100),
    POPULAR_CREATOR("Popular Creator", "Get likes on your memes", Counter.LIKES_RECEIVED, 1, 10, 50, 100, 500, 1000),
    COMMUNITY_MEMBER("Community Member", "Make comments", Counter.COMMENTS_MADE, 1, 5, 10, 25, 50, 100);

    private final String displayName;
    private final String description;
    private final Counter counter;
    private final long[] milestones;

    MilestoneTrack(String displayName, String description, Counter counter, long... milestones) {
        this.displayName = displayName;
        this.description = description;
        this.counter = counter;
        this.milestones = milestones;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDescription() {
        return description;
    }

    public Counter getCounter() {
        return counter;
    }

    public long[] getMilestones() {
        return milestones.clone();
    }
}
