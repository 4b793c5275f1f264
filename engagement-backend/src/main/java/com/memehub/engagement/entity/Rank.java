package com.memehub.engagement.entity;

/**
 * Rank tiers in ascending order. The minimum points of each tier are
 * strictly increasing, so ordinal order is also threshold order.
 */
public enum Rank {
    NEWBIE("Newbie", 0),
    ROOKIE_MEMER("Rookie Memer", 50),
    MEME_ENTHUSIAST("Meme Enthusiast", 200),
    PRO_MEMER("Pro Memer", 500),
    MEME_LEGEND("Meme Legend", 1000);

    private final String displayName;
    private final long minPoints;

    Rank(String displayName, long minPoints) {
        this.displayName = displayName;
        this.minPoints = minPoints;
    }

    public String getDisplayName() {
        return displayName;
    }

    public long getMinPoints() {
        return minPoints;
    }

    public boolean isAtLeast(Rank other) {
        return compareTo(other) >= 0;
    }
}
