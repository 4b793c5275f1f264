package com.memehub.engagement.badge;

import java.util.Arrays;
import java.util.Optional;

/**
 * Counters a threshold criterion can refer to, by descriptor name.
 */
public enum Counter {
    MEMES_CREATED("memes_created"),
    LIKES_RECEIVED("likes_received"),
    COMMENTS_MADE("comments_made"),
    TOTAL_POINTS("total_points");

    private final String descriptorName;

    Counter(String descriptorName) {
        this.descriptorName = descriptorName;
    }

    public String getDescriptorName() {
        return descriptorName;
    }

    public static Optional<Counter> fromDescriptorName(String name) {
        return Arrays.stream(values())
                .filter(c -> c.descriptorName.equals(name))
                .findFirst();
    }
}
