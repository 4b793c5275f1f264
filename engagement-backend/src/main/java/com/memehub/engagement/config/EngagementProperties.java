package com.memehub.engagement.config;

import com.memehub.engagement.entity.BadgeCategory;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * engagement.* 配置项 (application.yml)
 */
@Data
@ConfigurationProperties(prefix = "engagement")
public class EngagementProperties {

    /** Zone that defines calendar days for daily logins and timestamps */
    private String zone = "UTC";

    private Points points = new Points();
    private Bonus bonus = new Bonus();
    private Likes likes = new Likes();
    private Comments comments = new Comments();
    private Trending trending = new Trending();
    private List<BadgeDefinition> badges = new ArrayList<>();

    @Data
    public static class Points {
        private int memeCreated = 10;
        private int likeReceived = 5;
        private int commentMade = 2;
        private int dailyLogin = 1;
    }

    @Data
    public static class Bonus {
        private int min = 20;
        private int max = 100;
    }

    @Data
    public static class Likes {
        private boolean allowSelfLike = false;
    }

    @Data
    public static class Comments {
        private int maxLength = 1000;
    }

    @Data
    public static class Trending {
        private int likeWeight = 1;
        private int commentWeight = 2;
        private Duration defaultWindow = Duration.ofHours(24);
        private Duration refreshDelay = Duration.ofMinutes(1);
        private Duration initialDelay = Duration.ofSeconds(5);
        private int viewSize = 50;
    }

    @Data
    public static class BadgeDefinition {
        private String key;
        private String name;
        private String description;
        private BadgeCategory category;
        private String criteria;
    }
}
