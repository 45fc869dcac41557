package com.noteshub.gamification.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Tunables of the gamification engine, bound from {@code gamification.*}.
 */
@Data
@ConfigurationProperties(prefix = "gamification")
public class GamificationProperties {

    private Leaderboard leaderboard = new Leaderboard();
    private Referral referral = new Referral();
    private Streak streak = new Streak();

    @Data
    public static class Leaderboard {
        /** TTL of the all-India ranking. */
        private Duration allIndiaTtl = Duration.ofHours(1);
        /** TTL of college and department rankings. */
        private Duration scopedTtl = Duration.ofMinutes(30);
        private int defaultLimit = 100;
        private int maxLimit = 1000;
        private int maxScopedLimit = 500;
        /** Upper bound on cached (scope, filter) rankings. */
        private long cacheMaxEntries = 1000;
    }

    @Data
    public static class Referral {
        private String baseUrl = "https://noteshub.app";
        private int maxCodeAttempts = 10;
    }

    @Data
    public static class Streak {
        /** Re-reads allowed when a guarded streak update loses a race. */
        private int maxTransitionAttempts = 3;
    }
}
