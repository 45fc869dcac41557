package com.noteshub.gamification.service;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic cache invalidation. Off unless {@code gamification.leaderboard.refresh-cron} is set.
 */
@Component
public class LeaderboardRefreshJob {

    private final LeaderboardService leaderboardService;

    public LeaderboardRefreshJob(LeaderboardService leaderboardService) {
        this.leaderboardService = leaderboardService;
    }

    @Scheduled(cron = "${gamification.leaderboard.refresh-cron:-}")
    public void refresh() {
        leaderboardService.refresh();
    }
}
