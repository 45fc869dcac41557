package com.noteshub.gamification.service;

import com.noteshub.gamification.dto.StreakDTO;

import java.time.Instant;

public interface StreakService {

    /**
     * Records one qualifying activity at {@code now} and returns the resulting current streak.
     * Days are UTC calendar days.
     */
    int recordActivity(String userId, Instant now);

    int recordActivity(String userId);

    StreakDTO getStreak(String userId);
}
