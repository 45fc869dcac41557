package com.noteshub.gamification.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StreakDTO {
    private int currentStreak;
    private int longestStreak;
    private LocalDate lastActivityDate;
    private long totalActivities;
    private int nextMilestone;
    private int daysUntilNextMilestone;
}
