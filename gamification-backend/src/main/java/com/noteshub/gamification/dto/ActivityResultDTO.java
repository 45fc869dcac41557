package com.noteshub.gamification.dto;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * What one user action changed for the acting user.
 */
@Data
public class ActivityResultDTO {
    private String action;
    private int pointsAwarded;
    private long totalPoints;
    private int level;
    private String levelName;
    private int currentStreak;
    private List<UserAchievementDTO> newAchievements = new ArrayList<>();
}
