package com.noteshub.gamification.dto;

import lombok.Data;

import java.util.Map;

/**
 * Per-user achievement summary.
 */
@Data
public class AchievementStatsDTO {
    private int totalAchievements;
    private int unlocked;
    private int locked;
    private Double completionPercentage;
    // rarity code -> unlocked count, every rarity present
    private Map<String, Integer> rarityBreakdown;
    private Long pointsFromAchievements;
}
