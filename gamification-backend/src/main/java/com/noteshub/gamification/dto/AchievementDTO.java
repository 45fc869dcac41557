package com.noteshub.gamification.dto;

import lombok.Data;

/**
 * Catalog entry with platform-wide unlock statistics.
 */
@Data
public class AchievementDTO {
    private Integer rank;              // only set in ranking lists
    private String achievementKey;
    private String name;
    private String description;
    private String category;
    private String icon;
    private String rarity;
    private Integer points;
    private Double completionRate;     // achievedCount / users, 0..1
    private Integer achievedCount;
}
