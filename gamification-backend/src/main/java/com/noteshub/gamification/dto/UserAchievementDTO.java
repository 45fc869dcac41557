package com.noteshub.gamification.dto;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * Catalog entry as seen by one user.
 */
@Data
public class UserAchievementDTO {
    private String id;
    private String name;
    private String description;
    private String category;
    private String icon;
    private String rarity;
    private Integer points;
    private boolean unlocked;
    private LocalDateTime unlockedAt;
}
