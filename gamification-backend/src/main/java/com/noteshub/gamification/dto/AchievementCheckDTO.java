package com.noteshub.gamification.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Result of a manual achievement check.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AchievementCheckDTO {
    private List<UserAchievementDTO> newlyUnlocked;
    private int count;
}
