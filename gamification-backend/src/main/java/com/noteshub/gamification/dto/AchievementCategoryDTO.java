package com.noteshub.gamification.dto;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class AchievementCategoryDTO {
    private String category;
    private int total;
    private int unlocked;
    private List<UserAchievementDTO> achievements = new ArrayList<>();
}
