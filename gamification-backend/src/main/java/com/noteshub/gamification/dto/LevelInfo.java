package com.noteshub.gamification.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LevelInfo {
    private int level;
    private String levelName;
    private long pointsToNextLevel;
    private double progressPercentage;
}
