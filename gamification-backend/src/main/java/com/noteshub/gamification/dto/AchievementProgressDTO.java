package com.noteshub.gamification.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AchievementProgressDTO {
    private String achievementId;
    private String name;
    private String stat;
    private Long current;
    private Long required;
    private Double percentage;        // 0..100, one decimal
}
