package com.noteshub.gamification.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RewardsEarnedDTO {
    private int bonusDownloads;
    private int aiAccessDays;
    private int premiumDays;
}
