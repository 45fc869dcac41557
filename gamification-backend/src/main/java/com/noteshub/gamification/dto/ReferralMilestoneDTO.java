package com.noteshub.gamification.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReferralMilestoneDTO {
    private int referrals;
    private String reward;
    private int bonusDownloads;
    private boolean achieved;
}
