package com.noteshub.gamification.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReferralDTO {
    private String referralCode;
    private int totalReferrals;
    private RewardsEarnedDTO rewardsEarned;
    private String referralLink;
    private String referredBy;
}
