package com.noteshub.gamification.dto;

import lombok.Data;

import java.util.List;

@Data
public class ReferralStatsDTO {
    private String referralCode;
    private int totalReferrals;
    private RewardsEarnedDTO rewardsEarned;
    private List<ReferralMilestoneDTO> milestones;
    // null once every milestone is reached
    private ReferralMilestoneDTO nextMilestone;
    private Double progressToNext;
}
