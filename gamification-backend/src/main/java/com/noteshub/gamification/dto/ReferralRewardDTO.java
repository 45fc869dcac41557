package com.noteshub.gamification.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * What a successful referral application paid out.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReferralRewardDTO {
    private String type;              // signup, first_upload
    private String referrerId;
    private int applicantBonusDownloads;
    private int referrerBonusDownloads;
    private int referrerPoints;
}
