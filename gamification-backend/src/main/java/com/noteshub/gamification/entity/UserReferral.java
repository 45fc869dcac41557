package com.noteshub.gamification.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Referral ledger of one user (table user_referral).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "user_referral",
        uniqueConstraints = @UniqueConstraint(name = "uk_referral_code", columnNames = "referral_code"))
public class UserReferral {

    @Id
    @Column(name = "user_id", length = 64)
    private String userId;

    /**
     * referral_code: globally unique, never changes once minted
     */
    @Column(name = "referral_code", nullable = false, length = 16)
    private String referralCode;

    /**
     * referred_by: code this user signed up with, written at most once
     */
    @Column(name = "referred_by", length = 16)
    private String referredBy;

    @Column(name = "total_referrals", nullable = false)
    private int totalReferrals;

    @Column(name = "bonus_downloads", nullable = false)
    private int bonusDownloads;

    @Column(name = "ai_access_days", nullable = false)
    private int aiAccessDays;

    @Column(name = "premium_days", nullable = false)
    private int premiumDays;

    /**
     * flips to true once the referrer has been paid for this user's first upload
     */
    @Column(name = "first_upload_reward_claimed", nullable = false)
    private boolean firstUploadRewardClaimed;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
