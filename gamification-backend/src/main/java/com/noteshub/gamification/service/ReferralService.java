package com.noteshub.gamification.service;

import com.noteshub.gamification.dto.ReferralDTO;
import com.noteshub.gamification.dto.ReferralMilestoneDTO;
import com.noteshub.gamification.dto.ReferralRewardDTO;
import com.noteshub.gamification.dto.ReferralStatsDTO;
import com.noteshub.gamification.dto.ReferredUserDTO;
import com.noteshub.gamification.dto.TopReferrerDTO;

import java.util.List;
import java.util.Optional;

public interface ReferralService {

    /**
     * Returns the user's referral ledger, minting a code on first access.
     */
    ReferralDTO getOrCreateReferral(String userId);

    /**
     * @throws com.noteshub.gamification.exception.NotFoundException   unknown user or code
     * @throws com.noteshub.gamification.exception.ValidationException second application or own code
     */
    ReferralRewardDTO applyReferralCode(String userId, String code);

    /**
     * Pays the referrer for the user's first upload, at most once per referred user.
     * Empty when the user was not referred, has not uploaded, or was already paid for.
     */
    Optional<ReferralRewardDTO> rewardForFirstUpload(String userId);

    List<ReferralMilestoneDTO> getMilestones(int totalReferrals);

    ReferralStatsDTO getStats(String userId);

    List<ReferredUserDTO> getReferredUsers(String userId);

    List<TopReferrerDTO> getTopReferrers(int limit);
}
