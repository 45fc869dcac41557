package com.noteshub.gamification.repository;

import com.noteshub.gamification.entity.UserReferral;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface UserReferralRepository extends JpaRepository<UserReferral, String> {

    Optional<UserReferral> findByReferralCode(String referralCode);

    boolean existsByReferralCode(String referralCode);

    List<UserReferral> findByTotalReferralsGreaterThanOrderByTotalReferralsDescUserIdAsc(int minimum, Pageable pageable);

    /**
     * Set-once write of referred_by together with the applicant's signup bonus.
     * @return 0 when the user already used a code
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE UserReferral r SET r.referredBy = :code, r.bonusDownloads = r.bonusDownloads + :bonusDownloads " +
           "WHERE r.userId = :userId AND r.referredBy IS NULL")
    int markReferred(@Param("userId") String userId,
                     @Param("code") String code,
                     @Param("bonusDownloads") int bonusDownloads);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE UserReferral r SET r.totalReferrals = r.totalReferrals + 1, " +
           "r.bonusDownloads = r.bonusDownloads + :bonusDownloads WHERE r.userId = :userId")
    int creditReferral(@Param("userId") String userId, @Param("bonusDownloads") int bonusDownloads);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE UserReferral r SET r.bonusDownloads = r.bonusDownloads + :bonusDownloads WHERE r.userId = :userId")
    int addBonusDownloads(@Param("userId") String userId, @Param("bonusDownloads") int bonusDownloads);

    /**
     * Claims the first-upload payout for a referred user. Succeeds exactly once per user.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE UserReferral r SET r.firstUploadRewardClaimed = true " +
           "WHERE r.userId = :userId AND r.referredBy IS NOT NULL AND r.firstUploadRewardClaimed = false")
    int claimFirstUploadReward(@Param("userId") String userId);
}
