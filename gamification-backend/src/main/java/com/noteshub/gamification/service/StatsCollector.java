package com.noteshub.gamification.service;

import com.noteshub.gamification.achievement.StatKey;
import com.noteshub.gamification.achievement.StatsSnapshot;
import com.noteshub.gamification.entity.UserReferral;
import com.noteshub.gamification.entity.UserStreak;
import com.noteshub.gamification.external.NoteStore;
import com.noteshub.gamification.external.SocialGraph;
import com.noteshub.gamification.external.StudyGroupStore;
import com.noteshub.gamification.repository.ShareActionRepository;
import com.noteshub.gamification.repository.UserReferralRepository;
import com.noteshub.gamification.repository.UserStreakRepository;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Builds the statistics snapshot achievements are evaluated against.
 * Read failures propagate; a statistic is never defaulted to zero because its source failed.
 */
@Component
public class StatsCollector {

    private final NoteStore noteStore;
    private final SocialGraph socialGraph;
    private final StudyGroupStore studyGroupStore;
    private final UserStreakRepository streakRepository;
    private final UserReferralRepository referralRepository;
    private final ShareActionRepository shareRepository;
    private final PointsService pointsService;

    public StatsCollector(NoteStore noteStore,
                          SocialGraph socialGraph,
                          StudyGroupStore studyGroupStore,
                          UserStreakRepository streakRepository,
                          UserReferralRepository referralRepository,
                          ShareActionRepository shareRepository,
                          PointsService pointsService) {
        this.noteStore = noteStore;
        this.socialGraph = socialGraph;
        this.studyGroupStore = studyGroupStore;
        this.streakRepository = streakRepository;
        this.referralRepository = referralRepository;
        this.shareRepository = shareRepository;
        this.pointsService = pointsService;
    }

    public StatsSnapshot collect(String userId) {
        Optional<UserStreak> streak = streakRepository.findById(userId);
        Optional<UserReferral> referral = referralRepository.findById(userId);

        return StatsSnapshot.builder()
                .count(StatKey.UPLOADS, noteStore.countUploads(userId, true))
                .count(StatKey.DOWNLOADS, noteStore.countDownloadsBy(userId))
                .count(StatKey.NOTE_DOWNLOADS, noteStore.sumDownloadCount(userId))
                .count(StatKey.STREAK, streak.map(UserStreak::getCurrentStreak).orElse(0))
                .count(StatKey.TOTAL_ACTIVITIES, streak.map(UserStreak::getTotalActivities).orElse(0L))
                .count(StatKey.REFERRALS, referral.map(UserReferral::getTotalReferrals).orElse(0))
                .count(StatKey.SHARES, shareRepository.countByUserId(userId))
                .count(StatKey.FOLLOWERS, socialGraph.countFollowers(userId))
                .count(StatKey.FOLLOWING, socialGraph.countFollowing(userId))
                .count(StatKey.GROUPS_CREATED, studyGroupStore.countCreated(userId))
                .count(StatKey.GROUPS_JOINED, studyGroupStore.countJoined(userId))
                .count(StatKey.LEVEL, pointsService.getPoints(userId).getLevel())
                .flag(StatKey.REFERRED, referral.map(r -> r.getReferredBy() != null).orElse(false))
                .build();
    }
}
