package com.noteshub.gamification.service;

import com.noteshub.gamification.achievement.AchievementDefinition;
import com.noteshub.gamification.dto.ActivityResultDTO;
import com.noteshub.gamification.dto.PointsAward;
import com.noteshub.gamification.dto.PointsSummaryDTO;
import com.noteshub.gamification.dto.ShareStatsDTO;
import com.noteshub.gamification.entity.ShareAction;
import com.noteshub.gamification.exception.ValidationException;
import com.noteshub.gamification.repository.ShareActionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Entry point for user actions: points, then streak, then achievements.
 * Each step commits on its own; a failing step surfaces to the caller and the later steps do not run.
 */
@Service
public class ActivityService {

    private static final Logger log = LoggerFactory.getLogger(ActivityService.class);

    private final PointsService pointsService;
    private final StreakService streakService;
    private final AchievementEvaluator achievementEvaluator;
    private final ReferralService referralService;
    private final ShareActionRepository shareRepository;
    private final Clock clock;

    public ActivityService(PointsService pointsService,
                           StreakService streakService,
                           AchievementEvaluator achievementEvaluator,
                           ReferralService referralService,
                           ShareActionRepository shareRepository,
                           Clock clock) {
        this.pointsService = pointsService;
        this.streakService = streakService;
        this.achievementEvaluator = achievementEvaluator;
        this.referralService = referralService;
        this.shareRepository = shareRepository;
        this.clock = clock;
    }

    public ActivityResultDTO onNoteUploaded(String userId) {
        ActivityResultDTO result = perform(userId, PointsActions.UPLOAD_NOTE);
        referralService.rewardForFirstUpload(userId);
        return result;
    }

    /**
     * The owner earns points for the download, the downloader gets the streak credit.
     */
    public ActivityResultDTO onNoteDownloaded(String downloaderId, String ownerId) {
        if (ownerId != null && !ownerId.equals(downloaderId)) {
            pointsService.awardPoints(ownerId, PointsActions.NOTE_DOWNLOADED);
            achievementEvaluator.checkAndUnlock(ownerId);
        }
        return perform(downloaderId, "download");
    }

    public ActivityResultDTO onNoteShared(String userId, String noteId, String platform) {
        if (noteId == null || noteId.isBlank()) {
            throw new ValidationException("noteId is required");
        }
        if (platform == null || platform.isBlank()) {
            throw new ValidationException("platform is required");
        }
        shareRepository.save(new ShareAction(null, userId, noteId, platform.trim().toLowerCase(Locale.ROOT),
                LocalDateTime.now(clock)));
        return perform(userId, PointsActions.SHARE_NOTE);
    }

    public ActivityResultDTO onLogin(String userId) {
        return perform(userId, "login");
    }

    public ActivityResultDTO onFollow(String followerId, String followingId) {
        if (followingId != null && !followingId.equals(followerId)) {
            // follower counts feed the followed user's achievements
            achievementEvaluator.checkAndUnlock(followingId);
        }
        return perform(followerId, "follow");
    }

    public ActivityResultDTO onGroupJoined(String userId) {
        return perform(userId, "join_group");
    }

    public ActivityResultDTO onGroupCreated(String userId) {
        return perform(userId, "create_group");
    }

    public ShareStatsDTO getShareStats(String userId) {
        Map<String, Long> breakdown = new TreeMap<>();
        for (Object[] row : shareRepository.countByPlatform(userId)) {
            breakdown.put((String) row[0], ((Number) row[1]).longValue());
        }
        return new ShareStatsDTO(shareRepository.countByUserId(userId), breakdown);
    }

    /**
     * Actions without a points entry award nothing and still count towards the streak.
     */
    private ActivityResultDTO perform(String userId, String action) {
        if (userId == null || userId.isBlank()) {
            throw new ValidationException("userId is required");
        }
        PointsAward award = pointsService.awardPoints(userId, action);
        int streak = streakService.recordActivity(userId);
        List<AchievementDefinition> unlocked = achievementEvaluator.checkAndUnlock(userId);

        // streak and achievement bonuses may have moved the total since the award
        PointsSummaryDTO points = pointsService.getPoints(userId);

        ActivityResultDTO result = new ActivityResultDTO();
        result.setAction(action);
        result.setPointsAwarded(award.getAwarded());
        result.setTotalPoints(points.getTotalPoints());
        result.setLevel(points.getLevel());
        result.setLevelName(points.getLevelName());
        result.setCurrentStreak(streak);
        for (AchievementDefinition definition : unlocked) {
            result.getNewAchievements().add(AchievementServiceImpl.toUserDTO(definition, LocalDateTime.now(clock)));
        }
        log.debug("Action {} by user {}: +{} points, streak {}, {} new achievement(s)",
                action, userId, award.getAwarded(), streak, unlocked.size());
        return result;
    }
}
