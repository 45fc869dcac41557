package com.noteshub.gamification.repository;

import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Insert-if-absent writes backed by the unique keys of the gamification tables.
 * Plain JDBC on purpose: a duplicate key here is an expected outcome and must not mark the
 * surrounding JPA transaction rollback-only.
 */
@Repository
public class GamificationJdbcRepository {

    private final JdbcTemplate jdbcTemplate;

    public GamificationJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * @return true if the row was created by this call
     */
    public boolean insertPointsIfAbsent(String userId, int level, String levelName, LocalDateTime now) {
        return insertIfAbsent(
                "INSERT INTO user_points (user_id, total_points, level, level_name, created_at, updated_at) VALUES (?, 0, ?, ?, ?, ?)",
                userId, level, levelName, now, now);
    }

    /**
     * Zero-state streak: no activity recorded yet.
     */
    public boolean insertEmptyStreakIfAbsent(String userId, LocalDateTime now) {
        return insertIfAbsent(
                "INSERT INTO user_streak (user_id, current_streak, longest_streak, last_activity_date, last_activity_at, total_activities, created_at) " +
                "VALUES (?, 0, 0, NULL, NULL, 0, ?)",
                userId, now);
    }

    /**
     * Streak row for a user whose first activity is happening right now.
     */
    public boolean insertStartedStreakIfAbsent(String userId, LocalDate today, LocalDateTime now) {
        return insertIfAbsent(
                "INSERT INTO user_streak (user_id, current_streak, longest_streak, last_activity_date, last_activity_at, total_activities, created_at) " +
                "VALUES (?, 1, 1, ?, ?, 1, ?)",
                userId, today, now, now);
    }

    public boolean insertAchievementIfAbsent(String userId, String achievementId, LocalDateTime unlockedAt) {
        return insertIfAbsent(
                "INSERT INTO user_achievement (user_id, achievement_id, unlocked_at) VALUES (?, ?, ?)",
                userId, achievementId, unlockedAt);
    }

    public boolean insertMilestoneClaimIfAbsent(String userId, String milestoneType, int threshold,
                                                int rewardPoints, LocalDateTime claimedAt) {
        return insertIfAbsent(
                "INSERT INTO milestone_claim (user_id, milestone_type, threshold, reward_points, claimed_at) VALUES (?, ?, ?, ?, ?)",
                userId, milestoneType, threshold, rewardPoints, claimedAt);
    }

    /**
     * Unlike the other inserts the caller has to tell a taken user id from a taken code,
     * so the duplicate key is rethrown.
     * @throws DuplicateKeyException if the user already has a row or the code is taken
     */
    public void insertReferral(String userId, String referralCode, LocalDateTime now) {
        jdbcTemplate.update(
                "INSERT INTO user_referral (user_id, referral_code, referred_by, total_referrals, bonus_downloads, " +
                "ai_access_days, premium_days, first_upload_reward_claimed, created_at) VALUES (?, ?, NULL, 0, 0, 0, 0, FALSE, ?)",
                userId, referralCode, now);
    }

    private boolean insertIfAbsent(String sql, Object... args) {
        try {
            return jdbcTemplate.update(sql, args) == 1;
        } catch (DuplicateKeyException e) {
            return false;
        }
    }
}
