package com.noteshub.gamification.repository;

import com.noteshub.gamification.entity.UserAchievement;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface UserAchievementRepository extends JpaRepository<UserAchievement, Long> {

    List<UserAchievement> findByUserIdOrderByUnlockedAtDesc(String userId);

    boolean existsByUserIdAndAchievementId(String userId, String achievementId);

    long countByUserId(String userId);

    /**
     * Platform-wide unlock counts: [achievement_id, count of distinct users]
     */
    @Query("SELECT a.achievementId, COUNT(DISTINCT a.userId) FROM UserAchievement a GROUP BY a.achievementId")
    List<Object[]> countUsersPerAchievement();
}
