package com.noteshub.gamification.service;

import com.noteshub.gamification.dto.AchievementCategoryDTO;
import com.noteshub.gamification.dto.AchievementCheckDTO;
import com.noteshub.gamification.dto.AchievementDTO;
import com.noteshub.gamification.dto.AchievementProgressDTO;
import com.noteshub.gamification.dto.AchievementStatsDTO;
import com.noteshub.gamification.dto.UserAchievementDTO;

import java.util.List;

public interface AchievementService {

    // platform-wide statistics
    List<AchievementDTO> getAchievementList();
    List<AchievementDTO> getAchievementRanking(Integer count, String sortOrder);

    // per user
    List<UserAchievementDTO> getAllWithStatus(String userId);
    List<UserAchievementDTO> getUnlocked(String userId);
    List<AchievementProgressDTO> getProgress(String userId);
    List<AchievementCategoryDTO> getCategories(String userId);
    AchievementStatsDTO getStats(String userId);
    AchievementCheckDTO check(String userId);
}
