package com.noteshub.gamification.service;

import com.noteshub.gamification.achievement.AchievementCatalog;
import com.noteshub.gamification.achievement.AchievementDefinition;
import com.noteshub.gamification.achievement.StatsSnapshot;
import com.noteshub.gamification.entity.UserAchievement;
import com.noteshub.gamification.external.NotificationSink;
import com.noteshub.gamification.repository.GamificationJdbcRepository;
import com.noteshub.gamification.repository.UserAchievementRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Unlocks the catalog entries a user newly qualifies for.
 * Unlocks are insert-if-absent, so two concurrent checks pay out each achievement once.
 */
@Service
public class AchievementEvaluator {

    private static final Logger log = LoggerFactory.getLogger(AchievementEvaluator.class);

    private final AchievementCatalog catalog;
    private final StatsCollector statsCollector;
    private final UserAchievementRepository achievementRepository;
    private final GamificationJdbcRepository jdbcRepository;
    private final PointsService pointsService;
    private final NotificationSink notificationSink;
    private final Clock clock;

    public AchievementEvaluator(AchievementCatalog catalog,
                                StatsCollector statsCollector,
                                UserAchievementRepository achievementRepository,
                                GamificationJdbcRepository jdbcRepository,
                                PointsService pointsService,
                                NotificationSink notificationSink,
                                Clock clock) {
        this.catalog = catalog;
        this.statsCollector = statsCollector;
        this.achievementRepository = achievementRepository;
        this.jdbcRepository = jdbcRepository;
        this.pointsService = pointsService;
        this.notificationSink = notificationSink;
        this.clock = clock;
    }

    /**
     * Bonus points can raise the user's level and so qualify further entries; the catalog is
     * re-scanned with fresh statistics until a pass unlocks nothing.
     *
     * @return achievements unlocked by this call, empty when nothing new qualifies
     */
    @Transactional
    public List<AchievementDefinition> checkAndUnlock(String userId) {
        // collected first: a failed read leaves nothing unlocked
        StatsSnapshot stats = statsCollector.collect(userId);

        Set<String> unlockedIds = achievementRepository.findByUserIdOrderByUnlockedAtDesc(userId).stream()
                .map(UserAchievement::getAchievementId)
                .collect(Collectors.toSet());

        List<AchievementDefinition> newlyUnlocked = new ArrayList<>();
        LocalDateTime now = LocalDateTime.now(clock);

        // each productive pass unlocks at least one entry, so the catalog size bounds the passes
        for (int pass = 0; pass < catalog.size(); pass++) {
            List<AchievementDefinition> unlockedInPass = unlockPass(userId, stats, unlockedIds, now);
            if (unlockedInPass.isEmpty()) {
                break;
            }
            newlyUnlocked.addAll(unlockedInPass);
            stats = statsCollector.collect(userId);
        }

        if (!newlyUnlocked.isEmpty()) {
            log.info("User {} unlocked {} achievement(s): {}", userId, newlyUnlocked.size(),
                    newlyUnlocked.stream().map(AchievementDefinition::getId).collect(Collectors.joining(", ")));
        }
        return newlyUnlocked;
    }

    private List<AchievementDefinition> unlockPass(String userId, StatsSnapshot stats, Set<String> unlockedIds,
                                                   LocalDateTime now) {
        List<AchievementDefinition> unlocked = new ArrayList<>();
        for (AchievementDefinition definition : catalog.getAll()) {
            if (unlockedIds.contains(definition.getId()) || !definition.isSatisfiedBy(stats)) {
                continue;
            }
            // marked as seen either way so later passes skip it
            unlockedIds.add(definition.getId());
            if (!jdbcRepository.insertAchievementIfAbsent(userId, definition.getId(), now)) {
                // unlocked concurrently by another check
                continue;
            }
            pointsService.awardPoints(userId, PointsActions.ACHIEVEMENT_PREFIX + definition.getId(), definition.getPoints());
            notificationSink.enqueue(userId, "achievement_unlocked", payload(definition));
            unlocked.add(definition);
        }
        return unlocked;
    }

    private static Map<String, Object> payload(AchievementDefinition definition) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("achievement_id", definition.getId());
        payload.put("name", definition.getName());
        payload.put("icon", definition.getIcon());
        payload.put("rarity", definition.getRarity().getCode());
        payload.put("points", definition.getPoints());
        return payload;
    }
}
