package com.noteshub.gamification.service;

import com.noteshub.gamification.achievement.AchievementCatalog;
import com.noteshub.gamification.achievement.AchievementDefinition;
import com.noteshub.gamification.achievement.AtLeast;
import com.noteshub.gamification.achievement.Criterion;
import com.noteshub.gamification.achievement.Rarity;
import com.noteshub.gamification.achievement.StatsSnapshot;
import com.noteshub.gamification.dto.AchievementCategoryDTO;
import com.noteshub.gamification.dto.AchievementCheckDTO;
import com.noteshub.gamification.dto.AchievementDTO;
import com.noteshub.gamification.dto.AchievementProgressDTO;
import com.noteshub.gamification.dto.AchievementStatsDTO;
import com.noteshub.gamification.dto.UserAchievementDTO;
import com.noteshub.gamification.entity.UserAchievement;
import com.noteshub.gamification.external.UserDirectory;
import com.noteshub.gamification.repository.UserAchievementRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Service
@Transactional(readOnly = true)
public class AchievementServiceImpl implements AchievementService {

    private final AchievementCatalog catalog;
    private final UserAchievementRepository achievementRepository;
    private final UserDirectory userDirectory;
    private final StatsCollector statsCollector;
    private final AchievementEvaluator evaluator;

    public AchievementServiceImpl(AchievementCatalog catalog,
                                  UserAchievementRepository achievementRepository,
                                  UserDirectory userDirectory,
                                  StatsCollector statsCollector,
                                  AchievementEvaluator evaluator) {
        this.catalog = catalog;
        this.achievementRepository = achievementRepository;
        this.userDirectory = userDirectory;
        this.statsCollector = statsCollector;
        this.evaluator = evaluator;
    }

    /**
     * One DTO per catalog entry with its platform-wide unlock count; completion rate is relative to all users.
     */
    private List<AchievementDTO> buildAllAchievementDTOs() {
        long totalUsers = userDirectory.countAll();
        final double finalTotalUsers = (totalUsers == 0) ? 1.0 : (double) totalUsers;

        // [achievement_id, count]
        Map<String, Integer> achievedCounts = new HashMap<>();
        for (Object[] row : achievementRepository.countUsersPerAchievement()) {
            achievedCounts.put((String) row[0], ((Number) row[1]).intValue());
        }

        List<AchievementDTO> result = new ArrayList<>();
        for (AchievementDefinition definition : catalog.getAll()) {
            AchievementDTO dto = new AchievementDTO();
            dto.setAchievementKey(definition.getId());
            dto.setName(definition.getName());
            dto.setDescription(definition.getDescription());
            dto.setCategory(definition.getCategory().getCode());
            dto.setIcon(definition.getIcon());
            dto.setRarity(definition.getRarity().getCode());
            dto.setPoints(definition.getPoints());

            int achievedCount = achievedCounts.getOrDefault(definition.getId(), 0);
            dto.setAchievedCount(achievedCount);
            dto.setCompletionRate(achievedCount / finalTotalUsers);
            dto.setRank(null);
            result.add(dto);
        }
        return result;
    }

    @Override
    public List<AchievementDTO> getAchievementList() {
        return buildAllAchievementDTOs();
    }

    @Override
    public List<AchievementDTO> getAchievementRanking(Integer count, String sortOrder) {
        List<AchievementDTO> allAchievements = buildAllAchievementDTOs();

        final int finalCount = (count == null || count < 1) ? 1 : count;

        // default "desc": most achieved first; catalog order among equals
        Comparator<AchievementDTO> comparator = Comparator.comparing(AchievementDTO::getAchievedCount);
        if (sortOrder == null || sortOrder.equalsIgnoreCase("desc")) {
            comparator = comparator.reversed();
        }

        List<AchievementDTO> rankedList = allAchievements.stream()
                .sorted(comparator)
                .collect(Collectors.toList());

        List<AchievementDTO> subList = rankedList.size() > finalCount
                ? rankedList.subList(0, finalCount)
                : rankedList;

        for (int i = 0; i < subList.size(); i++) {
            subList.get(i).setRank(i + 1);
        }
        return subList;
    }

    @Override
    public List<UserAchievementDTO> getAllWithStatus(String userId) {
        Map<String, LocalDateTime> unlocked = unlockedAt(userId);
        List<UserAchievementDTO> result = new ArrayList<>();
        for (AchievementDefinition definition : catalog.getAll()) {
            result.add(toUserDTO(definition, unlocked.get(definition.getId())));
        }
        return result;
    }

    @Override
    public List<UserAchievementDTO> getUnlocked(String userId) {
        List<UserAchievementDTO> result = new ArrayList<>();
        // newest first, from the repository ordering
        for (UserAchievement row : achievementRepository.findByUserIdOrderByUnlockedAtDesc(userId)) {
            catalog.findById(row.getAchievementId())
                    .ifPresent(definition -> result.add(toUserDTO(definition, row.getUnlockedAt())));
        }
        return result;
    }

    /**
     * Progress towards each locked achievement, measured on its first minimum criterion.
     * Achievements with only boolean criteria are left out.
     */
    @Override
    public List<AchievementProgressDTO> getProgress(String userId) {
        StatsSnapshot stats = statsCollector.collect(userId);
        Map<String, LocalDateTime> unlocked = unlockedAt(userId);

        List<AchievementProgressDTO> result = new ArrayList<>();
        for (AchievementDefinition definition : catalog.getAll()) {
            if (unlocked.containsKey(definition.getId())) {
                continue;
            }
            for (Criterion criterion : definition.getCriteria()) {
                if (criterion instanceof AtLeast && stats.has(criterion.getStat())) {
                    AtLeast atLeast = (AtLeast) criterion;
                    long current = stats.getCount(atLeast.getStat());
                    result.add(new AchievementProgressDTO(definition.getId(), definition.getName(),
                            atLeast.getStat().getStatName(), current, atLeast.getMinimum(),
                            percentage(current, atLeast.getMinimum())));
                    break;
                }
            }
        }
        return result;
    }

    @Override
    public List<AchievementCategoryDTO> getCategories(String userId) {
        Map<String, LocalDateTime> unlocked = unlockedAt(userId);
        Map<String, AchievementCategoryDTO> byCategory = new LinkedHashMap<>();

        for (AchievementDefinition definition : catalog.getAll()) {
            String code = definition.getCategory().getCode();
            AchievementCategoryDTO group = byCategory.computeIfAbsent(code, c -> {
                AchievementCategoryDTO dto = new AchievementCategoryDTO();
                dto.setCategory(c);
                return dto;
            });
            LocalDateTime at = unlocked.get(definition.getId());
            group.setTotal(group.getTotal() + 1);
            if (at != null) {
                group.setUnlocked(group.getUnlocked() + 1);
            }
            group.getAchievements().add(toUserDTO(definition, at));
        }
        return new ArrayList<>(byCategory.values());
    }

    @Override
    public AchievementStatsDTO getStats(String userId) {
        Map<String, LocalDateTime> unlocked = unlockedAt(userId);

        Map<String, Integer> rarityBreakdown = new LinkedHashMap<>();
        for (Rarity rarity : Rarity.values()) {
            rarityBreakdown.put(rarity.getCode(), 0);
        }
        int unlockedCount = 0;
        long points = 0;
        for (AchievementDefinition definition : catalog.getAll()) {
            if (unlocked.containsKey(definition.getId())) {
                unlockedCount++;
                points += definition.getPoints();
                rarityBreakdown.merge(definition.getRarity().getCode(), 1, Integer::sum);
            }
        }

        int total = catalog.size();
        AchievementStatsDTO dto = new AchievementStatsDTO();
        dto.setTotalAchievements(total);
        dto.setUnlocked(unlockedCount);
        dto.setLocked(total - unlockedCount);
        dto.setCompletionPercentage(percentage(unlockedCount, total));
        dto.setRarityBreakdown(rarityBreakdown);
        dto.setPointsFromAchievements(points);
        return dto;
    }

    @Override
    @Transactional
    public AchievementCheckDTO check(String userId) {
        List<UserAchievementDTO> newlyUnlocked = new ArrayList<>();
        for (AchievementDefinition definition : evaluator.checkAndUnlock(userId)) {
            newlyUnlocked.add(toUserDTO(definition, null));
        }
        // unlock time is what was just written
        Map<String, LocalDateTime> unlocked = unlockedAt(userId);
        newlyUnlocked.forEach(dto -> {
            dto.setUnlocked(true);
            dto.setUnlockedAt(unlocked.get(dto.getId()));
        });
        return new AchievementCheckDTO(newlyUnlocked, newlyUnlocked.size());
    }

    private Map<String, LocalDateTime> unlockedAt(String userId) {
        Map<String, LocalDateTime> result = new HashMap<>();
        for (UserAchievement row : achievementRepository.findByUserIdOrderByUnlockedAtDesc(userId)) {
            result.put(row.getAchievementId(), row.getUnlockedAt());
        }
        return result;
    }

    static UserAchievementDTO toUserDTO(AchievementDefinition definition, LocalDateTime unlockedAt) {
        UserAchievementDTO dto = new UserAchievementDTO();
        dto.setId(definition.getId());
        dto.setName(definition.getName());
        dto.setDescription(definition.getDescription());
        dto.setCategory(definition.getCategory().getCode());
        dto.setIcon(definition.getIcon());
        dto.setRarity(definition.getRarity().getCode());
        dto.setPoints(definition.getPoints());
        dto.setUnlocked(unlockedAt != null);
        dto.setUnlockedAt(unlockedAt);
        return dto;
    }

    /**
     * current / required as a percentage capped at 100, one decimal.
     */
    static double percentage(long current, long required) {
        if (required <= 0) {
            return 100.0;
        }
        BigDecimal value = BigDecimal.valueOf(current)
                .multiply(BigDecimal.valueOf(100))
                .divide(BigDecimal.valueOf(required), 1, RoundingMode.HALF_UP);
        return Math.min(value.doubleValue(), 100.0);
    }
}
