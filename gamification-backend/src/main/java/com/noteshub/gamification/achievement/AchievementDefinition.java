package com.noteshub.gamification.achievement;

import lombok.Value;

import java.util.List;

/**
 * Immutable catalog entry. Bonus {@code points} are awarded once, on unlock.
 */
@Value
public class AchievementDefinition {

    String id;
    String name;
    String description;
    AchievementCategory category;
    String icon;
    List<Criterion> criteria;
    CriteriaMode mode;
    Rarity rarity;
    int points;

    public AchievementDefinition(String id, String name, String description, AchievementCategory category,
                                 String icon, List<Criterion> criteria, CriteriaMode mode,
                                 Rarity rarity, int points) {
        if (criteria == null || criteria.isEmpty()) {
            throw new IllegalArgumentException("Achievement " + id + " has no criteria");
        }
        this.id = id;
        this.name = name;
        this.description = description;
        this.category = category;
        this.icon = icon;
        this.criteria = List.copyOf(criteria);
        this.mode = mode;
        this.rarity = rarity;
        this.points = points;
    }

    public boolean isSatisfiedBy(StatsSnapshot stats) {
        return mode.matches(criteria, stats);
    }
}
