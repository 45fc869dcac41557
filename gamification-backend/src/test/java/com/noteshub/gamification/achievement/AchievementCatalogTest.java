package com.noteshub.gamification.achievement;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

public class AchievementCatalogTest {

    private final AchievementCatalog catalog = new AchievementCatalog();

    @Test
    void idsAreUniqueAndEveryEntryIsComplete() {
        Set<String> ids = new HashSet<>();
        for (AchievementDefinition definition : catalog.getAll()) {
            assertThat(ids.add(definition.getId())).as("duplicate %s", definition.getId()).isTrue();
            assertThat(definition.getCriteria()).isNotEmpty();
            assertThat(definition.getPoints()).isPositive();
            assertThat(definition.getName()).isNotBlank();
        }
        assertThat(catalog.size()).isEqualTo(55);
    }

    @Test
    void weekWarriorNeedsSevenDayStreak() {
        AchievementDefinition weekWarrior = catalog.findById("week_warrior").orElseThrow();

        assertThat(weekWarrior.getCategory()).isEqualTo(AchievementCategory.STREAK);
        assertThat(weekWarrior.getRarity()).isEqualTo(Rarity.COMMON);
        assertThat(weekWarrior.getPoints()).isEqualTo(100);
        assertThat(weekWarrior.isSatisfiedBy(StatsSnapshot.builder().count(StatKey.STREAK, 6).build())).isFalse();
        assertThat(weekWarrior.isSatisfiedBy(StatsSnapshot.builder().count(StatKey.STREAK, 7).build())).isTrue();
    }

    @Test
    void welcomeAboardUnlocksOnReferredFlag() {
        AchievementDefinition welcome = catalog.findById("welcome_aboard").orElseThrow();

        assertThat(welcome.isSatisfiedBy(StatsSnapshot.builder().flag(StatKey.REFERRED, false).build())).isFalse();
        assertThat(welcome.isSatisfiedBy(StatsSnapshot.builder().flag(StatKey.REFERRED, true).build())).isTrue();
    }

    @Test
    void allRounderNeedsAnyOneCriterion() {
        AchievementDefinition allRounder = catalog.findById("all_rounder").orElseThrow();

        assertThat(allRounder.getMode()).isEqualTo(CriteriaMode.ANY);
        assertThat(allRounder.isSatisfiedBy(StatsSnapshot.builder()
                .count(StatKey.UPLOADS, 0).count(StatKey.SHARES, 10).build())).isTrue();
        assertThat(allRounder.isSatisfiedBy(StatsSnapshot.builder()
                .count(StatKey.UPLOADS, 4).count(StatKey.DOWNLOADS, 24).count(StatKey.SHARES, 9).build())).isFalse();
    }

    @Test
    void communityPillarNeedsEveryCriterion() {
        AchievementDefinition pillar = catalog.findById("community_pillar").orElseThrow();
        StatsSnapshot almost = StatsSnapshot.builder()
                .count(StatKey.UPLOADS, 30).count(StatKey.FOLLOWERS, 40).count(StatKey.GROUPS_CREATED, 0).build();
        StatsSnapshot complete = StatsSnapshot.builder()
                .count(StatKey.UPLOADS, 25).count(StatKey.FOLLOWERS, 25).count(StatKey.GROUPS_CREATED, 1).build();

        assertThat(pillar.isSatisfiedBy(almost)).isFalse();
        assertThat(pillar.isSatisfiedBy(complete)).isTrue();
    }

    @Test
    void unknownIdIsEmpty() {
        assertThat(catalog.findById("no_such_badge")).isEmpty();
    }
}
