package com.noteshub.gamification.achievement;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class CriteriaModeTest {

    private static final List<Criterion> UPLOADS_OR_SHARES =
            List.of(new AtLeast(StatKey.UPLOADS, 5), new AtLeast(StatKey.SHARES, 3));

    @Test
    void anySkipsStatisticsThatWereNotCollected() {
        StatsSnapshot sharesOnly = StatsSnapshot.builder().count(StatKey.SHARES, 3).build();
        StatsSnapshot nothing = StatsSnapshot.builder().build();

        assertThat(CriteriaMode.ANY.matches(UPLOADS_OR_SHARES, sharesOnly)).isTrue();
        assertThat(CriteriaMode.ANY.matches(UPLOADS_OR_SHARES, nothing)).isFalse();
    }

    @Test
    void allTreatsMissingStatisticAsUnsatisfied() {
        StatsSnapshot uploadsOnly = StatsSnapshot.builder().count(StatKey.UPLOADS, 100).build();
        StatsSnapshot both = StatsSnapshot.builder().count(StatKey.UPLOADS, 5).count(StatKey.SHARES, 3).build();

        assertThat(CriteriaMode.ALL.matches(UPLOADS_OR_SHARES, uploadsOnly)).isFalse();
        assertThat(CriteriaMode.ALL.matches(UPLOADS_OR_SHARES, both)).isTrue();
        assertThat(CriteriaMode.ALL.matches(List.of(), both)).isFalse();
    }

    @Test
    void exactlyComparesFlag() {
        Exactly notReferred = new Exactly(StatKey.REFERRED, false);

        assertThat(notReferred.isSatisfiedBy(StatsSnapshot.builder().flag(StatKey.REFERRED, false).build())).isTrue();
        assertThat(notReferred.isSatisfiedBy(StatsSnapshot.builder().flag(StatKey.REFERRED, true).build())).isFalse();
    }

    @Test
    void builderRejectsWrongKind() {
        assertThatThrownBy(() -> StatsSnapshot.builder().count(StatKey.REFERRED, 1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> StatsSnapshot.builder().flag(StatKey.UPLOADS, true))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void definitionWithoutCriteriaIsRejected() {
        assertThatThrownBy(() -> new AchievementDefinition("empty", "Empty", "", AchievementCategory.SPECIAL, "",
                List.of(), CriteriaMode.ANY, Rarity.COMMON, 1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void snapshotMapUsesStatNames() {
        StatsSnapshot stats = StatsSnapshot.builder().count(StatKey.UPLOADS, 2).flag(StatKey.REFERRED, true).build();

        assertThat(stats.asMap()).containsEntry("uploads", 2L).containsEntry("referred", true).hasSize(2);
    }
}
