package com.noteshub.gamification.service;

import com.noteshub.gamification.dto.LevelInfo;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Pure level-from-points function over a fixed threshold table.
 *
 * Level      Name      Minimum points
 *   1        Newbie          0
 *   5        Helper      2 500
 *  10        Expert     10 000
 *  20        Master     50 000
 *  30        Champion  100 000
 *  40        Elite     200 000
 *  50        Legend    500 000
 */
@Component
public class LevelCalculator {

    private static final List<Tier> TIERS = List.of(
            new Tier(1, "Newbie", 0),
            new Tier(5, "Helper", 2_500),
            new Tier(10, "Expert", 10_000),
            new Tier(20, "Master", 50_000),
            new Tier(30, "Champion", 100_000),
            new Tier(40, "Elite", 200_000),
            new Tier(50, "Legend", 500_000)
    );

    private static final int SCALE = 2;
    private static final RoundingMode MODE = RoundingMode.HALF_UP;

    /**
     * @param points total points, negative values are treated as 0
     */
    public LevelInfo calculateLevel(long points) {
        long clamped = Math.max(0, points);

        int index = 0;
        for (int i = 0; i < TIERS.size(); i++) {
            if (TIERS.get(i).minPoints <= clamped) {
                index = i;
            }
        }
        Tier current = TIERS.get(index);

        if (index == TIERS.size() - 1) {
            return new LevelInfo(current.level, current.name, 0, 100.0);
        }

        Tier next = TIERS.get(index + 1);
        long span = next.minPoints - current.minPoints;
        long gained = clamped - current.minPoints;
        double progress = BigDecimal.valueOf(gained)
                .multiply(BigDecimal.valueOf(100))
                .divide(BigDecimal.valueOf(span), SCALE, MODE)
                .doubleValue();

        return new LevelInfo(current.level, current.name, next.minPoints - clamped, progress);
    }

    public int maxLevel() {
        return TIERS.get(TIERS.size() - 1).level;
    }

    private static final class Tier {
        private final int level;
        private final String name;
        private final long minPoints;

        private Tier(int level, String name, long minPoints) {
            this.level = level;
            this.name = name;
            this.minPoints = minPoints;
        }
    }
}
