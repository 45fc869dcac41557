package com.noteshub.gamification.achievement;

import lombok.Value;

/**
 * Integer minimum: stat >= minimum.
 */
@Value
public class AtLeast implements Criterion {

    StatKey stat;
    long minimum;

    public AtLeast(StatKey stat, long minimum) {
        if (stat.getKind() != StatKey.Kind.COUNT) {
            throw new IllegalArgumentException(stat + " cannot take a minimum");
        }
        this.stat = stat;
        this.minimum = minimum;
    }

    @Override
    public boolean isSatisfiedBy(StatsSnapshot stats) {
        return stats.getCount(stat) >= minimum;
    }
}
