package com.noteshub.gamification.achievement;

import lombok.Value;

/**
 * Boolean exact match: stat == expected.
 */
@Value
public class Exactly implements Criterion {

    StatKey stat;
    boolean expected;

    public Exactly(StatKey stat, boolean expected) {
        if (stat.getKind() != StatKey.Kind.FLAG) {
            throw new IllegalArgumentException(stat + " is not a flag");
        }
        this.stat = stat;
        this.expected = expected;
    }

    @Override
    public boolean isSatisfiedBy(StatsSnapshot stats) {
        return stats.getFlag(stat) == expected;
    }
}
