package com.noteshub.gamification.achievement;

/**
 * One condition of an achievement. Implemented by {@link AtLeast} and {@link Exactly} only.
 */
public interface Criterion {

    StatKey getStat();

    /**
     * Evaluated only when the snapshot carries {@link #getStat()}.
     */
    boolean isSatisfiedBy(StatsSnapshot stats);
}
