package com.noteshub.gamification.achievement;

import java.util.List;

/**
 * How the criteria of one achievement combine.
 */
public enum CriteriaMode {

    /**
     * Unlocks on the first criterion whose statistic is present and satisfied.
     */
    ANY {
        @Override
        public boolean matches(List<Criterion> criteria, StatsSnapshot stats) {
            for (Criterion criterion : criteria) {
                if (stats.has(criterion.getStat()) && criterion.isSatisfiedBy(stats)) {
                    return true;
                }
            }
            return false;
        }
    },

    /**
     * Every criterion must be present and satisfied.
     */
    ALL {
        @Override
        public boolean matches(List<Criterion> criteria, StatsSnapshot stats) {
            if (criteria.isEmpty()) {
                return false;
            }
            for (Criterion criterion : criteria) {
                if (!stats.has(criterion.getStat()) || !criterion.isSatisfiedBy(stats)) {
                    return false;
                }
            }
            return true;
        }
    };

    public abstract boolean matches(List<Criterion> criteria, StatsSnapshot stats);
}
