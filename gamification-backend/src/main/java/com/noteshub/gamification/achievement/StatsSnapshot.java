package com.noteshub.gamification.achievement;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Point-in-time statistics of one user. Immutable once built.
 */
public final class StatsSnapshot {

    private final Map<StatKey, Long> counts;
    private final Map<StatKey, Boolean> flags;

    private StatsSnapshot(Map<StatKey, Long> counts, Map<StatKey, Boolean> flags) {
        this.counts = Collections.unmodifiableMap(counts);
        this.flags = Collections.unmodifiableMap(flags);
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean has(StatKey key) {
        return counts.containsKey(key) || flags.containsKey(key);
    }

    /**
     * @return the count, 0 when the statistic was not collected
     */
    public long getCount(StatKey key) {
        return counts.getOrDefault(key, 0L);
    }

    public boolean getFlag(StatKey key) {
        return flags.getOrDefault(key, Boolean.FALSE);
    }

    /**
     * Flat view keyed by stat name, in {@link StatKey} order.
     */
    public Map<String, Object> asMap() {
        Map<String, Object> view = new LinkedHashMap<>();
        for (StatKey key : StatKey.values()) {
            if (counts.containsKey(key)) {
                view.put(key.getStatName(), counts.get(key));
            } else if (flags.containsKey(key)) {
                view.put(key.getStatName(), flags.get(key));
            }
        }
        return view;
    }

    public static final class Builder {
        private final Map<StatKey, Long> counts = new EnumMap<>(StatKey.class);
        private final Map<StatKey, Boolean> flags = new EnumMap<>(StatKey.class);

        private Builder() {
        }

        public Builder count(StatKey key, long value) {
            if (key.getKind() != StatKey.Kind.COUNT) {
                throw new IllegalArgumentException(key + " is not a count");
            }
            counts.put(key, value);
            return this;
        }

        public Builder flag(StatKey key, boolean value) {
            if (key.getKind() != StatKey.Kind.FLAG) {
                throw new IllegalArgumentException(key + " is not a flag");
            }
            flags.put(key, value);
            return this;
        }

        public StatsSnapshot build() {
            return new StatsSnapshot(new EnumMap<>(counts), new EnumMap<>(flags));
        }
    }
}
