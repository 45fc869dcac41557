package com.noteshub.gamification.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import com.noteshub.gamification.config.GamificationProperties;
import com.noteshub.gamification.dto.LeaderboardEntryDTO;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * In-process cache of built rankings, one entry per (scope, filter), bounded in size.
 * Advisory only: concurrent rebuilds of one key are allowed and the last write wins.
 */
@Component
public class LeaderboardCache {

    private final Cache<Key, Snapshot> entries;
    private final GamificationProperties properties;
    private final Clock clock;

    public LeaderboardCache(GamificationProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
        this.entries = Caffeine.newBuilder()
                .ticker(ticker(clock))
                .expireAfter(new ScopeExpiry())
                .maximumSize(properties.getLeaderboard().getCacheMaxEntries())
                // eviction and expiry run on the calling thread
                .executor(Runnable::run)
                .build();
    }

    /**
     * @return the snapshot if it is younger than the scope's TTL
     */
    public Optional<Snapshot> get(LeaderboardScope scope, String filter) {
        return Optional.ofNullable(entries.getIfPresent(new Key(scope, filter)));
    }

    /**
     * Stores copies of the entries, so later changes to the caller's objects do not reach the cache.
     */
    public Snapshot put(LeaderboardScope scope, String filter, List<LeaderboardEntryDTO> rankings) {
        Snapshot snapshot = new Snapshot(copyOf(rankings), clock.instant());
        entries.put(new Key(scope, filter), snapshot);
        return snapshot;
    }

    public void invalidateAll() {
        entries.invalidateAll();
        entries.cleanUp();
    }

    public int size() {
        entries.cleanUp();
        return (int) entries.estimatedSize();
    }

    Duration ttl(LeaderboardScope scope) {
        GamificationProperties.Leaderboard config = properties.getLeaderboard();
        return scope == LeaderboardScope.ALL_INDIA ? config.getAllIndiaTtl() : config.getScopedTtl();
    }

    static List<LeaderboardEntryDTO> copyOf(List<LeaderboardEntryDTO> rankings) {
        return rankings.stream()
                .map(entry -> entry.toBuilder().build())
                .collect(Collectors.toUnmodifiableList());
    }

    private static Ticker ticker(Clock clock) {
        return () -> {
            Instant now = clock.instant();
            return TimeUnit.SECONDS.toNanos(now.getEpochSecond()) + now.getNano();
        };
    }

    private class ScopeExpiry implements Expiry<Key, Snapshot> {

        @Override
        public long expireAfterCreate(Key key, Snapshot snapshot, long currentTime) {
            return ttl(key.getScope()).toNanos();
        }

        @Override
        public long expireAfterUpdate(Key key, Snapshot snapshot, long currentTime, long currentDuration) {
            return ttl(key.getScope()).toNanos();
        }

        @Override
        public long expireAfterRead(Key key, Snapshot snapshot, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }

    @Value
    static class Key {
        LeaderboardScope scope;
        String filter;
    }

    /**
     * Full ranking of a population, rank 1 first.
     */
    @Value
    public static class Snapshot {
        List<LeaderboardEntryDTO> rankings;
        Instant builtAt;
    }
}
