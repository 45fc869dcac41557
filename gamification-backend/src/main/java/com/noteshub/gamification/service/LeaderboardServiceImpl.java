package com.noteshub.gamification.service;

import com.noteshub.gamification.config.GamificationProperties;
import com.noteshub.gamification.dto.LeaderboardDTO;
import com.noteshub.gamification.dto.LeaderboardEntryDTO;
import com.noteshub.gamification.entity.UserPoints;
import com.noteshub.gamification.entity.UserStreak;
import com.noteshub.gamification.exception.ValidationException;
import com.noteshub.gamification.external.NoteStore;
import com.noteshub.gamification.external.UserDirectory;
import com.noteshub.gamification.external.UserProfile;
import com.noteshub.gamification.repository.UserPointsRepository;
import com.noteshub.gamification.repository.UserStreakRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * score = totalPoints + uploads x 100 + downloads received x 5 + current streak x 10
 */
@Service
public class LeaderboardServiceImpl implements LeaderboardService {

    private static final Logger log = LoggerFactory.getLogger(LeaderboardServiceImpl.class);

    static final long UPLOAD_WEIGHT = 100;
    static final long DOWNLOAD_WEIGHT = 5;
    static final long STREAK_WEIGHT = 10;

    private final UserDirectory userDirectory;
    private final NoteStore noteStore;
    private final UserPointsRepository pointsRepository;
    private final UserStreakRepository streakRepository;
    private final LevelCalculator levelCalculator;
    private final LeaderboardCache cache;
    private final GamificationProperties properties;

    public LeaderboardServiceImpl(UserDirectory userDirectory,
                                  NoteStore noteStore,
                                  UserPointsRepository pointsRepository,
                                  UserStreakRepository streakRepository,
                                  LevelCalculator levelCalculator,
                                  LeaderboardCache cache,
                                  GamificationProperties properties) {
        this.userDirectory = userDirectory;
        this.noteStore = noteStore;
        this.pointsRepository = pointsRepository;
        this.streakRepository = streakRepository;
        this.levelCalculator = levelCalculator;
        this.cache = cache;
        this.properties = properties;
    }

    static long score(long totalPoints, long uploads, long downloadsReceived, int currentStreak) {
        return totalPoints + uploads * UPLOAD_WEIGHT + downloadsReceived * DOWNLOAD_WEIGHT + currentStreak * STREAK_WEIGHT;
    }

    @Override
    @Transactional(readOnly = true)
    public List<LeaderboardEntryDTO> buildLeaderboard(LeaderboardScope scope, String filter) {
        long start = System.currentTimeMillis();
        List<UserProfile> users = population(scope, filter);
        if (users.isEmpty()) {
            return new ArrayList<>();
        }
        List<String> userIds = users.stream().map(UserProfile::getUserId).collect(Collectors.toList());

        // one query per field for the whole population
        Map<String, UserPoints> points = pointsRepository.findAllById(userIds).stream()
                .collect(Collectors.toMap(UserPoints::getUserId, p -> p));
        Map<String, UserStreak> streaks = streakRepository.findAllById(userIds).stream()
                .collect(Collectors.toMap(UserStreak::getUserId, s -> s));
        Map<String, Long> uploads = noteStore.countApprovedUploadsByUser(userIds);
        Map<String, Long> downloads = noteStore.sumDownloadCountByUser(userIds);

        List<LeaderboardEntryDTO> entries = new ArrayList<>(users.size());
        for (UserProfile user : users) {
            String userId = user.getUserId();
            UserPoints userPoints = points.get(userId);
            UserStreak streak = streaks.get(userId);
            long total = userPoints == null ? 0 : userPoints.getTotalPoints();
            int currentStreak = streak == null ? 0 : streak.getCurrentStreak();

            LeaderboardEntryDTO entry = new LeaderboardEntryDTO();
            entry.setUserId(userId);
            entry.setHandle(user.getHandle());
            entry.setCollege(user.getCollege());
            entry.setDepartment(user.getDepartment());
            entry.setProfilePicture(user.getProfilePicture());
            entry.setStreak(currentStreak);
            entry.setLevel(levelCalculator.calculateLevel(total).getLevel());
            entry.setScore(score(total, uploads.getOrDefault(userId, 0L), downloads.getOrDefault(userId, 0L), currentStreak));
            entries.add(entry);
        }

        entries.sort(Comparator.comparingLong(LeaderboardEntryDTO::getScore).reversed()
                .thenComparing(LeaderboardEntryDTO::getUserId));
        for (int i = 0; i < entries.size(); i++) {
            entries.get(i).setRank(i + 1);
        }

        log.debug("Built {} leaderboard{} with {} users in {} ms", scope.getCode(),
                filter == null ? "" : " for " + filter, entries.size(), System.currentTimeMillis() - start);
        return entries;
    }

    @Override
    public LeaderboardDTO getLeaderboard(LeaderboardScope scope, String filter, Integer limit, String requesterId) {
        int resolvedLimit = resolveLimit(scope, limit);
        String resolvedFilter = resolveFilter(scope, filter, requesterId);

        LeaderboardCache.Snapshot snapshot = cache.get(scope, resolvedFilter)
                .orElseGet(() -> cache.put(scope, resolvedFilter, buildLeaderboard(scope, resolvedFilter)));

        List<LeaderboardEntryDTO> all = snapshot.getRankings();
        // copies, so callers cannot edit the cached entries
        List<LeaderboardEntryDTO> top = new ArrayList<>(
                LeaderboardCache.copyOf(all.subList(0, Math.min(resolvedLimit, all.size()))));

        Integer requesterRank = null;
        if (requesterId != null) {
            requesterRank = all.stream()
                    .filter(e -> requesterId.equals(e.getUserId()))
                    .map(LeaderboardEntryDTO::getRank)
                    .findFirst()
                    // not part of this population
                    .orElseGet(() -> (int) userDirectory.countAll() + 1);
        }

        return new LeaderboardDTO(scope.getCode(), resolvedFilter, top, requesterRank, all.size(),
                LocalDateTime.ofInstant(snapshot.getBuiltAt(), ZoneOffset.UTC));
    }

    @Override
    public void refresh() {
        int dropped = cache.size();
        cache.invalidateAll();
        log.info("Leaderboard caches cleared ({} entries)", dropped);
    }

    private List<UserProfile> population(LeaderboardScope scope, String filter) {
        switch (scope) {
            case COLLEGE:
                return userDirectory.findByCollege(filter);
            case DEPARTMENT:
                return userDirectory.findByDepartment(filter);
            default:
                return userDirectory.findAll();
        }
    }

    private int resolveLimit(LeaderboardScope scope, Integer limit) {
        GamificationProperties.Leaderboard config = properties.getLeaderboard();
        if (limit == null) {
            return config.getDefaultLimit();
        }
        int max = scope == LeaderboardScope.ALL_INDIA ? config.getMaxLimit() : config.getMaxScopedLimit();
        if (limit < 1 || limit > max) {
            throw new ValidationException("limit must be between 1 and " + max);
        }
        return limit;
    }

    private String resolveFilter(LeaderboardScope scope, String filter, String requesterId) {
        if (scope == LeaderboardScope.ALL_INDIA) {
            return null;
        }
        if (filter != null && !filter.isBlank()) {
            return filter;
        }
        String fallback = null;
        if (requesterId != null) {
            fallback = userDirectory.getUser(requesterId)
                    .map(u -> scope == LeaderboardScope.COLLEGE ? u.getCollege() : u.getDepartment())
                    .orElse(null);
        }
        if (fallback == null || fallback.isBlank()) {
            throw new ValidationException(scope == LeaderboardScope.COLLEGE
                    ? "College not specified and user has no college set"
                    : "Department not specified and user has no department set");
        }
        return fallback;
    }
}
