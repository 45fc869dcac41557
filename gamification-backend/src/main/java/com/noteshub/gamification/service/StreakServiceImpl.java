package com.noteshub.gamification.service;

import com.noteshub.gamification.config.GamificationProperties;
import com.noteshub.gamification.dto.StreakDTO;
import com.noteshub.gamification.entity.UserStreak;
import com.noteshub.gamification.repository.GamificationJdbcRepository;
import com.noteshub.gamification.repository.UserStreakRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

/**
 * Day-granularity streak state machine.
 *
 * <ul>
 *   <li>no row, or a registration row without activity: streak starts at 1, daily_streak awarded</li>
 *   <li>same UTC day as the last activity: only total_activities moves</li>
 *   <li>the next UTC day: current + 1, longest follows, daily_streak awarded</li>
 *   <li>a gap of two days or more: current back to 1, no penalty</li>
 * </ul>
 * An activity stamped before the last activity day is treated as same-day.
 */
@Service
public class StreakServiceImpl implements StreakService {

    private static final Logger log = LoggerFactory.getLogger(StreakServiceImpl.class);

    static final List<Integer> MILESTONES = List.of(7, 30, 100, 365);

    private final UserStreakRepository streakRepository;
    private final GamificationJdbcRepository jdbcRepository;
    private final PointsService pointsService;
    private final GamificationProperties properties;
    private final Clock clock;

    public StreakServiceImpl(UserStreakRepository streakRepository,
                             GamificationJdbcRepository jdbcRepository,
                             PointsService pointsService,
                             GamificationProperties properties,
                             Clock clock) {
        this.streakRepository = streakRepository;
        this.jdbcRepository = jdbcRepository;
        this.pointsService = pointsService;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    @Transactional
    public int recordActivity(String userId) {
        return recordActivity(userId, clock.instant());
    }

    @Override
    @Transactional
    public int recordActivity(String userId, Instant now) {
        LocalDate today = LocalDate.ofInstant(now, ZoneOffset.UTC);
        LocalDateTime at = LocalDateTime.ofInstant(now, ZoneOffset.UTC);
        int attempts = Math.max(1, properties.getStreak().getMaxTransitionAttempts());

        for (int attempt = 1; attempt <= attempts; attempt++) {
            Optional<UserStreak> locked = streakRepository.findAndLockByUserId(userId);

            if (locked.isEmpty()) {
                if (jdbcRepository.insertStartedStreakIfAbsent(userId, today, at)) {
                    pointsService.awardPoints(userId, PointsActions.DAILY_STREAK);
                    log.debug("Streak started for user {}", userId);
                    return 1;
                }
                // a concurrent first activity created the row, read it again
                continue;
            }

            LocalDate last = locked.get().getLastActivityDate();
            boolean awardsPoints;
            int updated;
            if (last == null) {
                updated = streakRepository.begin(userId, today, at);
                awardsPoints = true;
            } else if (!today.isAfter(last)) {
                updated = streakRepository.touch(userId, last, at);
                awardsPoints = false;
            } else if (today.equals(last.plusDays(1))) {
                updated = streakRepository.extend(userId, last, today, at);
                awardsPoints = true;
            } else {
                updated = streakRepository.restart(userId, last, today, at);
                awardsPoints = false;
            }

            if (updated == 1) {
                UserStreak after = streakRepository.findById(userId)
                        .orElseThrow(() -> new IllegalStateException("Streak row vanished for user " + userId));
                checkInvariant(after);
                if (awardsPoints) {
                    pointsService.awardPoints(userId, PointsActions.DAILY_STREAK);
                }
                return after.getCurrentStreak();
            }
            log.debug("Streak transition for user {} lost a race (attempt {}/{})", userId, attempt, attempts);
        }
        throw new IllegalStateException("Streak update for user " + userId + " failed after " + attempts + " attempts");
    }

    @Override
    @Transactional(readOnly = true)
    public StreakDTO getStreak(String userId) {
        Optional<UserStreak> row = streakRepository.findById(userId);
        int current = row.map(UserStreak::getCurrentStreak).orElse(0);
        int longest = row.map(UserStreak::getLongestStreak).orElse(0);
        LocalDate lastDate = row.map(UserStreak::getLastActivityDate).orElse(null);
        long total = row.map(UserStreak::getTotalActivities).orElse(0L);

        int next = nextMilestone(current);
        return new StreakDTO(current, longest, lastDate, total, next, Math.max(0, next - current));
    }

    /**
     * First milestone above {@code current}; past the last one, the last one.
     */
    static int nextMilestone(int current) {
        for (Integer milestone : MILESTONES) {
            if (current < milestone) {
                return milestone;
            }
        }
        return MILESTONES.get(MILESTONES.size() - 1);
    }

    private static void checkInvariant(UserStreak streak) {
        if (streak.getLongestStreak() < streak.getCurrentStreak()) {
            throw new IllegalStateException("Streak invariant broken for user " + streak.getUserId()
                    + ": longest " + streak.getLongestStreak() + " < current " + streak.getCurrentStreak());
        }
    }
}
