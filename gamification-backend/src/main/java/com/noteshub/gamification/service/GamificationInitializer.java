package com.noteshub.gamification.service;

import com.noteshub.gamification.dto.LevelInfo;
import com.noteshub.gamification.exception.DegradedModeWarning;
import com.noteshub.gamification.exception.ValidationException;
import com.noteshub.gamification.external.UserDirectory;
import com.noteshub.gamification.external.UserProfile;
import com.noteshub.gamification.repository.GamificationJdbcRepository;
import com.noteshub.gamification.util.ProgressBar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Creates zero-state gamification rows at registration and backfills them for existing users.
 * Failures here never block the caller: rows are created lazily on the first qualifying action anyway.
 */
@Service
public class GamificationInitializer {

    private static final Logger log = LoggerFactory.getLogger(GamificationInitializer.class);

    private final GamificationJdbcRepository jdbcRepository;
    private final ReferralService referralService;
    private final UserDirectory userDirectory;
    private final LevelCalculator levelCalculator;
    private final Clock clock;

    private final AtomicBoolean backfillRunning = new AtomicBoolean(false);

    public GamificationInitializer(GamificationJdbcRepository jdbcRepository,
                                   ReferralService referralService,
                                   UserDirectory userDirectory,
                                   LevelCalculator levelCalculator,
                                   Clock clock) {
        this.jdbcRepository = jdbcRepository;
        this.referralService = referralService;
        this.userDirectory = userDirectory;
        this.levelCalculator = levelCalculator;
        this.clock = clock;
    }

    /**
     * @return false when initialisation failed and the user continues in degraded mode
     */
    public boolean initializeUser(String userId) {
        try {
            LocalDateTime now = LocalDateTime.now(clock);
            LevelInfo base = levelCalculator.calculateLevel(0);
            jdbcRepository.insertPointsIfAbsent(userId, base.getLevel(), base.getLevelName(), now);
            jdbcRepository.insertEmptyStreakIfAbsent(userId, now);
            referralService.getOrCreateReferral(userId);
            return true;
        } catch (RuntimeException e) {
            DegradedModeWarning warning = new DegradedModeWarning(userId, e);
            log.warn(warning.getMessage(), warning);
            return false;
        }
    }

    /**
     * Initialises every user in the directory. Idempotent: existing rows are left alone.
     * @return number of users that failed to initialise
     */
    public int backfillAll() {
        if (!backfillRunning.compareAndSet(false, true)) {
            throw new ValidationException("A backfill is already running");
        }
        try {
            List<UserProfile> users = userDirectory.findAll();
            ProgressBar progressBar = new ProgressBar("gamification backfill", users.size(), 10, clock);
            int failures = 0;
            for (UserProfile user : users) {
                if (!initializeUser(user.getUserId())) {
                    failures++;
                }
                progressBar.step();
            }
            progressBar.complete();
            log.info("Backfill finished: {} users, {} failures", users.size(), failures);
            return failures;
        } finally {
            backfillRunning.set(false);
        }
    }
}
