package com.noteshub.gamification.service;

import com.noteshub.gamification.achievement.StatKey;
import com.noteshub.gamification.achievement.StatsSnapshot;
import com.noteshub.gamification.dto.MilestoneDTO;
import com.noteshub.gamification.exception.ValidationException;
import com.noteshub.gamification.repository.GamificationJdbcRepository;
import com.noteshub.gamification.repository.MilestoneClaimRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * One-off point rewards for reaching fixed thresholds. Unlike achievements they are claimed explicitly.
 */
@Service
public class MilestoneRewardService {

    private static final Logger log = LoggerFactory.getLogger(MilestoneRewardService.class);

    private static final List<Milestone> MILESTONES = List.of(
            new Milestone("uploads", StatKey.UPLOADS, 10, 500, "10 Uploads"),
            new Milestone("uploads", StatKey.UPLOADS, 50, 2000, "50 Uploads"),
            new Milestone("uploads", StatKey.UPLOADS, 100, 5000, "100 Uploads"),
            // downloads given = downloads other students made of this user's notes
            new Milestone("downloads_given", StatKey.NOTE_DOWNLOADS, 100, 1000, "100 Downloads Given"),
            new Milestone("downloads_given", StatKey.NOTE_DOWNLOADS, 500, 3000, "500 Downloads Given"),
            new Milestone("followers", StatKey.FOLLOWERS, 50, 1500, "50 Followers"),
            new Milestone("level", StatKey.LEVEL, 20, 2500, "Level 20")
    );

    private final StatsCollector statsCollector;
    private final MilestoneClaimRepository claimRepository;
    private final GamificationJdbcRepository jdbcRepository;
    private final PointsService pointsService;
    private final Clock clock;

    public MilestoneRewardService(StatsCollector statsCollector,
                                  MilestoneClaimRepository claimRepository,
                                  GamificationJdbcRepository jdbcRepository,
                                  PointsService pointsService,
                                  Clock clock) {
        this.statsCollector = statsCollector;
        this.claimRepository = claimRepository;
        this.jdbcRepository = jdbcRepository;
        this.pointsService = pointsService;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<MilestoneDTO> getMilestones(String userId) {
        StatsSnapshot stats = statsCollector.collect(userId);
        Set<String> claimed = claimRepository.findByUserId(userId).stream()
                .map(c -> key(c.getMilestoneType(), c.getThreshold()))
                .collect(Collectors.toSet());

        List<MilestoneDTO> result = new ArrayList<>(MILESTONES.size());
        for (Milestone milestone : MILESTONES) {
            result.add(new MilestoneDTO(milestone.type, milestone.threshold, milestone.rewardPoints, milestone.name,
                    stats.getCount(milestone.stat), claimed.contains(key(milestone.type, milestone.threshold))));
        }
        return result;
    }

    /**
     * Reached but not yet claimed.
     */
    @Transactional(readOnly = true)
    public List<MilestoneDTO> getUnclaimed(String userId) {
        return getMilestones(userId).stream()
                .filter(m -> !m.isClaimed() && m.getCurrent() >= m.getThreshold())
                .collect(Collectors.toList());
    }

    @Transactional
    public MilestoneDTO claim(String userId, String type, int threshold) {
        Milestone milestone = MILESTONES.stream()
                .filter(m -> m.type.equals(type) && m.threshold == threshold)
                .findFirst()
                .orElseThrow(() -> new ValidationException("Unknown milestone " + type + "/" + threshold));

        long current = statsCollector.collect(userId).getCount(milestone.stat);
        if (current < threshold) {
            throw new ValidationException("Milestone not reached");
        }
        if (!jdbcRepository.insertMilestoneClaimIfAbsent(userId, type, threshold, milestone.rewardPoints,
                LocalDateTime.now(clock))) {
            throw new ValidationException("Already claimed");
        }
        pointsService.awardPoints(userId, PointsActions.MILESTONE_PREFIX + type + "_" + threshold, milestone.rewardPoints);

        log.info("User {} claimed milestone {}/{} for {} points", userId, type, threshold, milestone.rewardPoints);
        return new MilestoneDTO(type, threshold, milestone.rewardPoints, milestone.name, current, true);
    }

    private static String key(String type, int threshold) {
        return type + "/" + threshold;
    }

    private static final class Milestone {
        private final String type;
        private final StatKey stat;
        private final int threshold;
        private final int rewardPoints;
        private final String name;

        private Milestone(String type, StatKey stat, int threshold, int rewardPoints, String name) {
            this.type = type;
            this.stat = stat;
            this.threshold = threshold;
            this.rewardPoints = rewardPoints;
            this.name = name;
        }
    }
}
