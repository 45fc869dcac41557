package com.noteshub.gamification.service;

import com.noteshub.gamification.dto.LevelInfo;
import com.noteshub.gamification.dto.PointsAward;
import com.noteshub.gamification.dto.PointsHistoryItemDTO;
import com.noteshub.gamification.dto.PointsSummaryDTO;
import com.noteshub.gamification.entity.PointsHistory;
import com.noteshub.gamification.entity.UserPoints;
import com.noteshub.gamification.exception.ValidationException;
import com.noteshub.gamification.external.NotificationSink;
import com.noteshub.gamification.repository.GamificationJdbcRepository;
import com.noteshub.gamification.repository.PointsHistoryRepository;
import com.noteshub.gamification.repository.UserPointsRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class PointsServiceImpl implements PointsService {

    private static final Logger log = LoggerFactory.getLogger(PointsServiceImpl.class);

    static final int MAX_HISTORY = 100;

    private final UserPointsRepository pointsRepository;
    private final PointsHistoryRepository historyRepository;
    private final GamificationJdbcRepository jdbcRepository;
    private final LevelCalculator levelCalculator;
    private final NotificationSink notificationSink;
    private final Clock clock;

    public PointsServiceImpl(UserPointsRepository pointsRepository,
                             PointsHistoryRepository historyRepository,
                             GamificationJdbcRepository jdbcRepository,
                             LevelCalculator levelCalculator,
                             NotificationSink notificationSink,
                             Clock clock) {
        this.pointsRepository = pointsRepository;
        this.historyRepository = historyRepository;
        this.jdbcRepository = jdbcRepository;
        this.levelCalculator = levelCalculator;
        this.notificationSink = notificationSink;
        this.clock = clock;
    }

    @Override
    @Transactional
    public PointsAward awardPoints(String userId, String action) {
        return awardPoints(userId, action, null);
    }

    /**
     * Increment and history append run in one transaction; the total is never read back and rewritten.
     */
    @Override
    @Transactional
    public PointsAward awardPoints(String userId, String action, Integer points) {
        int resolved = points != null ? points : PointsActions.defaultPoints(action);
        if (resolved < 0) {
            throw new ValidationException("Points must not be negative: " + resolved);
        }
        if (resolved == 0) {
            PointsSummaryDTO current = getPoints(userId);
            return new PointsAward(current.getTotalPoints(), current.getLevel(), current.getLevelName(), 0);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        LevelInfo base = levelCalculator.calculateLevel(0);
        jdbcRepository.insertPointsIfAbsent(userId, base.getLevel(), base.getLevelName(), now);

        pointsRepository.incrementTotal(userId, resolved, now);
        historyRepository.save(new PointsHistory(null, userId, action, resolved, now));

        UserPoints row = pointsRepository.findById(userId)
                .orElseThrow(() -> new IllegalStateException("Points row vanished for user " + userId));
        LevelInfo info = levelCalculator.calculateLevel(row.getTotalPoints());

        if (info.getLevel() != row.getLevel()) {
            int updated = pointsRepository.updateLevelIfTotal(userId, row.getTotalPoints(), info.getLevel(), info.getLevelName());
            if (updated == 1 && info.getLevel() > row.getLevel()) {
                log.info("User {} reached level {} ({})", userId, info.getLevel(), info.getLevelName());
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("level", info.getLevel());
                payload.put("level_name", info.getLevelName());
                payload.put("total_points", row.getTotalPoints());
                notificationSink.enqueue(userId, "level_up", payload);
            }
        }

        log.debug("Awarded {} points to user {} for {}", resolved, userId, action);
        return new PointsAward(row.getTotalPoints(), info.getLevel(), info.getLevelName(), resolved);
    }

    @Override
    @Transactional(readOnly = true)
    public PointsSummaryDTO getPoints(String userId) {
        long total = pointsRepository.findById(userId).map(UserPoints::getTotalPoints).orElse(0L);
        LevelInfo info = levelCalculator.calculateLevel(total);
        return new PointsSummaryDTO(total, info.getLevel(), info.getLevelName(),
                info.getPointsToNextLevel(), info.getProgressPercentage());
    }

    @Override
    @Transactional(readOnly = true)
    public List<PointsHistoryItemDTO> getHistory(String userId, int limit) {
        if (limit < 1) {
            throw new ValidationException("limit must be positive");
        }
        int pageSize = Math.min(limit, MAX_HISTORY);
        List<PointsHistory> newestFirst = historyRepository
                .findByUserIdOrderByCreatedAtDescHistoryIdDesc(userId, PageRequest.of(0, pageSize));

        List<PointsHistoryItemDTO> result = new ArrayList<>(newestFirst.size());
        for (PointsHistory entry : newestFirst) {
            result.add(new PointsHistoryItemDTO(entry.getAction(), entry.getPoints(), entry.getCreatedAt()));
        }
        Collections.reverse(result);
        return result;
    }
}
