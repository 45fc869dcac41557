package com.noteshub.gamification.service;

import com.noteshub.gamification.dto.PointsAward;
import com.noteshub.gamification.dto.PointsHistoryItemDTO;
import com.noteshub.gamification.dto.PointsSummaryDTO;

import java.util.List;

public interface PointsService {

    /**
     * Credits points for an action. {@code points == null} takes the action's default;
     * a resolved value of 0 changes nothing and returns the current state.
     */
    PointsAward awardPoints(String userId, String action, Integer points);

    PointsAward awardPoints(String userId, String action);

    PointsSummaryDTO getPoints(String userId);

    /**
     * Most recent {@code limit} entries in chronological order.
     */
    List<PointsHistoryItemDTO> getHistory(String userId, int limit);
}
