package com.noteshub.gamification.service;

import com.noteshub.gamification.dto.LeaderboardDTO;
import com.noteshub.gamification.dto.LeaderboardEntryDTO;

import java.util.List;

public interface LeaderboardService {

    /**
     * Ranks the whole population of a scope, bypassing the cache.
     */
    List<LeaderboardEntryDTO> buildLeaderboard(LeaderboardScope scope, String filter);

    /**
     * @param filter  college or department; when blank the requester's own is used
     * @param limit   null for the configured default
     */
    LeaderboardDTO getLeaderboard(LeaderboardScope scope, String filter, Integer limit, String requesterId);

    /**
     * Drops every cached ranking; the next read rebuilds.
     */
    void refresh();
}
