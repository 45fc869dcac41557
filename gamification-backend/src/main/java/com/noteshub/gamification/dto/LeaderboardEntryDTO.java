package com.noteshub.gamification.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One ranked user.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class LeaderboardEntryDTO {
    private String userId;
    private String handle;
    private int rank;
    private long score;
    private String college;
    private String department;
    private String profilePicture;
    private int streak;
    private int level;
}
