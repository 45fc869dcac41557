package com.noteshub.gamification.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * State of a user's points after an award.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PointsAward {
    private long totalPoints;
    private int level;
    private String levelName;
    // points credited by this award, 0 for a no-op
    private int awarded;
}
