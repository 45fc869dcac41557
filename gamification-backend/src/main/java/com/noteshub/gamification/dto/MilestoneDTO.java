package com.noteshub.gamification.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A reward milestone and where the user stands against it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MilestoneDTO {
    private String type;
    private int threshold;
    private int rewardPoints;
    private String description;
    private long current;
    private boolean claimed;
}
