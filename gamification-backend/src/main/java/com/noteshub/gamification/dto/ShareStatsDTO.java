package com.noteshub.gamification.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ShareStatsDTO {
    private long totalShares;
    // platform -> shares
    private Map<String, Long> platformBreakdown;
}
