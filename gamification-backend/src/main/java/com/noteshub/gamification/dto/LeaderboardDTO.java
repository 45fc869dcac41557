package com.noteshub.gamification.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LeaderboardDTO {
    private String scope;           // all_india, college, department
    private String filter;          // college or department name, null for all_india
    private List<LeaderboardEntryDTO> rankings;
    private Integer requesterRank;
    private int totalUsers;         // size of the ranked population
    private LocalDateTime updatedAt;
}
