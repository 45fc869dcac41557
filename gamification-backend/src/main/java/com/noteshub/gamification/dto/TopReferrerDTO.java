package com.noteshub.gamification.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TopReferrerDTO {
    private int rank;
    private String userId;
    private String handle;
    private int totalReferrals;
}
