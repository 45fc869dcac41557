package com.noteshub.gamification.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "milestone_claim",
        uniqueConstraints = @UniqueConstraint(name = "uk_milestone_claim", columnNames = {"user_id", "milestone_type", "threshold"}))
public class MilestoneClaim {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "claim_id")
    private Long claimId;

    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;

    @Column(name = "milestone_type", nullable = false, length = 32)
    private String milestoneType;

    @Column(name = "threshold", nullable = false)
    private int threshold;

    @Column(name = "reward_points", nullable = false)
    private int rewardPoints;

    @Column(name = "claimed_at", nullable = false)
    private LocalDateTime claimedAt;
}
