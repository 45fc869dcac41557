package com.noteshub.gamification.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Append-only log of point awards (table points_history).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "points_history", indexes = @Index(name = "idx_points_history_user", columnList = "user_id, created_at"))
public class PointsHistory {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "history_id")
    private Long historyId;

    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;

    /**
     * action key, e.g. upload_note or achievement_week_warrior
     */
    @Column(name = "action", nullable = false, length = 64)
    private String action;

    @Column(name = "points", nullable = false)
    private int points;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
