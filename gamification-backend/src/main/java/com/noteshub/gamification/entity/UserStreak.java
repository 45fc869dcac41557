package com.noteshub.gamification.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Daily activity streak of one user (table user_streak).
 * Invariant: longest_streak >= current_streak.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "user_streak")
public class UserStreak {

    @Id
    @Column(name = "user_id", length = 64)
    private String userId;

    @Column(name = "current_streak", nullable = false)
    private int currentStreak;

    @Column(name = "longest_streak", nullable = false)
    private int longestStreak;

    /**
     * UTC calendar date of the last qualifying activity, null until the first one
     */
    @Column(name = "last_activity_date")
    private LocalDate lastActivityDate;

    @Column(name = "last_activity_at")
    private LocalDateTime lastActivityAt;

    @Column(name = "total_activities", nullable = false)
    private long totalActivities;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
