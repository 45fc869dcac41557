package com.noteshub.gamification.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Unlocked achievement (table user_achievement). At most one row per (user_id, achievement_id).
 */
@Entity
@Table(name = "user_achievement",
        uniqueConstraints = @UniqueConstraint(name = "uk_user_achievement", columnNames = {"user_id", "achievement_id"}))
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UserAchievement {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "unlock_id")
    private Long unlockId;

    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;

    /**
     * key of the catalog entry, see AchievementCatalog
     */
    @Column(name = "achievement_id", nullable = false, length = 50)
    private String achievementId;

    @Column(name = "unlocked_at", nullable = false)
    private LocalDateTime unlockedAt;
}
