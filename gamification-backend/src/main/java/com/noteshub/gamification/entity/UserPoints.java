package com.noteshub.gamification.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Running points total of one user (table user_points).
 * level and level_name are derived from total_points and rewritten after every award.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "user_points")
public class UserPoints {

    /**
     * user_id: owner of the record (Primary Key)
     */
    @Id
    @Column(name = "user_id", length = 64)
    private String userId;

    /**
     * total_points: never negative, only ever incremented in the database
     */
    @Column(name = "total_points", nullable = false)
    private long totalPoints;

    @Column(name = "level", nullable = false)
    private int level;

    @Column(name = "level_name", nullable = false, length = 32)
    private String levelName;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
