package com.noteshub.gamification.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * One user brought in by a referrer (table referred_user). A user can be referred only once.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "referred_user",
        uniqueConstraints = @UniqueConstraint(name = "uk_referred_user", columnNames = "user_id"),
        indexes = @Index(name = "idx_referred_user_referrer", columnList = "referrer_id, joined_at"))
public class ReferredUser {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "referred_id")
    private Long referredId;

    @Column(name = "referrer_id", nullable = false, length = 64)
    private String referrerId;

    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;

    @Column(name = "handle", length = 64)
    private String handle;

    @Column(name = "joined_at", nullable = false)
    private LocalDateTime joinedAt;
}
