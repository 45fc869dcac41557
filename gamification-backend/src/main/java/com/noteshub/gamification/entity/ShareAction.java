package com.noteshub.gamification.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * A note shared to an outside platform (table share_action).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "share_action", indexes = @Index(name = "idx_share_action_user", columnList = "user_id"))
public class ShareAction {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "share_id")
    private Long shareId;

    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;

    @Column(name = "note_id", nullable = false, length = 64)
    private String noteId;

    /**
     * whatsapp, instagram, telegram, ...
     */
    @Column(name = "platform", nullable = false, length = 32)
    private String platform;

    @Column(name = "shared_at", nullable = false)
    private LocalDateTime sharedAt;
}
