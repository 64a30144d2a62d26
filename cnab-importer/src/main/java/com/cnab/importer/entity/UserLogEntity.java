package com.cnab.importer.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * Append-only audit entry recording an action taken by a user.
 */
@Entity
@Table(name = "user_logs", indexes = {
    @Index(name = "idx_user_logs_user_id", columnList = "user_id")
})
@Getter
@Setter
@NoArgsConstructor
public class UserLogEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "log", nullable = false, length = 255)
    private String log;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public UserLogEntity(Long userId, String log) {
        this.userId = userId;
        this.log = log;
        this.createdAt = Instant.now();
    }
}
