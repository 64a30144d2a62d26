package com.cnab.importer.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;

/**
 * A card transaction imported from a CNAB file.
 *
 * <p>Rows are written by the import pipeline only; afterwards only the lifecycle columns
 * ({@code is_active}, {@code deleted_at}, {@code updated_*}) change.
 */
@Entity
@Table(name = "transactions", indexes = {
    @Index(name = "idx_transactions_cpf", columnList = "cpf"),
    @Index(name = "idx_transactions_date", columnList = "date")
})
@Getter
@Setter
@NoArgsConstructor
public class TransactionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "date", nullable = false)
    private LocalDate date;

    @Column(name = "time", nullable = false)
    private LocalTime time;

    @Column(name = "`value`", nullable = false, precision = 10, scale = 2)
    private BigDecimal value;

    @Column(name = "cpf", nullable = false, length = 11)
    private String cpf;

    @Column(name = "card", nullable = false, length = 12)
    private String card;

    @Column(name = "owner", nullable = false, length = 14)
    private String owner;

    @Column(name = "store", nullable = false, length = 19)
    private String store;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "transaction_type_id", nullable = false)
    private TransactionTypeEntity transactionType;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Column(name = "deleted_at")
    private Instant deletedAt;

    @Column(name = "updated_by", length = 50)
    private String updatedBy;
}
