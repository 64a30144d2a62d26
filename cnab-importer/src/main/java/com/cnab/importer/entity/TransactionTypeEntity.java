package com.cnab.importer.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * Catalog row describing the nature of a CNAB transaction.
 *
 * <p>{@code typeCode} is the single-digit business code found at column 1 of every CNAB
 * line; {@code id} is the durable identifier that transactions reference.
 */
@Entity
@Table(name = "transaction_types", indexes = {
    @Index(name = "idx_transaction_types_code", columnList = "type_code")
})
@Getter
@Setter
@NoArgsConstructor
public class TransactionTypeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "type_code", nullable = false)
    private Integer typeCode;

    @Column(name = "description", nullable = false, length = 30)
    private String description;

    /** Entrada (inflow) or Saída (outflow). */
    @Column(name = "nature", nullable = false, length = 20)
    private String nature;

    @Column(name = "sign", nullable = false, length = 2)
    private String sign;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public TransactionTypeEntity(Integer typeCode, String description, String nature, String sign) {
        this.typeCode = typeCode;
        this.description = description;
        this.nature = nature;
        this.sign = sign;
        this.active = true;
        this.createdAt = Instant.now();
    }
}
