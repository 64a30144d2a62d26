package com.cnab.importer.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Domain model representing a single decoded line of a CNAB file.
 *
 * <p>Field layout of the source line (1-based columns):
 * <pre>
 *    1       Type code
 *    2 -  9  Date           YYYYMMDD
 *   10 - 19  Amount         integer cents
 *   20 - 30  Payer CPF
 *   31 - 42  Card
 *   43 - 48  Time           HHMMSS
 *   49 - 62  Store owner
 *   63 - 81  Store name
 * </pre>
 */
@Value
@Builder
public class TransactionRecord {

    /** 1-based line number in the source file. */
    int lineNumber;

    /** Business code read from column 1. */
    int typeCode;

    /** Durable id of the catalog row the type code resolved to. */
    Long transactionTypeId;

    LocalDate date;

    LocalTime time;

    /** Amount in currency units, two decimal places. */
    BigDecimal amount;

    String cpf;

    String card;

    String owner;

    String store;

    // ── Import metadata ──────────────────────────────────────────────────────

    Instant importedAt;

    long importedByUserId;

    String importedBy;
}
