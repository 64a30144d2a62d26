package com.cnab.importer.domain;

/**
 * Lifecycle of a single import.
 *
 * <pre>
 *   IDLE ─► VALIDATING_FILE ─► DECODING ─► WRITING ─► COMMITTED
 *                 │                │           │
 *                 └────────────────┴───────────┴────► ABORTED
 * </pre>
 */
public enum ImportState {
    IDLE,
    VALIDATING_FILE,
    DECODING,
    WRITING,
    COMMITTED,
    ABORTED
}
