package com.cnab.importer.batch;

import com.cnab.importer.domain.ImportError;
import com.cnab.importer.domain.TransactionRecord;

import java.util.List;

/**
 * In-memory result of reading a whole CNAB file: decoded records and per-line errors,
 * both in file order.
 *
 * @param records      successfully decoded lines
 * @param errors       lines that were rejected
 * @param linesRead    physical lines read, including skipped ones
 * @param linesSkipped blank or short lines
 * @param readable     {@code false} when the input could not be opened or read to the end;
 *                     records and errors are then empty
 */
public record CollectedBatch(List<TransactionRecord> records,
                             List<ImportError> errors,
                             int linesRead,
                             int linesSkipped,
                             boolean readable) {

    public CollectedBatch {
        records = List.copyOf(records);
        errors = List.copyOf(errors);
    }

    public static CollectedBatch unreadable(int linesRead) {
        return new CollectedBatch(List.of(), List.of(), linesRead, 0, false);
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
