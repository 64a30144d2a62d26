package com.cnab.importer.batch;

import com.cnab.importer.domain.ImportError;
import com.cnab.importer.domain.TransactionRecord;

/**
 * Outcome of decoding one CNAB line.
 *
 * <ul>
 *   <li>{@link Status#DECODED} carries the {@link TransactionRecord}.</li>
 *   <li>{@link Status#SKIPPED} marks a blank or short line; it is neither a record nor an error.</li>
 *   <li>{@link Status#REJECTED} carries the {@link ImportError} explaining why the line was dropped.</li>
 * </ul>
 */
public record LineDecodeResult(Status status, int lineNumber, TransactionRecord record, ImportError error) {

    public enum Status {
        DECODED,
        SKIPPED,
        REJECTED
    }

    public static LineDecodeResult decoded(TransactionRecord record) {
        return new LineDecodeResult(Status.DECODED, record.getLineNumber(), record, null);
    }

    public static LineDecodeResult skipped(int lineNumber) {
        return new LineDecodeResult(Status.SKIPPED, lineNumber, null, null);
    }

    public static LineDecodeResult rejected(ImportError error) {
        return new LineDecodeResult(Status.REJECTED, error.lineNumber() != null ? error.lineNumber() : 0, null, error);
    }

    public boolean isDecoded() {
        return status == Status.DECODED;
    }
}
