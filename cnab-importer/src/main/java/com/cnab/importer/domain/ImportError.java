package com.cnab.importer.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A problem found while importing a file, reported back to the caller.
 *
 * @param context    where the problem was found, e.g. {@code "UploadFileWithTransactions - reading type"}
 * @param message    human-readable description
 * @param lineNumber 1-based source line, {@code null} for file- or batch-level errors
 * @param detail     diagnostic detail such as the root cause of a storage failure
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ImportError(String context, String message, Integer lineNumber, String detail) {

    public static final String CONTEXT_UPLOAD = "UploadFileWithTransactions";
    public static final String CONTEXT_READING_TYPE = CONTEXT_UPLOAD + " - reading type";
    public static final String CONTEXT_READING_LINE = CONTEXT_UPLOAD + " - reading line";
    public static final String CONTEXT_FINISH_READING = CONTEXT_UPLOAD + " - finish reading lines";
    public static final String CONTEXT_SAVING = CONTEXT_UPLOAD + " - saving transactions";

    public static ImportError of(String context, String message) {
        return new ImportError(context, message, null, null);
    }

    public static ImportError atLine(String context, int lineNumber, String message) {
        return new ImportError(context, message, lineNumber, null);
    }
}
