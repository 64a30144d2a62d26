package com.cnab.importer.domain;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.List;

/**
 * Result of one import call. Built once, returned to the caller and then discarded.
 */
@Getter
@Builder
@Schema(description = "Result of importing one CNAB file")
public class ImportOutcome {

    @Schema(description = "Name of the imported file", example = "CNAB.txt")
    private final String fileName;

    @Schema(description = "Terminal state of the import", example = "COMMITTED")
    private final ImportState state;

    @Schema(description = "Whether the batch was committed", example = "true")
    private final boolean success;

    @Schema(description = "Number of transactions persisted", example = "21")
    private final int writtenCount;

    @Schema(description = "Number of lines decoded into transactions", example = "21")
    private final int decodedCount;

    @Schema(description = "Number of lines read from the file", example = "23")
    private final int linesRead;

    @Schema(description = "Lines skipped for being blank or shorter than 81 characters", example = "1")
    private final int linesSkipped;

    @Singular
    @Schema(description = "Per-line decode errors and batch-level failures, in file order")
    private final List<ImportError> errors;

    public static ImportOutcome aborted(String fileName, ImportError error) {
        return ImportOutcome.builder()
                .fileName(fileName)
                .state(ImportState.ABORTED)
                .success(false)
                .error(error)
                .build();
    }
}
