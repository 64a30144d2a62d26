package com.cnab.importer.service;

import com.cnab.importer.batch.CnabBatchCollector;
import com.cnab.importer.batch.CnabLineDecoder;
import com.cnab.importer.batch.CollectedBatch;
import com.cnab.importer.batch.TransactionBatchWriter;
import com.cnab.importer.batch.TransactionTypeCatalog;
import com.cnab.importer.batch.TransactionTypeCatalogLoader;
import com.cnab.importer.domain.CnabUpload;
import com.cnab.importer.domain.ImportError;
import com.cnab.importer.domain.ImportOutcome;
import com.cnab.importer.domain.ImportState;
import com.cnab.importer.exception.BatchPersistenceException;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.Clock;
import java.time.Instant;

/**
 * Runs a CNAB import from upload to commit.
 *
 * <h3>States</h3>
 * <ol>
 *   <li>{@code VALIDATING_FILE}: a missing or zero-length file aborts with "File empty.".</li>
 *   <li>{@code DECODING}: the active catalog is loaded once, then every line is decoded by
 *       {@link CnabBatchCollector}; rejected lines become errors and decoding continues.</li>
 *   <li>{@code WRITING}: entered only when at least one line decoded; otherwise the import
 *       aborts with "No transactions read.". The batch is written by
 *       {@link TransactionBatchWriter} in one transaction.</li>
 *   <li>{@code COMMITTED}: an audit entry is appended, best effort.</li>
 * </ol>
 *
 * <p>{@link #importFile} never throws: every failure ends as an {@code ABORTED}
 * {@link ImportOutcome} carrying the collected errors.
 */
@Slf4j
@Service
public class CnabImportService {

    static final String FILE_EMPTY = "File empty.";
    static final String FILE_UNREADABLE = "File could not be read.";
    static final String CATALOG_UNAVAILABLE = "Transaction types could not be loaded.";
    static final String NO_TRANSACTIONS = "No transactions read.";
    static final String SAVE_FAILED = "Error saving transactions.";
    static final String BUSY = "Too many concurrent imports, try again later.";

    private final TransactionTypeCatalogLoader catalogLoader;
    private final CnabBatchCollector batchCollector;
    private final TransactionBatchWriter batchWriter;
    private final ImportAuditLogger auditLogger;
    private final Bulkhead importBulkhead;
    private final Clock clock;

    @Autowired
    public CnabImportService(TransactionTypeCatalogLoader catalogLoader,
                             CnabBatchCollector batchCollector,
                             TransactionBatchWriter batchWriter,
                             ImportAuditLogger auditLogger,
                             @Qualifier("cnabImportBulkhead") Bulkhead importBulkhead) {
        this(catalogLoader, batchCollector, batchWriter, auditLogger, importBulkhead, Clock.systemUTC());
    }

    CnabImportService(TransactionTypeCatalogLoader catalogLoader,
                      CnabBatchCollector batchCollector,
                      TransactionBatchWriter batchWriter,
                      ImportAuditLogger auditLogger,
                      Bulkhead importBulkhead,
                      Clock clock) {
        this.catalogLoader = catalogLoader;
        this.batchCollector = batchCollector;
        this.batchWriter = batchWriter;
        this.auditLogger = auditLogger;
        this.importBulkhead = importBulkhead;
        this.clock = clock;
    }

    /**
     * Imports {@code upload} on behalf of the given user.
     *
     * @return the terminal outcome; {@link ImportOutcome#isSuccess()} is {@code true} only
     *         when the batch was committed
     */
    public ImportOutcome importFile(CnabUpload upload, long userId, String userName) {
        String fileName = upload != null ? upload.fileName() : null;
        try {
            return Bulkhead.decorateSupplier(importBulkhead, () -> runImport(upload, userId, userName)).get();
        } catch (BulkheadFullException e) {
            log.warn("Rejected import of '{}' by user {}: {}", fileName, userId, e.getMessage());
            return ImportOutcome.aborted(fileName, ImportError.of(ImportError.CONTEXT_UPLOAD, BUSY));
        }
    }

    private ImportOutcome runImport(CnabUpload upload, long userId, String userName) {
        String fileName = upload != null ? upload.fileName() : null;
        ImportState state = transition(ImportState.IDLE, ImportState.VALIDATING_FILE, fileName);

        if (upload == null || upload.isEmpty()) {
            log.info("Import of '{}' by user {} rejected: file empty", fileName, userId);
            transition(state, ImportState.ABORTED, fileName);
            return ImportOutcome.aborted(fileName, ImportError.of(ImportError.CONTEXT_UPLOAD, FILE_EMPTY));
        }

        state = transition(state, ImportState.DECODING, fileName);
        log.info("Starting to read '{}' ({} bytes) for user {}", fileName, upload.size(), userId);

        TransactionTypeCatalog catalog;
        try {
            catalog = catalogLoader.load();
        } catch (DataAccessException | TransactionException e) {
            log.error("Cannot load transaction types for import of '{}'", fileName, e);
            transition(state, ImportState.ABORTED, fileName);
            return ImportOutcome.aborted(fileName, new ImportError(
                    ImportError.CONTEXT_UPLOAD, CATALOG_UNAVAILABLE, null, e.getMessage()));
        }

        CnabLineDecoder decoder = new CnabLineDecoder(catalog, Instant.now(clock), userId, userName);
        CollectedBatch batch = batchCollector.collect(upload.content(), decoder);

        if (!batch.readable()) {
            transition(state, ImportState.ABORTED, fileName);
            return ImportOutcome.aborted(fileName, ImportError.of(ImportError.CONTEXT_UPLOAD, FILE_UNREADABLE));
        }

        ImportOutcome.ImportOutcomeBuilder outcome = ImportOutcome.builder()
                .fileName(fileName)
                .decodedCount(batch.records().size())
                .linesRead(batch.linesRead())
                .linesSkipped(batch.linesSkipped())
                .errors(batch.errors());

        if (batch.isEmpty()) {
            log.info("{} ('{}')", NO_TRANSACTIONS, fileName);
            transition(state, ImportState.ABORTED, fileName);
            return outcome
                    .error(ImportError.of(ImportError.CONTEXT_FINISH_READING, NO_TRANSACTIONS))
                    .state(ImportState.ABORTED)
                    .success(false)
                    .build();
        }

        state = transition(state, ImportState.WRITING, fileName);
        int written;
        try {
            written = batchWriter.writeAll(batch.records());
        } catch (BatchPersistenceException e) {
            transition(state, ImportState.ABORTED, fileName);
            return outcome
                    .error(new ImportError(ImportError.CONTEXT_SAVING, SAVE_FAILED, null, e.getRootCauseMessage()))
                    .state(ImportState.ABORTED)
                    .success(false)
                    .build();
        }

        transition(state, ImportState.COMMITTED, fileName);
        auditLogger.recordUpload(userId, fileName);

        log.info("Imported '{}' for user {}: {} written, {} rejected, {} skipped",
                fileName, userId, written, batch.errors().size(), batch.linesSkipped());
        return outcome
                .writtenCount(written)
                .state(ImportState.COMMITTED)
                .success(true)
                .build();
    }

    private static ImportState transition(ImportState from, ImportState to, String fileName) {
        log.debug("Import '{}': {} -> {}", fileName, from, to);
        return to;
    }
}
