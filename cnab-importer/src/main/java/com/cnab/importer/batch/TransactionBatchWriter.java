package com.cnab.importer.batch;

import com.cnab.importer.domain.TransactionRecord;
import com.cnab.importer.entity.TransactionEntity;
import com.cnab.importer.exception.BatchPersistenceException;
import com.cnab.importer.repository.TransactionRepository;
import com.cnab.importer.repository.TransactionTypeRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;

/**
 * Persists a decoded batch in one database transaction.
 *
 * <p>The whole batch handed to {@link #writeAll(List)} is one unit: every record is saved and
 * flushed inside a single {@code REQUIRES_NEW} transaction. Any failure rolls that transaction
 * back before {@link BatchPersistenceException} reaches the caller, so readers never observe
 * part of a batch. A new transaction is always started so the batch commits or rolls back on
 * its own even when the caller already runs inside one (e.g. a Spring Batch tasklet step).
 */
@Slf4j
@Component
public class TransactionBatchWriter {

    private final TransactionRepository transactionRepository;
    private final TransactionTypeRepository transactionTypeRepository;
    private final TransactionTemplate transactionTemplate;

    public TransactionBatchWriter(TransactionRepository transactionRepository,
                                  TransactionTypeRepository transactionTypeRepository,
                                  PlatformTransactionManager transactionManager) {
        this.transactionRepository = transactionRepository;
        this.transactionTypeRepository = transactionTypeRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.transactionTemplate.setName("cnabBatchWrite");
    }

    /**
     * @return number of transactions committed
     * @throws BatchPersistenceException if anything failed; nothing from the batch was kept
     */
    public int writeAll(List<? extends TransactionRecord> records) {
        if (records.isEmpty()) {
            return 0;
        }
        log.info("Saving {} transactions to the database", records.size());

        Integer written;
        try {
            written = transactionTemplate.execute(status -> {
                for (TransactionRecord record : records) {
                    transactionRepository.save(toEntity(record));
                }
                transactionRepository.flush();
                return records.size();
            });
        } catch (RuntimeException e) {
            log.error("Error saving transactions, batch of {} rolled back", records.size(), e);
            throw new BatchPersistenceException(records.size(), e);
        }

        log.info("Transactions saved successfully ({})", written);
        return written != null ? written : 0;
    }

    // ─── helper ──────────────────────────────────────────────────────────────

    private TransactionEntity toEntity(TransactionRecord record) {
        TransactionEntity entity = new TransactionEntity();
        entity.setDate(record.getDate());
        entity.setTime(record.getTime());
        entity.setValue(record.getAmount());
        entity.setCpf(record.getCpf());
        entity.setCard(record.getCard());
        entity.setOwner(record.getOwner());
        entity.setStore(record.getStore());
        entity.setTransactionType(transactionTypeRepository.getReferenceById(record.getTransactionTypeId()));
        entity.setUserId(record.getImportedByUserId());
        entity.setActive(true);
        entity.setCreatedAt(record.getImportedAt());
        entity.setUpdatedAt(record.getImportedAt());
        entity.setUpdatedBy(record.getImportedBy());
        return entity;
    }
}
