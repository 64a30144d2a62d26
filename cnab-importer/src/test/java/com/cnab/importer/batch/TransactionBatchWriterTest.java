package com.cnab.importer.batch;

import com.cnab.importer.domain.TransactionRecord;
import com.cnab.importer.exception.BatchPersistenceException;
import com.cnab.importer.repository.TransactionRepository;
import com.cnab.importer.repository.TransactionTypeRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.AdditionalAnswers.delegatesTo;

@SpringBootTest
class TransactionBatchWriterTest {

    @Autowired private TransactionBatchWriter batchWriter;
    @Autowired private TransactionRepository transactionRepository;
    @Autowired private TransactionTypeRepository transactionTypeRepository;
    @Autowired private PlatformTransactionManager transactionManager;

    @BeforeEach
    void cleanTables() {
        transactionRepository.deleteAll();
    }

    @Test
    @DisplayName("Whole batch is committed")
    void writeAll_commitsBatch() {
        int written = batchWriter.writeAll(List.of(record(1, 1L), record(2, 2L), record(3, 9L)));

        assertThat(written).isEqualTo(3);
        assertThat(transactionRepository.count()).isEqualTo(3);
    }

    @Test
    @DisplayName("Failure on the second record rolls back the first")
    void writeAll_failureLeavesNoRows() {
        TransactionBatchWriter failingWriter = new TransactionBatchWriter(
                failingOnSecondSave(), transactionTypeRepository, transactionManager);

        assertThatThrownBy(() -> failingWriter.writeAll(List.of(record(1, 1L), record(2, 2L), record(3, 3L))))
                .isInstanceOf(BatchPersistenceException.class)
                .satisfies(e -> {
                    BatchPersistenceException failure = (BatchPersistenceException) e;
                    assertThat(failure.getBatchSize()).isEqualTo(3);
                    assertThat(failure.getRootCauseMessage()).isEqualTo("store column too long");
                });

        assertThat(transactionRepository.count()).isZero();
    }

    @Test
    @DisplayName("Empty batch writes nothing")
    void writeAll_empty() {
        assertThat(batchWriter.writeAll(List.of())).isZero();
    }

    /**
     * Real repository whose second {@code save} fails, after the first row has been inserted.
     */
    TransactionRepository failingOnSecondSave() {
        AtomicInteger saves = new AtomicInteger();
        TransactionRepository failing = mock(TransactionRepository.class, delegatesTo(transactionRepository));
        doAnswer(inv -> {
            if (saves.incrementAndGet() == 2) {
                throw new DataIntegrityViolationException("store column too long");
            }
            return transactionRepository.save(inv.getArgument(0));
        }).when(failing).save(any());
        return failing;
    }

    static TransactionRecord record(int lineNumber, long transactionTypeId) {
        return TransactionRecord.builder()
                .lineNumber(lineNumber)
                .typeCode((int) transactionTypeId)
                .transactionTypeId(transactionTypeId)
                .date(LocalDate.of(2019, 3, 1))
                .time(LocalTime.of(15, 34, 53))
                .amount(new BigDecimal("142.00"))
                .cpf("09620676017")
                .card("4753****3153")
                .owner("JOAO MACEDO")
                .store("BAR DO JOAO")
                .importedAt(Instant.now())
                .importedByUserId(1L)
                .importedBy("tester")
                .build();
    }
}
