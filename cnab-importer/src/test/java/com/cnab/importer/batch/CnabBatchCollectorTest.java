package com.cnab.importer.batch;

import com.cnab.importer.config.CnabImportProperties;
import com.cnab.importer.domain.ImportError;
import com.cnab.importer.domain.TransactionRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.InputStreamSource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CnabBatchCollectorTest {

    private final CnabBatchCollector collector = new CnabBatchCollector(new CnabImportProperties());

    /**
     * {@code cnab-sample.txt}: lines 1, 2 and 7 decode; 3 is short; 4 has type 0; 5 has month 13;
     * 6 is blank.
     */
    @Test
    @DisplayName("Collects decoded lines in file order with per-line errors and counts")
    void collect_mixedFile() {
        CollectedBatch batch = collector.collect(new ClassPathResource("data/cnab-sample.txt"), decoder());

        assertThat(batch.readable()).isTrue();
        assertThat(batch.linesRead()).isEqualTo(7);
        assertThat(batch.linesSkipped()).isEqualTo(2);
        assertThat(batch.records()).extracting(TransactionRecord::getLineNumber).containsExactly(1, 2, 7);
        assertThat(batch.records()).extracting(TransactionRecord::getTypeCode).containsExactly(1, 2, 9);
        assertThat(batch.errors()).extracting(ImportError::lineNumber).containsExactly(4, 5);
        assertThat(batch.errors()).extracting(ImportError::context).containsExactly(
                ImportError.CONTEXT_READING_TYPE, ImportError.CONTEXT_READING_LINE);
    }

    @Test
    @DisplayName("Lines starting with '#' are decoded like any other line")
    void collect_noCommentPrefix() {
        String line = "#" + "20230101" + "0000000100" + "12345678901" + "1234****5678" + "093000"
                + String.format("%-14s%-19s", "JOHN DOE", "STORE A");

        CollectedBatch batch = collector.collect(utf8(line), decoder());

        assertThat(batch.linesRead()).isEqualTo(1);
        assertThat(batch.errors()).singleElement()
                .satisfies(e -> assertThat(e.message()).startsWith("Invalid transaction type '#'"));
    }

    @Test
    @DisplayName("Leading byte order mark is dropped before the first line is decoded")
    void collect_utf8WithByteOrderMark() {
        String lines = "1202301010000000100123456789011234****5678093000JOHN DOE      STORE A            \n"
                + "2202301020000015075096206760173648****0099234234JOAO MACEDO   BAR DO JOAO        \n";
        byte[] body = lines.getBytes(StandardCharsets.UTF_8);
        byte[] withBom = new byte[body.length + 3];
        withBom[0] = (byte) 0xEF;
        withBom[1] = (byte) 0xBB;
        withBom[2] = (byte) 0xBF;
        System.arraycopy(body, 0, withBom, 3, body.length);

        CollectedBatch batch = collector.collect(new ByteArrayResource(withBom), decoder());

        assertThat(batch.errors()).isEmpty();
        assertThat(batch.records()).extracting(TransactionRecord::getTypeCode).containsExactly(1, 2);
        assertThat(batch.records().get(0).getAmount()).isEqualByComparingTo("1.00");
        assertThat(batch.records().get(0).getCpf()).isEqualTo("12345678901");
    }

    @Test
    @DisplayName("Byte order mark is dropped from uploads read as plain streams too")
    void collect_byteOrderMarkOnInputStreamSource() {
        byte[] content = ("\uFEFF1202301010000000100123456789011234****5678093000JOHN DOE      STORE A            ")
                .getBytes(StandardCharsets.UTF_8);
        InputStreamSource source = () -> new java.io.ByteArrayInputStream(content);

        CollectedBatch batch = collector.collect(source, decoder());

        assertThat(batch.errors()).isEmpty();
        assertThat(batch.records()).hasSize(1);
    }

    @Test
    @DisplayName("Non-resource sources are read through their input stream")
    void collect_plainInputStreamSource() {
        byte[] content = "1202301010000000100123456789011234****5678093000JOHN DOE      STORE A            \n"
                .getBytes(StandardCharsets.UTF_8);
        InputStreamSource source = () -> new java.io.ByteArrayInputStream(content);

        CollectedBatch batch = collector.collect(source, decoder());

        assertThat(batch.records()).hasSize(1);
        assertThat(batch.records().get(0).getAmount()).isEqualByComparingTo("1.00");
    }

    @Test
    @DisplayName("Source that cannot be opened yields an unreadable batch")
    void collect_unreadableSource() {
        InputStreamSource broken = () -> {
            throw new IOException("disk gone");
        };

        CollectedBatch batch = collector.collect(broken, decoder());

        assertThat(batch.readable()).isFalse();
        assertThat(batch.records()).isEmpty();
        assertThat(batch.errors()).isEmpty();
    }

    // ─── helpers ─────────────────────────────────────────────────────────────

    private static CnabLineDecoder decoder() {
        Map<Long, Integer> codes = new HashMap<>();
        for (int code = 1; code <= 9; code++) {
            codes.put((long) code, code);
        }
        return new CnabLineDecoder(TransactionTypeCatalog.of(codes), Instant.now(), 1L, "tester");
    }

    private static ByteArrayResource utf8(String content) {
        return new ByteArrayResource(content.getBytes(StandardCharsets.UTF_8));
    }
}
