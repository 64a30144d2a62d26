package com.cnab.importer.batch;

import com.cnab.importer.config.CnabImportProperties;
import com.cnab.importer.domain.ImportError;
import com.cnab.importer.domain.TransactionRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.batch.item.ItemStreamException;
import org.springframework.batch.item.file.FlatFileItemReader;
import org.springframework.batch.item.file.LineMapper;
import org.springframework.batch.item.file.builder.FlatFileItemReaderBuilder;
import org.springframework.core.io.InputStreamResource;
import org.springframework.core.io.InputStreamSource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a CNAB file line by line and sorts every decoded line into records or errors.
 *
 * <p>Lines are read through a {@link FlatFileItemReader} whose {@link LineMapper} is the
 * per-import {@link CnabLineDecoder}. Decoding is strictly sequential, so both output lists
 * keep file order. Nothing here touches the database.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CnabBatchCollector {

    private static final int BYTE_ORDER_MARK = '\uFEFF';

    private final CnabImportProperties properties;

    /**
     * @param source  the file content; opened exactly once
     * @param decoder line mapper bound to the current import
     * @return the collected batch, or {@link CollectedBatch#unreadable(int)} when the stream
     *         cannot be opened or fails mid-way
     */
    public CollectedBatch collect(InputStreamSource source, LineMapper<LineDecodeResult> decoder) {
        List<TransactionRecord> records = new ArrayList<>();
        List<ImportError> errors = new ArrayList<>();
        int linesRead = 0;
        int linesSkipped = 0;

        FlatFileItemReader<LineDecodeResult> reader;
        try {
            reader = createReader(asResource(source), decoder);
        } catch (IOException e) {
            log.error("Cannot open CNAB input: {}", e.getMessage(), e);
            return CollectedBatch.unreadable(0);
        }

        try {
            reader.open(new ExecutionContext());
            for (LineDecodeResult result = reader.read(); result != null; result = reader.read()) {
                linesRead++;
                switch (result.status()) {
                    case DECODED -> records.add(result.record());
                    case REJECTED -> errors.add(result.error());
                    case SKIPPED -> linesSkipped++;
                }
            }
        } catch (Exception e) {
            log.error("Cannot read CNAB input after {} lines: {}", linesRead, e.getMessage(), e);
            return CollectedBatch.unreadable(linesRead);
        } finally {
            close(reader);
        }

        log.info("Read {} lines: {} decoded, {} rejected, {} skipped",
                linesRead, records.size(), errors.size(), linesSkipped);
        return new CollectedBatch(records, errors, linesRead, linesSkipped, true);
    }

    // ─── helpers ─────────────────────────────────────────────────────────────

    private FlatFileItemReader<LineDecodeResult> createReader(Resource resource,
                                                              LineMapper<LineDecodeResult> decoder) {
        FlatFileItemReader<LineDecodeResult> reader = new FlatFileItemReaderBuilder<LineDecodeResult>()
                .name("cnabLineReader")
                .resource(resource)
                .encoding(properties.getEncoding())
                .lineMapper(decoder)
                .bufferedReaderFactory(CnabBatchCollector::openSkippingBom)
                .saveState(false)
                .strict(true)
                .build();
        // CNAB has no comment syntax; every line goes to the decoder.
        reader.setComments(new String[0]);
        return reader;
    }

    /**
     * Opens {@code resource} and drops a leading byte order mark, which editors on Windows
     * commonly prepend; otherwise it would be read as the type column of line 1.
     */
    static BufferedReader openSkippingBom(Resource resource, String encoding) throws IOException {
        BufferedReader reader = new BufferedReader(
                new InputStreamReader(resource.getInputStream(), Charset.forName(encoding)));
        reader.mark(1);
        if (reader.read() != BYTE_ORDER_MARK) {
            reader.reset();
        }
        return reader;
    }

    private static Resource asResource(InputStreamSource source) throws IOException {
        if (source instanceof Resource resource) {
            return resource;
        }
        return new InputStreamResource(source.getInputStream());
    }

    private static void close(FlatFileItemReader<LineDecodeResult> reader) {
        try {
            reader.close();
        } catch (ItemStreamException e) {
            log.warn("Failed to close CNAB reader: {}", e.getMessage());
        }
    }
}
