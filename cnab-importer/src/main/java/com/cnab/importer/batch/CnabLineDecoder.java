package com.cnab.importer.batch;

import com.cnab.importer.domain.ImportError;
import com.cnab.importer.domain.TransactionRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.item.file.LineMapper;
import org.springframework.batch.item.file.transform.FieldSet;
import org.springframework.batch.item.file.transform.FixedLengthTokenizer;
import org.springframework.batch.item.file.transform.Range;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Decodes one fixed-width CNAB line into a {@link LineDecodeResult}.
 *
 * <p>Column ranges (1-based, inclusive), as configured on the {@link FixedLengthTokenizer}:
 * <pre>
 *    1       type     business code, resolved through the {@link TransactionTypeCatalog}
 *    2 -  9  date     YYYYMMDD
 *   10 - 19  amount   unsigned integer cents
 *   20 - 30  cpf
 *   31 - 42  card
 *   43 - 48  time     HHMMSS
 *   49 - 62  owner
 *   63 - 81  store
 * </pre>
 * All values are trimmed. Characters past column 81 are ignored.
 *
 * <p>An instance is bound to one import: it carries the catalog snapshot and the import
 * metadata stamped on every record. It never throws for malformed input; every problem is
 * returned as a {@link LineDecodeResult.Status#REJECTED} result so the reader moves on to
 * the next line.
 */
@Slf4j
public class CnabLineDecoder implements LineMapper<LineDecodeResult> {

    public static final int MIN_LINE_LENGTH = 81;

    private static final String[] FIELD_NAMES = {
            "type", "date", "amount", "cpf", "card", "time", "owner", "store"
    };

    private static final DateTimeFormatter DATE_FORMAT =
            DateTimeFormatter.ofPattern("uuuuMMdd").withResolverStyle(ResolverStyle.STRICT);

    private static final DateTimeFormatter TIME_FORMAT =
            DateTimeFormatter.ofPattern("HHmmss").withResolverStyle(ResolverStyle.STRICT);

    private static final Pattern TYPE_PATTERN = Pattern.compile("[0-9]");

    /** Up to ten digits: at most 99 999 999.99, which fits the decimal(10,2) column. */
    private static final Pattern AMOUNT_PATTERN = Pattern.compile("[0-9]{1,10}");

    private final FixedLengthTokenizer tokenizer;
    private final TransactionTypeCatalog catalog;
    private final Instant importedAt;
    private final long userId;
    private final String userName;

    public CnabLineDecoder(TransactionTypeCatalog catalog, Instant importedAt, long userId, String userName) {
        this.catalog = catalog;
        this.importedAt = importedAt;
        this.userId = userId;
        this.userName = userName;

        this.tokenizer = new FixedLengthTokenizer();
        this.tokenizer.setNames(FIELD_NAMES);
        this.tokenizer.setColumns(
                new Range(1, 1),
                new Range(2, 9),
                new Range(10, 19),
                new Range(20, 30),
                new Range(31, 42),
                new Range(43, 48),
                new Range(49, 62),
                new Range(63, 81));
        this.tokenizer.setStrict(false);
    }

    @Override
    public LineDecodeResult mapLine(String line, int lineNumber) {
        if (line == null || line.isBlank() || line.length() < MIN_LINE_LENGTH) {
            log.warn("Skipping invalid or empty line {}: '{}'", lineNumber, line);
            return LineDecodeResult.skipped(lineNumber);
        }

        FieldSet fields = tokenizer.tokenize(line);

        String rawType = fields.readString("type");
        Optional<Long> transactionTypeId = TYPE_PATTERN.matcher(rawType).matches()
                ? catalog.resolve(Integer.parseInt(rawType))
                : Optional.empty();
        if (transactionTypeId.isEmpty()) {
            return reject(ImportError.CONTEXT_READING_TYPE, lineNumber, line, "transaction type", rawType);
        }

        String rawDate = fields.readString("date");
        LocalDate date = parseDate(rawDate);
        if (date == null) {
            return reject(ImportError.CONTEXT_READING_LINE, lineNumber, line, "date", rawDate);
        }

        String rawTime = fields.readString("time");
        LocalTime time = parseTime(rawTime);
        if (time == null) {
            return reject(ImportError.CONTEXT_READING_LINE, lineNumber, line, "time", rawTime);
        }

        String rawAmount = fields.readString("amount");
        if (!AMOUNT_PATTERN.matcher(rawAmount).matches()) {
            return reject(ImportError.CONTEXT_READING_LINE, lineNumber, line, "amount", rawAmount);
        }
        BigDecimal amount = new BigDecimal(rawAmount).movePointLeft(2);

        TransactionRecord record = TransactionRecord.builder()
                .lineNumber(lineNumber)
                .typeCode(Integer.parseInt(rawType))
                .transactionTypeId(transactionTypeId.get())
                .date(date)
                .time(time)
                .amount(amount)
                .cpf(fields.readString("cpf"))
                .card(fields.readString("card"))
                .owner(fields.readString("owner"))
                .store(fields.readString("store"))
                .importedAt(importedAt)
                .importedByUserId(userId)
                .importedBy(userName)
                .build();

        log.debug("Decoded line {}: type={}, amount={}, cpf={}", lineNumber, record.getTypeCode(),
                record.getAmount(), record.getCpf());
        return LineDecodeResult.decoded(record);
    }

    // ─── private helpers ─────────────────────────────────────────────────────

    private LineDecodeResult reject(String context, int lineNumber, String line, String field, String rawValue) {
        String message = "Invalid " + field + " '" + rawValue + "' in line " + lineNumber + ": " + line;
        log.warn(message);
        return LineDecodeResult.rejected(ImportError.atLine(context, lineNumber, message));
    }

    private static LocalDate parseDate(String raw) {
        try {
            return LocalDate.parse(raw, DATE_FORMAT);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static LocalTime parseTime(String raw) {
        try {
            return LocalTime.parse(raw, TIME_FORMAT);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
