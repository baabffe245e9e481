package com.fintech.ledger.infrastructure.csv;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.fintech.ledger.domain.exception.ErrorCode;
import com.fintech.ledger.domain.exception.LedgerException;
import com.fintech.ledger.domain.model.Transaction;
import com.fintech.ledger.domain.service.TransactionSource;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Streams transactions from CSV input with a header row {@code type, client, tx, amount}.
 *
 * Columns are matched by header name. Whitespace around fields is trimmed, blank lines
 * are skipped and the amount column may be empty or absent for dispute, resolve and
 * chargeback rows. Rows are decoded one at a time; the first malformed row fails with
 * DECODE_ERROR naming its physical line number, header included.
 */
@Slf4j
public class CsvTransactionSource implements TransactionSource {

    // Blank lines are decoded as empty records and skipped here, so every physical
    // line advances the row counter.
    private static final CsvMapper CSV_MAPPER = CsvMapper.builder()
            .enable(CsvParser.Feature.TRIM_SPACES)
            .enable(CsvParser.Feature.IGNORE_TRAILING_UNMAPPABLE)
            .build();

    // Columns are bound by the names in the header row, in any order.
    private static final CsvSchema SCHEMA = CsvSchema.emptySchema().withHeader();

    private final String description;
    private final Reader reader;
    private final MappingIterator<CsvTransactionRecord> records;
    private long rowNumber = 1;

    public CsvTransactionSource(String description, Reader reader) {
        this.description = description;
        this.reader = reader;
        try {
            this.records = CSV_MAPPER.readerFor(CsvTransactionRecord.class)
                    .with(SCHEMA)
                    .readValues(reader);
        } catch (IOException e) {
            throw new LedgerException(ErrorCode.DECODE_ERROR,
                    "Cannot open CSV input " + description + ": " + e.getMessage(), e);
        }
    }

    public static CsvTransactionSource open(Path path) {
        try {
            return new CsvTransactionSource(path.toString(), Files.newBufferedReader(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new LedgerException(ErrorCode.DECODE_ERROR, "Cannot read " + path + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<Transaction> next() {
        try {
            CsvTransactionRecord record;
            do {
                if (!records.hasNextValue()) {
                    return Optional.empty();
                }
                record = records.nextValue();
                rowNumber++;
            } while (record.isBlank());
            return Optional.of(record.toTransaction());
        } catch (LedgerException e) {
            throw new LedgerException(ErrorCode.DECODE_ERROR,
                    String.format("Row %d: %s", rowNumber, e.getMessage()), e);
        } catch (IOException | RuntimeException e) {
            throw new LedgerException(ErrorCode.DECODE_ERROR,
                    String.format("Row %d: %s", rowNumber + 1, e.getMessage()), e);
        }
    }

    @Override
    public String describe() {
        return description;
    }

    @Override
    public void close() {
        try {
            records.close();
            reader.close();
        } catch (IOException e) {
            log.warn("Failed to close CSV input {}: {}", description, e.getMessage());
        }
    }
}
