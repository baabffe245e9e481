package com.fintech.ledger.infrastructure.csv;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.fintech.ledger.domain.model.AccountSnapshot;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.util.Map;
import java.util.SortedMap;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * Renders the final account balances as CSV, one row per client in ascending client id order.
 */
@Component
public class AccountReportWriter {

    private static final CsvMapper CSV_MAPPER = CsvMapper.builder()
            .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
            .build();
    private static final CsvSchema SCHEMA = CSV_MAPPER.schemaFor(ReportRow.class).withHeader();

    /**
     * Writes the header and rows. The target is flushed but left open.
     */
    public void write(Map<Integer, AccountSnapshot> accounts, Writer out) throws IOException {
        SortedMap<Integer, AccountSnapshot> ordered = new TreeMap<>(accounts);

        if (ordered.isEmpty()) {
            // the CSV generator only emits the header together with the first row
            out.write(headerLine());
            out.flush();
            return;
        }

        try (SequenceWriter rows = CSV_MAPPER.writer(SCHEMA).writeValues(out)) {
            for (AccountSnapshot account : ordered.values()) {
                rows.write(ReportRow.from(account));
            }
        }
        out.flush();
    }

    private static String headerLine() {
        StringJoiner header = new StringJoiner(String.valueOf(SCHEMA.getColumnSeparator()));
        for (CsvSchema.Column column : SCHEMA) {
            header.add(column.getName());
        }
        return header + new String(SCHEMA.getLineSeparator());
    }

    /**
     * Plain notation with at least one fractional digit: {@code 5} renders as {@code 5.0}.
     */
    static String formatDecimal(BigDecimal value) {
        if (value.scale() <= 0) {
            return value.setScale(1).toPlainString();
        }
        return value.toPlainString();
    }

    @Value
    @JsonPropertyOrder({"client", "available", "held", "total", "locked"})
    static class ReportRow {
        int client;
        String available;
        String held;
        String total;
        boolean locked;

        static ReportRow from(AccountSnapshot account) {
            return new ReportRow(
                    account.getClient(),
                    formatDecimal(account.getAvailable()),
                    formatDecimal(account.getHeld()),
                    formatDecimal(account.getTotal()),
                    account.isLocked());
        }
    }
}
