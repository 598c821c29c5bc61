package io.xsql.engine.serialization;

import io.xsql.engine.execution.Column;
import io.xsql.engine.execution.ResultSet;
import io.xsql.engine.execution.Row;
import io.xsql.engine.execution.Value;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;

/**
 * CSV serializer for query results.
 *
 * Produces RFC 4180 compliant CSV with CRLF line endings.
 * Values containing commas, quotes, or newlines are quoted; nulls are empty
 * fields; maps and lists are written as JSON text.
 */
public final class CsvSerializer implements ResultSerializer {

    public static final CsvSerializer INSTANCE = new CsvSerializer(true);

    /**
     * Rows only, for {@code TO TABLE(NOHEADER, EXPORT=...)}.
     */
    public static final CsvSerializer WITHOUT_HEADER = new CsvSerializer(false);

    private static final char DELIMITER = ',';
    private static final char QUOTE = '"';
    private static final String LINE_ENDING = "\r\n";

    private final boolean header;

    private CsvSerializer(boolean header) {
        this.header = header;
    }

    @Override
    public String formatId() {
        return "csv";
    }

    @Override
    public void serialize(ResultSet result, OutputStream out) throws IOException {
        try (Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8)) {
            if (header) {
                writeHeader(writer, result.columns());
            }
            for (Row row : result) {
                writeRow(writer, row);
            }
        }
    }

    private void writeHeader(Writer writer, List<Column> columns) throws IOException {
        String line = columns.stream()
                .map(col -> escapeField(col.name()))
                .collect(Collectors.joining(String.valueOf(DELIMITER)));
        writer.write(line);
        writer.write(LINE_ENDING);
    }

    private void writeRow(Writer writer, Row row) throws IOException {
        List<Value> values = row.values();
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                writer.write(DELIMITER);
            }
            writer.write(escapeField(values.get(i).asText()));
        }
        writer.write(LINE_ENDING);
    }

    static String escapeField(String value) {
        if (value == null) {
            return "";
        }

        boolean needsQuoting = value.indexOf(DELIMITER) >= 0
                || value.indexOf(QUOTE) >= 0
                || value.indexOf('\n') >= 0
                || value.indexOf('\r') >= 0;

        if (!needsQuoting) {
            return value;
        }

        // Escape quotes by doubling them and wrap in quotes
        StringBuilder sb = new StringBuilder(value.length() + 2);
        sb.append(QUOTE);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == QUOTE) {
                sb.append(QUOTE);
            }
            sb.append(c);
        }
        sb.append(QUOTE);
        return sb.toString();
    }
}
