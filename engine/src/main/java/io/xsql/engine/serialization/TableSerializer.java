package io.xsql.engine.serialization;

import io.xsql.engine.execution.ResultSet;
import io.xsql.engine.execution.Row;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * ASCII table rendering of a result, as produced by {@code TO TABLE()}.
 *
 * <pre>
 * +------+-------+
 * | tag  | count |
 * +------+-------+
 * | div  | 3     |
 * +------+-------+
 * </pre>
 *
 * Nulls render as {@code NULL}; lines end with '\n'.
 */
public final class TableSerializer implements ResultSerializer {

    public static final TableSerializer INSTANCE = new TableSerializer(true);
    public static final TableSerializer WITHOUT_HEADER = new TableSerializer(false);

    private static final String NULL_TEXT = "NULL";

    private final boolean header;

    private TableSerializer(boolean header) {
        this.header = header;
    }

    public static TableSerializer of(boolean header) {
        return header ? INSTANCE : WITHOUT_HEADER;
    }

    @Override
    public String formatId() {
        return "table";
    }

    @Override
    public void serialize(ResultSet result, OutputStream out) throws IOException {
        try (out) {
            out.write(render(result).getBytes(StandardCharsets.UTF_8));
        }
    }

    public String render(ResultSet result) {
        List<String> headers = result.columnNames();
        int colCount = headers.size();
        int[] widths = new int[colCount];
        if (header) {
            for (int i = 0; i < colCount; i++) widths[i] = headers.get(i).length();
        }
        for (Row r : result) {
            for (int i = 0; i < colCount; i++) {
                String s = cell(r, i);
                if (s.length() > widths[i]) widths[i] = s.length();
            }
        }

        StringBuilder sb = new StringBuilder();
        String divLine = buildDivider(widths);
        sb.append(divLine).append('\n');
        if (header) {
            sb.append(buildLine(headers.toArray(new String[0]), widths)).append('\n');
            sb.append(divLine).append('\n');
        }
        for (Row r : result) {
            String[] cells = new String[colCount];
            for (int i = 0; i < colCount; i++) cells[i] = cell(r, i);
            sb.append(buildLine(cells, widths)).append('\n');
        }
        if (!result.isEmpty()) {
            sb.append(divLine).append('\n');
        }
        return sb.toString();
    }

    private static String cell(Row row, int index) {
        String s = row.get(index).asText();
        return s == null ? NULL_TEXT : s.replace('\n', ' ').replace('\r', ' ');
    }

    private static String buildDivider(int[] widths) {
        StringBuilder divider = new StringBuilder();
        divider.append('+');
        for (int w : widths) {
            for (int k = 0; k < w + 2; k++) divider.append('-');
            divider.append('+');
        }
        return divider.toString();
    }

    private static String buildLine(String[] cells, int[] widths) {
        StringBuilder sb = new StringBuilder();
        sb.append('|');
        for (int i = 0; i < cells.length; i++) {
            sb.append(' ').append(pad(cells[i], widths[i])).append(' ').append('|');
        }
        return sb.toString();
    }

    private static String pad(String s, int width) {
        if (s.length() >= width) return s;
        StringBuilder sb = new StringBuilder(width);
        sb.append(s);
        for (int i = s.length(); i < width; i++) sb.append(' ');
        return sb.toString();
    }
}
