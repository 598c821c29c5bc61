package io.xsql.engine.execution;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * A fully materialized, immutable query result.
 *
 * Columns are in select-list order; rows are in pipeline order.
 *
 * @param rendering text produced by {@code TO TABLE(...)}, or null
 */
public record ResultSet(
        List<Column> columns,
        List<Row> rows,
        String rendering) implements Iterable<Row> {

    public ResultSet {
        columns = List.copyOf(columns);
        rows = List.copyOf(rows);
    }

    public ResultSet(List<Column> columns, List<Row> rows) {
        this(columns, rows, null);
    }

    public static ResultSet empty(List<Column> columns) {
        return new ResultSet(columns, List.of(), null);
    }

    public ResultSet withRendering(String text) {
        return new ResultSet(columns, rows, text);
    }

    public int rowCount() {
        return rows.size();
    }

    public int columnCount() {
        return columns.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    @Override
    public Iterator<Row> iterator() {
        return rows.iterator();
    }

    public Stream<Row> stream() {
        return rows.stream();
    }

    public List<String> columnNames() {
        return columns.stream().map(Column::name).collect(Collectors.toList());
    }

    /**
     * Column names joined by commas, e.g. {@code title.text,COUNT(*)}.
     */
    public String headerLine() {
        return String.join(",", columnNames());
    }

    /**
     * @return the column index, or -1
     */
    public int columnIndex(String columnName) {
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).name().equals(columnName)) {
                return i;
            }
        }
        return -1;
    }

    public Value getValue(int rowIndex, int columnIndex) {
        return rows.get(rowIndex).get(columnIndex);
    }

    public Value getValue(int rowIndex, String columnName) {
        int index = columnIndex(columnName);
        if (index < 0) {
            throw new IllegalArgumentException("Column not found: " + columnName);
        }
        return rows.get(rowIndex).get(index);
    }

    /**
     * One row as an ordered column name to value mapping.
     */
    public Map<String, Value> rowAsMap(int rowIndex) {
        Map<String, Value> out = new LinkedHashMap<>();
        Row row = rows.get(rowIndex);
        for (int i = 0; i < columns.size(); i++) {
            out.put(columns.get(i).name(), row.get(i));
        }
        return out;
    }

    /**
     * Plain text of one column across all rows; nulls stay null.
     */
    public List<String> columnText(String columnName) {
        int index = columnIndex(columnName);
        if (index < 0) {
            throw new IllegalArgumentException("Column not found: " + columnName);
        }
        List<String> out = new ArrayList<>(rows.size());
        for (Row row : rows) {
            out.add(row.get(index).asText());
        }
        return out;
    }
}
