package io.xsql.engine.serialization;

import io.xsql.engine.execution.Column;
import io.xsql.engine.execution.ResultSet;
import io.xsql.engine.execution.Row;
import io.xsql.engine.execution.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Parquet serializer backed by an in-memory DuckDB database.
 *
 * Rows are loaded into a temporary table and written with
 * {@code COPY ... TO ... (FORMAT PARQUET)}. int64 columns become BIGINT,
 * double columns DOUBLE, everything else VARCHAR (maps as JSON text).
 */
public final class ParquetSerializer implements ResultSerializer {

    private static final Logger logger = LoggerFactory.getLogger(ParquetSerializer.class);

    public static final ParquetSerializer INSTANCE = new ParquetSerializer();

    private static final String TABLE_NAME = "xsql_result";

    private ParquetSerializer() {
    }

    @Override
    public String formatId() {
        return "parquet";
    }

    @Override
    public void serialize(ResultSet result, OutputStream out) throws IOException {
        Path file = Files.createTempFile("xsql-", ".parquet");
        try (out) {
            Files.delete(file);
            writeFile(result, file);
            Files.copy(file, out);
        } finally {
            Files.deleteIfExists(file);
        }
    }

    /**
     * Writes the result straight to a Parquet file, replacing it.
     */
    public void writeFile(ResultSet result, Path file) throws IOException {
        try (Connection conn = DriverManager.getConnection("jdbc:duckdb:");
             Statement stmt = conn.createStatement()) {
            stmt.execute("CREATE TEMP TABLE " + TABLE_NAME + " (" + columnDefinitions(result.columns()) + ")");
            insertRows(conn, result);
            stmt.execute("COPY " + TABLE_NAME + " TO '" + file.toString().replace("'", "''")
                    + "' (FORMAT PARQUET)");
            logger.debug("Wrote {} rows as Parquet to {}", result.rowCount(), file);
        } catch (SQLException e) {
            throw new IOException("Parquet export failed: " + e.getMessage(), e);
        }
    }

    private static void insertRows(Connection conn, ResultSet result) throws SQLException {
        List<Column> columns = result.columns();
        if (columns.isEmpty() || result.isEmpty()) {
            return;
        }
        String placeholders = columns.stream().map(c -> "?").collect(Collectors.joining(", "));
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO " + TABLE_NAME + " VALUES (" + placeholders + ")")) {
            for (Row row : result) {
                for (int i = 0; i < columns.size(); i++) {
                    bind(ps, i + 1, columns.get(i), row.get(i));
                }
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    private static void bind(PreparedStatement ps, int index, Column column, Value value) throws SQLException {
        String type = column.type();
        if (value.isNull()) {
            ps.setNull(index, sqlTypeCode(type));
        } else if (Column.INT64.equals(type) && value instanceof Value.NumberValue number) {
            ps.setLong(index, number.value().longValue());
        } else if (Column.DOUBLE.equals(type) && value instanceof Value.NumberValue number) {
            ps.setDouble(index, number.value().doubleValue());
        } else {
            ps.setString(index, value.asText());
        }
    }

    private static String columnDefinitions(List<Column> columns) {
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("Cannot write a Parquet file without columns");
        }
        return columns.stream()
                .map(c -> quoteIdentifier(c.name()) + " " + sqlType(c.type()))
                .collect(Collectors.joining(", "));
    }

    private static String sqlType(String type) {
        return switch (type) {
            case Column.INT64 -> "BIGINT";
            case Column.DOUBLE -> "DOUBLE";
            default -> "VARCHAR";
        };
    }

    private static int sqlTypeCode(String type) {
        return switch (type) {
            case Column.INT64 -> Types.BIGINT;
            case Column.DOUBLE -> Types.DOUBLE;
            default -> Types.VARCHAR;
        };
    }

    private static String quoteIdentifier(String name) {
        return "\"" + name.replace("\"", "\"\"") + "\"";
    }
}
