package io.xsql.engine.serialization;

import io.xsql.engine.execution.Column;
import io.xsql.engine.execution.ResultSet;
import io.xsql.engine.execution.Row;
import io.xsql.engine.execution.Value;
import org.junit.jupiter.api.*;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Table Serializer Tests")
class TableSerializerTest {

    private final ResultSet result = new ResultSet(
            List.of(Column.string("tag"), Column.int64("count")),
            List.of(Row.of(Value.of("div"), Value.of(3)), Row.of(Value.of("blockquote"), Value.nullValue())));

    @Test
    @DisplayName("Header row between dividers, columns padded to the widest cell")
    void withHeader() {
        String expected = """
                +------------+-------+
                | tag        | count |
                +------------+-------+
                | div        | 3     |
                | blockquote | NULL  |
                +------------+-------+
                """;
        assertEquals(expected, TableSerializer.INSTANCE.render(result));
    }

    @Test
    @DisplayName("Without header the widths follow the data only")
    void withoutHeader() {
        String expected = """
                +------------+------+
                | div        | 3    |
                | blockquote | NULL |
                +------------+------+
                """;
        assertEquals(expected, TableSerializer.of(false).render(result));
    }

    @Test
    @DisplayName("Empty result renders the header block only")
    void empty() {
        String expected = """
                +-----+
                | tag |
                +-----+
                """;
        assertEquals(expected, TableSerializer.INSTANCE.render(ResultSet.empty(List.of(Column.string("tag")))));
    }

    @Test
    @DisplayName("Newlines inside cells are flattened")
    void newlines() {
        ResultSet multiline = new ResultSet(List.of(Column.string("text")), List.of(Row.of(Value.of("a\nb"))));
        assertTrue(TableSerializer.INSTANCE.render(multiline).contains("| a b  |"));
    }
}
