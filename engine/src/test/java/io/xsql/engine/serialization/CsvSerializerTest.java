package io.xsql.engine.serialization;

import io.xsql.engine.execution.Column;
import io.xsql.engine.execution.ResultSet;
import io.xsql.engine.execution.Row;
import io.xsql.engine.execution.Value;
import org.junit.jupiter.api.*;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CSV Serializer Tests")
class CsvSerializerTest {

    private static String serialize(CsvSerializer serializer, ResultSet result) throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        serializer.serialize(result, out);
        return out.toString(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Header and rows end with CRLF")
    void headerAndRows() throws Exception {
        ResultSet result = new ResultSet(
                List.of(Column.string("a.href"), Column.int64("COUNT(*)")),
                List.of(Row.of(Value.of("/x"), Value.of(2)), Row.of(Value.nullValue(), Value.of(2))));

        assertEquals("a.href,COUNT(*)\r\n/x,2\r\n,2\r\n", serialize(CsvSerializer.INSTANCE, result));
        assertEquals("/x,2\r\n,2\r\n", serialize(CsvSerializer.WITHOUT_HEADER, result));
    }

    @Test
    @DisplayName("Fields with delimiters, quotes or newlines are quoted")
    void escaping() {
        assertEquals("plain", CsvSerializer.escapeField("plain"));
        assertEquals("\"a,b\"", CsvSerializer.escapeField("a,b"));
        assertEquals("\"say \"\"hi\"\"\"", CsvSerializer.escapeField("say \"hi\""));
        assertEquals("\"line\nbreak\"", CsvSerializer.escapeField("line\nbreak"));
        assertEquals("", CsvSerializer.escapeField(null));
    }

    @Test
    @DisplayName("Maps are written as JSON text")
    void mapsAsJson() throws Exception {
        ResultSet result = new ResultSet(
                List.of(new Column("attributes", Column.STRING_MAP)),
                List.of(Row.of(Value.ofStrings(Map.of("id", "x")))));

        assertEquals("attributes\r\n\"{\"\"id\"\":\"\"x\"\"}\"\r\n", serialize(CsvSerializer.INSTANCE, result));
    }

    @Test
    @DisplayName("Empty result still has a header")
    void emptyResult() throws Exception {
        assertEquals("tag\r\n", serialize(CsvSerializer.INSTANCE, ResultSet.empty(List.of(Column.string("tag")))));
    }
}
