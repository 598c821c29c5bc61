package io.xsql.engine.serialization;

import io.xsql.engine.execution.ResultSet;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Interface for serializing query results to various output formats.
 */
public interface ResultSerializer {

    /**
     * Returns the format identifier (e.g., "csv", "table", "parquet").
     */
    String formatId();

    /**
     * Serializes a result to the output stream. Implementations may close
     * the stream.
     */
    void serialize(ResultSet result, OutputStream out) throws IOException;
}
