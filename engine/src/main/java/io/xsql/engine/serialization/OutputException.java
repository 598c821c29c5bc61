package io.xsql.engine.serialization;

import io.xsql.engine.XsqlException;

import java.nio.file.Path;

/**
 * A result could not be written to its TO CSV / TO PARQUET / EXPORT path.
 */
public class OutputException extends XsqlException {

    private final Path path;

    public OutputException(Path path, Throwable cause) {
        super("Cannot write " + path + ": " + cause.getMessage(), cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
