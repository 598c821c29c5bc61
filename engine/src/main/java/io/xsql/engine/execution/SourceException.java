package io.xsql.engine.execution;

import io.xsql.engine.XsqlException;

/**
 * The FROM clause could not be resolved: an unbound alias, an unreadable
 * file, or fragments that are not markup.
 */
public class SourceException extends XsqlException {

    public SourceException(String message) {
        super(message);
    }

    public SourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
