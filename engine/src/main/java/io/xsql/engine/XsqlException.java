package io.xsql.engine;

/**
 * Base class for every failure raised by the XSQL engine.
 *
 * Unchecked, like the parser and executor exceptions built on it.
 */
public abstract class XsqlException extends RuntimeException {

    protected XsqlException(String message) {
        super(message);
    }

    protected XsqlException(String message, Throwable cause) {
        super(message, cause);
    }
}
