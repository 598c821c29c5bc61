package io.xsql.engine.execution;

import io.xsql.engine.XsqlException;

/**
 * A WHERE predicate that cannot be evaluated, such as a comparison on the
 * whole attribute map or an invalid regular expression.
 */
public class FilterException extends XsqlException {

    public FilterException(String message) {
        super(message);
    }

    public FilterException(String message, Throwable cause) {
        super(message, cause);
    }
}
