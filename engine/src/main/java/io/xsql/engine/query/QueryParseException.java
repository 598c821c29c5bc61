package io.xsql.engine.query;

import io.xsql.engine.XsqlException;

/**
 * Exception thrown when a statement does not match the XSQL grammar.
 */
public class QueryParseException extends XsqlException {

    private final int offset;
    private final String expected;
    private final String found;

    public QueryParseException(String message, int offset, String expected, String found) {
        super(message + " at offset " + offset);
        this.offset = offset;
        this.expected = expected;
        this.found = found;
    }

    public int getOffset() {
        return offset;
    }

    public String getExpected() {
        return expected;
    }

    public String getFound() {
        return found;
    }

    /**
     * Renders the statement with a caret under the failing offset.
     */
    public String caret(String statement) {
        int lineStart = statement.lastIndexOf('\n', offset - 1) + 1;
        int lineEnd = statement.indexOf('\n', offset);
        if (lineEnd < 0) {
            lineEnd = statement.length();
        }
        String line = statement.substring(lineStart, lineEnd);
        return line + "\n" + " ".repeat(Math.max(0, offset - lineStart)) + "^";
    }
}
