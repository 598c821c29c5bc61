package io.xsql.engine.query;

import io.xsql.engine.XsqlException;

/**
 * Exception thrown when statement text cannot be tokenized.
 */
public class LexException extends XsqlException {

    private final int offset;
    private final char character;

    public LexException(String message, int offset, char character) {
        super(message + " at offset " + offset);
        this.offset = offset;
        this.character = character;
    }

    public int getOffset() {
        return offset;
    }

    /**
     * The offending character, or {@code '\0'} when input ended early.
     */
    public char getCharacter() {
        return character;
    }
}
