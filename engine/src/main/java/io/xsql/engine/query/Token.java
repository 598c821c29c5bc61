package io.xsql.engine.query;

import java.util.Locale;

/**
 * XSQL token types with pre-computed hash codes for O(1) keyword lookup.
 */
public enum Token {
    // Literals
    EOF,
    IDENTIFIER,
    STRING,             // 'string' or "string"
    INTEGER,            // 123, -4
    DECIMAL,            // 45.67

    // Keywords - statement
    SELECT, FROM, WHERE, EXCLUDE, AS,
    ORDER, BY, ASC, DESC, LIMIT,

    // Keywords - predicates
    AND, OR, IN, IS, NOT, NULL, EXISTS, CONTAINS, ALL, ANY, HAS_DIRECT_TEXT,

    // Keywords - sources and functions
    RAW, FRAGMENTS, COUNT,

    // Keywords - output
    TO, LIST, TABLE, CSV, PARQUET,

    // Keywords - meta
    SHOW, DESCRIBE,

    // Operators
    EQ,         // =
    NE,         // <> or !=
    TILDE,      // ~
    STAR,       // *
    DOT,        // .
    COMMA,      // ,
    SEMICOLON,  // ;

    // Brackets
    LPAREN,     // (
    RPAREN,     // )
    ;

    /**
     * FNV-1a 64-bit hash constants.
     */
    public static final long FNV_PRIME = 0x100000001b3L;
    public static final long FNV_OFFSET = 0xcbf29ce484222325L;

    /**
     * Pre-computed hash code for this token (lowercase).
     */
    private final long hash;

    Token() {
        this.hash = fnv1a64(this.name().toLowerCase(Locale.ROOT));
    }

    /**
     * FNV-1a 64-bit hash (case-insensitive via lowercase).
     */
    public static long fnv1a64(String s) {
        long h = FNV_OFFSET;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c >= 'A' && c <= 'Z') {
                c = (char) (c + 32);
            }
            h ^= c;
            h *= FNV_PRIME;
        }
        return h;
    }

    /**
     * Lookup keyword by hash. Returns null if not a keyword.
     */
    public static Token keyword(long hash) {
        for (Token t : KEYWORDS) {
            if (t.hash == hash) return t;
        }
        return null;
    }

    private static final Token[] KEYWORDS = {
        SELECT, FROM, WHERE, EXCLUDE, AS,
        ORDER, BY, ASC, DESC, LIMIT,
        AND, OR, IN, IS, NOT, NULL, EXISTS, CONTAINS, ALL, ANY, HAS_DIRECT_TEXT,
        RAW, FRAGMENTS, COUNT,
        TO, LIST, TABLE, CSV, PARQUET,
        SHOW, DESCRIBE
    };

    public boolean isKeyword() {
        return ordinal() >= SELECT.ordinal() && ordinal() <= DESCRIBE.ordinal();
    }

    /**
     * Human readable category used in parse diagnostics.
     */
    public String describe() {
        if (isKeyword()) {
            return "keyword " + name();
        }
        return switch (this) {
            case EOF -> "end of input";
            case IDENTIFIER -> "identifier";
            case STRING -> "string literal";
            case INTEGER, DECIMAL -> "number";
            case EQ -> "'='";
            case NE -> "'<>'";
            case TILDE -> "'~'";
            case STAR -> "'*'";
            case DOT -> "'.'";
            case COMMA -> "','";
            case SEMICOLON -> "';'";
            case LPAREN -> "'('";
            case RPAREN -> "')'";
            default -> name();
        };
    }
}
