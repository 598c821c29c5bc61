package io.xsql.engine.query.ast;

/**
 * Comparison operators of WHERE predicates.
 */
public enum CompareOp {
    EQ("="),
    NE("<>"),
    IN("IN"),
    REGEX("~"),
    CONTAINS("CONTAINS"),
    CONTAINS_ALL("CONTAINS ALL"),
    CONTAINS_ANY("CONTAINS ANY"),
    IS_NULL("IS NULL"),
    IS_NOT_NULL("IS NOT NULL");

    private final String symbol;

    CompareOp(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public boolean isNullTest() {
        return this == IS_NULL || this == IS_NOT_NULL;
    }

    public boolean isContains() {
        return this == CONTAINS || this == CONTAINS_ALL || this == CONTAINS_ANY;
    }
}
