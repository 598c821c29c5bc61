package io.xsql.engine.query.ast;

import java.math.BigDecimal;

/**
 * Literal value on the right-hand side of a comparison: 'string', 123, 45.67
 */
public record Literal(LiteralType type, String text) {

    public enum LiteralType {
        STRING, NUMBER
    }

    public static Literal string(String value) {
        return new Literal(LiteralType.STRING, value);
    }

    public static Literal number(String value) {
        return new Literal(LiteralType.NUMBER, value);
    }

    public boolean isNumber() {
        return type == LiteralType.NUMBER;
    }

    public BigDecimal numericValue() {
        return new BigDecimal(text);
    }
}
