package io.xsql.engine.query.ast;

import java.util.List;

/**
 * Boolean expression of a WHERE clause.
 */
public sealed interface Expression extends XsqlNode
        permits Expression.Binary, Expression.Comparison, Expression.Exists, Expression.DirectText {

    // ==================== Factory Methods ====================

    static Expression and(Expression left, Expression right) {
        return new Binary(BoolOp.AND, left, right);
    }

    static Expression or(Expression left, Expression right) {
        return new Binary(BoolOp.OR, left, right);
    }

    static Comparison compare(Operand operand, CompareOp op, Literal... values) {
        return new Comparison(operand, op, List.of(values));
    }

    // ==================== AST Node Types ====================

    /**
     * left AND right, left OR right
     */
    record Binary(BoolOp op, Expression left, Expression right) implements Expression {
    }

    enum BoolOp {
        AND, OR
    }

    /**
     * operand op values, e.g. {@code attributes.href <> ''}, {@code tag IN ('a', 'b')}
     *
     * @param values empty for IS [NOT] NULL
     */
    record Comparison(Operand operand, CompareOp op, List<Literal> values) implements Expression {
        public Comparison {
            values = List.copyOf(values);
        }
    }

    /**
     * EXISTS(axis [WHERE expr]); {@code where} is null when absent.
     */
    record Exists(Axis axis, Expression where) implements Expression {
    }

    /**
     * {@code [axis.]tag HAS_DIRECT_TEXT ['needle']}
     *
     * @param tag    required tag of the tested node, null for any
     * @param needle case-insensitive substring, null to test for non-blank text
     */
    record DirectText(Axis axis, String tag, String needle) implements Expression {
    }
}
