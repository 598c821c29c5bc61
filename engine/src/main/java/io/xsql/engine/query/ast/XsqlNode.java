package io.xsql.engine.query.ast;

/**
 * Base sealed interface for all XSQL AST nodes.
 *
 * The AST is immutable and acyclic; re-parsing the same statement text
 * yields an equal tree.
 */
public sealed interface XsqlNode
        permits Query, SelectItem, Source, Expression, Operand, FieldRef, OrderSpec, OutputTarget {
}
