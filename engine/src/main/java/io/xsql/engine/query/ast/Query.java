package io.xsql.engine.query.ast;

/**
 * Root of a parsed statement.
 */
public sealed interface Query extends XsqlNode
        permits SelectQuery, ShowQuery, DescribeQuery {
}
