package io.xsql.engine.execution;

/**
 * Pipeline stages of a SELECT, in execution order.
 */
public enum Stage {
    RESOLVE_SOURCE,
    FILTER,
    PROJECT,
    AGGREGATE,
    ORDER_BY,
    LIMIT,
    BIND
}
