package io.xsql.engine.query.ast;

/**
 * ORDER BY key [ASC|DESC]
 *
 * The key names a result column (or its alias) or a node field.
 */
public record OrderSpec(String key, Direction direction) implements XsqlNode {

    public enum Direction {
        ASC, DESC
    }

    public static OrderSpec asc(String key) {
        return new OrderSpec(key, Direction.ASC);
    }

    public static OrderSpec desc(String key) {
        return new OrderSpec(key, Direction.DESC);
    }

    public boolean descending() {
        return direction == Direction.DESC;
    }
}
