package io.xsql.engine.query.ast;

/**
 * DESCRIBE DOC | DOCUMENT | LANGUAGE
 */
public record DescribeQuery(Target target) implements Query {

    public enum Target {
        DOCUMENT, LANGUAGE
    }
}
