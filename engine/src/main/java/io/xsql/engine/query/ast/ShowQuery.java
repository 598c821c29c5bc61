package io.xsql.engine.query.ast;

/**
 * SHOW INPUT | INPUTS | FUNCTIONS | AXES | OPERATORS
 */
public record ShowQuery(Target target) implements Query {

    public enum Target {
        INPUT, INPUTS, FUNCTIONS, AXES, OPERATORS
    }
}
