package io.xsql.engine.query.ast;

/**
 * Left-hand side of a comparison: {@code [axis.]field_ref}.
 */
public record Operand(Axis axis, FieldRef field) implements XsqlNode {

    public static Operand self(FieldRef field) {
        return new Operand(Axis.SELF, field);
    }

    public String display() {
        String base = field instanceof FieldRef.AttributeNamed named
                ? "attributes." + named.name()
                : field.display();
        return axis == Axis.SELF ? base : axis.keyword() + "." + base;
    }
}
