package io.xsql.engine.query.ast;

import java.util.Locale;

/**
 * Tree-navigation direction qualifying a WHERE operand.
 */
public enum Axis {
    SELF("self"),
    PARENT("parent"),
    CHILD("child"),
    ANCESTOR("ancestor"),
    DESCENDANT("descendant");

    private final String keyword;

    Axis(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    /**
     * Resolves a navigation axis name; SELF is implicit and never named.
     *
     * @return null when the name is not an axis
     */
    public static Axis fromName(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        for (Axis axis : values()) {
            if (axis != SELF && axis.keyword.equals(lower)) {
                return axis;
            }
        }
        return null;
    }
}
