package io.xsql.engine.query.ast;

import java.util.Locale;

/**
 * What an operand or projection reads from a node.
 *
 * Each variant has exactly one extraction rule, so there is no probing of
 * node properties by name at evaluation time.
 */
public sealed interface FieldRef extends XsqlNode
        permits FieldRef.NodeField, FieldRef.Attributes, FieldRef.AttributeNamed {

    /**
     * Canonical text of the reference, used for column names.
     */
    String display();

    /**
     * Resolves a bare field name: a node field, {@code attributes}, or else
     * the attribute of that name.
     */
    static FieldRef of(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        if (lower.equals("attributes")) {
            return Attributes.INSTANCE;
        }
        Field field = Field.fromName(lower);
        if (field != null) {
            return new NodeField(field);
        }
        return new AttributeNamed(lower);
    }

    /**
     * A structural node field such as tag, text or node_id.
     */
    record NodeField(Field field) implements FieldRef {
        @Override
        public String display() {
            return field.columnName();
        }
    }

    /**
     * The full attribute mapping of a node.
     */
    record Attributes() implements FieldRef {
        public static final Attributes INSTANCE = new Attributes();

        @Override
        public String display() {
            return "attributes";
        }
    }

    /**
     * One named attribute; absent attributes read as null.
     */
    record AttributeNamed(String name) implements FieldRef {
        @Override
        public String display() {
            return name;
        }
    }

    enum Field {
        TAG("tag", "string"),
        TEXT("text", "string"),
        NODE_ID("node_id", "int64"),
        PARENT_ID("parent_id", "int64"),
        SIBLING_POS("sibling_pos", "int64"),
        MAX_DEPTH("max_depth", "int64"),
        DOC_ORDER("doc_order", "int64"),
        INNER_HTML("inner_html", "string"),
        SOURCE_URI("source_uri", "string");

        private final String columnName;
        private final String type;

        Field(String columnName, String type) {
            this.columnName = columnName;
            this.type = type;
        }

        public String columnName() {
            return columnName;
        }

        public String type() {
            return type;
        }

        public boolean isNumeric() {
            return "int64".equals(type);
        }

        public static Field fromName(String name) {
            for (Field f : values()) {
                if (f.columnName.equalsIgnoreCase(name)) {
                    return f;
                }
            }
            return null;
        }
    }
}
