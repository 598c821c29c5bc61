package io.xsql.engine.execution;

import io.xsql.engine.document.DocumentTree;
import io.xsql.engine.query.ast.FieldRef;
import io.xsql.engine.query.ast.OrderSpec;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * ORDER BY stage.
 *
 * Keys resolve against result columns first (names compared without
 * whitespace and case), then against node fields of each row's candidate.
 * Nulls sort last in either direction; the sort is stable.
 */
final class RowOrdering {

    private final DocumentTree tree;

    RowOrdering(DocumentTree tree) {
        this.tree = tree;
    }

    Projection sort(Projection projection, List<OrderSpec> specs) {
        Comparator<ProjectedRow> comparator = null;
        for (OrderSpec spec : specs) {
            Comparator<ProjectedRow> next = keyComparator(spec, projection.columns());
            comparator = comparator == null ? next : comparator.thenComparing(next);
        }
        List<ProjectedRow> rows = new ArrayList<>(projection.rows());
        if (comparator != null) {
            rows.sort(comparator);
        }
        return projection.withRows(rows);
    }

    private Comparator<ProjectedRow> keyComparator(OrderSpec spec, List<Column> columns) {
        Function<ProjectedRow, Value> key = resolveKey(spec.key(), columns);
        boolean descending = spec.descending();
        return (a, b) -> {
            Value left = key.apply(a);
            Value right = key.apply(b);
            if (left.isNull() || right.isNull()) {
                return Boolean.compare(left.isNull(), right.isNull());
            }
            int cmp = compareValues(left, right);
            return descending ? -cmp : cmp;
        };
    }

    private Function<ProjectedRow, Value> resolveKey(String key, List<Column> columns) {
        String wanted = normalize(key);
        for (int i = 0; i < columns.size(); i++) {
            if (normalize(columns.get(i).name()).equals(wanted)) {
                int index = i;
                return row -> row.values().get(index);
            }
        }
        FieldRef.Field field = FieldRef.Field.fromName(key);
        if (field == null) {
            throw new IllegalArgumentException("Unknown ORDER BY key '" + key
                    + "'; expected a result column or one of the node fields");
        }
        return row -> {
            if (row.anchor() == null) {
                throw new IllegalArgumentException("ORDER BY " + key
                        + " needs a node field, but rows are aggregated; order by a result column");
            }
            return NodeFields.field(tree, row.anchor(), field);
        };
    }

    static int compareValues(Value left, Value right) {
        if (left instanceof Value.NumberValue l && right instanceof Value.NumberValue r) {
            return l.value().compareTo(r.value());
        }
        if (left instanceof Value.BooleanValue l && right instanceof Value.BooleanValue r) {
            return Boolean.compare(l.value(), r.value());
        }
        return compareCodePoints(left.asText(), right.asText());
    }

    /**
     * Code point order; differs from {@link String#compareTo} for characters
     * above U+FFFF.
     */
    static int compareCodePoints(String left, String right) {
        int i = 0;
        int j = 0;
        while (i < left.length() && j < right.length()) {
            int a = left.codePointAt(i);
            int b = right.codePointAt(j);
            if (a != b) {
                return Integer.compare(a, b);
            }
            i += Character.charCount(a);
            j += Character.charCount(b);
        }
        return Integer.compare(left.length() - i, right.length() - j);
    }

    private static String normalize(String name) {
        return name.replaceAll("\\s+", "").toLowerCase(Locale.ROOT);
    }
}
