package io.xsql.engine.execution;

import io.xsql.engine.document.DocumentNode;

import java.util.ArrayList;
import java.util.List;

/**
 * A row between the PROJECT and BIND stages: its values plus the candidate
 * node it came from, which ORDER BY may still read node fields from.
 *
 * @param anchor null for rows produced by aggregation
 */
record ProjectedRow(DocumentNode anchor, List<Value> values) {

    ProjectedRow {
        values = List.copyOf(values);
    }

    ProjectedRow withValue(int index, Value value) {
        List<Value> copy = new ArrayList<>(values);
        copy.set(index, value);
        return new ProjectedRow(anchor, copy);
    }

    Row toRow() {
        return new Row(values);
    }
}
