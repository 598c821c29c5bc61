package io.xsql.engine.execution;

import java.util.List;

/**
 * Output of the PROJECT stage; aggregation, ordering and limiting derive new
 * projections from it.
 */
record Projection(List<Column> columns, List<ProjectedRow> rows) {

    Projection {
        columns = List.copyOf(columns);
        rows = List.copyOf(rows);
    }

    Projection withRows(List<ProjectedRow> newRows) {
        return new Projection(columns, newRows);
    }

    ResultSet toResultSet() {
        return new ResultSet(columns, rows.stream().map(ProjectedRow::toRow).toList());
    }
}
