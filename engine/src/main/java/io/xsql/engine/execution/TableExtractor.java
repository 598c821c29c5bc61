package io.xsql.engine.execution;

import io.xsql.engine.document.DocumentNode;
import io.xsql.engine.document.DocumentTree;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads the cells of HTML tables into rows: one row per {@code tr}, one
 * value per {@code td} or {@code th}. Rows of nested tables belong to the
 * nested table only.
 */
final class TableExtractor {

    private final DocumentTree tree;

    TableExtractor(DocumentTree tree) {
        this.tree = tree;
    }

    /**
     * @param header take column names from the first row instead of
     *               {@code col_1..col_n}
     */
    Projection extract(List<DocumentNode> tables, boolean header) {
        List<DocumentNode> rowNodes = new ArrayList<>();
        List<List<String>> cells = new ArrayList<>();
        for (DocumentNode table : tables) {
            for (DocumentNode row : tree.descendants(table)) {
                if (row.tag().equals("tr") && owningTable(row) == table) {
                    rowNodes.add(row);
                    cells.add(cellTexts(row));
                }
            }
        }

        int width = 0;
        for (List<String> row : cells) {
            width = Math.max(width, row.size());
        }

        List<Column> columns = new ArrayList<>(width);
        int firstRow = 0;
        if (header && !cells.isEmpty()) {
            List<String> names = cells.get(0);
            Set<String> seen = new HashSet<>();
            for (int i = 0; i < width; i++) {
                String name = i < names.size() && !names.get(i).isEmpty() ? names.get(i) : "col_" + (i + 1);
                String unique = name;
                for (int n = 2; !seen.add(unique); n++) {
                    unique = name + "_" + n;
                }
                columns.add(Column.string(unique));
            }
            firstRow = 1;
        } else {
            for (int i = 0; i < width; i++) {
                columns.add(Column.string("col_" + (i + 1)));
            }
        }

        List<ProjectedRow> rows = new ArrayList<>();
        for (int r = firstRow; r < cells.size(); r++) {
            List<String> row = cells.get(r);
            List<Value> values = new ArrayList<>(width);
            for (int i = 0; i < width; i++) {
                values.add(i < row.size() ? Value.of(row.get(i)) : Value.nullValue());
            }
            rows.add(new ProjectedRow(rowNodes.get(r), values));
        }
        return new Projection(columns, rows);
    }

    private DocumentNode owningTable(DocumentNode node) {
        DocumentNode current = tree.parent(node);
        while (current != null && !current.tag().equals("table")) {
            current = tree.parent(current);
        }
        return current;
    }

    private List<String> cellTexts(DocumentNode row) {
        List<String> out = new ArrayList<>();
        for (DocumentNode cell : tree.children(row)) {
            if (cell.tag().equals("td") || cell.tag().equals("th")) {
                out.add(normalize(cell.text()));
            }
        }
        return out;
    }

    private static String normalize(String text) {
        return text.trim().replaceAll("\\s+", " ");
    }
}
