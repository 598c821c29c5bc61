package io.xsql.engine.execution;

import io.xsql.engine.EngineOptions;
import io.xsql.engine.document.DocumentNode;
import io.xsql.engine.query.ast.SelectItem;
import io.xsql.engine.query.ast.SelectQuery;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * AGGREGATE stage: COUNT, SUMMARIZE and TFIDF.
 *
 * Counts cover the whole candidate set, so LIMIT never changes them.
 */
final class Aggregator {

    private final EngineOptions options;

    Aggregator(EngineOptions options) {
        this.options = options;
    }

    /**
     * @param emptySource true when FRAGMENTS produced nothing; COUNT then
     *                    yields no row rather than a zero
     */
    Projection aggregate(SelectQuery query, Projection projection, boolean emptySource) {
        List<SelectItem> items = query.items();
        if (items.get(0) instanceof SelectItem.SummarizeItem) {
            return summarize(projection);
        }
        List<ProjectedRow> rows = new ArrayList<>(projection.rows());

        boolean countsOnly = items.stream().allMatch(item -> item instanceof SelectItem.CountItem);
        if (countsOnly) {
            if (emptySource) {
                return projection.withRows(List.of());
            }
            List<Value> values = new ArrayList<>(items.size());
            for (SelectItem item : items) {
                values.add(Value.of(count((SelectItem.CountItem) item, rows)));
            }
            return projection.withRows(List.of(new ProjectedRow(null, values)));
        }

        for (int i = 0; i < items.size(); i++) {
            SelectItem item = items.get(i);
            if (item instanceof SelectItem.CountItem countItem) {
                Value total = Value.of(count(countItem, rows));
                for (int r = 0; r < rows.size(); r++) {
                    rows.set(r, rows.get(r).withValue(i, total));
                }
            } else if (item instanceof SelectItem.TfidfItem tfidf) {
                fillTfidf(tfidf, i, rows);
            }
        }
        return projection.withRows(rows);
    }

    private static long count(SelectItem.CountItem item, List<ProjectedRow> rows) {
        if (item.tag() == null) {
            return rows.size();
        }
        return rows.stream()
                .filter(row -> row.anchor() != null && row.anchor().tag().equals(item.tag()))
                .count();
    }

    /**
     * Rows outside the TFIDF tags keep a null score.
     */
    private void fillTfidf(SelectItem.TfidfItem item, int column, List<ProjectedRow> rows) {
        List<Integer> members = new ArrayList<>();
        List<String> documents = new ArrayList<>();
        for (int r = 0; r < rows.size(); r++) {
            DocumentNode anchor = rows.get(r).anchor();
            if (anchor != null && (item.tags().isEmpty() || item.tags().contains(anchor.tag()))) {
                members.add(r);
                documents.add(anchor.text());
            }
        }
        List<Value> scores = new TfIdf(item, options.defaultTopTerms()).score(documents);
        for (int m = 0; m < members.size(); m++) {
            int r = members.get(m);
            rows.set(r, rows.get(r).withValue(column, scores.get(m)));
        }
    }

    /**
     * (tag, count) rows ordered by count descending, then tag.
     */
    private static Projection summarize(Projection projection) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (ProjectedRow row : projection.rows()) {
            counts.merge(row.anchor().tag(), 1L, Long::sum);
        }
        List<Map.Entry<String, Long>> entries = new ArrayList<>(counts.entrySet());
        entries.sort(Map.Entry.<String, Long>comparingByValue().reversed()
                .thenComparing(Map.Entry.<String, Long>comparingByKey(RowOrdering::compareCodePoints)));
        List<ProjectedRow> rows = new ArrayList<>(entries.size());
        for (Map.Entry<String, Long> e : entries) {
            rows.add(new ProjectedRow(null, List.of(Value.of(e.getKey()), Value.of(e.getValue()))));
        }
        return projection.withRows(rows);
    }
}
