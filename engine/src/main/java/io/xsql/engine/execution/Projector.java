package io.xsql.engine.execution;

import io.xsql.engine.document.DocumentNode;
import io.xsql.engine.document.DocumentTree;
import io.xsql.engine.document.MarkupWriter;
import io.xsql.engine.query.QueryParser;
import io.xsql.engine.query.ast.FieldRef;
import io.xsql.engine.query.ast.OutputTarget;
import io.xsql.engine.query.ast.SelectItem;
import io.xsql.engine.query.ast.SelectQuery;

import java.util.ArrayList;
import java.util.List;

/**
 * PROJECT stage: turns each candidate node into a row of values.
 *
 * Aggregate items get a null placeholder here and are filled in by
 * {@link Aggregator}. Projection only reads the tree.
 */
final class Projector {

    private final DocumentTree tree;
    private final FilterEvaluator filter;

    Projector(DocumentTree tree, FilterEvaluator filter) {
        this.tree = tree;
        this.filter = filter;
    }

    Projection project(SelectQuery query, List<DocumentNode> candidates) {
        if (isTableExtraction(query)) {
            boolean header = ((OutputTarget.ToTable) query.output()).header();
            return new TableExtractor(tree).extract(candidates, header);
        }
        List<Column> columns = columns(query);
        List<ProjectedRow> rows = new ArrayList<>(candidates.size());
        if (query.isTagOnly()) {
            List<String> names = nodeColumnNames(query);
            for (DocumentNode node : candidates) {
                List<Value> values = new ArrayList<>(names.size());
                for (String name : names) {
                    values.add(NodeFields.value(tree, node, FieldRef.of(name)));
                }
                rows.add(new ProjectedRow(node, values));
            }
            return new Projection(columns, rows);
        }
        TextFlattener flattener = query.isFlatten() ? new TextFlattener(tree, filter, query) : null;
        for (DocumentNode node : candidates) {
            List<Value> values = new ArrayList<>(columns.size());
            List<String> flattened = flattener != null ? flattener.flatten(node) : List.of();
            for (SelectItem item : query.items()) {
                if (item instanceof SelectItem.SummarizeItem) {
                    values.add(Value.nullValue());
                    values.add(Value.nullValue());
                } else if (item instanceof SelectItem.FlattenTextItem flatten) {
                    values.add(flatten.index() < flattened.size()
                            ? Value.of(flattened.get(flatten.index()))
                            : Value.nullValue());
                } else {
                    values.add(evaluate(item, node));
                }
            }
            rows.add(new ProjectedRow(node, values));
        }
        return new Projection(columns, rows);
    }

    /**
     * {@code SELECT table ... TO TABLE(...)} reads the cells of HTML tables.
     */
    static boolean isTableExtraction(SelectQuery query) {
        return query.output() instanceof OutputTarget.ToTable
                && query.items().size() == 1
                && query.items().get(0) instanceof SelectItem.TagRef ref
                && "table".equals(ref.tag());
    }

    // ==================== Columns ====================

    static List<Column> columns(SelectQuery query) {
        List<Column> columns = new ArrayList<>();
        if (query.isTagOnly()) {
            for (String name : nodeColumnNames(query)) {
                columns.add(nodeColumn(name));
            }
            return columns;
        }
        for (SelectItem item : query.items()) {
            if (item instanceof SelectItem.SummarizeItem) {
                columns.add(Column.string("tag"));
                columns.add(Column.int64("count"));
            } else {
                columns.add(new Column(item.column(), typeOf(item)));
            }
        }
        return columns;
    }

    private static List<String> nodeColumnNames(SelectQuery query) {
        List<String> names = new ArrayList<>(QueryParser.NODE_COLUMNS);
        names.removeAll(query.exclude());
        return names;
    }

    private static Column nodeColumn(String name) {
        FieldRef ref = FieldRef.of(name);
        if (ref instanceof FieldRef.NodeField nodeField) {
            return new Column(name, nodeField.field().type());
        }
        return new Column(name, Column.STRING_MAP);
    }

    private static String typeOf(SelectItem item) {
        if (item instanceof SelectItem.FieldItem fieldItem) {
            FieldRef field = fieldItem.field();
            if (field instanceof FieldRef.NodeField nodeField) {
                return nodeField.field().type();
            }
            return field instanceof FieldRef.Attributes ? Column.STRING_MAP : Column.STRING;
        }
        if (item instanceof SelectItem.CountItem) {
            return Column.INT64;
        }
        if (item instanceof SelectItem.TfidfItem tfidf) {
            return tfidf.scoresTerms() ? Column.DOUBLE : Column.DOUBLE_MAP;
        }
        return Column.STRING;
    }

    // ==================== Values ====================

    private Value evaluate(SelectItem item, DocumentNode candidate) {
        if (item instanceof SelectItem.FieldItem fieldItem) {
            DocumentNode bound = bind(candidate, fieldItem.tag());
            if (bound == null) {
                return Value.nullValue();
            }
            Value value = NodeFields.value(tree, bound, fieldItem.field());
            return fieldItem.trim() ? trim(value) : value;
        }
        if (item instanceof SelectItem.TextItem textItem) {
            DocumentNode bound = bind(candidate, textItem.tag());
            if (bound == null) {
                return Value.nullValue();
            }
            String text = NodeFields.inlineText(tree, bound);
            return Value.of(textItem.trim() ? text.trim() : text);
        }
        if (item instanceof SelectItem.InnerHtmlItem htmlItem) {
            DocumentNode bound = bind(candidate, htmlItem.tag());
            if (bound == null) {
                return Value.nullValue();
            }
            return Value.of(innerHtml(bound, htmlItem));
        }
        if (item.isAggregate()) {
            return Value.nullValue();
        }
        throw new IllegalStateException("Cannot project " + item + " next to other items");
    }

    /**
     * The candidate itself when the tag matches (or no tag is given), else its
     * first descendant with that tag.
     */
    private DocumentNode bind(DocumentNode candidate, String tag) {
        if (tag == null || candidate.tag().equals(tag)) {
            return candidate;
        }
        return tree.firstDescendant(candidate, tag);
    }

    private String innerHtml(DocumentNode node, SelectItem.InnerHtmlItem item) {
        String html = MarkupWriter.innerHtml(tree, node);
        if (!item.raw()) {
            html = MarkupWriter.minify(html);
        }
        if (item.maxChars() != null && html.length() > item.maxChars()) {
            html = html.substring(0, item.maxChars());
        }
        return item.trim() ? html.trim() : html;
    }

    private static Value trim(Value value) {
        if (value instanceof Value.StringValue s) {
            return Value.of(s.value().trim());
        }
        return value;
    }
}
