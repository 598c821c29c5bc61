package io.xsql.engine.execution;

import io.xsql.engine.document.DocumentNode;
import io.xsql.engine.document.DocumentTree;
import io.xsql.engine.query.ast.Expression;
import io.xsql.engine.query.ast.SelectItem;
import io.xsql.engine.query.ast.SelectQuery;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects the texts a FLATTEN_TEXT item spreads over its columns.
 *
 * Without a depth every descendant is visited in document order and blank
 * texts are skipped. With a depth only nodes exactly that many levels below
 * the base node are visited, and blanks keep their slot.
 */
final class TextFlattener {

    private final DocumentTree tree;
    private final FilterEvaluator filter;
    private final Integer depth;
    private final List<Expression.Comparison> descendantFilters;

    TextFlattener(DocumentTree tree, FilterEvaluator filter, SelectQuery query) {
        this.tree = tree;
        this.filter = filter;
        this.depth = flattenItem(query).depth();
        this.descendantFilters = query.where() == null
                ? List.of()
                : FilterEvaluator.descendantFilters(query.where());
    }

    private static SelectItem.FlattenTextItem flattenItem(SelectQuery query) {
        for (SelectItem item : query.items()) {
            if (item instanceof SelectItem.FlattenTextItem flatten) {
                return flatten;
            }
        }
        throw new IllegalArgumentException("Query has no FLATTEN_TEXT item");
    }

    List<String> flatten(DocumentNode base) {
        List<String> values = new ArrayList<>();
        for (DocumentNode node : visited(base)) {
            if (!passesFilters(node)) {
                continue;
            }
            String text = normalize(node.directText());
            if (text.isEmpty()) {
                text = normalize(NodeFields.inlineText(tree, node));
            }
            if (depth == null && text.isEmpty()) {
                continue;
            }
            values.add(text);
        }
        return values;
    }

    private List<DocumentNode> visited(DocumentNode base) {
        if (depth == null) {
            return tree.descendants(base);
        }
        List<DocumentNode> level = List.of(base);
        for (int i = 0; i < depth && !level.isEmpty(); i++) {
            List<DocumentNode> next = new ArrayList<>();
            for (DocumentNode node : level) {
                next.addAll(tree.children(node));
            }
            level = next;
        }
        return level;
    }

    private boolean passesFilters(DocumentNode node) {
        for (Expression.Comparison cmp : descendantFilters) {
            if (!filter.holdsFor(cmp, node)) {
                return false;
            }
        }
        return true;
    }

    static String normalize(String text) {
        return text.trim().replaceAll("\\s+", " ");
    }
}
