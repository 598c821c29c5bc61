package io.xsql.engine.execution;

import io.xsql.engine.document.DocumentNode;
import io.xsql.engine.document.DocumentTree;
import io.xsql.engine.document.HtmlTags;
import io.xsql.engine.document.MarkupWriter;
import io.xsql.engine.query.ast.FieldRef;

/**
 * Extraction of {@link FieldRef} values from document nodes.
 *
 * Shared by WHERE evaluation, projection and ORDER BY, so a field reads the
 * same everywhere.
 */
final class NodeFields {

    private NodeFields() {
    }

    static Value value(DocumentTree tree, DocumentNode node, FieldRef ref) {
        if (ref instanceof FieldRef.NodeField nodeField) {
            return field(tree, node, nodeField.field());
        }
        if (ref instanceof FieldRef.AttributeNamed named) {
            return Value.of(node.attribute(named.name()));
        }
        if (ref instanceof FieldRef.Attributes) {
            return Value.ofStrings(node.attributes());
        }
        throw new IllegalStateException("Unknown field reference: " + ref);
    }

    static Value field(DocumentTree tree, DocumentNode node, FieldRef.Field field) {
        return switch (field) {
            case TAG -> Value.of(node.tag());
            case TEXT -> Value.of(node.text());
            case NODE_ID -> Value.of(node.id());
            case PARENT_ID -> node.hasParent() ? Value.of(node.parentId()) : Value.nullValue();
            case SIBLING_POS -> Value.of(node.siblingPos());
            case MAX_DEPTH -> Value.of(node.maxDepth());
            case DOC_ORDER -> Value.of(node.docOrder());
            case INNER_HTML -> Value.of(MarkupWriter.innerHtml(tree, node));
            case SOURCE_URI -> Value.of(tree.sourceUri());
        };
    }

    /**
     * Direct text plus the full text of inline children such as a, b or span.
     */
    static String inlineText(DocumentTree tree, DocumentNode node) {
        StringBuilder sb = new StringBuilder();
        for (DocumentNode.Content content : node.content()) {
            if (content instanceof DocumentNode.Text text) {
                sb.append(text.text());
            } else if (content instanceof DocumentNode.Element element) {
                DocumentNode child = tree.node(element.nodeId());
                if (HtmlTags.isInline(child.tag())) {
                    sb.append(child.text());
                }
            }
        }
        return sb.toString();
    }

    /**
     * Null, or an empty attribute map.
     */
    static boolean isAbsent(Value value) {
        return value.isNull()
                || (value instanceof Value.MapValue map && map.entries().isEmpty());
    }
}
