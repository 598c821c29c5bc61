package io.xsql.engine.document;

import java.util.List;
import java.util.Map;

/**
 * One element of a {@link DocumentTree}.
 *
 * Nodes are immutable and refer to their parent and children by index into
 * the owning tree, never by reference. Navigation goes through the tree.
 */
public final class DocumentNode {

    /**
     * Parent index of a root node.
     */
    public static final int NO_PARENT = -1;

    /**
     * Ordered node content: text runs interleaved with child elements.
     */
    public sealed interface Content permits Text, Element {
    }

    public record Text(String text) implements Content {
    }

    public record Element(int nodeId) implements Content {
    }

    private final int id;
    private final String tag;
    private final Map<String, String> attributes;
    private final List<Content> content;
    private final List<Integer> childIds;
    private final int parentId;
    private final int siblingPos;
    private final int maxDepth;
    private final int subtreeEnd;
    private final String directText;
    private final String text;

    DocumentNode(int id, String tag, Map<String, String> attributes, List<Content> content,
                 List<Integer> childIds, int parentId, int siblingPos, int maxDepth, int subtreeEnd,
                 String directText, String text) {
        this.id = id;
        this.tag = tag;
        this.attributes = attributes;
        this.content = content;
        this.childIds = childIds;
        this.parentId = parentId;
        this.siblingPos = siblingPos;
        this.maxDepth = maxDepth;
        this.subtreeEnd = subtreeEnd;
        this.directText = directText;
        this.text = text;
    }

    /**
     * Preorder index; also the node_id column.
     */
    public int id() {
        return id;
    }

    public int docOrder() {
        return id;
    }

    /**
     * Lowercase tag name.
     */
    public String tag() {
        return tag;
    }

    /**
     * Attributes in source order; names are lowercase.
     */
    public Map<String, String> attributes() {
        return attributes;
    }

    /**
     * @return the attribute value, or null when absent
     */
    public String attribute(String name) {
        return attributes.get(name);
    }

    public List<Content> content() {
        return content;
    }

    public List<Integer> childIds() {
        return childIds;
    }

    public int parentId() {
        return parentId;
    }

    public boolean hasParent() {
        return parentId != NO_PARENT;
    }

    /**
     * 1-based position among the parent's children (or among the roots).
     */
    public int siblingPos() {
        return siblingPos;
    }

    /**
     * Height of the element subtree below this node; 0 for a leaf.
     */
    public int maxDepth() {
        return maxDepth;
    }

    /**
     * Exclusive end of this node's subtree in preorder ids.
     */
    int subtreeEnd() {
        return subtreeEnd;
    }

    /**
     * Text runs directly under this node, excluding any descendant text.
     */
    public String directText() {
        return directText;
    }

    /**
     * All text under this node in document order. Bodies of descendant
     * script and style elements are left out.
     */
    public String text() {
        return text;
    }

    public boolean isRawText() {
        return HtmlTags.isRawText(tag);
    }

    @Override
    public String toString() {
        return "<" + tag + "#" + id + ">";
    }
}
