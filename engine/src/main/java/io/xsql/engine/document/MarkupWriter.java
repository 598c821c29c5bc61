package io.xsql.engine.document;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Serializes nodes of a {@link DocumentTree} back to markup.
 */
public final class MarkupWriter {

    private MarkupWriter() {
    }

    /**
     * Markup of the node's content, without the node's own tags.
     */
    public static String innerHtml(DocumentTree tree, DocumentNode node) {
        StringBuilder sb = new StringBuilder();
        write(tree, node, false, sb);
        return sb.toString();
    }

    public static String outerHtml(DocumentTree tree, DocumentNode node) {
        StringBuilder sb = new StringBuilder();
        write(tree, node, true, sb);
        return sb.toString();
    }

    /**
     * Whole tree, roots concatenated.
     */
    public static String toHtml(DocumentTree tree) {
        StringBuilder sb = new StringBuilder();
        for (DocumentNode root : tree.roots()) {
            write(tree, root, true, sb);
        }
        return sb.toString();
    }

    /**
     * Collapses whitespace runs to one space, drops whitespace between two tags
     * and trims both ends.
     */
    public static String minify(String html) {
        StringBuilder sb = new StringBuilder(html.length());
        boolean pendingSpace = false;
        for (int i = 0; i < html.length(); i++) {
            char c = html.charAt(i);
            if (Character.isWhitespace(c)) {
                pendingSpace = true;
                continue;
            }
            if (pendingSpace) {
                int last = sb.length() - 1;
                if (last >= 0 && !(sb.charAt(last) == '>' && c == '<')) {
                    sb.append(' ');
                }
                pendingSpace = false;
            }
            sb.append(c);
        }
        return sb.toString();
    }

    // ==================== Writing ====================

    /**
     * An element whose content is being written; {@code next} is the index of
     * the next content entry.
     */
    private static final class Frame {
        final DocumentNode node;
        final boolean closeTag;
        int next;

        Frame(DocumentNode node, boolean closeTag) {
            this.node = node;
            this.closeTag = closeTag;
        }
    }

    /**
     * Iterative; nesting depth is limited by the heap only.
     */
    private static void write(DocumentTree tree, DocumentNode node, boolean outer, StringBuilder sb) {
        if (outer && !writeStartTag(node, sb)) {
            return;
        }
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(node, outer));
        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            List<DocumentNode.Content> content = frame.node.content();
            if (frame.next == content.size()) {
                stack.pop();
                if (frame.closeTag) {
                    sb.append("</").append(frame.node.tag()).append('>');
                }
                continue;
            }
            DocumentNode.Content next = content.get(frame.next++);
            if (next instanceof DocumentNode.Text text) {
                if (frame.node.isRawText()) {
                    sb.append(text.text());
                } else {
                    escape(text.text(), false, sb);
                }
            } else if (next instanceof DocumentNode.Element element) {
                DocumentNode child = tree.node(element.nodeId());
                if (writeStartTag(child, sb)) {
                    stack.push(new Frame(child, true));
                }
            }
        }
    }

    /**
     * @return false for a void element, which has no content or end tag
     */
    private static boolean writeStartTag(DocumentNode node, StringBuilder sb) {
        sb.append('<').append(node.tag());
        for (Map.Entry<String, String> attr : node.attributes().entrySet()) {
            sb.append(' ').append(attr.getKey()).append("=\"");
            escape(attr.getValue(), true, sb);
            sb.append('"');
        }
        sb.append('>');
        return !HtmlTags.isVoid(node.tag());
    }

    private static void escape(String s, boolean attribute, StringBuilder sb) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '&' -> sb.append("&amp;");
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                case '"' -> sb.append(attribute ? "&quot;" : "\"");
                default -> sb.append(c);
            }
        }
    }
}
