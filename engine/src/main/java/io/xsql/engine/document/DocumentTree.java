package io.xsql.engine.document;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only node graph an XSQL query walks.
 *
 * Nodes live in an arena addressed by preorder index, so a node's
 * descendants are the contiguous id range after it and ancestor walks are
 * index hops. A tree may have several roots (fragment sources).
 */
public final class DocumentTree {

    private final List<DocumentNode> nodes;
    private final List<Integer> rootIds;
    private final String sourceUri;

    private DocumentTree(List<DocumentNode> nodes, List<Integer> rootIds, String sourceUri) {
        this.nodes = nodes;
        this.rootIds = rootIds;
        this.sourceUri = sourceUri;
    }

    /**
     * Parses markup with {@code document} as source label.
     */
    public static DocumentTree parse(String html) {
        return HtmlParser.parse(html, "document");
    }

    public static DocumentTree parse(String html, String sourceUri) {
        return HtmlParser.parse(html, sourceUri);
    }

    /**
     * Concatenates trees into one forest, shifting node ids so the result is
     * still in preorder.
     */
    public static DocumentTree merge(List<DocumentTree> parts, String sourceUri) {
        Builder builder = new Builder();
        for (DocumentTree part : parts) {
            builder.append(part);
        }
        return builder.build(sourceUri);
    }

    // ==================== Access ====================

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public DocumentNode node(int id) {
        return nodes.get(id);
    }

    /**
     * All nodes in document order.
     */
    public List<DocumentNode> nodes() {
        return nodes;
    }

    public List<DocumentNode> roots() {
        List<DocumentNode> out = new ArrayList<>(rootIds.size());
        for (int id : rootIds) {
            out.add(nodes.get(id));
        }
        return out;
    }

    public String sourceUri() {
        return sourceUri;
    }

    // ==================== Navigation ====================

    /**
     * @return the parent, or null for a root
     */
    public DocumentNode parent(DocumentNode node) {
        return node.hasParent() ? nodes.get(node.parentId()) : null;
    }

    public List<DocumentNode> children(DocumentNode node) {
        List<Integer> ids = node.childIds();
        List<DocumentNode> out = new ArrayList<>(ids.size());
        for (int id : ids) {
            out.add(nodes.get(id));
        }
        return out;
    }

    /**
     * Strict ancestors in root-to-node order.
     */
    public List<DocumentNode> ancestors(DocumentNode node) {
        List<DocumentNode> out = new ArrayList<>();
        int current = node.parentId();
        while (current != DocumentNode.NO_PARENT) {
            DocumentNode ancestor = nodes.get(current);
            out.add(ancestor);
            current = ancestor.parentId();
        }
        Collections.reverse(out);
        return out;
    }

    /**
     * Strict descendants in document order.
     */
    public List<DocumentNode> descendants(DocumentNode node) {
        return nodes.subList(node.id() + 1, node.subtreeEnd());
    }

    /**
     * First descendant with the given tag in document order, or null.
     */
    public DocumentNode firstDescendant(DocumentNode node, String tag) {
        for (int id = node.id() + 1; id < node.subtreeEnd(); id++) {
            DocumentNode candidate = nodes.get(id);
            if (candidate.tag().equals(tag)) {
                return candidate;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return "DocumentTree[" + sourceUri + ", " + nodes.size() + " nodes]";
    }

    // ==================== Builder ====================

    /**
     * Collects elements in preorder; {@link #build} derives the computed fields.
     */
    static final class Builder {

        private static final class Draft {
            final String tag;
            final Map<String, String> attributes;
            final int parentId;
            final List<DocumentNode.Content> content = new ArrayList<>();

            Draft(String tag, Map<String, String> attributes, int parentId) {
                this.tag = tag;
                this.attributes = attributes;
                this.parentId = parentId;
            }
        }

        private final List<Draft> drafts = new ArrayList<>();

        /**
         * Adds an element under {@code parentId} (or as a root) and returns its id.
         */
        int open(String tag, Map<String, String> attributes, int parentId) {
            int id = drafts.size();
            drafts.add(new Draft(tag, new LinkedHashMap<>(attributes), parentId));
            if (parentId != DocumentNode.NO_PARENT) {
                drafts.get(parentId).content.add(new DocumentNode.Element(id));
            }
            return id;
        }

        /**
         * Appends a text run to an element, merging with a preceding run.
         */
        void text(int nodeId, String text) {
            if (text.isEmpty()) {
                return;
            }
            List<DocumentNode.Content> content = drafts.get(nodeId).content;
            if (!content.isEmpty() && content.get(content.size() - 1) instanceof DocumentNode.Text last) {
                content.set(content.size() - 1, new DocumentNode.Text(last.text() + text));
            } else {
                content.add(new DocumentNode.Text(text));
            }
        }

        void append(DocumentTree tree) {
            int offset = drafts.size();
            for (DocumentNode node : tree.nodes()) {
                int parent = node.hasParent() ? node.parentId() + offset : DocumentNode.NO_PARENT;
                Draft draft = new Draft(node.tag(), node.attributes(), parent);
                for (DocumentNode.Content c : node.content()) {
                    if (c instanceof DocumentNode.Element e) {
                        draft.content.add(new DocumentNode.Element(e.nodeId() + offset));
                    } else {
                        draft.content.add(c);
                    }
                }
                drafts.add(draft);
            }
        }

        DocumentTree build(String sourceUri) {
            int n = drafts.size();
            int[] maxDepth = new int[n];
            int[] subtreeEnd = new int[n];
            String[] text = new String[n];
            List<List<Integer>> childIds = new ArrayList<>(n);
            List<Integer> rootIds = new ArrayList<>();
            int[] siblingPos = new int[n];

            for (int id = 0; id < n; id++) {
                List<Integer> kids = new ArrayList<>();
                for (DocumentNode.Content c : drafts.get(id).content) {
                    if (c instanceof DocumentNode.Element e) {
                        kids.add(e.nodeId());
                        siblingPos[e.nodeId()] = kids.size();
                    }
                }
                childIds.add(List.copyOf(kids));
                if (drafts.get(id).parentId == DocumentNode.NO_PARENT) {
                    rootIds.add(id);
                    siblingPos[id] = rootIds.size();
                }
            }

            // Children always have larger ids than their parent, so one reverse pass
            // sees every subtree complete.
            for (int id = n - 1; id >= 0; id--) {
                Draft draft = drafts.get(id);
                int depth = 0;
                int end = id + 1;
                StringBuilder sb = new StringBuilder();
                for (DocumentNode.Content c : draft.content) {
                    if (c instanceof DocumentNode.Text t) {
                        sb.append(t.text());
                    } else if (c instanceof DocumentNode.Element e) {
                        int child = e.nodeId();
                        depth = Math.max(depth, maxDepth[child] + 1);
                        end = Math.max(end, subtreeEnd[child]);
                        if (!HtmlTags.isRawText(drafts.get(child).tag)) {
                            sb.append(text[child]);
                        }
                    }
                }
                maxDepth[id] = depth;
                subtreeEnd[id] = end;
                text[id] = sb.toString();
            }

            List<DocumentNode> nodes = new ArrayList<>(n);
            for (int id = 0; id < n; id++) {
                Draft draft = drafts.get(id);
                StringBuilder direct = new StringBuilder();
                for (DocumentNode.Content c : draft.content) {
                    if (c instanceof DocumentNode.Text t) {
                        direct.append(t.text());
                    }
                }
                nodes.add(new DocumentNode(
                        id,
                        draft.tag,
                        Collections.unmodifiableMap(new LinkedHashMap<>(draft.attributes)),
                        List.copyOf(draft.content),
                        childIds.get(id),
                        draft.parentId,
                        siblingPos[id],
                        maxDepth[id],
                        subtreeEnd[id],
                        direct.toString(),
                        text[id]));
            }
            return new DocumentTree(List.copyOf(nodes), List.copyOf(rootIds), sourceUri);
        }
    }
}
