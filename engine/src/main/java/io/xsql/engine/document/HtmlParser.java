package io.xsql.engine.document;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.DataNode;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.parser.Parser;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Builds a {@link DocumentTree} from markup using jsoup.
 *
 * Input that opens with a doctype or an html, head or body tag is parsed as
 * a whole document, so the tree gets jsoup's html/head/body skeleton. Anything
 * else is parsed as a fragment and its top-level elements become the roots;
 * fragments starting with table parts are parsed in a matching table context
 * so their rows and cells survive.
 */
public final class HtmlParser {

    private static final String DOCTYPE = "!doctype";

    private static final Set<String> DOCUMENT_START = Set.of(DOCTYPE, "html", "head", "body");

    private static final Map<String, String> FRAGMENT_CONTEXT = Map.of(
            "tr", "tbody",
            "td", "tr",
            "th", "tr",
            "thead", "table",
            "tbody", "table",
            "tfoot", "table",
            "caption", "table",
            "colgroup", "table",
            "col", "colgroup");

    private HtmlParser() {
    }

    public static DocumentTree parse(String html, String sourceUri) {
        DocumentTree.Builder builder = new DocumentTree.Builder();
        TreeBuilder visitor = new TreeBuilder(builder);

        String first = firstTagName(html);
        if (DOCUMENT_START.contains(first)) {
            Document document = Jsoup.parse(html);
            for (Node child : document.childNodes()) {
                NodeTraversor.traverse(visitor, child);
            }
        } else {
            Element context = new Element(FRAGMENT_CONTEXT.getOrDefault(first, "body"));
            List<Node> nodes = Parser.parseFragment(html, context, "");
            for (Node node : nodes) {
                NodeTraversor.traverse(visitor, node);
            }
        }
        return builder.build(sourceUri);
    }

    /**
     * Lowercase name of the first start tag (or {@code !doctype}), skipping
     * comments; empty when there is none.
     */
    static String firstTagName(String html) {
        int pos = html.indexOf('<');
        while (pos >= 0) {
            if (html.startsWith("<!--", pos)) {
                int end = html.indexOf("-->", pos + 4);
                if (end < 0) {
                    return "";
                }
                pos = html.indexOf('<', end + 3);
                continue;
            }
            if (html.regionMatches(true, pos, "<!doctype", 0, DOCTYPE.length() + 1)) {
                return DOCTYPE;
            }
            int start = pos + 1;
            int end = start;
            while (end < html.length() && isNameChar(html.charAt(end))) {
                end++;
            }
            if (end > start && isAsciiLetter(html.charAt(start))) {
                return html.substring(start, end).toLowerCase(Locale.ROOT);
            }
            pos = html.indexOf('<', start);
        }
        return "";
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isNameChar(char c) {
        return isAsciiLetter(c) || (c >= '0' && c <= '9') || c == '-' || c == '_' || c == ':';
    }

    // ==================== Tree building ====================

    /**
     * Copies jsoup elements and their text into the builder in preorder.
     * Text that is not inside an element is dropped, and so are comments.
     */
    private static final class TreeBuilder implements NodeVisitor {

        private final DocumentTree.Builder builder;
        private final Deque<Integer> open = new ArrayDeque<>();

        TreeBuilder(DocumentTree.Builder builder) {
            this.builder = builder;
        }

        @Override
        public void head(Node node, int depth) {
            if (node instanceof Element element) {
                int parent = open.isEmpty() ? DocumentNode.NO_PARENT : open.peek();
                open.push(builder.open(element.normalName(), attributes(element), parent));
            } else if (open.isEmpty()) {
                return;
            } else if (node instanceof TextNode text) {
                builder.text(open.peek(), text.getWholeText());
            } else if (node instanceof DataNode data) {
                // script and style bodies
                builder.text(open.peek(), data.getWholeData());
            }
        }

        @Override
        public void tail(Node node, int depth) {
            if (node instanceof Element) {
                open.pop();
            }
        }

        private static Map<String, String> attributes(Element element) {
            Map<String, String> out = new LinkedHashMap<>();
            for (Attribute attribute : element.attributes()) {
                out.putIfAbsent(attribute.getKey().toLowerCase(Locale.ROOT), attribute.getValue());
            }
            return out;
        }
    }
}
