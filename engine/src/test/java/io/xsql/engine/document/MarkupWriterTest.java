package io.xsql.engine.document;

import org.junit.jupiter.api.*;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Markup Writer Tests")
class MarkupWriterTest {

    @Test
    @DisplayName("Inner and outer HTML re-escape text and attributes")
    void innerAndOuter() {
        DocumentTree tree = DocumentTree.parse("<div class=\"x\"><p title='a&quot;b'>1 &lt; 2</p><br></div>");
        DocumentNode div = tree.node(0);

        assertEquals("<p title=\"a&quot;b\">1 &lt; 2</p><br>", MarkupWriter.innerHtml(tree, div));
        assertEquals("<div class=\"x\"><p title=\"a&quot;b\">1 &lt; 2</p><br></div>",
                MarkupWriter.outerHtml(tree, div));
    }

    @Test
    @DisplayName("Script bodies are written raw")
    void rawScript() {
        DocumentTree tree = DocumentTree.parse("<script>a < b && c</script>");
        assertEquals("<script>a < b && c</script>", MarkupWriter.toHtml(tree));
    }

    @Test
    @DisplayName("Minify collapses whitespace and drops it between tags")
    void minify() {
        String html = """
                <ul>
                  <li>One   two</li>
                  <li> three </li>
                </ul>
                """;
        assertEquals("<ul><li>One two</li><li> three </li></ul>", MarkupWriter.minify(html));
    }

    @Test
    @DisplayName("Re-parsing written markup gives the same shape")
    void roundTripShape() {
        DocumentTree tree = DocumentTree.parse("<ul><li>a<li>b</ul>");
        DocumentTree again = DocumentTree.parse(MarkupWriter.toHtml(tree));

        assertEquals(tree.size(), again.size());
        assertEquals("<ul><li>a</li><li>b</li></ul>", MarkupWriter.toHtml(again));
    }

    @Test
    @DisplayName("Deeply nested markup is written without recursion")
    void deepNesting() {
        int depth = 20_000;
        String html = "<div>" + "<b>".repeat(depth) + "x" + "</b>".repeat(depth) + "</div>";
        DocumentTree tree = DocumentTree.parse(html);

        String written = MarkupWriter.toHtml(tree);

        assertEquals(depth + 1, tree.size());
        assertTrue(written.startsWith("<div><b><b>"));
        assertTrue(written.endsWith("x" + "</b>".repeat(3) + "</div>"));
        assertEquals(MarkupWriter.innerHtml(tree, tree.node(0)).length() + "<div></div>".length(), written.length());
    }
}
