package io.xsql.engine.execution;

import io.xsql.engine.EngineOptions;
import io.xsql.engine.document.DocumentTree;
import io.xsql.engine.document.MarkupWriter;
import io.xsql.engine.query.QueryParser;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Query Executor Tests")
class QueryExecutorTest {

    private static final String CATALOG = """
            <html>
              <head><title>Catalog</title></head>
              <body>
                <div id="nav" class="menu main">
                  <a href="https://example.com/a">Alpha</a>
                  <a href="/b">Beta</a>
                  <a>No link</a>
                </div>
                <ul>
                  <li>one</li>
                  <li>two <b>bold</b></li>
                  <li>three</li>
                </ul>
                <p>Java is great. Java rocks.</p>
                <p>Python is fine.</p>
                <table>
                  <tr><th>Name</th><th>Qty</th></tr>
                  <tr><td>Apple</td><td>3</td></tr>
                  <tr><td>Pear</td></tr>
                </table>
              </body>
            </html>
            """;

    private DocumentTree document;
    private QueryExecutor executor;

    @BeforeEach
    void setUp() {
        document = DocumentTree.parse(CATALOG);
        executor = new QueryExecutor();
    }

    private ResultSet run(String statement) {
        return executor.execute(QueryParser.parse(statement), document);
    }

    private QueryExecutionException fails(String statement) {
        return assertThrows(QueryExecutionException.class, () -> run(statement));
    }

    @Nested
    @DisplayName("Projection")
    class ProjectionTests {

        @Test
        @DisplayName("Title text with COUNT(*) renders a headed table")
        void titleWithCount() {
            DocumentTree page = DocumentTree.parse("<html><head><title>T</title></head></html>");

            ResultSet result = executor.execute(QueryParser.parse(
                    "SELECT title.text, COUNT(*) FROM doc WHERE child.tag = 'title' LIMIT 1 TO TABLE(HEADER=ON)"), page);

            assertEquals(1, result.rowCount());
            assertEquals(2, result.columnCount());
            assertEquals("title.text,COUNT(*)", result.headerLine());
            assertEquals("T", result.getValue(0, "title.text").asText());
            assertEquals("1", result.getValue(0, "COUNT(*)").asText());
            assertTrue(result.rendering().contains("| title.text | COUNT(*) |"));
        }

        @Test
        @DisplayName("Missing attributes project as null")
        void missingAttributeIsNull() {
            ResultSet result = run("SELECT a.href FROM doc");

            assertEquals(Arrays.asList("https://example.com/a", "/b", null), result.columnText("a.href"));
            assertEquals(Column.STRING, result.columns().get(0).type());
        }

        @Test
        @DisplayName("Bare tags expand to node columns minus EXCLUDE")
        void bareTags() {
            ResultSet result = run("SELECT li FROM doc");
            assertEquals(List.of("node_id", "tag", "attributes", "parent_id", "max_depth", "doc_order", "source_uri"),
                    result.columnNames());
            assertEquals(List.of("9", "10", "12"), result.columnText("node_id"));
            assertEquals(List.of("document", "document", "document"), result.columnText("source_uri"));

            ResultSet excluded = run("SELECT * EXCLUDE (attributes, source_uri) FROM doc");
            assertEquals(5, excluded.columnCount());
            assertEquals(document.size(), excluded.rowCount());
        }

        @Test
        @DisplayName("Attributes column is a string map")
        void attributesMap() {
            ResultSet result = run("SELECT div FROM doc");
            Value.MapValue attributes = assertInstanceOf(Value.MapValue.class, result.getValue(0, "attributes"));

            assertEquals("nav", attributes.get("id").asText());
            assertEquals(Column.STRING_MAP, result.columns().get(2).type());
        }

        @Test
        @DisplayName("Field binds to the first descendant with the tag")
        void bindsFirstDescendant() {
            ResultSet result = run("SELECT ul.text, li.text FROM doc WHERE tag = 'ul'");

            assertEquals(1, result.rowCount());
            assertEquals("one", result.getValue(0, "li.text").asText());
        }

        @Test
        @DisplayName("TEXT keeps inline children, INNER_HTML truncates after minifying")
        void markupFunctions() {
            ResultSet text = run("SELECT TRIM(TEXT(li)) FROM doc");
            assertEquals(List.of("one", "two bold", "three"), text.columnText("TRIM(TEXT(li))"));

            ResultSet html = run("SELECT INNER_HTML(ul, 20), TRIM(INNER_HTML(ul, 20)), INNER_HTML(ul) FROM doc");
            assertEquals("<li>one</li><li>two ", html.getValue(0, 0).asText());
            assertEquals("<li>one</li><li>two", html.getValue(0, 1).asText());
            assertEquals("<li>one</li><li>two <b>bold</b></li><li>three</li>", html.getValue(0, 2).asText());
        }

        @Test
        @DisplayName("RAW_INNER_HTML keeps whitespace")
        void rawInnerHtml() {
            ResultSet result = run("SELECT RAW_INNER_HTML(ul) FROM doc");
            assertTrue(result.getValue(0, 0).asText().contains("\n"));
        }

        @Test
        @DisplayName("Document-qualified fields refer to each candidate")
        void documentQualified() {
            ResultSet result = run("SELECT doc.tag FROM doc WHERE parent.tag = 'body'");
            assertEquals(List.of("div", "ul", "p", "p", "table"), result.columnText("doc.tag"));
        }

        @Test
        @DisplayName("Projection does not modify the tree")
        void treeUnchanged() {
            String before = MarkupWriter.toHtml(document);
            int size = document.size();

            run("SELECT TRIM(INNER_HTML(ul, 5)), COUNT(*) FROM doc ORDER BY tag DESC LIMIT 1");
            run("SELECT SUMMARIZE(*) FROM doc");
            run("SELECT p.text, TFIDF(p) FROM doc");

            assertEquals(before, MarkupWriter.toHtml(document));
            assertEquals(size, document.size());
        }
    }

    @Nested
    @DisplayName("Filtering")
    class Filtering {

        @Test
        @DisplayName("IS NOT NULL and regex on attributes")
        void nullTestAndRegex() {
            assertEquals(2, run("SELECT a.href FROM doc WHERE href IS NOT NULL").rowCount());
            assertEquals(1, run("SELECT a.href FROM doc WHERE href IS NULL").rowCount());
            assertEquals(List.of("https://example.com/a"),
                    run("SELECT a.href FROM doc WHERE href ~ '^https'").columnText("a.href"));
        }

        @Test
        @DisplayName("Class equality matches any class token")
        void classToken() {
            ResultSet result = run("SELECT div.node_id FROM doc WHERE attributes.class = 'menu'");
            assertEquals(List.of("4"), result.columnText("div.node_id"));
            assertEquals(1, run("SELECT div FROM doc WHERE attributes.class = 'menu main'").rowCount());
            assertEquals(0, run("SELECT div FROM doc WHERE attributes.class = 'men'").rowCount());
        }

        @Test
        @DisplayName("CONTAINS is case-insensitive")
        void contains() {
            assertEquals(List.of("two bold"), run("SELECT li.text FROM doc WHERE text CONTAINS 'TWO'").columnText("li.text"));
            assertEquals(1, run("SELECT li FROM doc WHERE text CONTAINS ALL ('two', 'BOLD')").rowCount());
            assertEquals(2, run("SELECT li FROM doc WHERE text CONTAINS ANY ('one', 'three')").rowCount());
        }

        @Test
        @DisplayName("CONTAINS ALL of nothing holds, CONTAINS ANY of nothing does not")
        void emptyContainsLists() {
            assertEquals(3, run("SELECT li FROM doc WHERE text CONTAINS ALL ()").rowCount());
            assertEquals(0, run("SELECT li FROM doc WHERE text CONTAINS ANY ()").rowCount());
        }

        @Test
        @DisplayName("IN and numeric equality")
        void inAndNumbers() {
            assertEquals(List.of("10"), run("SELECT li FROM doc WHERE sibling_pos = 2").columnText("node_id"));
            assertEquals(2, run("SELECT li FROM doc WHERE sibling_pos IN (1, 3)").rowCount());
            assertEquals(2, run("SELECT li FROM doc WHERE sibling_pos <> 2").rowCount());
        }

        @Test
        @DisplayName("Axis comparisons are existential")
        void axes() {
            assertEquals(List.of("one", "two bold", "three"),
                    run("SELECT li.text FROM doc WHERE parent.tag = 'ul'").columnText("li.text"));
            assertEquals(List.of("10"),
                    run("SELECT li FROM doc WHERE EXISTS(child WHERE tag = 'b')").columnText("node_id"));
            assertEquals(3, run("SELECT a FROM doc WHERE ancestor.attributes.id = 'nav'").rowCount());
        }

        @Test
        @DisplayName("IS NULL holds when the axis reaches no node")
        void nullOnMissingAxis() {
            ResultSet result = run("SELECT * FROM doc WHERE parent.tag IS NULL");
            assertEquals(List.of("html"), result.columnText("tag"));
        }

        @Test
        @DisplayName("Comparisons on absent values are false")
        void absentValuesFail() {
            assertEquals(0, run("SELECT a FROM doc WHERE rel = 'x'").rowCount());
            assertEquals(0, run("SELECT a FROM doc WHERE rel <> 'x'").rowCount());
        }

        @Test
        @DisplayName("HAS_DIRECT_TEXT checks only the node's own text")
        void directText() {
            assertEquals(List.of("10"), run("SELECT li FROM doc WHERE li HAS_DIRECT_TEXT 'two'").columnText("node_id"));
            assertEquals(0, run("SELECT li FROM doc WHERE li HAS_DIRECT_TEXT 'bold'").rowCount());
            assertEquals(3, run("SELECT li FROM doc WHERE HAS_DIRECT_TEXT").rowCount());
        }

        @Test
        @DisplayName("Invalid regex fails at FILTER")
        void invalidRegex() {
            QueryExecutionException e = fails("SELECT a FROM doc WHERE href ~ '('");
            assertEquals(Stage.FILTER, e.getStage());
            assertInstanceOf(FilterException.class, e.getCause());
        }

        @Test
        @DisplayName("Regex longer than the limit fails at FILTER")
        void regexTooLong() {
            QueryExecutor strict = new QueryExecutor(new EngineOptions(100, 1000, 10, 1000, 3, 5));
            QueryExecutionException e = assertThrows(QueryExecutionException.class,
                    () -> strict.execute(QueryParser.parse("SELECT a FROM doc WHERE href ~ 'abcd'"), document));
            assertEquals(Stage.FILTER, e.getStage());
        }

        @Test
        @DisplayName("Whole attribute map only supports null tests")
        void attributeMapComparison() {
            QueryExecutionException e = fails("SELECT a FROM doc WHERE attributes = 'x'");
            assertEquals(Stage.FILTER, e.getStage());

            assertEquals(1, run("SELECT a FROM doc WHERE attributes IS NULL").rowCount());
        }
    }

    @Nested
    @DisplayName("Aggregation")
    class Aggregation {

        @Test
        @DisplayName("COUNT alone collapses to one row")
        void countOnly() {
            ResultSet result = run("SELECT COUNT(*), COUNT(a) FROM doc");

            assertEquals(1, result.rowCount());
            assertEquals(String.valueOf(document.size()), result.getValue(0, "COUNT(*)").asText());
            assertEquals("3", result.getValue(0, "COUNT(a)").asText());
            assertEquals(Column.INT64, result.columns().get(0).type());
        }

        @Test
        @DisplayName("COUNT next to projections counts before LIMIT")
        void countBeforeLimit() {
            ResultSet result = run("SELECT li.text, COUNT(*) FROM doc LIMIT 2");

            assertEquals(2, result.rowCount());
            assertEquals(List.of("3", "3"), result.columnText("COUNT(*)"));
        }

        @Test
        @DisplayName("COUNT over no candidates is zero")
        void countNothing() {
            ResultSet result = run("SELECT COUNT(*) FROM doc WHERE tag = 'section'");
            assertEquals(List.of("0"), result.columnText("COUNT(*)"));
        }

        @Test
        @DisplayName("SUMMARIZE orders by count, then tag")
        void summarize() {
            ResultSet result = run("SELECT SUMMARIZE(*) FROM doc WHERE parent.tag = 'body'");

            assertEquals(List.of("tag", "count"), result.columnNames());
            assertEquals(List.of("p", "div", "table", "ul"), result.columnText("tag"));
            assertEquals(List.of("2", "1", "1", "1"), result.columnText("count"));
        }

        @Test
        @DisplayName("SUMMARIZE can be ordered by its columns")
        void summarizeOrdered() {
            ResultSet result = run("SELECT SUMMARIZE(*) FROM doc WHERE parent.tag = 'body' ORDER BY tag");
            assertEquals(List.of("div", "p", "table", "ul"), result.columnText("tag"));
        }

        @Test
        @DisplayName("TFIDF reports top terms per candidate")
        void tfidfTopTerms() {
            ResultSet result = run("SELECT p.text, TFIDF(p, TOP_TERMS=2) FROM doc");

            assertEquals(2, result.rowCount());
            assertEquals(Column.DOUBLE_MAP, result.columns().get(1).type());
            Value.MapValue first = assertInstanceOf(Value.MapValue.class, result.getValue(0, 1));
            assertEquals(List.of("java", "great"), List.copyOf(first.entries().keySet()));
            assertEquals("0.702733", first.get("java").asText());
            assertFalse(first.entries().containsKey("is"));
        }

        @Test
        @DisplayName("TFIDF with query terms scores each candidate")
        void tfidfTerms() {
            ResultSet result = run("SELECT p.text, TFIDF(p, 'Java') FROM doc");

            assertEquals(Column.DOUBLE, result.columns().get(1).type());
            assertEquals(List.of("0.702733", "0"), result.columnText("TFIDF(p, 'java')"));
        }
    }

    @Nested
    @DisplayName("Ordering and limits")
    class OrderingAndLimits {

        @Test
        @DisplayName("ORDER BY a result column, descending, nulls last")
        void orderByColumn() {
            assertEquals(List.of("No link", "Beta", "Alpha"),
                    run("SELECT a.text FROM doc ORDER BY a.text DESC").columnText("a.text"));
            assertEquals(Arrays.asList("https://example.com/a", "/b", null),
                    run("SELECT a.href FROM doc ORDER BY a.href DESC").columnText("a.href"));
            assertEquals(Arrays.asList("/b", "https://example.com/a", null),
                    run("SELECT a.href FROM doc ORDER BY a.href").columnText("a.href"));
        }

        @Test
        @DisplayName("ORDER BY compares strings by code point")
        void orderByCodePoint() {
            ResultSet result = run("SELECT li.text FROM RAW('<ul><li>\uD83D\uDE00</li><li>\uFF5E</li></ul>') ORDER BY li.text");

            assertEquals(List.of("\uFF5E", "\uD83D\uDE00"), result.columnText("li.text"));
        }

        @Test
        @DisplayName("ORDER BY a node field is stable for ties")
        void orderByNodeFieldIsStable() {
            ResultSet result = run("SELECT li.text FROM doc ORDER BY max_depth");
            assertEquals(List.of("one", "three", "two bold"), result.columnText("li.text"));
        }

        @Test
        @DisplayName("ORDER BY resolves column aliases and ignores case")
        void orderByAlias() {
            ResultSet result = run("SELECT li.text AS item FROM doc ORDER BY ITEM DESC");
            assertEquals(List.of("two bold", "three", "one"), result.columnText("item"));
        }

        @Test
        @DisplayName("Unknown ORDER BY key fails at ORDER_BY")
        void unknownOrderKey() {
            QueryExecutionException e = fails("SELECT li.text FROM doc ORDER BY nope");
            assertEquals(Stage.ORDER_BY, e.getStage());
            assertInstanceOf(IllegalArgumentException.class, e.getCause());
        }

        @Test
        @DisplayName("LIMIT truncates without reordering")
        void limitTruncates() {
            assertEquals(List.of("one", "two bold"), run("SELECT li.text FROM doc LIMIT 2").columnText("li.text"));

            ResultSet none = run("SELECT li.text FROM doc LIMIT 0");
            assertTrue(none.isEmpty());
            assertEquals(List.of("li.text"), none.columnNames());
        }

        @Test
        @DisplayName("LIMIT above the maximum fails at LIMIT")
        void limitAboveMaximum() {
            QueryExecutor strict = new QueryExecutor(EngineOptions.defaults().withMaxLimit(5));
            QueryExecutionException e = assertThrows(QueryExecutionException.class,
                    () -> strict.execute(QueryParser.parse("SELECT li FROM doc LIMIT 10"), document));

            assertEquals(Stage.LIMIT, e.getStage());
            assertTrue(e.getMessage().startsWith("Query failed at LIMIT"));
        }
    }

    @Nested
    @DisplayName("Sources")
    class Sources {

        @TempDir
        Path tempDir;

        @Test
        @DisplayName("RAW source is labelled raw")
        void rawSource() {
            ResultSet result = run("SELECT li FROM RAW('<ul><li>x</li><li>y</li></ul>')");
            assertEquals(List.of("raw", "raw"), result.columnText("source_uri"));
        }

        @Test
        @DisplayName("RAW above the size limit fails at RESOLVE_SOURCE")
        void rawTooLarge() {
            QueryExecutor strict = new QueryExecutor(EngineOptions.defaults().withMaxRawHtmlBytes(10));
            QueryExecutionException e = assertThrows(QueryExecutionException.class,
                    () -> strict.execute(QueryParser.parse("SELECT p FROM RAW('<p>far too long</p>')"), document));
            assertEquals(Stage.RESOLVE_SOURCE, e.getStage());
            assertInstanceOf(SourceException.class, e.getCause());
        }

        @Test
        @DisplayName("Path source reads a local file")
        void pathSource() throws Exception {
            Path file = tempDir.resolve("page.html");
            Files.writeString(file, "<p>Héllo</p>", StandardCharsets.UTF_8);

            ResultSet result = run("SELECT p.text, p.source_uri FROM '" + file + "'");

            assertEquals("Héllo", result.getValue(0, 0).asText());
            assertEquals(file.toString(), result.getValue(0, 1).asText());
        }

        @Test
        @DisplayName("Missing file and URL sources fail at RESOLVE_SOURCE")
        void unreadableSources() {
            QueryExecutionException missing = fails("SELECT p FROM '" + tempDir.resolve("none.html") + "'");
            assertEquals(Stage.RESOLVE_SOURCE, missing.getStage());
            assertInstanceOf(SourceException.class, missing.getCause());

            QueryExecutionException url = fails("SELECT p FROM 'https://example.com/index.html'");
            assertEquals(Stage.RESOLVE_SOURCE, url.getStage());
        }

        @Test
        @DisplayName("FRAGMENTS over a subquery merges each HTML value")
        void fragmentsSubquery() {
            ResultSet result = run("SELECT li.text, li.source_uri FROM FRAGMENTS(SELECT INNER_HTML(ul) FROM doc)");

            assertEquals(List.of("one", "two bold", "three"), result.columnText("li.text"));
            assertEquals("fragment", result.getValue(0, 1).asText());
        }

        @Test
        @DisplayName("FRAGMENTS over RAW")
        void fragmentsRaw() {
            assertEquals(2, run("SELECT li FROM FRAGMENTS(RAW('<li>a</li><li>b</li>'))").rowCount());
        }

        @Test
        @DisplayName("No fragments gives an empty result, even for COUNT")
        void noFragments() {
            ResultSet result = run("SELECT COUNT(*) FROM FRAGMENTS(SELECT INNER_HTML(section) FROM doc)");

            assertTrue(result.isEmpty());
            assertEquals(List.of("COUNT(*)"), result.columnNames());
        }

        @Test
        @DisplayName("FRAGMENTS rejects plain text and several columns")
        void fragmentsRejects() {
            QueryExecutionException text = fails("SELECT li FROM FRAGMENTS(SELECT li.text FROM doc)");
            assertEquals(Stage.RESOLVE_SOURCE, text.getStage());
            assertInstanceOf(SourceException.class, text.getCause());

            QueryExecutionException columns = fails("SELECT li FROM FRAGMENTS(SELECT li.text, li.node_id FROM doc)");
            assertInstanceOf(SourceException.class, columns.getCause());
        }

        @Test
        @DisplayName("FRAGMENTS enforces the fragment count")
        void fragmentCount() {
            QueryExecutor strict = new QueryExecutor(EngineOptions.defaults().withMaxFragmentCount(1));
            String statement = "SELECT i FROM FRAGMENTS(SELECT INNER_HTML(div) "
                    + "FROM RAW('<div><i>1</i></div><div><i>2</i></div>'))";

            QueryExecutionException e = assertThrows(QueryExecutionException.class,
                    () -> strict.execute(QueryParser.parse(statement), document));
            assertEquals(Stage.RESOLVE_SOURCE, e.getStage());
        }
    }

    @Nested
    @DisplayName("Aliases")
    class Aliases {

        @Test
        @DisplayName("An alias stays bound for later statements")
        void aliasCarriesOver() {
            run("SELECT li FROM RAW('<ul><li>x</li></ul>') AS Snippet");

            ResultSet result = run("SELECT li.text FROM snippet");

            assertEquals(List.of("x"), result.columnText("li.text"));
            assertTrue(executor.bindings().containsKey("snippet"));
        }

        @Test
        @DisplayName("A failed statement leaves its alias unbound")
        void failedStatementDoesNotBind() {
            QueryExecutor strict = new QueryExecutor(EngineOptions.defaults().withMaxLimit(5));

            QueryExecutionException e = assertThrows(QueryExecutionException.class,
                    () -> strict.execute(QueryParser.parse("SELECT li FROM RAW('<ul><li>x</li></ul>') AS tmp LIMIT 10"), document));

            assertEquals(Stage.LIMIT, e.getStage());
            assertFalse(strict.bindings().containsKey("tmp"));
            QueryExecutionException unbound = assertThrows(QueryExecutionException.class,
                    () -> strict.execute(QueryParser.parse("SELECT li FROM tmp"), document));
            assertEquals(Stage.RESOLVE_SOURCE, unbound.getStage());
        }

        @Test
        @DisplayName("Programmatic bind")
        void programmaticBind() {
            executor.bind("Other", DocumentTree.parse("<p>bound</p>", "other.html"));
            assertEquals(List.of("bound"), run("SELECT p.text FROM other").columnText("p.text"));
        }

        @Test
        @DisplayName("Unbound alias fails at RESOLVE_SOURCE")
        void unboundAlias() {
            QueryExecutionException e = fails("SELECT p FROM nowhere");
            assertEquals(Stage.RESOLVE_SOURCE, e.getStage());
            assertInstanceOf(SourceException.class, e.getCause());
        }
    }

    @Nested
    @DisplayName("Output")
    class Output {

        @TempDir
        Path tempDir;

        @Test
        @DisplayName("TO CSV writes header and rows")
        void toCsv() throws Exception {
            Path out = tempDir.resolve("links.csv");

            ResultSet result = run("SELECT a.href FROM doc WHERE href IS NOT NULL TO CSV('" + out + "')");

            assertEquals(2, result.rowCount());
            assertEquals("a.href\r\nhttps://example.com/a\r\n/b\r\n", Files.readString(out));
        }

        @Test
        @DisplayName("TO CSV keeps only anchors with a non-empty href")
        void toCsvNonEmptyHref() throws Exception {
            Path out = tempDir.resolve("hrefs.csv");
            DocumentTree links = DocumentTree.parse("<div><a href=\"/x\">x</a><a href=\"\">empty</a><a>none</a></div>");

            ResultSet result = executor.execute(QueryParser.parse(
                    "SELECT attributes.href FROM doc WHERE tag = 'a' AND attributes.href <> '' TO CSV('" + out + "')"), links);

            assertEquals(1, result.rowCount());
            assertEquals(List.of("/x"), result.columnText("attributes.href"));
            assertEquals("attributes.href\r\n/x\r\n", Files.readString(out));
        }

        @Test
        @DisplayName("TO TABLE extracts table cells with a header row")
        void tableExtraction() {
            ResultSet result = run("SELECT table FROM doc TO TABLE()");

            assertEquals(List.of("Name", "Qty"), result.columnNames());
            assertEquals(List.of("Apple", "Pear"), result.columnText("Name"));
            assertEquals(Arrays.asList("3", null), result.columnText("Qty"));
            assertTrue(result.rendering().contains("| Pear  | NULL |"));
        }

        @Test
        @DisplayName("TO TABLE(NOHEADER) names columns by position and exports without header")
        void tableWithoutHeader() throws Exception {
            Path out = tempDir.resolve("cells.csv");

            ResultSet result = run("SELECT table FROM doc TO TABLE(NOHEADER, EXPORT='" + out + "')");

            assertEquals(List.of("col_1", "col_2"), result.columnNames());
            assertEquals(3, result.rowCount());
            assertEquals("Name,Qty\r\nApple,3\r\nPear,\r\n", Files.readString(out));
        }

        @Test
        @DisplayName("TO LIST passes the single column through")
        void toList() {
            ResultSet result = run("SELECT a.text FROM doc TO LIST()");
            assertEquals(List.of("Alpha", "Beta", "No link"), result.columnText("a.text"));
            assertNull(result.rendering());
        }

        @Test
        @DisplayName("Unwritable target fails at BIND")
        void unwritableTarget() throws Exception {
            Path blocker = Files.writeString(tempDir.resolve("blocker"), "not a directory");
            Path out = blocker.resolve("x.csv");
            QueryExecutionException e = fails("SELECT a.text FROM doc TO CSV('" + out + "')");
            assertEquals(Stage.BIND, e.getStage());
        }
    }

    @Nested
    @DisplayName("Flattening")
    class Flattening {

        private ResultSet flatten(String html, String statement) {
            return executor.execute(QueryParser.parse(statement), DocumentTree.parse(html));
        }

        @Test
        @DisplayName("Descendant texts fill the named columns, missing ones are null")
        void allDescendants() {
            ResultSet result = flatten(
                    "<div id='a'><section><p>One</p><span>Two</span></section></div>"
                            + "<div id='b'><section><p>Three</p></section></div>",
                    "SELECT FLATTEN_TEXT(div) AS (col1, col2) FROM doc WHERE descendant.tag IN ('p', 'span')");

            assertEquals(List.of("col1", "col2"), result.columnNames());
            assertEquals(List.of("One", "Three"), result.columnText("col1"));
            assertEquals(Arrays.asList("Two", null), result.columnText("col2"));
        }

        @Test
        @DisplayName("A depth takes only nodes at that level, using their direct text")
        void atDepth() {
            ResultSet result = flatten("<div><section> Alpha <p>One</p></section></div>",
                    "SELECT FLATTEN_TEXT(div, 1) AS (col1) FROM doc");

            assertEquals(List.of("Alpha"), result.columnText("col1"));
        }

        @Test
        @DisplayName("A descendant tag filter picks the flattened nodes")
        void descendantTag() {
            ResultSet result = flatten("<div><p>One</p><span>Skip</span></div>",
                    "SELECT FLATTEN(div) AS (col1, col2) FROM doc WHERE descendant.tag = 'p'");

            assertEquals(1, result.rowCount());
            assertEquals("One", result.getValue(0, "col1").asText());
            assertTrue(result.getValue(0, "col2").isNull());
        }

        @Test
        @DisplayName("Blank descendants are skipped without a depth")
        void skipsBlank() {
            ResultSet result = flatten("<div><span><i></i></span><p>Text</p></div>",
                    "SELECT FLATTEN_TEXT(div) AS (col1) FROM doc");

            assertEquals(List.of("Text"), result.columnText("col1"));
        }

        @Test
        @DisplayName("Attribute filters on descendants")
        void descendantAttribute() {
            String html = """
                    <div class="card">
                      <span data-testid="flight-time-dep">08:00</span>
                      <span data-testid="carrier">Air</span>
                      <span data-testid="flight_price_total">US$1</span>
                    </div>
                    """;
            ResultSet result = flatten(html, "SELECT FLATTEN_TEXT(div) AS (time, price) FROM doc "
                    + "WHERE attributes.class = 'card' "
                    + "AND descendant.attributes.data-testid CONTAINS ANY ('flight-time-', 'flight_price_')");

            assertEquals(List.of("08:00"), result.columnText("time"));
            assertEquals(List.of("US$1"), result.columnText("price"));
        }

        @Test
        @DisplayName("Whitespace inside a text is collapsed")
        void collapsesWhitespace() {
            ResultSet result = flatten("<div><p>  two\n   words </p></div>",
                    "SELECT FLATTEN_TEXT(div) AS (col1) FROM doc");

            assertEquals(List.of("two words"), result.columnText("col1"));
        }

        @Test
        @DisplayName("Without AS the single column is flatten_text")
        void defaultColumn() {
            ResultSet result = flatten("<div><p>One</p><p>Two</p></div>", "SELECT FLATTEN_TEXT(div) FROM doc");

            assertEquals(List.of("flatten_text"), result.columnNames());
            assertEquals(List.of("One"), result.columnText("flatten_text"));
        }
    }

    @Nested
    @DisplayName("Deep documents")
    class DeepDocuments {

        @Test
        @DisplayName("INNER_HTML over deeply nested markup")
        void deepInnerHtml() {
            int depth = 20_000;
            DocumentTree deep = DocumentTree.parse("<div>" + "<b>".repeat(depth) + "x" + "</b>".repeat(depth) + "</div>");

            ResultSet result = executor.execute(QueryParser.parse("SELECT INNER_HTML(div, 5) FROM doc"), deep);

            assertEquals(1, result.rowCount());
            assertEquals("<b><b", result.getValue(0, 0).asText());
        }
    }

    @Nested
    @DisplayName("Meta statements")
    class MetaStatements {

        @Test
        @DisplayName("SHOW INPUT reports the active document")
        void showInput() {
            ResultSet result = run("SHOW INPUT");

            Map<String, Value> uri = result.rowAsMap(0);
            assertEquals("source_uri", uri.get("key").asText());
            assertEquals("document", uri.get("value").asText());
            assertEquals(String.valueOf(document.size()), result.getValue(1, "value").asText());
        }

        @Test
        @DisplayName("SHOW INPUTS lists bound sources too")
        void showInputs() {
            run("SELECT p FROM RAW('<p>x</p>') AS r");
            assertEquals(List.of("document", "raw"), run("SHOW INPUTS").columnText("source_uri"));
        }

        @Test
        @DisplayName("Static catalogues")
        void catalogues() {
            assertEquals(9, run("SHOW FUNCTIONS").rowCount());
            assertEquals(List.of("parent", "child", "ancestor", "descendant"), run("SHOW AXES").columnText("axis"));
            assertTrue(run("SHOW OPERATORS").columnText("operator").contains("CONTAINS ANY"));

            ResultSet schema = run("DESCRIBE doc");
            assertEquals(8, schema.rowCount());
            assertEquals("node_id", schema.getValue(0, "column_name").asText());

            assertFalse(run("DESCRIBE LANGUAGE").isEmpty());
        }
    }
}
