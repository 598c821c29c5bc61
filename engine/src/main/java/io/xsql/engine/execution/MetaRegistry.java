package io.xsql.engine.execution;

import io.xsql.engine.document.DocumentTree;
import io.xsql.engine.query.ast.DescribeQuery;
import io.xsql.engine.query.ast.ShowQuery;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Read-only tables answering SHOW and DESCRIBE, built once at class load.
 */
public final class MetaRegistry {

    public static final ResultSet FUNCTIONS = table(
            List.of("function", "returns", "description"),
            new String[][]{
                    {"text(tag)", "string", "Direct text of a tag, including inline children"},
                    {"inner_html(tag[, n])", "string", "Minified HTML inside a tag, truncated to n characters"},
                    {"raw_inner_html(tag[, n])", "string", "Inner HTML without minification"},
                    {"trim(text(...) | inner_html(...))", "string", "Trim surrounding whitespace"},
                    {"count(tag|*)", "int64", "Aggregate node count"},
                    {"summarize(*)", "table<tag,count>", "Tag counts summary"},
                    {"tfidf(tag|*[, 'term'...])", "map<string,double>", "TF-IDF term scores, or a score for the terms"},
                    {"flatten_text(tag[, depth]) AS (c1, ...)", "string[]", "Descendant texts spread over the named columns"},
                    {"flatten(tag[, depth]) AS (c1, ...)", "string[]", "Same as flatten_text"},
            });

    public static final ResultSet AXES = table(
            List.of("axis", "description"),
            new String[][]{
                    {"parent", "Parent node"},
                    {"child", "Direct child nodes"},
                    {"ancestor", "Any ancestor node"},
                    {"descendant", "Any descendant node"},
            });

    public static final ResultSet OPERATORS = table(
            List.of("operator", "description"),
            new String[][]{
                    {"=", "Equality"},
                    {"<>", "Not equal"},
                    {"IN (...)", "Membership"},
                    {"CONTAINS", "Case-insensitive substring"},
                    {"CONTAINS ALL", "Contains all values"},
                    {"CONTAINS ANY", "Contains any value"},
                    {"IS NULL", "Null check"},
                    {"IS NOT NULL", "Not-null check"},
                    {"HAS_DIRECT_TEXT", "Direct text predicate"},
                    {"~", "Regex match"},
                    {"AND", "Logical AND"},
                    {"OR", "Logical OR"},
            });

    public static final ResultSet DOCUMENT_SCHEMA = table(
            List.of("column_name", "type", "nullable", "notes"),
            new String[][]{
                    {"node_id", "int64", "false", "Stable node identifier"},
                    {"tag", "string", "false", "Lowercase tag name"},
                    {"attributes", "map<string,string>", "false", "HTML attributes"},
                    {"parent_id", "int64", "true", "Null for root"},
                    {"max_depth", "int64", "false", "Max element depth under node"},
                    {"doc_order", "int64", "false", "Preorder document index"},
                    {"sibling_pos", "int64", "false", "1-based among siblings"},
                    {"source_uri", "string", "true", "File path, raw or fragment"},
            });

    public static final ResultSet LANGUAGE = table(
            List.of("category", "name", "syntax", "notes"),
            new String[][]{
                    {"clause", "SELECT", "SELECT <tag|*|projection>[, ...]", "Tags, projections or aggregates"},
                    {"clause", "FROM", "FROM <source>", "document, path, RAW, FRAGMENTS or alias"},
                    {"clause", "WHERE", "WHERE <expr>", "Predicate expression"},
                    {"clause", "ORDER BY", "ORDER BY <field> [ASC|DESC]",
                            "Result column, alias or node field; SUMMARIZE uses tag/count"},
                    {"clause", "LIMIT", "LIMIT <n>", "n >= 0, max enforced"},
                    {"clause", "EXCLUDE", "EXCLUDE <field>[, ...]", "Only with SELECT *"},
                    {"output", "TO LIST", "TO LIST()", "Requires one projected column"},
                    {"output", "TO TABLE", "TO TABLE([HEADER|NOHEADER][, EXPORT='file.csv'])",
                            "Text table; SELECT table extracts cells"},
                    {"output", "TO CSV", "TO CSV('file.csv')", "Export result"},
                    {"output", "TO PARQUET", "TO PARQUET('file.parquet')", "Export result"},
                    {"source", "document", "FROM document", "Input document"},
                    {"source", "alias", "FROM doc", "Alias for document"},
                    {"source", "path", "FROM 'file.html'", "Local file"},
                    {"source", "raw", "FROM RAW('<html>')", "Inline HTML"},
                    {"source", "fragments", "FROM FRAGMENTS(<raw|subquery>)", "Concatenate HTML fragments"},
                    {"source", "fragments_raw", "FRAGMENTS(RAW('<ul>...</ul>'))", "Raw fragment input"},
                    {"source", "fragments_query", "FRAGMENTS(SELECT inner_html(...) FROM doc)",
                            "Subquery returns HTML strings"},
                    {"field", "node_id", "node_id", "int64"},
                    {"field", "tag", "tag", "lowercase"},
                    {"field", "text", "text", "All descendant text"},
                    {"field", "attributes", "attributes", "map<string,string>"},
                    {"field", "parent_id", "parent_id", "int64 or null"},
                    {"field", "sibling_pos", "sibling_pos", "1-based among siblings"},
                    {"field", "max_depth", "max_depth", "Element height, leaf = 0"},
                    {"field", "doc_order", "doc_order", "Preorder index"},
                    {"field", "inner_html", "inner_html", "Serialized inner markup"},
                    {"field", "source_uri", "source_uri", "Origin of the tree"},
                    {"function", "text", "text(tag)", "Direct text content"},
                    {"function", "inner_html", "inner_html(tag[, n])", "Minified inner HTML"},
                    {"function", "raw_inner_html", "raw_inner_html(tag[, n])", "Raw inner HTML (no minify)"},
                    {"function", "trim", "trim(text(...)) | trim(inner_html(...))", "Trim whitespace"},
                    {"function", "flatten_text", "flatten_text(tag[, depth]) AS (c1, ...)", "Descendant texts as columns"},
                    {"function", "flatten", "flatten(tag[, depth]) AS (c1, ...)", "Alias of flatten_text"},
                    {"aggregate", "count", "count(tag|*)", "int64"},
                    {"aggregate", "summarize", "summarize(*)", "tag counts table"},
                    {"aggregate", "tfidf", "tfidf(tag|*)", "map<string,double>"},
                    {"axis", "parent", "parent.<field>", "Direct parent"},
                    {"axis", "child", "child.<field>", "Direct child"},
                    {"axis", "ancestor", "ancestor.<field>", "Any ancestor"},
                    {"axis", "descendant", "descendant.<field>", "Any descendant"},
                    {"predicate", "exists", "EXISTS(axis [WHERE expr])", "Existential axis predicate"},
                    {"operator", "=", "lhs = rhs", "Equality"},
                    {"operator", "<>", "lhs <> rhs", "Not equal"},
                    {"operator", "IN", "lhs IN ('a','b')", "Membership"},
                    {"operator", "CONTAINS", "lhs CONTAINS 'x'", "Case-insensitive substring"},
                    {"operator", "CONTAINS ALL", "lhs CONTAINS ALL ('a','b')", "All values"},
                    {"operator", "CONTAINS ANY", "lhs CONTAINS ANY ('a','b')", "Any value"},
                    {"operator", "IS NULL", "lhs IS NULL", "Null check"},
                    {"operator", "IS NOT NULL", "lhs IS NOT NULL", "Not-null check"},
                    {"operator", "HAS_DIRECT_TEXT", "[axis.]tag HAS_DIRECT_TEXT ['x']", "Predicate on direct text"},
                    {"operator", "~", "lhs ~ 're'", "Regex match"},
                    {"operator", "AND", "expr AND expr", "Logical AND"},
                    {"operator", "OR", "expr OR expr", "Logical OR"},
                    {"meta", "SHOW INPUT", "SHOW INPUT", "Active source"},
                    {"meta", "SHOW INPUTS", "SHOW INPUTS", "Active and bound sources"},
                    {"meta", "SHOW FUNCTIONS", "SHOW FUNCTIONS", "Function list"},
                    {"meta", "SHOW AXES", "SHOW AXES", "Axis list"},
                    {"meta", "SHOW OPERATORS", "SHOW OPERATORS", "Operator list"},
                    {"meta", "DESCRIBE doc", "DESCRIBE doc", "Document schema"},
                    {"meta", "DESCRIBE language", "DESCRIBE language", "Language reference"},
            });

    private MetaRegistry() {
        // Static utility class
    }

    /**
     * @param bound trees currently bound to aliases, listed by SHOW INPUTS
     */
    public static ResultSet show(ShowQuery.Target target, DocumentTree input, Collection<DocumentTree> bound) {
        return switch (target) {
            case INPUT -> table(List.of("key", "value"), new String[][]{
                    {"source_uri", input.sourceUri()},
                    {"node_count", Integer.toString(input.size())},
            });
            case INPUTS -> inputs(input, bound);
            case FUNCTIONS -> FUNCTIONS;
            case AXES -> AXES;
            case OPERATORS -> OPERATORS;
        };
    }

    public static ResultSet describe(DescribeQuery.Target target) {
        return switch (target) {
            case DOCUMENT -> DOCUMENT_SCHEMA;
            case LANGUAGE -> LANGUAGE;
        };
    }

    private static ResultSet inputs(DocumentTree input, Collection<DocumentTree> bound) {
        Set<String> uris = new LinkedHashSet<>();
        uris.add(input.sourceUri());
        for (DocumentTree tree : bound) {
            uris.add(tree.sourceUri());
        }
        List<Row> rows = new ArrayList<>(uris.size());
        for (String uri : uris) {
            rows.add(Row.of(Value.of(uri)));
        }
        return new ResultSet(List.of(Column.string("source_uri")), rows);
    }

    private static ResultSet table(List<String> names, String[][] cells) {
        List<Column> columns = new ArrayList<>(names.size());
        for (String name : names) {
            columns.add(Column.string(name));
        }
        List<Row> rows = new ArrayList<>(cells.length);
        for (String[] cell : cells) {
            List<Value> values = new ArrayList<>(cell.length);
            for (String text : cell) {
                values.add(Value.of(text));
            }
            rows.add(new Row(values));
        }
        return new ResultSet(columns, rows);
    }
}
