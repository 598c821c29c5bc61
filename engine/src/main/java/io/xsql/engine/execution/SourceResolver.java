package io.xsql.engine.execution;

import io.xsql.engine.EngineOptions;
import io.xsql.engine.document.DocumentTree;
import io.xsql.engine.query.ast.OutputTarget;
import io.xsql.engine.query.ast.SelectQuery;
import io.xsql.engine.query.ast.Source;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * RESOLVE_SOURCE stage: turns a FROM clause into the tree to query. Aliases
 * are only looked up here; the executor binds a new one once the statement
 * has succeeded.
 */
final class SourceResolver {

    private static final Logger logger = LoggerFactory.getLogger(SourceResolver.class);

    static final String RAW_URI = "raw";
    static final String FRAGMENT_URI = "fragment";

    private final EngineOptions options;
    private final Map<String, DocumentTree> bindings;
    private final QueryExecutor executor;

    SourceResolver(EngineOptions options, Map<String, DocumentTree> bindings, QueryExecutor executor) {
        this.options = options;
        this.bindings = bindings;
        this.executor = executor;
    }

    DocumentTree resolve(Source source, DocumentTree input) {
        DocumentTree tree;
        if (source instanceof Source.Document) {
            tree = input;
        } else if (source instanceof Source.Path path) {
            tree = readPath(path);
        } else if (source instanceof Source.Raw raw) {
            tree = DocumentTree.parse(checkRawSize(raw.html()), RAW_URI);
        } else if (source instanceof Source.Fragments fragments) {
            tree = fragments.isSubquery()
                    ? fromSubquery(fragments.query(), input)
                    : DocumentTree.parse(checkRawSize(fragments.raw().html()), FRAGMENT_URI);
        } else if (source instanceof Source.AliasRef ref) {
            tree = lookup(ref.name());
        } else {
            throw new IllegalStateException("Unknown source: " + source);
        }
        logger.debug("Resolved {} to {}", source.getClass().getSimpleName(), tree);
        return tree;
    }

    private DocumentTree lookup(String name) {
        DocumentTree tree = bindings.get(name.toLowerCase(Locale.ROOT));
        if (tree == null) {
            throw new SourceException("Unknown source alias '" + name
                    + "'; bind it first, e.g. FROM document AS " + name);
        }
        return tree;
    }

    private DocumentTree readPath(Source.Path path) {
        if (path.isUrl()) {
            throw new SourceException("URL sources are not supported: " + path.location());
        }
        try {
            String html = Files.readString(Path.of(path.location()), StandardCharsets.UTF_8);
            return DocumentTree.parse(html, path.location());
        } catch (IOException e) {
            throw new SourceException("Cannot read source file '" + path.location() + "'", e);
        }
    }

    private String checkRawSize(String html) {
        int bytes = html.getBytes(StandardCharsets.UTF_8).length;
        if (bytes > options.maxRawHtmlBytes()) {
            throw new SourceException("RAW() input of " + bytes + " bytes exceeds the limit of "
                    + options.maxRawHtmlBytes());
        }
        return html;
    }

    /**
     * Runs the subquery and parses each non-blank value of its single column
     * as an independent fragment.
     */
    private DocumentTree fromSubquery(SelectQuery subquery, DocumentTree input) {
        if (subquery.output() != null && !(subquery.output() instanceof OutputTarget.ToList)) {
            throw new SourceException("FRAGMENTS subquery cannot use TO " + describe(subquery.output()));
        }
        ResultSet result = executor.execute(subquery, input);
        if (result.columnCount() != 1) {
            throw new SourceException("FRAGMENTS expects a single HTML string column, got "
                    + result.columnCount() + " columns");
        }

        List<DocumentTree> parts = new ArrayList<>();
        long totalBytes = 0;
        for (Row row : result) {
            Value value = row.get(0);
            if (value.isNull()) {
                continue;
            }
            if (!(value instanceof Value.StringValue)) {
                throw new SourceException("FRAGMENTS expects HTML strings (use INNER_HTML(...) or RAW('<...>'))");
            }
            String fragment = value.asText().trim();
            if (fragment.isEmpty()) {
                continue;
            }
            if (fragment.indexOf('<') < 0 || fragment.indexOf('>') < 0) {
                throw new SourceException("FRAGMENTS expects HTML strings (use INNER_HTML(...) or RAW('<...>'))");
            }
            if (parts.size() >= options.maxFragmentCount()) {
                throw new SourceException("FRAGMENTS exceeds the maximum of " + options.maxFragmentCount()
                        + " fragments");
            }
            totalBytes += fragment.getBytes(StandardCharsets.UTF_8).length;
            if (totalBytes > options.maxFragmentBytes()) {
                throw new SourceException("FRAGMENTS exceeds the maximum total size of "
                        + options.maxFragmentBytes() + " bytes");
            }
            parts.add(DocumentTree.parse(fragment, FRAGMENT_URI));
        }
        logger.debug("FRAGMENTS subquery produced {} fragments", parts.size());
        return DocumentTree.merge(parts, FRAGMENT_URI);
    }

    private static String describe(OutputTarget target) {
        if (target instanceof OutputTarget.ToTable) {
            return "TABLE()";
        }
        return target instanceof OutputTarget.ToCsv ? "CSV()" : "PARQUET()";
    }
}
