package io.xsql.engine;

import io.xsql.engine.document.DocumentTree;
import io.xsql.engine.execution.QueryExecutor;
import io.xsql.engine.execution.ResultSet;
import io.xsql.engine.query.QueryParser;
import io.xsql.engine.query.ast.Query;

/**
 * Entry points for embedding XSQL.
 *
 * <pre>
 * DocumentTree doc = Xsql.parseDocument(html);
 * ResultSet links = Xsql.execute(Xsql.parseQuery("SELECT a.href FROM doc"), doc);
 * </pre>
 *
 * These methods use a fresh {@link QueryExecutor} per call, so aliases do not
 * carry over between statements; keep a QueryExecutor for that.
 */
public final class Xsql {

    private Xsql() {
    }

    /**
     * @throws io.xsql.engine.query.LexException        on an unrecognized character
     * @throws io.xsql.engine.query.QueryParseException on a grammar error
     */
    public static Query parseQuery(String statement) {
        return QueryParser.parse(statement);
    }

    /**
     * @throws io.xsql.engine.execution.QueryExecutionException when a pipeline stage fails
     */
    public static ResultSet execute(Query query, DocumentTree document) {
        return new QueryExecutor(EngineOptions.fromEnvironment()).execute(query, document);
    }

    public static DocumentTree parseDocument(String html) {
        return DocumentTree.parse(html);
    }

    /**
     * Parses both the markup and the statement, then runs it.
     */
    public static ResultSet query(String html, String statement) {
        return execute(parseQuery(statement), parseDocument(html));
    }
}
