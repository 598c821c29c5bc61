package io.xsql.engine.execution;

import io.xsql.engine.EngineOptions;
import io.xsql.engine.document.DocumentNode;
import io.xsql.engine.document.DocumentTree;
import io.xsql.engine.query.ast.DescribeQuery;
import io.xsql.engine.query.ast.Query;
import io.xsql.engine.query.ast.SelectQuery;
import io.xsql.engine.query.ast.ShowQuery;
import io.xsql.engine.query.ast.Source;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Executes parsed statements against a document tree.
 *
 * A SELECT runs through the stages RESOLVE_SOURCE, FILTER, PROJECT,
 * AGGREGATE (only with an aggregate item), ORDER_BY, LIMIT and BIND, in
 * that order. The first failure aborts the statement with a
 * {@link QueryExecutionException} naming the stage.
 *
 * Aliases bound with {@code AS} stay bound for later statements on the same
 * executor, so an instance is not meant to be shared between threads.
 */
public class QueryExecutor {

    private static final Logger logger = LoggerFactory.getLogger(QueryExecutor.class);

    private final EngineOptions options;
    private final Map<String, DocumentTree> bindings = new LinkedHashMap<>();

    public QueryExecutor() {
        this(EngineOptions.defaults());
    }

    public QueryExecutor(EngineOptions options) {
        this.options = options;
    }

    public EngineOptions options() {
        return options;
    }

    /**
     * Trees bound to aliases so far, by lowercase alias.
     */
    public Map<String, DocumentTree> bindings() {
        return Collections.unmodifiableMap(bindings);
    }

    /**
     * Binds a tree to a name usable as {@code FROM name}.
     */
    public void bind(String alias, DocumentTree tree) {
        bindings.put(alias.toLowerCase(Locale.ROOT), tree);
    }

    public ResultSet execute(Query query, DocumentTree document) {
        if (query instanceof SelectQuery select) {
            return executeSelect(select, document);
        }
        if (query instanceof ShowQuery show) {
            Collection<DocumentTree> bound = bindings.values();
            return MetaRegistry.show(show.target(), document, bound);
        }
        if (query instanceof DescribeQuery describe) {
            return MetaRegistry.describe(describe.target());
        }
        throw new IllegalStateException("Unknown query type: " + query);
    }

    private ResultSet executeSelect(SelectQuery query, DocumentTree document) {
        SourceResolver resolver = new SourceResolver(options, Collections.unmodifiableMap(bindings), this);
        DocumentTree tree = stage(Stage.RESOLVE_SOURCE, () -> resolver.resolve(query.source(), document));
        boolean emptySource = query.source() instanceof Source.Fragments && tree.isEmpty();

        FilterEvaluator filter = new FilterEvaluator(tree, options);
        List<DocumentNode> candidates = stage(Stage.FILTER, () -> filter.candidates(query));
        logger.debug("FILTER kept {} of {} nodes", candidates.size(), tree.size());

        Projector projector = new Projector(tree, filter);
        Projection projection = stage(Stage.PROJECT, () -> projector.project(query, candidates));

        if (query.hasAggregate()) {
            Projection projected = projection;
            projection = stage(Stage.AGGREGATE,
                    () -> new Aggregator(options).aggregate(query, projected, emptySource));
            logger.debug("AGGREGATE produced {} rows", projection.rows().size());
        }

        if (!query.orderBy().isEmpty()) {
            Projection unordered = projection;
            projection = stage(Stage.ORDER_BY, () -> new RowOrdering(tree).sort(unordered, query.orderBy()));
        }

        if (query.limit() != null) {
            Projection unlimited = projection;
            projection = stage(Stage.LIMIT, () -> limit(unlimited, query.limit()));
        }

        ResultSet result = projection.toResultSet();
        ResultSet bound = stage(Stage.BIND, () -> OutputBinder.bind(query.output(), result));
        if (query.source().alias() != null) {
            bind(query.source().alias(), tree);
            logger.debug("Bound alias '{}' to {}", query.source().alias(), tree);
        }
        logger.debug("SELECT returned {} rows x {} columns", bound.rowCount(), bound.columnCount());
        return bound;
    }

    private Projection limit(Projection projection, int limit) {
        if (limit > options.maxLimit()) {
            throw new IllegalArgumentException("LIMIT " + limit + " exceeds the maximum of " + options.maxLimit());
        }
        List<ProjectedRow> rows = projection.rows();
        return rows.size() <= limit ? projection : projection.withRows(rows.subList(0, limit));
    }

    private static <T> T stage(Stage stage, Supplier<T> body) {
        try {
            return body.get();
        } catch (RuntimeException e) {
            logger.debug("Stage {} failed: {}", stage, e.getMessage());
            throw new QueryExecutionException(stage, e);
        }
    }
}
