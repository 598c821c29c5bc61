package io.xsql.engine.execution;

import io.xsql.engine.XsqlException;

/**
 * First failure of a SELECT pipeline, tagged with the stage that raised it.
 */
public class QueryExecutionException extends XsqlException {

    private final Stage stage;

    public QueryExecutionException(Stage stage, Throwable cause) {
        super("Query failed at " + stage + ": " + cause.getMessage(), cause);
        this.stage = stage;
    }

    public Stage getStage() {
        return stage;
    }
}
