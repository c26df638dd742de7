package db.runner.query;

import java.util.List;

import db.runner.QueryException;
import db.runner.catalog.Catalog;
import db.runner.exec.JoinStrategy;
import db.runner.exec.Relation;

/**
 * Processor combining parsing, execution and formatting behind one string-in, string-out call.
 * Every transport (shell, socket server) wraps {@link #execute(String)}.
 */
public class QueryProcessor {
    private final QueryParser parser = new QueryParser();
    private final QueryExecutor executor;

    public QueryProcessor(Catalog catalog, JoinStrategy joinStrategy) {
        this.executor = new QueryExecutor(catalog, joinStrategy);
    }

    /** Parse and run a query, failing with a {@link QueryException} subtype. */
    public Relation run(String query) {
        List<Step> steps = parser.parse(query);
        return executor.run(steps);
    }

    /**
     * Unified execution entry point.
     * Success -> header line plus one line per row, or "No data returned." for an empty result.
     * Failure -> the single-line message of the failing step.
     */
    public String execute(String query) {
        try {
            return ResultFormatter.format(run(query));
        } catch (QueryException e) {
            return e.getMessage();
        } catch (RuntimeException e) {
            logError("Unexpected failure for query: " + query, e);
            return "Internal error: " + e.getMessage();
        }
    }

    private void logError(String message, Exception e) {
        System.err.println("[QueryProcessor] " + message);
        e.printStackTrace(System.err);
    }
}
