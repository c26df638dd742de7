package db.runner.exec;

import java.util.List;

import db.runner.QueryException;

/**
 * An operator would produce an output schema with repeated column names.
 */
public class SchemaConflictException extends QueryException {
    private final List<String> columns;

    public SchemaConflictException(List<String> columns) {
        super("Duplicate output column(s): " + String.join(", ", columns));
        this.columns = List.copyOf(columns);
    }

    public List<String> columns() { return columns; }
}
