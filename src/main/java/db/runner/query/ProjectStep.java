package db.runner.query;

import java.util.List;

/**
 * SELECT a,b,c. Column order is the output order; repeated names are kept.
 */
public record ProjectStep(List<String> columns) implements Step {
    public ProjectStep {
        columns = List.copyOf(columns);
    }
}
