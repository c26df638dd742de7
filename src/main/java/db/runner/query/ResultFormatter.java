package db.runner.query;

import java.util.List;

import db.runner.catalog.Cell;
import db.runner.exec.Relation;
import db.runner.exec.Row;

/**
 * Renders a relation as query output: comma-joined header line, then one comma-joined line per row.
 * Every line ends with a newline. An empty relation renders as {@link #NO_DATA}.
 */
public final class ResultFormatter {
    public static final String NO_DATA = "No data returned.";

    private ResultFormatter() {}

    public static String format(Relation relation) {
        if (relation == null || relation.isEmpty()) return NO_DATA;
        StringBuilder sb = new StringBuilder();
        sb.append(String.join(",", relation.schema().columns())).append('\n');
        for (Row r : relation.rows()) {
            appendRow(sb, r.values());
        }
        return sb.toString();
    }

    private static void appendRow(StringBuilder sb, List<Cell> values) {
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) sb.append(',');
            sb.append(values.get(i));
        }
        sb.append('\n');
    }
}
