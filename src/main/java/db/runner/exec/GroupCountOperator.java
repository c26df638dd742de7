package db.runner.exec;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import db.runner.catalog.Cell;
import db.runner.catalog.Schema;

/**
 * COUNTBY: one output row per distinct key, in order of first occurrence, with the number of input rows
 * sharing that key.
 */
public class GroupCountOperator implements Operator {
    public static final String COUNT_COLUMN = "count";

    private final String column;

    public GroupCountOperator(String column) {
        this.column = column;
    }

    @Override
    public Relation apply(Relation input) {
        int idx = input.columnIndex(column);
        if (COUNT_COLUMN.equals(column)) throw new SchemaConflictException(List.of(COUNT_COLUMN));

        Map<Cell, Long> counts = new LinkedHashMap<>();
        for (Row r : input.rows()) {
            counts.merge(r.get(idx), 1L, Long::sum);
        }
        List<Row> out = new ArrayList<>(counts.size());
        for (Map.Entry<Cell, Long> e : counts.entrySet()) {
            out.add(Row.of(e.getKey(), Cell.ofInteger(e.getValue())));
        }
        return new Relation(Schema.of(column, COUNT_COLUMN), out);
    }
}
