package db.runner.exec;

import java.util.ArrayList;
import java.util.List;

import db.runner.catalog.Cell;
import db.runner.catalog.Schema;

/**
 * Projection operator: keeps the requested columns in the requested order.
 * A name requested twice yields two output columns carrying the same value.
 * All names are resolved before any row is built, so a missing column yields no partial result.
 */
public class ProjectionOperator implements Operator {
    private final List<String> columnNames;

    public ProjectionOperator(List<String> columnNames) {
        if (columnNames == null || columnNames.isEmpty()) throw new IllegalArgumentException("columnNames must be non-empty");
        this.columnNames = List.copyOf(columnNames);
    }

    @Override
    public Relation apply(Relation input) {
        int[] idxs = new int[columnNames.size()];
        for (int i = 0; i < columnNames.size(); i++) {
            idxs[i] = input.columnIndex(columnNames.get(i));
        }
        List<Row> out = new ArrayList<>(input.size());
        for (Row r : input.rows()) {
            List<Cell> projected = new ArrayList<>(idxs.length);
            for (int idx : idxs) projected.add(r.get(idx));
            out.add(Row.of(projected));
        }
        return new Relation(new Schema(columnNames), out);
    }
}
