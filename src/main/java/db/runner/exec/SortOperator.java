package db.runner.exec;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Stable sort on one column. Equal keys keep their input order in both directions.
 */
public class SortOperator implements Operator {
    private final String column;
    private final boolean descending;

    public SortOperator(String column, boolean descending) {
        this.column = column;
        this.descending = descending;
    }

    /** ORDERBY always sorts descending. */
    public static SortOperator orderBy(String column) { return new SortOperator(column, true); }

    public static SortOperator ascending(String column) { return new SortOperator(column, false); }

    @Override
    public Relation apply(Relation input) {
        int idx = input.columnIndex(column);
        Comparator<Row> byKey = Comparator.comparing((Row r) -> r.get(idx));
        // List.sort is a stable merge sort; reversed() keeps ties in input order
        List<Row> sorted = new ArrayList<>(input.rows());
        sorted.sort(descending ? byKey.reversed() : byKey);
        return new Relation(input.schema(), sorted);
    }
}
