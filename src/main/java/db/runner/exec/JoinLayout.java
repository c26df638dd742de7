package db.runner.exec;

import java.util.ArrayList;
import java.util.List;

import db.runner.catalog.Cell;
import db.runner.catalog.Schema;

/**
 * Column bookkeeping shared by the join strategies: validates the join column on both sides,
 * derives the output schema (left columns, then right columns minus the join column) and
 * lays out combined rows in that order.
 */
final class JoinLayout {
    final int leftKey;
    final int rightKey;
    final Schema outputSchema;
    private final int[] rightKept; // right positions copied after the left values

    private JoinLayout(int leftKey, int rightKey, Schema outputSchema, int[] rightKept) {
        this.leftKey = leftKey;
        this.rightKey = rightKey;
        this.outputSchema = outputSchema;
        this.rightKept = rightKept;
    }

    static JoinLayout of(Relation left, Relation right, String joinColumn) {
        int leftKey = left.columnIndex(joinColumn);
        int rightKey = right.columnIndex(joinColumn);

        Schema ls = left.schema();
        Schema rs = right.schema();
        String leftDup = ls.firstDuplicate();
        if (leftDup != null) throw new SchemaConflictException(List.of(leftDup));
        List<String> names = new ArrayList<>(ls.columns());
        List<String> conflicts = new ArrayList<>();
        int[] kept = new int[rs.size() - 1];
        int k = 0;
        for (int i = 0; i < rs.size(); i++) {
            if (i == rightKey) continue;
            String name = rs.name(i);
            if (ls.contains(name) || name.equals(joinColumn)) conflicts.add(name);
            names.add(name);
            kept[k++] = i;
        }
        if (!conflicts.isEmpty()) throw new SchemaConflictException(conflicts);
        return new JoinLayout(leftKey, rightKey, new Schema(names), kept);
    }

    Row combine(Row left, Row right) {
        List<Cell> combined = new ArrayList<>(left.size() + rightKept.length);
        combined.addAll(left.values());
        for (int i : rightKept) combined.add(right.get(i));
        return Row.of(combined);
    }
}
