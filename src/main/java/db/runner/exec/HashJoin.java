package db.runner.exec;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import db.runner.catalog.Cell;

/**
 * Classic hash join. The smaller input (left on ties) is the build side: its rows are indexed by join value,
 * keeping every position for duplicate keys. The other input is probed row by row, so output follows probe
 * order, then build position.
 */
public class HashJoin implements JoinStrategy {

    @Override
    public Relation join(Relation left, Relation right, String joinColumn) {
        JoinLayout layout = JoinLayout.of(left, right, joinColumn);
        boolean buildLeft = left.size() <= right.size();
        Relation build = buildLeft ? left : right;
        Relation probe = buildLeft ? right : left;
        int buildKey = buildLeft ? layout.leftKey : layout.rightKey;
        int probeKey = buildLeft ? layout.rightKey : layout.leftKey;

        // build phase
        Map<Cell, List<Integer>> lookup = new HashMap<>();
        List<Row> buildRows = build.rows();
        for (int i = 0; i < buildRows.size(); i++) {
            lookup.computeIfAbsent(buildRows.get(i).get(buildKey), k -> new ArrayList<>()).add(i);
        }

        // probe phase
        List<Row> out = new ArrayList<>();
        for (Row probeRow : probe.rows()) {
            List<Integer> matches = lookup.get(probeRow.get(probeKey));
            if (matches == null) continue;
            for (int pos : matches) {
                Row buildRow = buildRows.get(pos);
                out.add(buildLeft ? layout.combine(buildRow, probeRow) : layout.combine(probeRow, buildRow));
            }
        }
        return new Relation(layout.outputSchema, out);
    }
}
