package db.runner.exec;

import java.util.ArrayList;
import java.util.List;

/**
 * Sort-merge join. Both inputs are sorted ascending on the join column, then walked with two cursors.
 * <p>
 * When the cursors first meet on equal keys the right position is remembered as the run mark. Each left row
 * of that key is paired with the right run starting at the mark; once the right cursor passes the run (or
 * runs off the end) it goes back to the mark and the left cursor advances. The mark is dropped as soon as
 * the left key changes. Running out of either side while catching up ends the merge.
 */
public class SortMergeJoin implements JoinStrategy {

    @Override
    public Relation join(Relation left, Relation right, String joinColumn) {
        JoinLayout layout = JoinLayout.of(left, right, joinColumn);
        List<Row> ls = SortOperator.ascending(joinColumn).apply(left).rows();
        List<Row> rs = SortOperator.ascending(joinColumn).apply(right).rows();
        int lk = layout.leftKey;
        int rk = layout.rightKey;

        List<Row> out = new ArrayList<>();
        int l = 0;
        int r = 0;
        int mark = -1;
        while (l < ls.size()) {
            if (mark < 0) {
                while (l < ls.size() && r < rs.size()) {
                    int c = ls.get(l).get(lk).compareTo(rs.get(r).get(rk));
                    if (c < 0) l++;
                    else if (c > 0) r++;
                    else break;
                }
                if (l >= ls.size() || r >= rs.size()) break;
                mark = r;
            }
            if (r < rs.size() && ls.get(l).get(lk).equals(rs.get(r).get(rk))) {
                out.add(layout.combine(ls.get(l), rs.get(r)));
                r++;
            } else {
                r = mark;
                l++;
                if (l >= ls.size() || !ls.get(l).get(lk).equals(rs.get(mark).get(rk))) mark = -1;
            }
        }
        return new Relation(layout.outputSchema, out);
    }
}
