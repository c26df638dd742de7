package db.runner.exec;

import static db.runner.exec.TestRelations.lines;
import static db.runner.exec.TestRelations.relation;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

public class LimitOperatorTest {
    private final Relation nums = relation("n", "1", "2", "3", "4", "5");

    @Test
    void positiveTakesFirstRows() {
        assertEquals(List.of("1", "2"), lines(new LimitOperator(2).apply(nums)));
    }

    @Test
    void negativeTakesLastRowsInOriginalOrder() {
        assertEquals(List.of("4", "5"), lines(new LimitOperator(-2).apply(nums)));
    }

    @Test
    void zeroYieldsEmptyRelationWithSameSchema() {
        Relation out = new LimitOperator(0).apply(nums);
        assertTrue(out.isEmpty());
        assertEquals(nums.schema(), out.schema());
    }

    @Test
    void limitsAtOrBeyondSizeReturnEverything() {
        assertEquals(nums.rows(), new LimitOperator(5).apply(nums).rows());
        assertEquals(nums.rows(), new LimitOperator(100).apply(nums).rows());
        assertEquals(nums.rows(), new LimitOperator(-100).apply(nums).rows());
        assertEquals(nums.rows(), new LimitOperator(Integer.MIN_VALUE).apply(nums).rows());
    }

    @Test
    void limitIsIdempotent() {
        for (int n : new int[] {3, -3, 0, 9}) {
            LimitOperator op = new LimitOperator(n);
            Relation once = op.apply(nums);
            assertEquals(once.rows(), op.apply(once).rows(), "n=" + n);
        }
    }
}
