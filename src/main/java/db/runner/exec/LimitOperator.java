package db.runner.exec;

/**
 * TAKE n: first n rows for positive n, last |n| rows for negative n, nothing for zero.
 */
public class LimitOperator implements Operator {
    private final int limit;

    public LimitOperator(int limit) {
        this.limit = limit;
    }

    @Override
    public Relation apply(Relation input) {
        int size = input.size();
        if (limit == 0) return Relation.empty(input.schema());
        if (limit > 0) {
            if (limit >= size) return new Relation(input.schema(), input.rows());
            return new Relation(input.schema(), input.rows().subList(0, limit));
        }
        // Math.abs(Integer.MIN_VALUE) overflows; compare in long
        long tail = -(long) limit;
        if (tail >= size) return new Relation(input.schema(), input.rows());
        return new Relation(input.schema(), input.rows().subList(size - (int) tail, size));
    }
}
