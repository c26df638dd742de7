package db.runner.exec;

/**
 * Pipeline stage joining its input (left) with a fixed right relation on one column.
 */
public class JoinOperator implements Operator {
    private final JoinStrategy strategy;
    private final Relation right;
    private final String joinColumn;

    public JoinOperator(JoinStrategy strategy, Relation right, String joinColumn) {
        this.strategy = strategy;
        this.right = right;
        this.joinColumn = joinColumn;
    }

    @Override
    public Relation apply(Relation left) {
        return strategy.join(left, right, joinColumn);
    }

    public String joinColumn() { return joinColumn; }
}
