package db.runner.query;

import java.util.List;

import db.runner.catalog.Catalog;
import db.runner.exec.GroupCountOperator;
import db.runner.exec.JoinOperator;
import db.runner.exec.JoinStrategy;
import db.runner.exec.LimitOperator;
import db.runner.exec.Operator;
import db.runner.exec.ProjectionOperator;
import db.runner.exec.Relation;
import db.runner.exec.SortOperator;

/**
 * Runs a parsed pipeline: resolves the source, then threads the relation through one operator per step.
 * The first failing step aborts the whole pipeline; no partial relation escapes.
 */
public class QueryExecutor {
    private final Catalog catalog;
    private final JoinStrategy joinStrategy;

    public QueryExecutor(Catalog catalog, JoinStrategy joinStrategy) {
        this.catalog = catalog;
        this.joinStrategy = joinStrategy;
    }

    public Relation run(List<Step> steps) {
        if (steps.isEmpty() || !(steps.get(0) instanceof SourceStep source)) {
            throw new IllegalArgumentException("Pipeline must start with a source step: " + steps);
        }
        Relation current = catalog.load(source.sourceName());
        for (Step step : steps.subList(1, steps.size())) {
            current = toOperator(step).apply(current);
        }
        return current;
    }

    /** Map one step to its operator. JOIN loads its right side through the catalog here. */
    Operator toOperator(Step step) {
        if (step instanceof ProjectStep p) return new ProjectionOperator(p.columns());
        if (step instanceof LimitStep l) return new LimitOperator(l.count());
        if (step instanceof SortStep s) return SortOperator.orderBy(s.column());
        if (step instanceof GroupCountStep g) return new GroupCountOperator(g.column());
        if (step instanceof JoinStep j) {
            Relation right = catalog.load(j.sourceName());
            return new JoinOperator(joinStrategy, right, j.joinColumn());
        }
        throw new IllegalArgumentException("Unsupported step: " + step);
    }
}
