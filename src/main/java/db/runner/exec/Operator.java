package db.runner.exec;

/**
 * One pipeline stage: consumes a relation and produces a new one.
 * Implementations keep no state between calls and never modify their input.
 */
public interface Operator {
    Relation apply(Relation input);
}
