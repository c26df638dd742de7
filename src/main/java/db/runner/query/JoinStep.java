package db.runner.query;

/**
 * JOIN <source> <column>: the current relation is the left side, the named source the right side.
 */
public record JoinStep(String sourceName, String joinColumn) implements Step {}
