package db.runner.query;

/**
 * Parsed, typed form of one query clause. A pipeline is an ordered list of steps whose first element is
 * always a {@link SourceStep}.
 */
public interface Step {}
