package db.runner.query;

// ORDERBY <column>, always descending.
public record SortStep(String column) implements Step {}
