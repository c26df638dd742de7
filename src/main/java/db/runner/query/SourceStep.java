package db.runner.query;

// FROM <source>
public record SourceStep(String sourceName) implements Step {}
