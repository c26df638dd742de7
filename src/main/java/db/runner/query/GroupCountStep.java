package db.runner.query;

public record GroupCountStep(String column) implements Step {}
