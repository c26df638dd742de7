package db.runner.query;

// TAKE <n>; negative n keeps the last |n| rows.
public record LimitStep(int count) implements Step {}
