package db.runner.catalog;

/**
 * Inferred cell types. Declaration order is also the cross-type sort order.
 */
public enum DataType {
    INTEGER,
    TEXT;
}
