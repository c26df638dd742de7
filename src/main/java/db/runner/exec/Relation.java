package db.runner.exec;

import java.util.List;

import db.runner.catalog.Schema;

/**
 * Immutable schema plus ordered rows. Operators never modify a relation; they build a new one.
 */
public final class Relation {
    private final Schema schema;
    private final List<Row> rows;

    public Relation(Schema schema, List<Row> rows) {
        if (schema == null) throw new IllegalArgumentException("schema must not be null");
        this.schema = schema;
        this.rows = List.copyOf(rows);
        for (Row r : this.rows) {
            if (r.size() != schema.size()) {
                throw new IllegalArgumentException("Row width " + r.size() + " != schema width " + schema.size() + ": " + r);
            }
        }
    }

    public static Relation empty(Schema schema) { return new Relation(schema, List.of()); }

    public Schema schema() { return schema; }
    public List<Row> rows() { return rows; }
    public int size() { return rows.size(); }
    public boolean isEmpty() { return rows.isEmpty(); }

    /** Resolve a column position or fail with {@link UnknownColumnException}. */
    public int columnIndex(String column) {
        int idx = schema.indexOf(column);
        if (idx < 0) throw new UnknownColumnException(column);
        return idx;
    }

    @Override
    public String toString() {
        return "Relation[" + schema + "] rows=" + rows.size();
    }
}
