package db.runner.catalog;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

// Immutable ordered list of column names. Lookups by name resolve to the first match.
public record Schema(List<String> columns) {

    public Schema {
        if (columns == null) throw new IllegalArgumentException("columns must not be null");
        columns = List.copyOf(columns);
    }

    public static Schema of(String... columns) { return new Schema(List.of(columns)); }

    public int size() { return columns.size(); }

    public String name(int index) { return columns.get(index); }

    /** Position of the first column with this name, or -1. */
    public int indexOf(String column) { return columns.indexOf(column); }

    public boolean contains(String column) { return columns.contains(column); }

    /** First name that appears more than once, or null when all names are unique. */
    public String firstDuplicate() {
        Set<String> seen = new HashSet<>();
        for (String c : columns) {
            if (!seen.add(c)) return c;
        }
        return null;
    }

    @Override
    public String toString() { return String.join(",", columns); }
}
