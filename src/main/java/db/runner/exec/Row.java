package db.runner.exec;

import java.util.ArrayList;
import java.util.List;

import db.runner.catalog.Cell;

/**
 * Row is the unit flowing between operators: a fixed-order list of cells,
 * positionally aligned with the schema of the relation that owns it.
 */
public final class Row {
    private final List<Cell> values;

    private Row(List<Cell> values) {
        this.values = values;
    }

    public static Row of(List<Cell> values) { return new Row(List.copyOf(values)); }

    public static Row of(Cell... values) { return new Row(List.of(values)); }

    /** Infer every raw field; used by the loader and by tests building fixtures. */
    public static Row parse(String[] fields) {
        List<Cell> cells = new ArrayList<>(fields.length);
        for (String f : fields) cells.add(Cell.infer(f));
        return new Row(List.copyOf(cells));
    }

    public List<Cell> values() { return values; }

    public Cell get(int index) { return values.get(index); }

    public int size() { return values.size(); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Row other)) return false;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() { return values.hashCode(); }

    @Override
    public String toString() { return "Row" + values; }
}
