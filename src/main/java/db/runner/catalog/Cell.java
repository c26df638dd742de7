package db.runner.catalog;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Single typed value in a row. INTEGER cells hold a {@link BigInteger}, TEXT cells a {@link String}.
 * Ordering: integers numerically, text lexicographically, and any INTEGER before any TEXT.
 * Equality follows the typed value; the source text is kept only for rendering.
 */
public final class Cell implements Comparable<Cell> {
    private final DataType type;
    private final Object value;
    private final String text;

    public Cell(DataType type, Object value) {
        this(type, value, value == null ? null : value.toString());
    }

    private Cell(DataType type, Object value, String text) {
        if (type == null || value == null) throw new IllegalArgumentException("type and value must not be null");
        switch (type) {
            case INTEGER -> { if (!(value instanceof BigInteger)) throw mismatch(type, value); }
            case TEXT -> { if (!(value instanceof String)) throw mismatch(type, value); }
        }
        this.type = type;
        this.value = value;
        this.text = text;
    }

    public static Cell ofInteger(long v) { return new Cell(DataType.INTEGER, BigInteger.valueOf(v)); }

    public static Cell ofText(String s) { return new Cell(DataType.TEXT, s); }

    /**
     * Infer the type of a raw source field: unsigned ASCII digit strings become INTEGER,
     * everything else (including "-1", "1.5" and "") stays TEXT. The raw field is what renders.
     */
    public static Cell infer(String raw) {
        if (isUnsignedDigits(raw)) return new Cell(DataType.INTEGER, new BigInteger(raw), raw);
        return ofText(raw);
    }

    private static boolean isUnsignedDigits(String raw) {
        if (raw.isEmpty()) return false;
        for (int i = 0; i < raw.length(); i++) {
            char ch = raw.charAt(i);
            if (ch < '0' || ch > '9') return false;
        }
        return true;
    }

    public DataType type() { return type; }

    public Object value() { return value; }

    public String text() { return text; }

    public boolean isInteger() { return type == DataType.INTEGER; }

    @Override
    public int compareTo(Cell other) {
        if (type != other.type) return type.compareTo(other.type);
        return switch (type) {
            case INTEGER -> ((BigInteger) value).compareTo((BigInteger) other.value);
            case TEXT -> ((String) value).compareTo((String) other.value);
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Cell other)) return false;
        return type == other.type && value.equals(other.value);
    }

    @Override
    public int hashCode() { return Objects.hash(type, value); }

    private static IllegalArgumentException mismatch(DataType t, Object v) {
        return new IllegalArgumentException("Expected value of type " + t + " but got " + v.getClass().getSimpleName());
    }

    // Rendered form used by query output
    @Override
    public String toString() { return text; }
}
