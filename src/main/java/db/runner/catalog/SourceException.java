package db.runner.catalog;

import db.runner.QueryException;

/**
 * A source could not be turned into a relation: missing or unreadable, empty, or malformed.
 */
public class SourceException extends QueryException {
    public enum Kind { EMPTY, IO, MALFORMED }

    private final String sourceName;
    private final Kind kind;

    public SourceException(Kind kind, String sourceName, String message) {
        super(message);
        this.kind = kind;
        this.sourceName = sourceName;
    }

    public SourceException(Kind kind, String sourceName, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.sourceName = sourceName;
    }

    public static SourceException empty(String sourceName) {
        return new SourceException(Kind.EMPTY, sourceName, "Empty source: " + sourceName);
    }

    public Kind kind() { return kind; }
    public String sourceName() { return sourceName; }
}
