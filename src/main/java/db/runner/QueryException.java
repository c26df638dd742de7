package db.runner;

/**
 * Base type for every failure a single query can end with.
 * The message is what the caller of {@code execute} sees, so keep it to one line.
 */
public class QueryException extends RuntimeException {
    public QueryException(String message) {
        super(message);
    }

    public QueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
