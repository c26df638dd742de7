package db.runner.query;

import db.runner.QueryException;

public class QueryParseException extends QueryException {
    private final int tokenPosition; // 1-based, 0 when the query has no tokens

    public QueryParseException(String message, int tokenPosition) {
        super(message);
        this.tokenPosition = tokenPosition;
    }

    public int tokenPosition() { return tokenPosition; }
}
