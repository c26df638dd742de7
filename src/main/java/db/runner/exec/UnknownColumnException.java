package db.runner.exec;

import db.runner.QueryException;

public class UnknownColumnException extends QueryException {
    private final String column;

    public UnknownColumnException(String column) {
        super("Column " + column + " does not exist");
        this.column = column;
    }

    public String column() { return column; }
}
