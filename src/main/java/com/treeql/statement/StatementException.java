package com.treeql.statement;

/**
 * Thrown when a statement cannot be applied as written, for example a partial update of a
 * value that is not an object and has no DEFAULT.
 */
public class StatementException extends RuntimeException {
    public StatementException(String message) {
        super(message);
    }
}
