package io.clusterquery.query;

/**
 * Base type for failures routing a single query message. Such failures affect at most one query and
 * never stop the manager.
 */
public abstract class QueryException extends RuntimeException {

    protected QueryException(String message) {
        super(message);
    }

    protected QueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
