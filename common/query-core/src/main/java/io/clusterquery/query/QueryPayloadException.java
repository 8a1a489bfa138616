package io.clusterquery.query;

/**
 * A query or response payload could not be decoded or encoded.
 */
public final class QueryPayloadException extends QueryException {

    public QueryPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
