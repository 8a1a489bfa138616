package io.clusterquery.query;

/**
 * No registered handler claimed a query; nothing is sent back to the querying peer.
 */
public final class NoHandlerFoundException extends QueryException {

    private final String queryType;

    public NoHandlerFoundException(String queryType, String channel) {
        super("No query handler found for " + channel);
        this.queryType = queryType;
    }

    public String queryType() {
        return queryType;
    }
}
