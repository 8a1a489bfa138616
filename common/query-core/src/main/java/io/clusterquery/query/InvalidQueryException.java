package io.clusterquery.query;

import io.clusterquery.query.subscription.Ssid;

/**
 * Inbound query traffic whose subscription identifier does not have the expected arity.
 */
public final class InvalidQueryException extends QueryException {

    private final Ssid ssid;

    public InvalidQueryException(Ssid ssid) {
        super("Invalid query received on ssid " + ssid + " (expected " + QuerySsids.QUERY_ARITY + " segments)");
        this.ssid = ssid;
    }

    public Ssid ssid() {
        return ssid;
    }
}
