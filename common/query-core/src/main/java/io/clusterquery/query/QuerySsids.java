package io.clusterquery.query;

import io.clusterquery.query.subscription.Ssid;

/**
 * Reserved subscription identifiers for query traffic. Every node in a cluster must agree on these
 * values; they are not user-addressable.
 */
public final class QuerySsids {

    /**
     * Namespace of system-owned channels.
     */
    public static final int SYSTEM_NAMESPACE = 0;

    /**
     * Namespace of request/response query traffic inside {@link #SYSTEM_NAMESPACE}.
     */
    public static final int QUERY_NAMESPACE = (int) 3_939_663_052L;

    /**
     * Segment count of every query message: system, query, correlation id.
     */
    public static final int QUERY_ARITY = 3;

    /**
     * Identifier the query manager subscribes to.
     */
    public static final Ssid QUERY = Ssid.of(SYSTEM_NAMESPACE, QUERY_NAMESPACE);

    private QuerySsids() {
    }

    public static Ssid forCorrelation(int correlationId) {
        return QUERY.append(correlationId);
    }

    public static int correlationId(Ssid ssid) {
        return ssid.segment(QUERY_ARITY - 1);
    }
}
