package io.clusterquery.query.cluster;

import io.clusterquery.query.subscription.Ssid;

/**
 * Handle to a remote cluster member, borrowed from {@link QueryCluster} to send a single message.
 */
public interface QueryPeer {

    long address();

    void send(Ssid ssid, String channel, byte[] payload);
}
