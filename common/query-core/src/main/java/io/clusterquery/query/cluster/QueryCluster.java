package io.clusterquery.query.cluster;

import io.clusterquery.query.subscription.Ssid;
import java.util.Optional;

/**
 * Cluster membership capabilities the query manager borrows: peer lookup, the local node address and
 * the number of known peers.
 */
public interface QueryCluster {

    /**
     * Stable address of this node, shared with peers as the reply-to address of its queries.
     */
    long localAddress();

    /**
     * Number of currently known peers, excluding this node.
     */
    int peerCount();

    Optional<QueryPeer> findPeer(long address);

    /**
     * Announces that {@code subscriberId} on this node now carries {@code ssid}, so membership can
     * propagate the fact to the rest of the cluster.
     */
    void notifySubscribe(String subscriberId, Ssid ssid);
}
