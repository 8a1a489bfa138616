package io.clusterquery.query.spring;

import io.clusterquery.query.cluster.QueryCluster;
import io.clusterquery.query.cluster.QueryPeer;
import io.clusterquery.query.subscription.Ssid;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Membership taken from configuration: a fixed list of peer addresses reached through the AMQP
 * transport. Applications with a real membership layer replace this bean with their own
 * {@link QueryCluster}.
 */
public final class StaticQueryCluster implements QueryCluster {

    private static final Logger log = LoggerFactory.getLogger(StaticQueryCluster.class);

    private final AmqpQueryTransport transport;
    private final Set<Long> peers;

    public StaticQueryCluster(AmqpQueryTransport transport, Collection<Long> peers) {
        this.transport = Objects.requireNonNull(transport, "transport");
        Objects.requireNonNull(peers, "peers");
        Set<Long> known = new LinkedHashSet<>();
        for (Long peer : peers) {
            if (peer != null && peer != transport.localAddress()) {
                known.add(peer);
            }
        }
        this.peers = Set.copyOf(known);
    }

    @Override
    public long localAddress() {
        return transport.localAddress();
    }

    @Override
    public int peerCount() {
        return peers.size();
    }

    @Override
    public Optional<QueryPeer> findPeer(long address) {
        if (address == transport.localAddress() || peers.contains(address)) {
            return Optional.of(transport.peer(address));
        }
        return Optional.empty();
    }

    @Override
    public void notifySubscribe(String subscriberId, Ssid ssid) {
        log.info("Subscriber {} on node {} carries {} ({} static peer(s))",
            subscriberId, transport.localAddress(), ssid, peers.size());
    }
}
