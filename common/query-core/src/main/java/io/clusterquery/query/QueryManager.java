package io.clusterquery.query;

import io.clusterquery.query.QueryChannel.RequestChannel;
import io.clusterquery.query.cluster.QueryCluster;
import io.clusterquery.query.cluster.QueryPeer;
import io.clusterquery.query.subscription.QueryBroker;
import io.clusterquery.query.subscription.Ssid;
import io.clusterquery.query.subscription.Subscriber;
import io.clusterquery.query.subscription.SubscriberType;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cluster-wide request/response over the publish/subscribe substrate.
 * <p>
 * A query is published on {@link QuerySsids#QUERY} with a per-query correlation id appended and a
 * channel carrying the query type and this node's address. Peers answer through their registered
 * {@link QueryHandler handlers} by sending a {@link QueryChannel#RESPONSE} message straight back to
 * this node, where it is routed to the matching {@link QueryAwaiter}.
 * <p>
 * Correlation ids come from a 32-bit counter and wrap after 2<sup>32</sup> queries; an id is only
 * unique while its awaiter is registered.
 */
public final class QueryManager implements Subscriber {

    private static final Logger log = LoggerFactory.getLogger(QueryManager.class);

    private final QueryBroker broker;
    private final QueryCluster cluster;
    private final String subscriberId;
    private final QueryMetrics metrics;
    private final AtomicInteger next = new AtomicInteger();
    private final CorrelationTable awaiters = new CorrelationTable();
    private final HandlerRegistry handlers = new HandlerRegistry();
    private final AtomicBoolean started = new AtomicBoolean();

    private QueryManager(Builder builder) {
        this.broker = builder.broker;
        this.cluster = builder.cluster;
        this.subscriberId = builder.subscriberId != null ? builder.subscriberId : UUID.randomUUID().toString();
        this.metrics = builder.metrics != null ? builder.metrics : QueryMetrics.NOOP;
    }

    public static Builder builder(QueryBroker broker, QueryCluster cluster) {
        return new Builder(broker, cluster);
    }

    /**
     * Subscribes to the query identifier and, once the broker accepts, announces the subscription to
     * the cluster. Handlers should be registered before this call.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            log.warn("Query manager {} is already started", subscriberId);
            return;
        }
        if (broker.subscribe(QuerySsids.QUERY, this)) {
            cluster.notifySubscribe(subscriberId, QuerySsids.QUERY);
            log.info("Query manager {} subscribed to {} with {} handler(s)", subscriberId, QuerySsids.QUERY, handlers.size());
        } else {
            log.warn("Broker declined query subscription {} for manager {}", QuerySsids.QUERY, subscriberId);
        }
    }

    /**
     * Unsubscribes from query traffic. Pending awaiters finish on their own timeouts.
     */
    public void stop() {
        if (started.compareAndSet(true, false)) {
            broker.unsubscribe(QuerySsids.QUERY, this);
            log.info("Query manager {} unsubscribed from {}", subscriberId, QuerySsids.QUERY);
        }
    }

    public void handleFunc(QueryHandler handler) {
        handlers.register(handler);
    }

    @Override
    public String id() {
        return subscriberId;
    }

    @Override
    public SubscriberType type() {
        return SubscriberType.DIRECT;
    }

    /**
     * Entry point for every message the substrate delivers on the query identifier.
     *
     * @throws InvalidQueryException if {@code ssid} does not carry a correlation id
     * @throws MalformedReplyAddressException if a request channel has no numeric reply address
     * @throws UnknownPeerException if the reply address is not a known peer
     * @throws NoHandlerFoundException if no handler claims a request
     */
    @Override
    public void send(Ssid ssid, String channel, byte[] payload) {
        Objects.requireNonNull(ssid, "ssid");
        if (ssid.size() != QuerySsids.QUERY_ARITY) {
            metrics.requestRejected("invalid-query");
            throw new InvalidQueryException(ssid);
        }
        byte[] body = payload != null ? payload : new byte[0];
        if (QueryChannel.isResponse(channel)) {
            onResponse(QuerySsids.correlationId(ssid), body);
            return;
        }
        onRequest(ssid, channel, body);
    }

    void onResponse(int correlationId, byte[] payload) {
        QueryAwaiter awaiter = awaiters.find(correlationId);
        if (awaiter != null && awaiter.deliver(payload)) {
            metrics.responseDelivered();
            return;
        }
        metrics.responseDropped();
        log.debug("Dropping response for query {} ({})", Integer.toUnsignedString(correlationId),
            awaiter == null ? "not pending" : "no longer accepting");
    }

    void onRequest(Ssid ssid, String channel, byte[] payload) {
        RequestChannel request;
        try {
            request = QueryChannel.parseRequest(channel);
        } catch (MalformedReplyAddressException ex) {
            metrics.requestRejected("malformed-reply-address");
            throw ex;
        }

        Optional<QueryPeer> peer = cluster.findPeer(request.replyAddress());
        if (peer.isEmpty()) {
            metrics.requestRejected("unknown-peer");
            throw new UnknownPeerException(request.replyAddress());
        }

        Optional<byte[]> response = handlers.dispatch(request.queryType(), payload);
        if (response.isEmpty()) {
            metrics.requestRejected("no-handler");
            throw new NoHandlerFoundException(request.queryType(), channel);
        }

        int correlationId = QuerySsids.correlationId(ssid);
        peer.get().send(QuerySsids.forCorrelation(correlationId), QueryChannel.RESPONSE, response.get());
        metrics.requestHandled(request.queryType());
        log.debug("Answered query {} '{}' from peer {}", Integer.toUnsignedString(correlationId),
            request.queryType(), request.replyAddress());
    }

    /**
     * Publishes a query to the cluster and returns without waiting for delivery.
     * <p>
     * The returned awaiter expects one response per peer known right now; peers joining or leaving
     * afterwards do not change that count.
     */
    public QueryAwaiter request(String queryType, byte[] payload) {
        String type = QueryChannel.requireQueryType(queryType);
        Objects.requireNonNull(payload, "payload");

        int correlationId = next.incrementAndGet();
        QueryAwaiter awaiter = new QueryAwaiter(correlationId, Math.max(0, cluster.peerCount()), awaiters, metrics);
        // must be registered before publishing so that no response can arrive for an unknown id
        awaiters.register(awaiter);

        String channel = QueryChannel.requestChannel(type, cluster.localAddress());
        try {
            broker.publish(QuerySsids.forCorrelation(correlationId), channel, payload);
        } catch (RuntimeException ex) {
            awaiter.close();
            throw ex;
        }
        metrics.requestIssued(type);
        log.debug("Issued query {} '{}' expecting {} response(s)", Integer.toUnsignedString(correlationId), type,
            awaiter.maximum());
        return awaiter;
    }

    /**
     * Issues a query and gathers its responses.
     */
    public List<byte[]> query(String queryType, byte[] payload, Duration timeout) {
        return request(queryType, payload).gather(timeout);
    }

    public int pendingQueries() {
        return awaiters.size();
    }

    public static final class Builder {
        private final QueryBroker broker;
        private final QueryCluster cluster;
        private final List<QueryHandler> handlers = new ArrayList<>();
        private String subscriberId;
        private QueryMetrics metrics;

        private Builder(QueryBroker broker, QueryCluster cluster) {
            this.broker = Objects.requireNonNull(broker, "broker");
            this.cluster = Objects.requireNonNull(cluster, "cluster");
        }

        public Builder subscriberId(String subscriberId) {
            if (subscriberId != null && subscriberId.isBlank()) {
                throw new IllegalArgumentException("subscriberId must not be blank");
            }
            this.subscriberId = subscriberId;
            return this;
        }

        public Builder metrics(QueryMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder handler(QueryHandler handler) {
            Objects.requireNonNull(handler, "handler");
            handlers.add(handler);
            return this;
        }

        public QueryManager build() {
            QueryManager manager = new QueryManager(this);
            handlers.forEach(manager::handleFunc);
            return manager;
        }
    }
}
