package io.clusterquery.query.spring;

import io.clusterquery.query.cluster.QueryPeer;
import io.clusterquery.query.subscription.QueryBroker;
import io.clusterquery.query.subscription.Ssid;
import io.clusterquery.query.subscription.Subscriber;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.core.AmqpTemplate;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageProperties;

/**
 * Spring AMQP backed substrate for query traffic.
 * <p>
 * Broadcasts go to the topic exchange under {@code bcast.<ssid>}; messages for a single peer go under
 * {@code node.<address>.<ssid>}. Each node's queue is bound to both, and inbound messages are handed to
 * the subscribers registered here through {@link #dispatch(Ssid, String, byte[])}.
 */
public final class AmqpQueryTransport implements QueryBroker {

    public static final String CHANNEL_HEADER = "x-cq-channel";
    public static final String SSID_HEADER = "x-cq-ssid";
    public static final String ORIGIN_HEADER = "x-cq-origin";

    static final String BROADCAST_PREFIX = "bcast";
    static final String NODE_PREFIX = "node";

    private static final Logger log = LoggerFactory.getLogger(AmqpQueryTransport.class);

    private final AmqpTemplate template;
    private final String exchange;
    private final long localAddress;
    private final Map<Ssid, List<Subscriber>> subscriptions = new ConcurrentHashMap<>();

    public AmqpQueryTransport(AmqpTemplate template, String exchange, long localAddress) {
        this.template = Objects.requireNonNull(template, "template");
        this.exchange = Objects.requireNonNull(exchange, "exchange");
        this.localAddress = localAddress;
    }

    public static String broadcastRoutingKey(Ssid ssid) {
        return BROADCAST_PREFIX + "." + ssid;
    }

    public static String nodeRoutingKey(long address, Ssid ssid) {
        return NODE_PREFIX + "." + address + "." + ssid;
    }

    /**
     * Binding pattern matching every broadcast published under {@code prefix}.
     */
    public static String broadcastBinding(Ssid prefix) {
        return BROADCAST_PREFIX + "." + prefix + ".*";
    }

    public static String nodeBinding(long address) {
        return NODE_PREFIX + "." + address + ".#";
    }

    public long localAddress() {
        return localAddress;
    }

    @Override
    public boolean subscribe(Ssid ssid, Subscriber subscriber) {
        Objects.requireNonNull(ssid, "ssid");
        Objects.requireNonNull(subscriber, "subscriber");
        List<Subscriber> current = subscriptions.computeIfAbsent(ssid, key -> new CopyOnWriteArrayList<>());
        if (current.contains(subscriber)) {
            return false;
        }
        current.add(subscriber);
        log.info("Subscriber {} ({}) registered for {}", subscriber.id(), subscriber.type(), ssid);
        return true;
    }

    @Override
    public void unsubscribe(Ssid ssid, Subscriber subscriber) {
        List<Subscriber> current = subscriptions.get(ssid);
        if (current != null && current.remove(subscriber)) {
            log.info("Subscriber {} removed from {}", subscriber.id(), ssid);
        }
    }

    @Override
    public void publish(Ssid ssid, String channel, byte[] payload) {
        send(broadcastRoutingKey(ssid), ssid, channel, payload);
    }

    /**
     * Peer handle that sends straight to {@code address}'s queue.
     */
    public QueryPeer peer(long address) {
        return new AmqpQueryPeer(address);
    }

    /**
     * Hands an inbound message to every subscriber whose identifier prefixes {@code ssid}.
     *
     * @return number of subscribers the message was handed to
     */
    public int dispatch(Ssid ssid, String channel, byte[] payload) {
        int delivered = 0;
        for (Map.Entry<Ssid, List<Subscriber>> entry : subscriptions.entrySet()) {
            if (!ssid.startsWith(entry.getKey())) {
                continue;
            }
            for (Subscriber subscriber : entry.getValue()) {
                subscriber.send(ssid, channel, payload);
                delivered++;
            }
        }
        if (delivered == 0) {
            log.debug("No subscriber for {} on channel '{}'", ssid, channel);
        }
        return delivered;
    }

    private void send(String routingKey, Ssid ssid, String channel, byte[] payload) {
        Objects.requireNonNull(ssid, "ssid");
        Objects.requireNonNull(channel, "channel");
        MessageProperties properties = new MessageProperties();
        properties.setContentType(MessageProperties.CONTENT_TYPE_BYTES);
        properties.setHeader(CHANNEL_HEADER, channel);
        properties.setHeader(SSID_HEADER, ssid.toString());
        properties.setHeader(ORIGIN_HEADER, localAddress);
        Message message = new Message(payload != null ? payload : new byte[0], properties);
        template.send(exchange, routingKey, message);
    }

    private final class AmqpQueryPeer implements QueryPeer {

        private final long address;

        private AmqpQueryPeer(long address) {
            this.address = address;
        }

        @Override
        public long address() {
            return address;
        }

        @Override
        public void send(Ssid ssid, String channel, byte[] payload) {
            AmqpQueryTransport.this.send(nodeRoutingKey(address, ssid), ssid, channel, payload);
        }
    }
}
