package io.clusterquery.query.spring;

import io.clusterquery.query.QueryException;
import io.clusterquery.query.subscription.Ssid;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.AmqpRejectAndDontRequeueException;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.rabbit.annotation.RabbitListener;

/**
 * Consumes this node's query queue and hands each message to the {@link AmqpQueryTransport}.
 * <p>
 * Broadcasts published by this node come back through its own binding and are skipped. Messages that
 * the query layer cannot route, and messages whose handler or reply fails, are rejected without
 * requeue; query traffic is never retried.
 */
public class QueryTrafficListener {

    private static final Logger log = LoggerFactory.getLogger(QueryTrafficListener.class);

    private final AmqpQueryTransport transport;

    public QueryTrafficListener(AmqpQueryTransport transport) {
        this.transport = Objects.requireNonNull(transport, "transport");
    }

    @RabbitListener(queues = "#{@clusterQueryQueueName}")
    public void onMessage(Message message) {
        MessageProperties properties = message.getMessageProperties();
        String routingKey = properties.getReceivedRoutingKey();
        String channel = header(properties, AmqpQueryTransport.CHANNEL_HEADER);
        String ssidHeader = header(properties, AmqpQueryTransport.SSID_HEADER);
        if (channel == null || ssidHeader == null) {
            throw reject("Query message without channel or ssid header", null, routingKey);
        }
        if (isOwnBroadcast(properties, routingKey)) {
            log.debug("Skipping own query broadcast rk={}", routingKey);
            return;
        }
        Ssid ssid;
        try {
            ssid = Ssid.parse(ssidHeader);
        } catch (IllegalArgumentException ex) {
            throw reject("Query message with malformed ssid header", ex, routingKey);
        }
        try {
            transport.dispatch(ssid, channel, message.getBody());
        } catch (QueryException ex) {
            throw reject("Query message dropped", ex, routingKey);
        } catch (RuntimeException ex) {
            log.error("Query message on channel '{}' failed rk={}", channel, safe(routingKey), ex);
            throw new AmqpRejectAndDontRequeueException("Query message failed", ex);
        }
    }

    private boolean isOwnBroadcast(MessageProperties properties, String routingKey) {
        if (routingKey == null || !routingKey.startsWith(AmqpQueryTransport.BROADCAST_PREFIX + ".")) {
            return false;
        }
        Object origin = properties.getHeaders().get(AmqpQueryTransport.ORIGIN_HEADER);
        if (origin == null) {
            return false;
        }
        try {
            return Long.parseLong(origin.toString()) == transport.localAddress();
        } catch (NumberFormatException ex) {
            return false;
        }
    }

    private static String header(MessageProperties properties, String name) {
        Object value = properties.getHeaders().get(name);
        if (value == null) {
            return null;
        }
        String text = value.toString();
        return text.isBlank() ? null : text;
    }

    private static String safe(String routingKey) {
        return routingKey == null ? "n/a" : routingKey.trim();
    }

    private static AmqpRejectAndDontRequeueException reject(String reason, Throwable cause, String routingKey) {
        String safeRoutingKey = safe(routingKey);
        if (cause == null) {
            log.warn("{} rk={}", reason, safeRoutingKey);
            return new AmqpRejectAndDontRequeueException(reason);
        }
        log.warn("{} rk={}: {}", reason, safeRoutingKey, cause.getMessage());
        return new AmqpRejectAndDontRequeueException(reason, cause);
    }
}
