package io.clusterquery.query.subscription;

/**
 * Publish/subscribe substrate consumed by the query manager.
 * <p>
 * Publishing must deliver a message to every cluster peer subscribed to the identifier, at most once
 * per peer, with no ordering guarantee relative to other publishes.
 */
public interface QueryBroker {

    /**
     * Registers {@code subscriber} for {@code ssid}.
     *
     * @return {@code true} if the subscription was accepted
     */
    boolean subscribe(Ssid ssid, Subscriber subscriber);

    void unsubscribe(Ssid ssid, Subscriber subscriber);

    /**
     * Fire-and-forget publication.
     */
    void publish(Ssid ssid, String channel, byte[] payload);
}
