package io.clusterquery.query.subscription;

/**
 * Receives messages delivered by a {@link QueryBroker} for the identifiers it subscribed to.
 */
public interface Subscriber {

    String id();

    SubscriberType type();

    /**
     * Invoked by the substrate for every delivered message. Implementations may be called from many
     * threads at once.
     */
    void send(Ssid ssid, String channel, byte[] payload);
}
