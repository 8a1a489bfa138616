package io.clusterquery.query.subscription;

/**
 * How a subscriber was attached to the substrate.
 */
public enum SubscriberType {
    /**
     * Subscribed to an exact identifier, not a pattern.
     */
    DIRECT,
    /**
     * Subscribed through a wildcard or prefix pattern.
     */
    PATTERN
}
