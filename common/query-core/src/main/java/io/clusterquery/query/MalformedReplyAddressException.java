package io.clusterquery.query;

/**
 * A request channel whose reply-to segment is missing or not a decimal node address.
 */
public final class MalformedReplyAddressException extends QueryException {

    private final String channel;

    public MalformedReplyAddressException(String channel, Throwable cause) {
        super("Malformed reply address in query channel '" + channel + "'", cause);
        this.channel = channel;
    }

    public String channel() {
        return channel;
    }
}
