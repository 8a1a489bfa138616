package io.clusterquery.query;

import java.util.Objects;

/**
 * Encodes and decodes the channel strings carried by query traffic.
 * <p>
 * Requests use {@code <queryType>/<replyNodeAddress>}; responses use the literal {@link #RESPONSE}
 * and carry correlation in the identifier's last segment.
 */
public final class QueryChannel {

    public static final String RESPONSE = "response";

    private static final char SEPARATOR = '/';

    private QueryChannel() {
    }

    public static String requestChannel(String queryType, long replyAddress) {
        return requireQueryType(queryType) + SEPARATOR + replyAddress;
    }

    public static boolean isResponse(String channel) {
        return RESPONSE.equals(channel);
    }

    public static RequestChannel parseRequest(String channel) {
        if (channel == null) {
            throw new MalformedReplyAddressException(null, null);
        }
        int separator = channel.indexOf(SEPARATOR);
        if (separator < 0) {
            throw new MalformedReplyAddressException(channel, null);
        }
        String queryType = channel.substring(0, separator);
        String reply = channel.substring(separator + 1);
        try {
            return new RequestChannel(queryType, Long.parseLong(reply));
        } catch (NumberFormatException ex) {
            throw new MalformedReplyAddressException(channel, ex);
        }
    }

    static String requireQueryType(String queryType) {
        if (queryType == null || queryType.isBlank()) {
            throw new IllegalArgumentException("queryType must not be null or blank");
        }
        if (queryType.indexOf(SEPARATOR) >= 0) {
            throw new IllegalArgumentException("queryType must not contain '" + SEPARATOR + "'");
        }
        return queryType;
    }

    /**
     * Decoded request channel.
     */
    public record RequestChannel(String queryType, long replyAddress) {

        public RequestChannel {
            Objects.requireNonNull(queryType, "queryType");
        }
    }
}
