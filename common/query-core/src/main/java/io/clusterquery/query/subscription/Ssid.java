package io.clusterquery.query.subscription;

import java.util.Arrays;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Subscription identifier: an ordered tuple of unsigned 32-bit segments that addresses a logical
 * channel on the publish/subscribe substrate.
 * <p>
 * Segments are stored as {@code int} and rendered in unsigned decimal. Instances are immutable.
 */
public final class Ssid {

    private final int[] segments;

    private Ssid(int[] segments) {
        this.segments = segments;
    }

    public static Ssid of(int... segments) {
        Objects.requireNonNull(segments, "segments");
        if (segments.length == 0) {
            throw new IllegalArgumentException("ssid must have at least one segment");
        }
        return new Ssid(segments.clone());
    }

    /**
     * Parses the dotted textual form produced by {@link #toString()}.
     */
    public static Ssid parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ssid must not be null or blank");
        }
        String[] parts = value.trim().split("\\.");
        int[] parsed = new int[parts.length];
        for (int i = 0; i < parts.length; i++) {
            try {
                parsed[i] = Integer.parseUnsignedInt(parts[i]);
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("ssid segment '" + parts[i] + "' is not an unsigned 32-bit number", ex);
            }
        }
        return new Ssid(parsed);
    }

    public int size() {
        return segments.length;
    }

    public int segment(int index) {
        return segments[index];
    }

    /**
     * Returns a new identifier with {@code segment} appended.
     */
    public Ssid append(int segment) {
        int[] extended = Arrays.copyOf(segments, segments.length + 1);
        extended[segments.length] = segment;
        return new Ssid(extended);
    }

    /**
     * Returns the first {@code length} segments.
     */
    public Ssid prefix(int length) {
        if (length <= 0 || length > segments.length) {
            throw new IllegalArgumentException("prefix length must be between 1 and " + segments.length);
        }
        return new Ssid(Arrays.copyOf(segments, length));
    }

    public boolean startsWith(Ssid other) {
        Objects.requireNonNull(other, "other");
        if (other.segments.length > segments.length) {
            return false;
        }
        for (int i = 0; i < other.segments.length; i++) {
            if (segments[i] != other.segments[i]) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Ssid other)) {
            return false;
        }
        return Arrays.equals(segments, other.segments);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(segments);
    }

    @Override
    public String toString() {
        StringJoiner joiner = new StringJoiner(".");
        for (int segment : segments) {
            joiner.add(Integer.toUnsignedString(segment));
        }
        return joiner.toString();
    }
}
