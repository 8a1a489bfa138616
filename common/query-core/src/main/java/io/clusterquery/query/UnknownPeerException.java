package io.clusterquery.query;

/**
 * The reply-to address of a request does not resolve to a known cluster peer.
 */
public final class UnknownPeerException extends QueryException {

    private final long address;

    public UnknownPeerException(long address) {
        super("No cluster peer known for reply address " + address);
        this.address = address;
    }

    public long address() {
        return address;
    }
}
