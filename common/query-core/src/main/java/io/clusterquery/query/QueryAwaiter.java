package io.clusterquery.query;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One outstanding cluster query and the responses collected for it.
 * <p>
 * The awaiter expects at most {@link #maximum()} responses, the number of peers known when the query
 * was issued. Delivery never blocks: the conduit is bounded to that count and refuses payloads once the
 * awaiter is closed, so a responder can never be parked on a query that has stopped listening.
 */
public final class QueryAwaiter {

    private static final Logger log = LoggerFactory.getLogger(QueryAwaiter.class);

    private final int id;
    private final int maximum;
    private final BlockingQueue<byte[]> received;
    private final CorrelationTable table;
    private final QueryMetrics metrics;
    private final AtomicBoolean gathered = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();

    QueryAwaiter(int id, int maximum, CorrelationTable table, QueryMetrics metrics) {
        if (maximum < 0) {
            throw new IllegalArgumentException("maximum must be >= 0");
        }
        this.id = id;
        this.maximum = maximum;
        this.received = new ArrayBlockingQueue<>(Math.max(1, maximum));
        this.table = Objects.requireNonNull(table, "table");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Correlation id of the query, an unsigned 32-bit value.
     */
    public int id() {
        return id;
    }

    public int maximum() {
        return maximum;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Blocks until {@link #maximum()} responses arrived or {@code timeout} elapsed, whichever comes
     * first, then unregisters the query.
     * <p>
     * A query issued with no known peers completes immediately. A result shorter than
     * {@link #maximum()} means some peers did not answer in time; it is not an error. If the calling
     * thread is interrupted the responses collected so far are returned with the interrupt flag
     * restored.
     *
     * @return responses in arrival order
     * @throws IllegalStateException if the query was already gathered
     */
    public List<byte[]> gather(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be >= 0");
        }
        if (!gathered.compareAndSet(false, true)) {
            throw new IllegalStateException("Query " + Integer.toUnsignedString(id) + " has already been gathered");
        }
        long started = System.nanoTime();
        List<byte[]> responses = new ArrayList<>(Math.min(maximum, 16));
        try {
            long deadline = started + saturatedNanos(timeout);
            while (responses.size() < maximum) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    break;
                }
                byte[] payload = received.poll();
                if (payload == null) {
                    payload = received.poll(remaining, TimeUnit.NANOSECONDS);
                }
                if (payload == null) {
                    break;
                }
                responses.add(payload);
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.debug("Gather of query {} interrupted after {} of {} responses",
                Integer.toUnsignedString(id), responses.size(), maximum);
        } finally {
            close();
            metrics.gatherCompleted(maximum, responses.size(), Duration.ofNanos(System.nanoTime() - started));
        }
        if (responses.size() < maximum) {
            log.debug("Query {} completed with {} of {} responses",
                Integer.toUnsignedString(id), responses.size(), maximum);
        }
        return responses;
    }

    /**
     * Offers a response without blocking.
     *
     * @return {@code false} if the awaiter is closed or already holds {@link #maximum()} undelivered
     *     responses
     */
    boolean deliver(byte[] payload) {
        if (closed.get()) {
            return false;
        }
        return received.offer(payload);
    }

    /**
     * Stops accepting responses and unregisters from the correlation table. Only the first call has an
     * effect.
     */
    void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (!table.remove(this)) {
            log.debug("Query {} was no longer registered on close", Integer.toUnsignedString(id));
        }
    }

    private static long saturatedNanos(Duration timeout) {
        try {
            return Math.min(timeout.toNanos(), Long.MAX_VALUE / 2);
        } catch (ArithmeticException ex) {
            return Long.MAX_VALUE / 2;
        }
    }
}
