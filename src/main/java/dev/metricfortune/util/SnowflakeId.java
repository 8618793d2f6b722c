package dev.metricfortune.util;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 64-bit time-ordered id generator.
 *
 * <pre>
 * | 1 bit (unused) | 41 bits (millis since 2025-01-01) | 10 bits (node) | 12 bits (sequence) |
 * </pre>
 *
 * <p>Lock-free: the last (timestamp, sequence) pair is packed into one {@link AtomicLong}
 * and advanced with CAS. Rows created by the ingestion path and the batch jobs on
 * different nodes never collide as long as node ids differ.</p>
 */
public final class SnowflakeId {

    // 2025-01-01T00:00:00Z
    static final long EPOCH_MILLIS = 1735689600000L;

    private static final int NODE_BITS = 10;
    private static final int SEQUENCE_BITS = 12;
    private static final long MAX_NODE = (1L << NODE_BITS) - 1;
    private static final long SEQUENCE_MASK = (1L << SEQUENCE_BITS) - 1;
    private static final int NODE_SHIFT = SEQUENCE_BITS;
    private static final int TIME_SHIFT = SEQUENCE_BITS + NODE_BITS;
    private static final long MAX_BACKWARD_DRIFT_MS = 5;

    private final long node;
    private final AtomicLong state = new AtomicLong();

    public SnowflakeId(long node) {
        if (node < 0 || node > MAX_NODE) {
            throw new IllegalArgumentException("Node id must be within 0.." + MAX_NODE + ", got " + node);
        }
        this.node = node;
    }

    public long nextId() {
        while (true) {
            long now = System.currentTimeMillis() - EPOCH_MILLIS;
            long previous = state.get();
            long lastTime = previous >>> SEQUENCE_BITS;
            long lastSequence = previous & SEQUENCE_MASK;

            long time;
            long sequence;
            if (now > lastTime) {
                time = now;
                sequence = 0;
            } else if (lastTime - now <= MAX_BACKWARD_DRIFT_MS) {
                // same millisecond or a small clock step back: keep counting on the last timestamp
                time = lastTime;
                sequence = (lastSequence + 1) & SEQUENCE_MASK;
                if (sequence == 0) {
                    time = lastTime + 1;
                }
            } else {
                throw new IllegalStateException("Clock moved backwards by " + (lastTime - now) + "ms");
            }

            if (state.compareAndSet(previous, (time << SEQUENCE_BITS) | sequence)) {
                return (time << TIME_SHIFT) | (node << NODE_SHIFT) | sequence;
            }
        }
    }

    public static Instant createdAt(long id) {
        return Instant.ofEpochMilli((id >>> TIME_SHIFT) + EPOCH_MILLIS);
    }

    public static int nodeOf(long id) {
        return (int) ((id >>> NODE_SHIFT) & MAX_NODE);
    }

    @Override
    public String toString() {
        return "SnowflakeId{node=" + node + "}";
    }
}
