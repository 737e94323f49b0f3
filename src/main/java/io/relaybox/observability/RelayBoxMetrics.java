package io.relaybox.observability;

import io.relaybox.model.ErrorKind;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.DoubleAdder;
import java.util.concurrent.atomic.LongAdder;

/**
 * Lock-free in-process counters behind {@code /metrics}.
 */
public final class RelayBoxMetrics implements MetricsSink {
    static final double[] LATENCY_BUCKETS_SECONDS = {
            0.005d, 0.01d, 0.025d, 0.05d, 0.1d, 0.25d, 0.5d, 1d, 2.5d, 5d, 10d, 30d, 60d
    };

    private final LongAdder posted = new LongAdder();
    private final LongAdder delivered = new LongAdder();
    private final LongAdder evicted = new LongAdder();
    private final LongAdder rateLimitHits = new LongAdder();
    private final LongAdder allocationsCreated = new LongAdder();
    private final LongAdder bytesForwarded = new LongAdder();
    private final Map<ErrorKind, LongAdder> errors = new EnumMap<>(ErrorKind.class);
    private final Map<ErrorKind, LongAdder> forwardRejections = new EnumMap<>(ErrorKind.class);
    private final LongAdder[] latencyBuckets = new LongAdder[LATENCY_BUCKETS_SECONDS.length];
    private final LongAdder latencyCount = new LongAdder();
    private final DoubleAdder latencySumSeconds = new DoubleAdder();

    public RelayBoxMetrics() {
        for (ErrorKind kind : ErrorKind.values()) {
            errors.put(kind, new LongAdder());
            forwardRejections.put(kind, new LongAdder());
        }
        for (int i = 0; i < latencyBuckets.length; i++) {
            latencyBuckets[i] = new LongAdder();
        }
    }

    @Override
    public void messagePosted() {
        posted.increment();
    }

    @Override
    public void messageDelivered() {
        delivered.increment();
    }

    @Override
    public void messagesEvicted(int count) {
        evicted.add(count);
    }

    @Override
    public void rateLimitHit() {
        rateLimitHits.increment();
    }

    @Override
    public void error(ErrorKind kind) {
        if (kind != null) {
            errors.get(kind).increment();
        }
    }

    @Override
    public void requestLatency(long nanos) {
        double seconds = nanos / 1_000_000_000.0d;
        for (int i = 0; i < LATENCY_BUCKETS_SECONDS.length; i++) {
            if (seconds <= LATENCY_BUCKETS_SECONDS[i]) {
                latencyBuckets[i].increment();
                break;
            }
        }
        latencyCount.increment();
        latencySumSeconds.add(seconds);
    }

    @Override
    public void allocationCreated() {
        allocationsCreated.increment();
    }

    @Override
    public void bytesForwarded(long bytes) {
        bytesForwarded.add(bytes);
    }

    @Override
    public void forwardRejected(ErrorKind kind) {
        if (kind != null) {
            forwardRejections.get(kind).increment();
        }
    }

    public Snapshot snapshot() {
        long[] cumulative = new long[latencyBuckets.length];
        long running = 0L;
        for (int i = 0; i < latencyBuckets.length; i++) {
            running += latencyBuckets[i].sum();
            cumulative[i] = running;
        }
        return new Snapshot(
                posted.sum(),
                delivered.sum(),
                evicted.sum(),
                rateLimitHits.sum(),
                allocationsCreated.sum(),
                bytesForwarded.sum(),
                nonZero(errors),
                nonZero(forwardRejections),
                cumulative,
                latencyCount.sum(),
                latencySumSeconds.sum()
        );
    }

    private static Map<String, Long> nonZero(Map<ErrorKind, LongAdder> counters) {
        Map<String, Long> out = new LinkedHashMap<>();
        for (Map.Entry<ErrorKind, LongAdder> entry : counters.entrySet()) {
            long value = entry.getValue().sum();
            if (value > 0L) {
                out.put(entry.getKey().code(), value);
            }
        }
        return out;
    }

    public record Snapshot(
            long messagesPosted,
            long messagesDelivered,
            long messagesEvicted,
            long rateLimitHits,
            long allocationsCreated,
            long bytesForwarded,
            Map<String, Long> errorsByKind,
            Map<String, Long> forwardRejectionsByKind,
            long[] latencyBucketCounts,
            long latencyCount,
            double latencySumSeconds
    ) {
    }
}
