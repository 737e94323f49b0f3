package io.relaybox.relay;

import io.relaybox.model.AllocationStatus;
import io.relaybox.model.Direction;
import io.relaybox.model.ErrorKind;
import io.relaybox.observability.AuditEvent;
import io.relaybox.observability.AuditSink;
import io.relaybox.observability.MetricsSink;
import io.relaybox.ratelimit.RateDecision;
import io.relaybox.ratelimit.TokenBucket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.Map;

/**
 * Per-packet admission for relayed bytes. Checks run in a fixed order: existence, status,
 * expiry, receiver presence, allocation bandwidth, relay-wide bandwidth, quota. Bytes are
 * copied only after every check passed and are never inspected.
 */
public final class RelayForwarder {
    private static final Logger log = LoggerFactory.getLogger(RelayForwarder.class);
    private static final double QUOTA_WARNING_RATIO = 0.9d;

    private final AllocationTable table;
    private final Clock clock;
    private final MetricsSink metrics;
    private final AuditSink audit;
    private final TokenBucket globalBandwidth;

    public RelayForwarder(AllocationTable table, Clock clock, MetricsSink metrics, AuditSink audit) {
        this(table, clock, metrics, audit, null);
    }

    /**
     * @param globalBandwidth shared by every allocation; {@code null} leaves the relay uncapped
     */
    public RelayForwarder(AllocationTable table, Clock clock, MetricsSink metrics, AuditSink audit, TokenBucket globalBandwidth) {
        this.table = table;
        this.clock = clock;
        this.metrics = metrics == null ? MetricsSink.NOOP : metrics;
        this.audit = audit == null ? AuditSink.NOOP : audit;
        this.globalBandwidth = globalBandwidth;
    }

    public ForwardOutcome forward(String allocationId, Direction direction, byte[] bytes) {
        Allocation allocation = table.find(allocationId).orElse(null);
        if (allocation == null) {
            return reject(ErrorKind.NOT_FOUND);
        }
        AllocationStatus status = allocation.status();
        if (status.terminal()) {
            return reject(status.rejection());
        }
        if (clock.millis() >= allocation.expiresAtMs()) {
            table.transition(allocation, AllocationStatus.EXPIRED, "ttl");
            return reject(ErrorKind.EXPIRED);
        }
        FrameSink receiver = allocation.endpoint(direction.receiver());
        if (receiver == null) {
            return reject(ErrorKind.PEER_UNAVAILABLE);
        }
        long length = bytes.length;
        TokenBucket lane = allocation.bandwidth(direction);
        RateDecision bandwidth = lane.check(length);
        if (bandwidth.permanent()) {
            return reject(ErrorKind.MESSAGE_TOO_LARGE);
        }
        if (!bandwidth.allowed()) {
            metrics.forwardRejected(ErrorKind.BANDWIDTH_EXCEEDED);
            return ForwardOutcome.throttled(bandwidth.retryAfterMs());
        }
        if (globalBandwidth != null) {
            RateDecision shared = globalBandwidth.check(length);
            if (!shared.allowed()) {
                lane.refund(length);
                if (shared.permanent()) {
                    return reject(ErrorKind.MESSAGE_TOO_LARGE);
                }
                metrics.forwardRejected(ErrorKind.BANDWIDTH_EXCEEDED);
                return ForwardOutcome.throttled(shared.retryAfterMs());
            }
        }
        if (!allocation.tryConsumeQuota(length)) {
            table.transition(allocation, AllocationStatus.QUOTA_EXCEEDED, "quota");
            return reject(ErrorKind.QUOTA_EXCEEDED);
        }
        try {
            receiver.sendData(bytes);
        } catch (IOException e) {
            log.debug("Allocation {} receiver write failed: {}", allocationId, e.getMessage());
            return reject(ErrorKind.PEER_UNAVAILABLE);
        }
        allocation.recordForwarded(direction, length);
        metrics.bytesForwarded(length);
        warnNearQuota(allocation);
        return ForwardOutcome.forwarded(length);
    }

    private void warnNearQuota(Allocation allocation) {
        if (allocation.bytesUsed() < allocation.quotaBytes() * QUOTA_WARNING_RATIO) {
            return;
        }
        if (allocation.markQuotaWarned()) {
            log.warn("Allocation {} used {} of {} quota bytes", allocation.id(), allocation.bytesUsed(), allocation.quotaBytes());
            audit.record(AuditEvent.of("allocation.quota_warning", allocation.deviceId(), allocation.id(), "warn", Map.of(
                    "bytes_used", allocation.bytesUsed(),
                    "quota_bytes", allocation.quotaBytes()
            )));
        }
    }

    private ForwardOutcome reject(ErrorKind error) {
        metrics.forwardRejected(error);
        return ForwardOutcome.rejected(error);
    }
}
