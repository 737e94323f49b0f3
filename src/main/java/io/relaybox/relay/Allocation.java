package io.relaybox.relay;

import io.relaybox.model.AllocationStatus;
import io.relaybox.model.Direction;
import io.relaybox.model.EndpointRole;
import io.relaybox.ratelimit.TokenBucket;

import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-allocation relay state. Nothing here is shared with another allocation; quota, status
 * and endpoint slots are updated with atomic compare-and-set so the two directions can run on
 * different threads.
 */
public final class Allocation {
    private final String id;
    private final String deviceId;
    private final String peerId;
    private final long quotaBytes;
    private final long bandwidthBps;
    private final long createdAtMs;
    private final long expiresAtMs;
    private final long tokenExpiresAtMs;
    private final AtomicReference<AllocationStatus> status = new AtomicReference<>(AllocationStatus.ACTIVE);
    private final AtomicLong bytesUsed = new AtomicLong();
    private final AtomicBoolean quotaWarned = new AtomicBoolean();
    private final AtomicLong lastAttachmentChangeMs;
    private final Map<Direction, Lane> lanes = new EnumMap<>(Direction.class);
    private final Map<EndpointRole, AtomicReference<FrameSink>> endpoints = new EnumMap<>(EndpointRole.class);

    Allocation(
            String id,
            String deviceId,
            String peerId,
            long quotaBytes,
            long bandwidthBps,
            long createdAtMs,
            long expiresAtMs,
            long tokenExpiresAtMs,
            Clock clock
    ) {
        this.id = id;
        this.deviceId = deviceId;
        this.peerId = peerId;
        this.quotaBytes = quotaBytes;
        this.bandwidthBps = bandwidthBps;
        this.createdAtMs = createdAtMs;
        this.expiresAtMs = expiresAtMs;
        this.tokenExpiresAtMs = tokenExpiresAtMs;
        this.lastAttachmentChangeMs = new AtomicLong(createdAtMs);
        for (Direction direction : Direction.values()) {
            lanes.put(direction, new Lane(new TokenBucket(bandwidthBps, bandwidthBps, clock)));
        }
        for (EndpointRole role : EndpointRole.values()) {
            endpoints.put(role, new AtomicReference<>());
        }
    }

    public String id() {
        return id;
    }

    public String deviceId() {
        return deviceId;
    }

    public String peerId() {
        return peerId;
    }

    public long quotaBytes() {
        return quotaBytes;
    }

    public long bandwidthBps() {
        return bandwidthBps;
    }

    public long createdAtMs() {
        return createdAtMs;
    }

    public long expiresAtMs() {
        return expiresAtMs;
    }

    public long tokenExpiresAtMs() {
        return tokenExpiresAtMs;
    }

    public AllocationStatus status() {
        return status.get();
    }

    public long bytesUsed() {
        return bytesUsed.get();
    }

    public long bytesForwarded(Direction direction) {
        return lanes.get(direction).bytes.get();
    }

    /**
     * Moves out of {@code ACTIVE}. Returns false if another transition already happened.
     */
    boolean transition(AllocationStatus next) {
        if (!next.terminal()) {
            throw new IllegalArgumentException("cannot transition to " + next);
        }
        return status.compareAndSet(AllocationStatus.ACTIVE, next);
    }

    /**
     * Atomically reserves {@code length} bytes of quota, or reserves nothing.
     */
    boolean tryConsumeQuota(long length) {
        while (true) {
            long used = bytesUsed.get();
            if (used + length > quotaBytes) {
                return false;
            }
            if (bytesUsed.compareAndSet(used, used + length)) {
                return true;
            }
        }
    }

    TokenBucket bandwidth(Direction direction) {
        return lanes.get(direction).bandwidth;
    }

    void recordForwarded(Direction direction, long length) {
        lanes.get(direction).bytes.addAndGet(length);
    }

    boolean markQuotaWarned() {
        return quotaWarned.compareAndSet(false, true);
    }

    FrameSink endpoint(EndpointRole role) {
        return endpoints.get(role).get();
    }

    FrameSink attach(EndpointRole role, FrameSink sink, long nowMs) {
        lastAttachmentChangeMs.set(nowMs);
        return endpoints.get(role).getAndSet(sink);
    }

    boolean detach(EndpointRole role, FrameSink sink, long nowMs) {
        boolean detached = endpoints.get(role).compareAndSet(sink, null);
        if (detached) {
            lastAttachmentChangeMs.set(nowMs);
        }
        return detached;
    }

    boolean unattendedSince(long cutoffMs) {
        for (AtomicReference<FrameSink> endpoint : endpoints.values()) {
            if (endpoint.get() != null) {
                return false;
            }
        }
        return lastAttachmentChangeMs.get() <= cutoffMs;
    }

    int attachedEndpoints() {
        int count = 0;
        for (AtomicReference<FrameSink> endpoint : endpoints.values()) {
            if (endpoint.get() != null) {
                count++;
            }
        }
        return count;
    }

    public AllocationView view() {
        return new AllocationView(
                id,
                status.get().name(),
                bytesUsed.get(),
                quotaBytes,
                bandwidthBps,
                bytesForwarded(Direction.DEVICE_TO_PEER),
                bytesForwarded(Direction.PEER_TO_DEVICE),
                attachedEndpoints(),
                createdAtMs,
                expiresAtMs
        );
    }

    private static final class Lane {
        private final TokenBucket bandwidth;
        private final AtomicLong bytes = new AtomicLong();

        private Lane(TokenBucket bandwidth) {
            this.bandwidth = bandwidth;
        }
    }
}
