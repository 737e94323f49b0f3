package io.relaybox.relay;

import io.relaybox.config.RelayBoxConfig;
import io.relaybox.model.AllocationStatus;
import io.relaybox.model.EndpointRole;
import io.relaybox.model.ErrorKind;
import io.relaybox.observability.AuditEvent;
import io.relaybox.observability.AuditSink;
import io.relaybox.observability.MetricsSink;
import io.relaybox.security.SignatureVerifier;
import io.relaybox.security.Verification;
import io.relaybox.util.Hashing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

/**
 * Allocations keyed by an id derived from the signed token bytes, so presenting the same
 * token again resolves to the same entry. Terminal entries are retained until their token
 * expires; a re-presented token never gets fresh quota.
 */
public final class AllocationTable {
    private static final Logger log = LoggerFactory.getLogger(AllocationTable.class);
    private static final int ALLOCATION_ID_BYTES = 16;

    private final ConcurrentHashMap<String, Allocation> allocations = new ConcurrentHashMap<>();
    private final AtomicInteger active = new AtomicInteger();
    private final DeviceKeyDirectory devices;
    private final SignatureVerifier verifier;
    private final Clock clock;
    private final MetricsSink metrics;
    private final AuditSink audit;
    private final long defaultQuotaBytes;
    private final long defaultBandwidthBps;
    private final int maxAllocations;
    private final long maxAllocationTtlMs;
    private final long idleTimeoutMs;

    public AllocationTable(
            RelayBoxConfig config,
            DeviceKeyDirectory devices,
            SignatureVerifier verifier,
            Clock clock,
            MetricsSink metrics,
            AuditSink audit
    ) {
        this.devices = devices;
        this.verifier = verifier;
        this.clock = clock;
        this.metrics = metrics == null ? MetricsSink.NOOP : metrics;
        this.audit = audit == null ? AuditSink.NOOP : audit;
        this.defaultQuotaBytes = config.defaultQuotaBytes();
        this.defaultBandwidthBps = config.defaultBandwidthBps();
        this.maxAllocations = config.maxAllocations();
        this.maxAllocationTtlMs = config.maxAllocationTtlMs();
        this.idleTimeoutMs = config.allocationIdleTimeoutMs();
    }

    /**
     * Verifies a presented token and creates or resumes its allocation. {@code deviceId} is
     * the identity announced out of band; it selects the pinned keys and must equal the
     * device id inside the signed payload.
     */
    public AllocationOutcome createOrResume(byte[] deviceId, byte[] tokenBytes) {
        return createOrResume(deviceId, tokenBytes, () -> true);
    }

    /**
     * As above, but a brand-new allocation is only created when {@code admitCreation}
     * agrees. Resuming an existing allocation never consults it.
     */
    public AllocationOutcome createOrResume(byte[] deviceId, byte[] tokenBytes, BooleanSupplier admitCreation) {
        RelayToken.Signed signed = RelayToken.split(tokenBytes);
        if (signed == null || deviceId == null || deviceId.length != RelayToken.IDENTITY_BYTES) {
            return reject(ErrorKind.INVALID_TOKEN);
        }
        Verification<RelayToken> verification = verifier.verify(
                signed.payload(),
                signed.signature(),
                devices.candidates(deviceId, clock.millis()),
                RelayToken::parse
        );
        if (!verification.ok()) {
            return reject(verification.error() == ErrorKind.EXPIRED ? ErrorKind.EXPIRED : ErrorKind.INVALID_TOKEN);
        }
        RelayToken token = verification.claims();
        if (!Arrays.equals(token.deviceId(), deviceId)) {
            return reject(ErrorKind.INVALID_TOKEN);
        }
        String id = allocationId(signed.payload());
        boolean[] created = new boolean[1];
        ErrorKind[] refusal = new ErrorKind[1];
        Allocation allocation = allocations.computeIfAbsent(id, key -> {
            if (!admitCreation.getAsBoolean()) {
                refusal[0] = ErrorKind.RATE_LIMITED;
                return null;
            }
            if (!reserveSlot()) {
                refusal[0] = ErrorKind.ALLOCATION_LIMIT;
                return null;
            }
            created[0] = true;
            return newAllocation(key, token);
        });
        if (allocation == null) {
            if (refusal[0] == ErrorKind.ALLOCATION_LIMIT) {
                log.warn("Allocation limit {} reached", maxAllocations);
            }
            return reject(refusal[0]);
        }
        if (created[0]) {
            metrics.allocationCreated();
            audit.record(AuditEvent.of("allocation.create", allocation.deviceId(), id, "ok", Map.of(
                    "quota_bytes", allocation.quotaBytes(),
                    "bandwidth_bps", allocation.bandwidthBps(),
                    "expires_at_ms", allocation.expiresAtMs()
            )));
            log.info("Allocation {} created (quota={} bytes, bandwidth={} B/s)", id, allocation.quotaBytes(), allocation.bandwidthBps());
            return AllocationOutcome.created(allocation);
        }
        AllocationStatus status = allocation.status();
        if (status.terminal()) {
            return reject(status.rejection());
        }
        // The token may outlive the allocation's capped lifetime.
        if (clock.millis() >= allocation.expiresAtMs()) {
            finish(allocation, AllocationStatus.EXPIRED, "ttl");
            return reject(ErrorKind.EXPIRED);
        }
        log.debug("Allocation {} resumed", id);
        return AllocationOutcome.resumed(allocation);
    }

    public Optional<Allocation> find(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(allocations.get(id));
    }

    public boolean attach(Allocation allocation, EndpointRole role, FrameSink sink) {
        FrameSink previous = allocation.attach(role, sink, clock.millis());
        if (previous != null && previous != sink) {
            previous.close(ErrorKind.TERMINATED);
        }
        return previous == null;
    }

    /**
     * Detaches a closed endpoint. Losing either endpoint ends the allocation.
     */
    public void endpointClosed(Allocation allocation, EndpointRole role, FrameSink sink) {
        if (allocation.detach(role, sink, clock.millis())) {
            finish(allocation, AllocationStatus.TERMINATED, "endpoint_closed");
        }
    }

    /**
     * Moves an allocation out of {@code ACTIVE} without touching its endpoints.
     */
    boolean transition(Allocation allocation, AllocationStatus next, String reason) {
        if (!allocation.transition(next)) {
            return false;
        }
        active.decrementAndGet();
        audit.record(AuditEvent.of("allocation." + next.name().toLowerCase(Locale.ROOT), allocation.deviceId(), allocation.id(), "ok", Map.of(
                "reason", reason,
                "bytes_used", allocation.bytesUsed()
        )));
        log.info("Allocation {} -> {} ({}), {} of {} bytes used", allocation.id(), next, reason, allocation.bytesUsed(), allocation.quotaBytes());
        return true;
    }

    /**
     * Ends an allocation and closes whatever endpoints are still attached.
     */
    public void finish(Allocation allocation, AllocationStatus next, String reason) {
        transition(allocation, next, reason);
        release(allocation);
    }

    public void release(Allocation allocation) {
        ErrorKind reason = allocation.status().rejection();
        for (EndpointRole role : EndpointRole.values()) {
            FrameSink sink = allocation.endpoint(role);
            if (sink != null && allocation.detach(role, sink, clock.millis())) {
                sink.close(reason == null ? ErrorKind.TERMINATED : reason);
            }
        }
    }

    /**
     * Force-ends an allocation. Returns false when it is unknown or had already ended.
     */
    public boolean terminate(String id, String reason) {
        Allocation allocation = id == null ? null : allocations.get(id);
        if (allocation == null) {
            return false;
        }
        boolean ended = transition(allocation, AllocationStatus.TERMINATED, reason);
        release(allocation);
        return ended;
    }

    /**
     * Sweeps expired and abandoned allocations, and forgets terminal ones whose token can no
     * longer be presented.
     */
    public ExpiryReport expireStale() {
        long now = clock.millis();
        int expired = 0;
        int abandoned = 0;
        int removed = 0;
        for (Map.Entry<String, Allocation> entry : allocations.entrySet()) {
            Allocation allocation = entry.getValue();
            try {
                if (allocation.status() == AllocationStatus.ACTIVE) {
                    if (now >= allocation.expiresAtMs()) {
                        finish(allocation, AllocationStatus.EXPIRED, "ttl");
                        expired++;
                    } else if (allocation.unattendedSince(now - idleTimeoutMs)) {
                        finish(allocation, AllocationStatus.TERMINATED, "idle");
                        abandoned++;
                    }
                } else if (now >= allocation.tokenExpiresAtMs() && allocations.remove(entry.getKey(), allocation)) {
                    removed++;
                }
            } catch (RuntimeException e) {
                log.warn("Expiry sweep failed for allocation {}", entry.getKey(), e);
            }
        }
        return new ExpiryReport(expired, abandoned, removed);
    }

    public List<AllocationView> list() {
        List<AllocationView> out = new ArrayList<>();
        for (Allocation allocation : allocations.values()) {
            out.add(allocation.view());
        }
        return out;
    }

    public int activeCount() {
        return active.get();
    }

    public int size() {
        return allocations.size();
    }

    public Map<String, Integer> countsByStatus() {
        Map<String, Integer> out = new LinkedHashMap<>();
        for (AllocationStatus status : AllocationStatus.values()) {
            out.put(status.name().toLowerCase(Locale.ROOT), 0);
        }
        for (Allocation allocation : allocations.values()) {
            out.merge(allocation.status().name().toLowerCase(Locale.ROOT), 1, Integer::sum);
        }
        return out;
    }

    public static String allocationId(byte[] signedPayload) {
        return Hashing.hex(Arrays.copyOf(Hashing.sha256(signedPayload), ALLOCATION_ID_BYTES));
    }

    private Allocation newAllocation(String id, RelayToken token) {
        long now = clock.millis();
        long quota = token.quotaBytes() == 0L ? defaultQuotaBytes : token.quotaBytes();
        long bandwidth = token.bandwidthBps() == 0L ? defaultBandwidthBps : token.bandwidthBps();
        long expiresAt = Math.min(token.expiresAtMs(), now + maxAllocationTtlMs);
        return new Allocation(
                id,
                Hashing.hex(token.deviceId()),
                Hashing.hex(token.peerId()),
                quota,
                bandwidth,
                now,
                expiresAt,
                token.expiresAtMs(),
                clock
        );
    }

    private boolean reserveSlot() {
        while (true) {
            int current = active.get();
            if (current >= maxAllocations) {
                return false;
            }
            if (active.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    private AllocationOutcome reject(ErrorKind error) {
        metrics.error(error);
        return AllocationOutcome.rejected(error);
    }

    public record ExpiryReport(int expired, int abandoned, int removed) {
    }
}
