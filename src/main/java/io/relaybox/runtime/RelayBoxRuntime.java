package io.relaybox.runtime;

import io.relaybox.config.RelayBoxConfig;
import io.relaybox.mailbox.EvictionReport;
import io.relaybox.mailbox.MailboxService;
import io.relaybox.mailbox.MailboxStore;
import io.relaybox.observability.AuditLogger;
import io.relaybox.observability.AuditSink;
import io.relaybox.observability.PrometheusFormatter;
import io.relaybox.observability.RelayBoxMetrics;
import io.relaybox.ratelimit.SourceRateLimiter;
import io.relaybox.ratelimit.TokenBucket;
import io.relaybox.relay.AllocationTable;
import io.relaybox.relay.DeviceKeyDirectory;
import io.relaybox.relay.RelayAdmission;
import io.relaybox.relay.RelayForwarder;
import io.relaybox.relay.RelayService;
import io.relaybox.security.MailboxAuthenticator;
import io.relaybox.security.SignatureVerifier;
import io.relaybox.util.Threads;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

public final class RelayBoxRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RelayBoxRuntime.class);
    private static final double OVERLOAD_RATIO = 0.9d;

    private final RelayBoxConfig config;
    private final Clock clock;
    private final long startedAtMs;
    private final RelayBoxMetrics metrics;
    private final AuditSink audit;
    private final ScheduledExecutorService scheduler;
    private final SourceRateLimiter postLimiter;
    private final SourceRateLimiter getLimiter;
    private final MailboxStore store;
    private final MailboxService mailboxService;
    private final AllocationTable allocations;
    private final RelayForwarder forwarder;
    private final RelayAdmission relayAdmission;
    private RelayService relay;
    private ScheduledFuture<?> sweeper;
    private volatile boolean draining;

    public RelayBoxRuntime(RelayBoxConfig config) {
        this(config, Clock.systemUTC());
    }

    public RelayBoxRuntime(RelayBoxConfig config, Clock clock) {
        config.validate();
        this.config = config;
        this.clock = clock;
        this.startedAtMs = clock.millis();
        this.metrics = new RelayBoxMetrics();
        this.audit = config.auditFile().isBlank()
                ? AuditSink.NOOP
                : new AuditLogger(Path.of(config.auditFile()), config.auditSigningSecret(), clock);
        this.scheduler = Executors.newScheduledThreadPool(
                Math.max(1, Math.min(config.workerThreads(), 4)), Threads.named("relaybox-timer"));
        SignatureVerifier verifier = new SignatureVerifier(clock, config.clockSkewMs(), config.maxTokenAgeMs());
        this.postLimiter = limiter("post", config.postsPerMinute());
        this.getLimiter = limiter("get", config.getsPerMinute());
        this.store = new MailboxStore(config, clock, scheduler, metrics);
        this.mailboxService = new MailboxService(
                config,
                store,
                MailboxAuthenticator.fromConfig(config, verifier),
                postLimiter,
                getLimiter,
                metrics,
                audit
        );
        this.allocations = new AllocationTable(
                config,
                DeviceKeyDirectory.fromConfig(config.pinnedDevices()),
                verifier,
                clock,
                metrics,
                audit
        );
        TokenBucket relayWide = config.relayBandwidthCapped()
                ? new TokenBucket(config.globalBandwidthBps(), config.globalBandwidthBps(), clock)
                : null;
        this.forwarder = new RelayForwarder(allocations, clock, metrics, audit, relayWide);
        this.relayAdmission = new RelayAdmission(
                limiter("relay-connect", config.relayConnectionsPerMinute()),
                limiter("relay-allocate", config.relayAllocationsPerMinute())
        );
    }

    private SourceRateLimiter limiter(String name, int perMinute) {
        SourceRateLimiter limiter = new SourceRateLimiter(name, perMinute, clock);
        limiter.allow(config.allowlist());
        limiter.block(config.blocklist());
        return limiter;
    }

    public synchronized void startSweeper() {
        if (sweeper != null) {
            return;
        }
        long interval = config.evictionIntervalMs();
        sweeper = scheduler.scheduleWithFixedDelay(this::sweepSafely, interval, interval, TimeUnit.MILLISECONDS);
    }

    public synchronized RelayService startRelay() throws IOException {
        if (relay == null) {
            relay = new RelayService(config, allocations, forwarder, relayAdmission);
            relay.start();
        }
        return relay;
    }

    /**
     * One pass of the periodic sweep: expired messages, idle mailboxes, idle rate-limit
     * buckets and stale allocations.
     */
    public SweepOutcome sweep() {
        EvictionReport eviction = store.evictExpired();
        long idleMs = config.rateLimiterIdleMs();
        int buckets = postLimiter.sweepIdle(idleMs) + getLimiter.sweepIdle(idleMs) + relayAdmission.sweepIdle(idleMs);
        AllocationTable.ExpiryReport expiry = allocations.expireStale();
        return new SweepOutcome(
                eviction.messagesExpired(),
                eviction.mailboxesRemoved(),
                buckets,
                expiry.expired(),
                expiry.abandoned(),
                expiry.removed()
        );
    }

    private void sweepSafely() {
        try {
            SweepOutcome outcome = sweep();
            if (outcome.changed()) {
                log.debug("Sweep: {}", outcome);
            }
        } catch (RuntimeException e) {
            log.warn("Sweep failed; will retry next interval", e);
        }
    }

    public StatsOutcome stats() {
        return new StatsOutcome(
                RelayBoxConfig.VERSION,
                uptimeSeconds(),
                draining,
                store.activeMailboxes(),
                store.queuedMessages(),
                store.bufferedBytes(),
                store.memoryLimitBytes(),
                allocations.activeCount(),
                allocations.countsByStatus(),
                postLimiter.trackedSources() + getLimiter.trackedSources(),
                metrics.snapshot()
        );
    }

    public String metricsText() {
        PrometheusFormatter.Gauges gauges = new PrometheusFormatter.Gauges(
                store.activeMailboxes(),
                store.queuedMessages(),
                store.bufferedBytes(),
                allocations.activeCount()
        );
        return PrometheusFormatter.format(gauges, metrics.snapshot());
    }

    public HealthOutcome health() {
        if (draining) {
            return new HealthOutcome("draining", uptimeSeconds(), RelayBoxConfig.VERSION, 503);
        }
        if (store.bufferedBytes() >= store.memoryLimitBytes() * OVERLOAD_RATIO) {
            return new HealthOutcome("overloaded", uptimeSeconds(), RelayBoxConfig.VERSION, 503);
        }
        return new HealthOutcome("ok", uptimeSeconds(), RelayBoxConfig.VERSION, 200);
    }

    /**
     * Stops taking new work: posts are refused, pending readers are woken, and the relay
     * listener closes. Existing allocations keep running.
     */
    public void drain() {
        draining = true;
        mailboxService.beginDrain();
        RelayService current = relay;
        if (current != null) {
            current.stopAccepting();
        }
    }

    @Override
    public void close() {
        if (!draining) {
            drain();
        }
        RelayService current = relay;
        if (current != null) {
            try {
                if (!current.awaitAllocations(config.gracefulShutdownTimeoutMs())) {
                    log.warn("{} allocations still active after {} ms; terminating", allocations.activeCount(), config.gracefulShutdownTimeoutMs());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            current.close();
        }
        scheduler.shutdownNow();
        log.info("Runtime stopped after {} s", uptimeSeconds());
    }

    public long uptimeSeconds() {
        return Math.max(0L, (clock.millis() - startedAtMs) / 1000L);
    }

    public RelayBoxConfig config() {
        return config;
    }

    public Clock clock() {
        return clock;
    }

    public MailboxService mailboxService() {
        return mailboxService;
    }

    public MailboxStore store() {
        return store;
    }

    public AllocationTable allocations() {
        return allocations;
    }

    public RelayForwarder forwarder() {
        return forwarder;
    }

    public RelayAdmission relayAdmission() {
        return relayAdmission;
    }

    public RelayBoxMetrics metrics() {
        return metrics;
    }

    public AuditSink audit() {
        return audit;
    }

    public boolean draining() {
        return draining;
    }

    public record SweepOutcome(
            int messagesExpired,
            int mailboxesRemoved,
            int rateBucketsRemoved,
            int allocationsExpired,
            int allocationsAbandoned,
            int allocationsForgotten
    ) {
        public boolean changed() {
            return messagesExpired + mailboxesRemoved + rateBucketsRemoved
                    + allocationsExpired + allocationsAbandoned + allocationsForgotten > 0;
        }
    }

    public record StatsOutcome(
            String version,
            long uptimeSeconds,
            boolean draining,
            int activeMailboxes,
            long queuedMessages,
            long bufferedBytes,
            long memoryLimitBytes,
            int activeAllocations,
            Map<String, Integer> allocationsByStatus,
            int rateLimitedSources,
            RelayBoxMetrics.Snapshot counters
    ) {
    }

    public record HealthOutcome(String status, long uptimeSeconds, String version, int httpStatus) {
    }
}
