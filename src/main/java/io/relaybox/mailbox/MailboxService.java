package io.relaybox.mailbox;

import io.relaybox.config.RelayBoxConfig;
import io.relaybox.model.ErrorKind;
import io.relaybox.observability.AuditEvent;
import io.relaybox.observability.AuditSink;
import io.relaybox.observability.MetricsSink;
import io.relaybox.ratelimit.RateDecision;
import io.relaybox.ratelimit.SourceRateLimiter;
import io.relaybox.security.AuthOutcome;
import io.relaybox.security.MailboxAuthenticator;
import io.relaybox.security.MailboxScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Request-level mailbox semantics. Every request passes the drain gate, the source's rate
 * limiter and authorization, in that order, before the store is touched.
 */
public final class MailboxService {
    private static final Logger log = LoggerFactory.getLogger(MailboxService.class);

    private final MailboxStore store;
    private final MailboxAuthenticator authenticator;
    private final SourceRateLimiter postLimiter;
    private final SourceRateLimiter getLimiter;
    private final MetricsSink metrics;
    private final AuditSink audit;
    private final long defaultWaitMs;
    private final long maxWaitMs;
    private volatile boolean draining;

    public MailboxService(
            RelayBoxConfig config,
            MailboxStore store,
            MailboxAuthenticator authenticator,
            SourceRateLimiter postLimiter,
            SourceRateLimiter getLimiter,
            MetricsSink metrics,
            AuditSink audit
    ) {
        this.store = store;
        this.authenticator = authenticator;
        this.postLimiter = postLimiter;
        this.getLimiter = getLimiter;
        this.metrics = metrics == null ? MetricsSink.NOOP : metrics;
        this.audit = audit == null ? AuditSink.NOOP : audit;
        this.defaultWaitMs = config.defaultWaitMs();
        this.maxWaitMs = config.maxWaitMs();
    }

    public PostOutcome post(RecipientId recipient, byte[] payload, String source, String authorization) {
        if (draining) {
            return reject(PostOutcome.rejected(ErrorKind.SERVICE_UNAVAILABLE));
        }
        RateDecision rate = postLimiter.check(source);
        if (!rate.allowed()) {
            metrics.rateLimitHit();
            return reject(PostOutcome.rateLimited(rate.retryAfterMs()));
        }
        AuthOutcome auth = authenticator.verify(recipient, MailboxScope.POST, authorization);
        if (!auth.ok()) {
            auditDenied("mailbox.post", recipient, source, auth.error());
            return reject(PostOutcome.rejected(auth.error()));
        }
        EnqueueOutcome enqueued = store.enqueue(recipient, payload);
        if (!enqueued.accepted()) {
            log.debug("Post to {} rejected: {} ({} bytes)", recipient.logLabel(), enqueued.error().code(), payload == null ? 0 : payload.length);
            return reject(PostOutcome.rejected(enqueued.error()));
        }
        metrics.messagePosted();
        if (enqueued.handedOff()) {
            metrics.messageDelivered();
        }
        return PostOutcome.accepted(enqueued.sequence());
    }

    public CompletableFuture<GetOutcome> get(RecipientId recipient, long waitMs, String source, String authorization) {
        if (draining) {
            return CompletableFuture.completedFuture(reject(GetOutcome.rejected(ErrorKind.SERVICE_UNAVAILABLE)));
        }
        RateDecision rate = getLimiter.check(source);
        if (!rate.allowed()) {
            metrics.rateLimitHit();
            return CompletableFuture.completedFuture(reject(GetOutcome.rateLimited(rate.retryAfterMs())));
        }
        AuthOutcome auth = authenticator.verify(recipient, MailboxScope.GET, authorization);
        if (!auth.ok()) {
            auditDenied("mailbox.get", recipient, source, auth.error());
            return CompletableFuture.completedFuture(reject(GetOutcome.rejected(auth.error())));
        }
        long wait = Math.max(0L, Math.min(waitMs, maxWaitMs));
        return store.dequeueOrWait(recipient, wait).thenApply(outcome -> {
            GetOutcome result = GetOutcome.from(outcome);
            if (result.status() == GetOutcome.Status.DELIVERED) {
                metrics.messageDelivered();
            } else if (result.status() == GetOutcome.Status.REJECTED) {
                metrics.error(result.error());
            }
            return result;
        });
    }

    /**
     * Parses the {@code wait_ms} query value: absent or non-numeric falls back to the
     * default, negative means no wait, anything above the maximum is capped.
     */
    public long parseWaitMs(String raw) {
        if (raw == null || raw.isBlank()) {
            return defaultWaitMs;
        }
        long value;
        try {
            value = Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            return defaultWaitMs;
        }
        return Math.max(0L, Math.min(value, maxWaitMs));
    }

    public void beginDrain() {
        draining = true;
        int woken = store.shutdown();
        log.info("Mailbox draining; woke {} pending readers", woken);
    }

    public boolean draining() {
        return draining;
    }

    public MailboxStore store() {
        return store;
    }

    private void auditDenied(String action, RecipientId recipient, String source, ErrorKind error) {
        audit.record(AuditEvent.of(action, source, recipient.logLabel(), "denied", Map.of("error", error.code())));
    }

    private PostOutcome reject(PostOutcome outcome) {
        metrics.error(outcome.error());
        return outcome;
    }

    private GetOutcome reject(GetOutcome outcome) {
        metrics.error(outcome.error());
        return outcome;
    }
}
