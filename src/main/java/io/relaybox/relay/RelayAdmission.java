package io.relaybox.relay;

import io.relaybox.model.ErrorKind;
import io.relaybox.ratelimit.RateDecision;
import io.relaybox.ratelimit.SourceRateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Optional;

/**
 * Per-address gate in front of the relay: blocklisted sources are refused, and new
 * connections and new allocations are rate limited separately. Allowlisted sources skip
 * both limits.
 */
public final class RelayAdmission {
    private static final Logger log = LoggerFactory.getLogger(RelayAdmission.class);

    private final SourceRateLimiter connections;
    private final SourceRateLimiter allocations;

    public RelayAdmission(SourceRateLimiter connections, SourceRateLimiter allocations) {
        this.connections = connections;
        this.allocations = allocations;
    }

    public static RelayAdmission unlimited(Clock clock) {
        return new RelayAdmission(new SourceRateLimiter("relay-connect", 0, clock), new SourceRateLimiter("relay-allocate", 0, clock));
    }

    /**
     * Empty when the connection may proceed, otherwise the refusal to send back.
     */
    public Optional<ErrorKind> admitConnection(String source) {
        if (connections.blocked(source)) {
            log.warn("Blocked address {} attempted a relay connection", source);
            return Optional.of(ErrorKind.FORBIDDEN);
        }
        RateDecision decision = connections.check(source);
        if (!decision.allowed()) {
            log.warn("Relay connection rate limit exceeded for {}", source);
            return Optional.of(ErrorKind.RATE_LIMITED);
        }
        return Optional.empty();
    }

    public boolean admitAllocation(String source) {
        if (allocations.check(source).allowed()) {
            return true;
        }
        log.warn("Relay allocation rate limit exceeded for {}", source);
        return false;
    }

    public int sweepIdle(long idleMs) {
        return connections.sweepIdle(idleMs) + allocations.sweepIdle(idleMs);
    }
}
