package io.relaybox.ratelimit;

import java.time.Clock;

/**
 * Classic token bucket. Tokens refill continuously at {@code refillPerSecond} up to
 * {@code capacity}; a check either takes {@code cost} tokens or reports how long the
 * caller has to wait until enough have accumulated. A cost above {@code capacity} can never
 * be met and is denied permanently.
 *
 * <p>Over any window of length T the bucket hands out at most
 * {@code capacity + refillPerSecond * T} tokens. Thread-safe; one bucket is one lock.
 */
public final class TokenBucket {
    private final double capacity;
    private final double refillPerMs;
    private final Clock clock;
    private double tokens;
    private long lastRefillMs;
    private long lastTouchedMs;

    public TokenBucket(double capacity, double refillPerSecond, Clock clock) {
        if (capacity <= 0.0d) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        if (refillPerSecond < 0.0d) {
            throw new IllegalArgumentException("refillPerSecond must be >= 0");
        }
        this.capacity = capacity;
        this.refillPerMs = refillPerSecond / 1000.0d;
        this.clock = clock;
        this.tokens = capacity;
        this.lastRefillMs = clock.millis();
        this.lastTouchedMs = lastRefillMs;
    }

    public static TokenBucket perMinute(int limit, Clock clock) {
        return new TokenBucket(limit, limit / 60.0d, clock);
    }

    public synchronized RateDecision check(double cost) {
        if (cost < 0.0d) {
            throw new IllegalArgumentException("cost must be >= 0");
        }
        long nowMs = clock.millis();
        refill(nowMs);
        lastTouchedMs = nowMs;
        if (tokens >= cost) {
            tokens -= cost;
            return RateDecision.allow();
        }
        if (cost > capacity || refillPerMs <= 0.0d) {
            return RateDecision.never();
        }
        double missing = cost - tokens;
        long waitMs = (long) Math.ceil(missing / refillPerMs);
        return RateDecision.deny(waitMs);
    }

    /**
     * Puts back tokens taken by a check whose work was then refused elsewhere.
     */
    public synchronized void refund(double amount) {
        if (amount <= 0.0d) {
            return;
        }
        refill(clock.millis());
        tokens = Math.min(capacity, tokens + amount);
    }

    public synchronized double available() {
        refill(clock.millis());
        return tokens;
    }

    public double capacity() {
        return capacity;
    }

    // Full and untouched since cutoff: dropping it is indistinguishable from keeping it.
    public synchronized boolean idleSince(long cutoffMs) {
        refill(clock.millis());
        return lastTouchedMs < cutoffMs && tokens >= capacity;
    }

    private void refill(long nowMs) {
        if (nowMs <= lastRefillMs) {
            return;
        }
        long elapsed = nowMs - lastRefillMs;
        tokens = Math.min(capacity, tokens + elapsed * refillPerMs);
        lastRefillMs = nowMs;
    }
}
