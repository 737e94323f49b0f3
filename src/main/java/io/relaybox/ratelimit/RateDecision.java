package io.relaybox.ratelimit;

/**
 * Result of a bucket check. A {@code permanent} denial asks for more than the bucket can ever
 * hold; waiting does not help and {@code retryAfterMs} is zero.
 */
public record RateDecision(boolean allowed, long retryAfterMs, boolean permanent) {
    private static final RateDecision ALLOWED = new RateDecision(true, 0L, false);
    private static final RateDecision NEVER = new RateDecision(false, 0L, true);

    public static RateDecision allow() {
        return ALLOWED;
    }

    public static RateDecision deny(long retryAfterMs) {
        return new RateDecision(false, Math.max(1L, retryAfterMs), false);
    }

    public static RateDecision never() {
        return NEVER;
    }

    // Retry-After header value: whole seconds, never zero on a denial.
    public long retryAfterSeconds() {
        if (allowed) {
            return 0L;
        }
        return Math.max(1L, (retryAfterMs + 999L) / 1000L);
    }
}
