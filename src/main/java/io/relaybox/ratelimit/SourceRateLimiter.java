package io.relaybox.ratelimit;

import java.time.Clock;
import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Per-source request limiter: one {@link TokenBucket} per source address, created lazily.
 * Blocklist and allowlist are consulted before any bucket is touched.
 */
public final class SourceRateLimiter {
    private static final long WINDOW_MS = 60_000L;

    private final String name;
    private final int limitPerMinute;
    private final Clock clock;
    private final ConcurrentMap<String, TokenBucket> buckets;
    private final Set<String> allowlist;
    private final Set<String> blocklist;

    public SourceRateLimiter(String name, int limitPerMinute, Clock clock) {
        this.name = name;
        this.limitPerMinute = Math.max(0, limitPerMinute);
        this.clock = clock;
        this.buckets = new ConcurrentHashMap<>();
        this.allowlist = ConcurrentHashMap.newKeySet();
        this.blocklist = ConcurrentHashMap.newKeySet();
    }

    public String name() {
        return name;
    }

    public boolean disabled() {
        return limitPerMinute <= 0;
    }

    public RateDecision check(String source) {
        String key = normalize(source);
        if (blocklist.contains(key)) {
            return RateDecision.deny(WINDOW_MS);
        }
        if (allowlist.contains(key) || disabled()) {
            return RateDecision.allow();
        }
        RateDecision[] decision = new RateDecision[1];
        buckets.compute(key, (k, existing) -> {
            TokenBucket bucket = existing == null ? TokenBucket.perMinute(limitPerMinute, clock) : existing;
            decision[0] = bucket.check(1.0d);
            return bucket;
        });
        return decision[0];
    }

    public boolean blocked(String source) {
        return blocklist.contains(normalize(source));
    }

    public void allow(Collection<String> sources) {
        for (String source : sources) {
            allowlist.add(normalize(source));
        }
    }

    public void block(Collection<String> sources) {
        for (String source : sources) {
            blocklist.add(normalize(source));
        }
    }

    public void unblock(String source) {
        blocklist.remove(normalize(source));
    }

    public int sweepIdle(long idleMs) {
        long cutoff = clock.millis() - idleMs;
        int removed = 0;
        for (String key : buckets.keySet()) {
            boolean[] dropped = new boolean[1];
            buckets.computeIfPresent(key, (k, bucket) -> {
                dropped[0] = bucket.idleSince(cutoff);
                return dropped[0] ? null : bucket;
            });
            if (dropped[0]) {
                removed++;
            }
        }
        return removed;
    }

    public int trackedSources() {
        return buckets.size();
    }

    private static String normalize(String source) {
        return source == null ? "unknown" : source.trim().toLowerCase(Locale.ROOT);
    }
}
