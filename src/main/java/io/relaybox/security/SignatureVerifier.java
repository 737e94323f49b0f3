package io.relaybox.security;

import io.relaybox.model.ErrorKind;

import java.time.Clock;
import java.util.List;

/**
 * Verifies a signed payload against a candidate key set and only then hands the bytes
 * to a claims parser. Unverified bytes are never interpreted.
 */
public final class SignatureVerifier {
    private final Clock clock;
    private final long clockSkewMs;
    private final long maxTokenAgeMs;

    public SignatureVerifier(Clock clock, long clockSkewMs, long maxTokenAgeMs) {
        this.clock = clock;
        this.clockSkewMs = Math.max(0L, clockSkewMs);
        this.maxTokenAgeMs = maxTokenAgeMs <= 0L ? Long.MAX_VALUE : maxTokenAgeMs;
    }

    public <T extends TimeBounded> Verification<T> verify(
            byte[] payload,
            byte[] signature,
            List<VerificationKey> candidates,
            ClaimsParser<T> parser
    ) {
        if (payload == null || payload.length == 0 || signature == null || signature.length == 0) {
            return Verification.failure(ErrorKind.BAD_SIGNATURE);
        }
        String matchedKeyId = null;
        // Every candidate is tried so timing does not reveal which key matched.
        for (VerificationKey key : candidates) {
            boolean ok = key.verify(payload, signature);
            if (ok && matchedKeyId == null) {
                matchedKeyId = key.keyId();
            }
        }
        if (matchedKeyId == null) {
            return Verification.failure(ErrorKind.BAD_SIGNATURE);
        }
        T claims;
        try {
            claims = parser.parse(payload);
        } catch (RuntimeException e) {
            return Verification.failure(ErrorKind.FORBIDDEN);
        }
        if (claims == null) {
            return Verification.failure(ErrorKind.FORBIDDEN);
        }
        long now = clock.millis();
        if (claims.issuedAtMs() > now + clockSkewMs) {
            return Verification.failure(ErrorKind.EXPIRED);
        }
        if (now - claims.issuedAtMs() > maxTokenAgeMs) {
            return Verification.failure(ErrorKind.EXPIRED);
        }
        if (claims.expiresAtMs() <= now || claims.expiresAtMs() <= claims.issuedAtMs()) {
            return Verification.failure(ErrorKind.EXPIRED);
        }
        return Verification.success(claims, matchedKeyId);
    }

    public long nowMs() {
        return clock.millis();
    }
}
