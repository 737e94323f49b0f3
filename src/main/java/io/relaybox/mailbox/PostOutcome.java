package io.relaybox.mailbox;

import io.relaybox.model.ErrorKind;

public record PostOutcome(boolean accepted, long sequence, ErrorKind error, long retryAfterMs) {
    public static PostOutcome accepted(long sequence) {
        return new PostOutcome(true, sequence, null, 0L);
    }

    public static PostOutcome rejected(ErrorKind error) {
        return new PostOutcome(false, 0L, error, 0L);
    }

    public static PostOutcome rateLimited(long retryAfterMs) {
        return new PostOutcome(false, 0L, ErrorKind.RATE_LIMITED, retryAfterMs);
    }
}
