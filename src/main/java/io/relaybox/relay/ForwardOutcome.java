package io.relaybox.relay;

import io.relaybox.model.ErrorKind;

public record ForwardOutcome(boolean forwarded, long bytes, ErrorKind error, long retryAfterMs) {
    public static ForwardOutcome forwarded(long bytes) {
        return new ForwardOutcome(true, bytes, null, 0L);
    }

    public static ForwardOutcome rejected(ErrorKind error) {
        return new ForwardOutcome(false, 0L, error, 0L);
    }

    public static ForwardOutcome throttled(long retryAfterMs) {
        return new ForwardOutcome(false, 0L, ErrorKind.BANDWIDTH_EXCEEDED, retryAfterMs);
    }
}
