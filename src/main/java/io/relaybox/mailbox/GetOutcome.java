package io.relaybox.mailbox;

import io.relaybox.model.ErrorKind;

/**
 * Result of a mailbox read. {@code queueLength} is what remains after this delivery.
 */
public record GetOutcome(Status status, byte[] payload, long sequence, int queueLength, ErrorKind error, long retryAfterMs) {
    public static GetOutcome delivered(Message message, int queueLength) {
        return new GetOutcome(Status.DELIVERED, message.payload(), message.sequence(), queueLength, null, 0L);
    }

    public static GetOutcome empty() {
        return new GetOutcome(Status.EMPTY, null, 0L, 0, null, 0L);
    }

    public static GetOutcome rejected(ErrorKind error) {
        return new GetOutcome(Status.REJECTED, null, 0L, 0, error, 0L);
    }

    public static GetOutcome rateLimited(long retryAfterMs) {
        return new GetOutcome(Status.REJECTED, null, 0L, 0, ErrorKind.RATE_LIMITED, retryAfterMs);
    }

    static GetOutcome from(DequeueOutcome outcome) {
        switch (outcome.status()) {
            case DELIVERED:
                return delivered(outcome.message(), outcome.remaining());
            case EMPTY:
                return empty();
            default:
                return rejected(outcome.error());
        }
    }

    public enum Status {
        DELIVERED,
        EMPTY,
        REJECTED
    }
}
