package io.relaybox.mailbox;

import io.relaybox.model.ErrorKind;

public record EnqueueOutcome(boolean accepted, long sequence, boolean handedOff, ErrorKind error) {
    public static EnqueueOutcome queued(long sequence) {
        return new EnqueueOutcome(true, sequence, false, null);
    }

    public static EnqueueOutcome handedOff(long sequence) {
        return new EnqueueOutcome(true, sequence, true, null);
    }

    public static EnqueueOutcome rejected(ErrorKind error) {
        return new EnqueueOutcome(false, 0L, false, error);
    }
}
