package io.relaybox.mailbox;

import io.relaybox.model.ErrorKind;

public record DequeueOutcome(Status status, Message message, int remaining, ErrorKind error) {
    public static DequeueOutcome delivered(Message message, int remaining) {
        return new DequeueOutcome(Status.DELIVERED, message, remaining, null);
    }

    public static DequeueOutcome empty() {
        return new DequeueOutcome(Status.EMPTY, null, 0, null);
    }

    public static DequeueOutcome unavailable() {
        return new DequeueOutcome(Status.REJECTED, null, 0, ErrorKind.SERVICE_UNAVAILABLE);
    }

    public enum Status {
        DELIVERED,
        EMPTY,
        REJECTED
    }
}
