package io.relaybox.relay;

import io.relaybox.model.ErrorKind;

public record AllocationOutcome(boolean ok, Allocation allocation, boolean resumed, ErrorKind error) {
    public static AllocationOutcome created(Allocation allocation) {
        return new AllocationOutcome(true, allocation, false, null);
    }

    public static AllocationOutcome resumed(Allocation allocation) {
        return new AllocationOutcome(true, allocation, true, null);
    }

    public static AllocationOutcome rejected(ErrorKind error) {
        return new AllocationOutcome(false, null, false, error);
    }
}
