package io.relaybox.model;

public enum AllocationStatus {
    ACTIVE,
    QUOTA_EXCEEDED,
    EXPIRED,
    TERMINATED;

    public boolean terminal() {
        return this != ACTIVE;
    }

    public ErrorKind rejection() {
        return switch (this) {
            case ACTIVE -> null;
            case QUOTA_EXCEEDED -> ErrorKind.QUOTA_EXCEEDED;
            case EXPIRED -> ErrorKind.EXPIRED;
            case TERMINATED -> ErrorKind.TERMINATED;
        };
    }
}
