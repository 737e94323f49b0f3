package io.relaybox.relay;

public record AllocationView(
        String id,
        String status,
        long bytesUsed,
        long quotaBytes,
        long bandwidthBps,
        long deviceToPeerBytes,
        long peerToDeviceBytes,
        int attachedEndpoints,
        long createdAtMs,
        long expiresAtMs
) {
}
