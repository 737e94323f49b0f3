package io.relaybox.relay;

import io.relaybox.security.Ed25519Keys;
import io.relaybox.security.TimeBounded;

import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * Capability a device mints for its peer. Binary layout, big-endian:
 * {@code version:u8 | relayId:16 | deviceId:32 | peerId:32 | issuedAtMs:u64 | expiresAtMs:u64 |
 * bandwidthBps:u64 | quotaBytes:u64}, followed on the wire by a 64-byte Ed25519 signature.
 * Zero bandwidth or quota means the relay's default.
 */
public record RelayToken(
        int version,
        byte[] relayId,
        byte[] deviceId,
        byte[] peerId,
        long issuedAtMs,
        long expiresAtMs,
        long bandwidthBps,
        long quotaBytes
) implements TimeBounded {
    public static final int VERSION = 1;
    public static final int RELAY_ID_BYTES = 16;
    public static final int IDENTITY_BYTES = 32;
    public static final int PAYLOAD_BYTES = 1 + RELAY_ID_BYTES + IDENTITY_BYTES * 2 + Long.BYTES * 4;
    public static final int WIRE_BYTES = PAYLOAD_BYTES + Ed25519Keys.SIGNATURE_BYTES;

    public RelayToken {
        requireLength(relayId, RELAY_ID_BYTES, "relayId");
        requireLength(deviceId, IDENTITY_BYTES, "deviceId");
        requireLength(peerId, IDENTITY_BYTES, "peerId");
        if (bandwidthBps < 0L || quotaBytes < 0L) {
            throw new IllegalArgumentException("bandwidth and quota must not be negative");
        }
    }

    @Override
    public long issuedAtMs() {
        return issuedAtMs;
    }

    @Override
    public long expiresAtMs() {
        return expiresAtMs;
    }

    public byte[] encodePayload() {
        ByteBuffer buf = ByteBuffer.allocate(PAYLOAD_BYTES);
        buf.put((byte) version);
        buf.put(relayId);
        buf.put(deviceId);
        buf.put(peerId);
        buf.putLong(issuedAtMs);
        buf.putLong(expiresAtMs);
        buf.putLong(bandwidthBps);
        buf.putLong(quotaBytes);
        return buf.array();
    }

    /**
     * Decodes a payload whose signature has already been verified.
     */
    public static RelayToken parse(byte[] verifiedPayload) {
        if (verifiedPayload == null || verifiedPayload.length != PAYLOAD_BYTES) {
            throw new IllegalArgumentException("relay token payload must be " + PAYLOAD_BYTES + " bytes");
        }
        ByteBuffer buf = ByteBuffer.wrap(verifiedPayload);
        int version = buf.get() & 0xff;
        if (version != VERSION) {
            throw new IllegalArgumentException("unsupported relay token version " + version);
        }
        byte[] relayId = new byte[RELAY_ID_BYTES];
        byte[] deviceId = new byte[IDENTITY_BYTES];
        byte[] peerId = new byte[IDENTITY_BYTES];
        buf.get(relayId);
        buf.get(deviceId);
        buf.get(peerId);
        return new RelayToken(version, relayId, deviceId, peerId, buf.getLong(), buf.getLong(), buf.getLong(), buf.getLong());
    }

    public static Signed split(byte[] wire) {
        if (wire == null || wire.length != WIRE_BYTES) {
            return null;
        }
        return new Signed(
                Arrays.copyOfRange(wire, 0, PAYLOAD_BYTES),
                Arrays.copyOfRange(wire, PAYLOAD_BYTES, WIRE_BYTES)
        );
    }

    private static void requireLength(byte[] value, int length, String field) {
        if (value == null || value.length != length) {
            throw new IllegalArgumentException(field + " must be " + length + " bytes");
        }
    }

    public record Signed(byte[] payload, byte[] signature) {
    }
}
