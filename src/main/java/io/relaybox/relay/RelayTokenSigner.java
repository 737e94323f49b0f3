package io.relaybox.relay;

import io.relaybox.security.Ed25519Keys;

import java.security.PrivateKey;
import java.time.Clock;
import java.time.Duration;

/**
 * Device side: mints relay capability tokens with the device's Ed25519 identity key.
 */
public final class RelayTokenSigner {
    private final PrivateKey deviceKey;
    private final byte[] deviceId;
    private final Clock clock;

    public RelayTokenSigner(PrivateKey deviceKey, byte[] deviceId, Clock clock) {
        this.deviceKey = deviceKey;
        this.deviceId = deviceId.clone();
        this.clock = clock;
    }

    public byte[] mint(byte[] relayId, byte[] peerId, Duration ttl, long bandwidthBps, long quotaBytes) {
        long now = clock.millis();
        RelayToken token = new RelayToken(
                RelayToken.VERSION,
                relayId,
                deviceId,
                peerId,
                now,
                now + ttl.toMillis(),
                bandwidthBps,
                quotaBytes
        );
        return sign(token);
    }

    public byte[] sign(RelayToken token) {
        byte[] payload = token.encodePayload();
        byte[] signature = Ed25519Keys.sign(deviceKey, payload);
        byte[] wire = new byte[payload.length + signature.length];
        System.arraycopy(payload, 0, wire, 0, payload.length);
        System.arraycopy(signature, 0, wire, payload.length, signature.length);
        return wire;
    }
}
