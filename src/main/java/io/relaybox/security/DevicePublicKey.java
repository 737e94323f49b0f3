package io.relaybox.security;

import io.relaybox.util.Hashing;

import java.security.PublicKey;
import java.util.Base64;

/**
 * Pinned Ed25519 public key of a device identity; verifies relay capability tokens.
 */
public final class DevicePublicKey implements VerificationKey {
    private final String keyId;
    private final PublicKey key;

    public DevicePublicKey(byte[] rawPublicKey) {
        this.key = Ed25519Keys.publicKey(rawPublicKey);
        this.keyId = "ed25519:" + Hashing.shortLabel(rawPublicKey);
    }

    public static DevicePublicKey fromBase64(String base64) {
        return new DevicePublicKey(Base64.getDecoder().decode(base64.trim()));
    }

    @Override
    public String keyId() {
        return keyId;
    }

    @Override
    public boolean validAt(long nowMs) {
        return true;
    }

    @Override
    public boolean verify(byte[] payload, byte[] signature) {
        if (payload == null) {
            return false;
        }
        return Ed25519Keys.verify(key, payload, signature);
    }
}
