package io.relaybox.security;

import io.relaybox.util.Hashing;

import java.util.Base64;

/**
 * Server-held HMAC-SHA256 secret used to sign and verify mailbox bearer tokens.
 */
public final class HmacKey implements VerificationKey {
    private final String keyId;
    private final byte[] secret;
    private final long notAfterMs;

    public HmacKey(String keyId, byte[] secret, long notAfterMs) {
        if (keyId == null || keyId.isBlank()) {
            throw new IllegalArgumentException("key id is required");
        }
        if (secret == null || secret.length < 16) {
            throw new IllegalArgumentException("HMAC secret must be at least 16 bytes");
        }
        this.keyId = keyId.trim();
        this.secret = secret.clone();
        this.notAfterMs = notAfterMs <= 0L ? Long.MAX_VALUE : notAfterMs;
    }

    public static HmacKey fromBase64(String keyId, String base64Secret, Long notAfterMs) {
        byte[] raw = Base64.getDecoder().decode(base64Secret.trim());
        return new HmacKey(keyId, raw, notAfterMs == null ? 0L : notAfterMs);
    }

    @Override
    public String keyId() {
        return keyId;
    }

    @Override
    public boolean validAt(long nowMs) {
        return nowMs < notAfterMs;
    }

    @Override
    public boolean verify(byte[] payload, byte[] signature) {
        if (payload == null || signature == null) {
            return false;
        }
        return Hashing.constantTimeEquals(sign(payload), signature);
    }

    public byte[] sign(byte[] payload) {
        return Hashing.hmacSha256(secret, payload);
    }
}
