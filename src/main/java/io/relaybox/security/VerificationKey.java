package io.relaybox.security;

public interface VerificationKey {
    String keyId();

    boolean validAt(long nowMs);

    boolean verify(byte[] payload, byte[] signature);
}
