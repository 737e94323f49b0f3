package io.relaybox.security;

public interface TimeBounded {
    long issuedAtMs();

    long expiresAtMs();
}
