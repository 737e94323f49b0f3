package io.relaybox.security;

@FunctionalInterface
public interface ClaimsParser<T extends TimeBounded> {
    T parse(byte[] verifiedPayload);
}
