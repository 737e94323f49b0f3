package io.relaybox.security;

import io.relaybox.model.ErrorKind;

public record Verification<T>(boolean ok, ErrorKind error, T claims, String keyId) {
    public static <T> Verification<T> success(T claims, String keyId) {
        return new Verification<>(true, null, claims, keyId);
    }

    public static <T> Verification<T> failure(ErrorKind error) {
        return new Verification<>(false, error, null, null);
    }
}
