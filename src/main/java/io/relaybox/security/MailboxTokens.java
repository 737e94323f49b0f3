package io.relaybox.security;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.relaybox.util.Jsons;

import java.io.IOException;
import java.util.Base64;
import java.util.Optional;

/**
 * Token wire form: {@code base64url(payload) "." base64url(hmac)}, unpadded.
 */
public final class MailboxTokens {
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();
    private static final int MAX_TOKEN_CHARS = 4096;

    private MailboxTokens() {
    }

    public static String encode(MailboxClaims claims, HmacKey key) {
        byte[] payload;
        try {
            payload = Jsons.compact().writeValueAsBytes(claims);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode mailbox token", e);
        }
        return ENCODER.encodeToString(payload) + "." + ENCODER.encodeToString(key.sign(payload));
    }

    public static Optional<SignedToken> split(String token) {
        if (token == null || token.isBlank() || token.length() > MAX_TOKEN_CHARS) {
            return Optional.empty();
        }
        int dot = token.indexOf('.');
        if (dot <= 0 || dot == token.length() - 1 || token.indexOf('.', dot + 1) >= 0) {
            return Optional.empty();
        }
        try {
            byte[] payload = DECODER.decode(token.substring(0, dot));
            byte[] signature = DECODER.decode(token.substring(dot + 1));
            return Optional.of(new SignedToken(payload, signature));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    public static MailboxClaims parseClaims(byte[] verifiedPayload) {
        try {
            MailboxClaims claims = Jsons.mapper().readValue(verifiedPayload, MailboxClaims.class);
            if (claims.version() != MailboxClaims.VERSION || claims.subject() == null || claims.scope() == null) {
                throw new IllegalArgumentException("unsupported mailbox token");
            }
            claims.scopeValue();
            return claims;
        } catch (IOException e) {
            throw new IllegalArgumentException("malformed mailbox token payload", e);
        }
    }

    public record SignedToken(byte[] payload, byte[] signature) {
    }
}
