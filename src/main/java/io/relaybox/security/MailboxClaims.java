package io.relaybox.security;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Signed body of a mailbox bearer token. {@code sub} is a recipient id in hex, or
 * {@code *} for a server-wide token.
 */
public record MailboxClaims(
        @JsonProperty("v") int version,
        @JsonProperty("kid") String keyId,
        @JsonProperty("sub") String subject,
        @JsonProperty("scope") String scope,
        @JsonProperty("iat") long iat,
        @JsonProperty("exp") long exp
) implements TimeBounded {
    public static final int VERSION = 1;
    public static final String ANY_SUBJECT = "*";

    @Override
    public long issuedAtMs() {
        return iat;
    }

    @Override
    public long expiresAtMs() {
        return exp;
    }

    @JsonIgnore
    public MailboxScope scopeValue() {
        return MailboxScope.parse(scope);
    }

    @JsonIgnore
    public boolean wildcard() {
        return ANY_SUBJECT.equals(subject);
    }
}
