package io.relaybox.security;

import io.relaybox.config.RelayBoxConfig;
import io.relaybox.mailbox.RecipientId;
import io.relaybox.model.ErrorKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Authorizes mailbox requests from the raw {@code Authorization} header. A missing header
 * yields {@code unauthenticated}; every other failure collapses into one {@code forbidden}.
 */
public final class MailboxAuthenticator {
    private static final String BEARER = "Bearer ";
    private final MailboxAuthMode mode;
    private final KeyRing keys;
    private final SignatureVerifier verifier;

    public MailboxAuthenticator(MailboxAuthMode mode, KeyRing keys, SignatureVerifier verifier) {
        this.mode = mode;
        this.keys = keys;
        this.verifier = verifier;
    }

    public static MailboxAuthenticator fromConfig(RelayBoxConfig config, SignatureVerifier verifier) {
        List<VerificationKey> hmacKeys = new ArrayList<>();
        for (RelayBoxConfig.MailboxKey key : config.mailboxTokenKeys()) {
            hmacKeys.add(HmacKey.fromBase64(key.kid(), key.secret(), key.notAfterMs()));
        }
        return new MailboxAuthenticator(MailboxAuthMode.parse(config.authMode()), new KeyRing(hmacKeys), verifier);
    }

    public AuthOutcome verify(RecipientId recipient, MailboxScope operation, String authorizationHeader) {
        if (!mode.requiresToken()) {
            return AuthOutcome.allow("anonymous");
        }
        String token = bearerToken(authorizationHeader);
        if (token == null) {
            return AuthOutcome.deny(ErrorKind.UNAUTHENTICATED);
        }
        Optional<MailboxTokens.SignedToken> signed = MailboxTokens.split(token);
        if (signed.isEmpty()) {
            return AuthOutcome.deny(ErrorKind.FORBIDDEN);
        }
        Verification<MailboxClaims> verification = verifier.verify(
                signed.get().payload(),
                signed.get().signature(),
                keys.candidates(verifier.nowMs()),
                MailboxTokens::parseClaims
        );
        if (!verification.ok()) {
            return AuthOutcome.deny(ErrorKind.FORBIDDEN);
        }
        MailboxClaims claims = verification.claims();
        if (!verification.keyId().equals(claims.keyId()) || !mode.grants(claims, recipient, operation)) {
            return AuthOutcome.deny(ErrorKind.FORBIDDEN);
        }
        return AuthOutcome.allow(verification.keyId());
    }

    public MailboxAuthMode mode() {
        return mode;
    }

    public KeyRing keys() {
        return keys;
    }

    private static String bearerToken(String header) {
        if (header == null || !header.regionMatches(true, 0, BEARER, 0, BEARER.length())) {
            return null;
        }
        String token = header.substring(BEARER.length()).trim();
        return token.isEmpty() ? null : token;
    }
}
