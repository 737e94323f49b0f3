package io.relaybox.security;

import io.relaybox.mailbox.RecipientId;

import java.time.Clock;
import java.time.Duration;

public final class MailboxTokenIssuer {
    private final HmacKey key;
    private final Clock clock;

    public MailboxTokenIssuer(HmacKey key, Clock clock) {
        this.key = key;
        this.clock = clock;
    }

    public String issueFor(RecipientId recipient, MailboxScope scope, Duration ttl) {
        return issue(recipient == null ? MailboxClaims.ANY_SUBJECT : recipient.hex(), scope, ttl);
    }

    public String issueServerWide(MailboxScope scope, Duration ttl) {
        return issue(MailboxClaims.ANY_SUBJECT, scope, ttl);
    }

    private String issue(String subject, MailboxScope scope, Duration ttl) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("token ttl must be positive");
        }
        long now = clock.millis();
        MailboxClaims claims = new MailboxClaims(
                MailboxClaims.VERSION,
                key.keyId(),
                subject,
                scope.wireName(),
                now,
                now + ttl.toMillis()
        );
        return MailboxTokens.encode(claims, key);
    }
}
