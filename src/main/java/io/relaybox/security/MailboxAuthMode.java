package io.relaybox.security;

import io.relaybox.mailbox.RecipientId;

import java.util.Locale;

/**
 * How mailbox requests are authorized. Selected once from configuration.
 */
public enum MailboxAuthMode {
    DISABLED {
        @Override
        public boolean requiresToken() {
            return false;
        }

        @Override
        boolean grants(MailboxClaims claims, RecipientId recipient, MailboxScope operation) {
            return true;
        }
    },
    SERVER_WIDE {
        @Override
        public boolean requiresToken() {
            return true;
        }

        @Override
        boolean grants(MailboxClaims claims, RecipientId recipient, MailboxScope operation) {
            return claims.wildcard() && claims.scopeValue().permits(operation);
        }
    },
    PER_MAILBOX {
        @Override
        public boolean requiresToken() {
            return true;
        }

        @Override
        boolean grants(MailboxClaims claims, RecipientId recipient, MailboxScope operation) {
            boolean subjectMatches = claims.wildcard() || claims.subject().equals(recipient.hex());
            return subjectMatches && claims.scopeValue().permits(operation);
        }
    };

    public abstract boolean requiresToken();

    abstract boolean grants(MailboxClaims claims, RecipientId recipient, MailboxScope operation);

    public String configName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static MailboxAuthMode parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return DISABLED;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return MailboxAuthMode.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown auth mode: " + raw, e);
        }
    }
}
