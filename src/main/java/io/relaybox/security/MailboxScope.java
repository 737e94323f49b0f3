package io.relaybox.security;

import java.util.Locale;

public enum MailboxScope {
    POST,
    GET,
    ANY;

    public boolean permits(MailboxScope requested) {
        return this == ANY || this == requested;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static MailboxScope parse(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("scope is required");
        }
        return MailboxScope.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
