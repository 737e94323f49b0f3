package io.relaybox.security;

import io.relaybox.model.ErrorKind;

public record AuthOutcome(boolean ok, ErrorKind error, String principal) {
    public static AuthOutcome allow(String principal) {
        return new AuthOutcome(true, null, principal);
    }

    public static AuthOutcome deny(ErrorKind error) {
        return new AuthOutcome(false, error, null);
    }
}
