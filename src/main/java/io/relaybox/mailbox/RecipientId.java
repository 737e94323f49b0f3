package io.relaybox.mailbox;

import io.relaybox.util.Hashing;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Opaque 32-byte mailbox address. Rendered as 64 lowercase hex characters.
 */
public final class RecipientId {
    public static final int LENGTH = 32;
    private final byte[] value;
    private final String hex;

    private RecipientId(byte[] value) {
        this.value = value;
        this.hex = HexFormat.of().formatHex(value);
    }

    public static RecipientId of(byte[] raw) {
        if (raw == null || raw.length != LENGTH) {
            throw new IllegalArgumentException("recipient id must be " + LENGTH + " bytes");
        }
        return new RecipientId(raw.clone());
    }

    public static RecipientId parseHex(String raw) {
        if (raw == null || raw.length() != LENGTH * 2) {
            throw new IllegalArgumentException("recipient id must be " + (LENGTH * 2) + " hex characters");
        }
        try {
            return new RecipientId(HexFormat.of().parseHex(raw.toLowerCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("recipient id is not valid hex", e);
        }
    }

    public byte[] bytes() {
        return value.clone();
    }

    public String hex() {
        return hex;
    }

    public String logLabel() {
        return Hashing.shortLabel(value);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof RecipientId)) {
            return false;
        }
        return Arrays.equals(value, ((RecipientId) other).value);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return "RecipientId[" + logLabel() + "]";
    }
}
