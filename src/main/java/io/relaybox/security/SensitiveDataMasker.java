package io.relaybox.security;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Scrubs audit details before they are written. Credentials and anything that looks like
 * message content are replaced with a fixed mask.
 */
public final class SensitiveDataMasker {
    private static final String MASK = "***";
    private static final Set<String> SENSITIVE_HINTS = Set.of(
            "secret", "token", "authorization", "signature", "key", "payload", "body", "content"
    );

    private SensitiveDataMasker() {
    }

    public static Map<String, Object> masked(Map<String, ?> input) {
        if (input == null || input.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : input.entrySet()) {
            if (isSensitiveKey(entry.getKey())) {
                out.put(entry.getKey(), MASK);
            } else {
                out.put(entry.getKey(), maskedValue(entry.getValue()));
            }
        }
        return out;
    }

    @SuppressWarnings("unchecked")
    private static Object maskedValue(Object value) {
        if (value instanceof Map) {
            return masked((Map<String, ?>) value);
        }
        if (value instanceof Collection) {
            Collection<?> items = (Collection<?>) value;
            List<Object> out = new ArrayList<>(items.size());
            for (Object item : items) {
                out.add(maskedValue(item));
            }
            return out;
        }
        if (value instanceof byte[]) {
            return MASK;
        }
        if (value instanceof String && likelySecretValue((String) value)) {
            return MASK;
        }
        return value;
    }

    private static boolean isSensitiveKey(String rawKey) {
        if (rawKey == null || rawKey.isBlank()) {
            return false;
        }
        String key = rawKey.toLowerCase(Locale.ROOT);
        for (String hint : SENSITIVE_HINTS) {
            if (key.contains(hint)) {
                return true;
            }
        }
        return false;
    }

    private static boolean likelySecretValue(String value) {
        String v = value.trim();
        if (v.length() < 48) {
            return false;
        }
        // Long opaque strings are treated as credentials; hex ids stay readable below 48 chars.
        return v.matches("^[A-Za-z0-9+/=_\\-:.]{48,}$");
    }
}
