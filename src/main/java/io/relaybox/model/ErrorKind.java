package io.relaybox.model;

import java.util.Locale;

public enum ErrorKind {
    MALFORMED_REQUEST(Category.VALIDATION, 400),
    MESSAGE_TOO_LARGE(Category.VALIDATION, 413),
    QUEUE_FULL(Category.CAPACITY, 507),
    STORAGE_EXHAUSTED(Category.CAPACITY, 507),
    QUOTA_EXCEEDED(Category.CAPACITY, 429),
    BANDWIDTH_EXCEEDED(Category.CAPACITY, 429),
    ALLOCATION_LIMIT(Category.CAPACITY, 503),
    UNAUTHENTICATED(Category.AUTHORIZATION, 401),
    FORBIDDEN(Category.AUTHORIZATION, 403),
    INVALID_TOKEN(Category.AUTHORIZATION, 403),
    BAD_SIGNATURE(Category.AUTHORIZATION, 403),
    EXPIRED(Category.AUTHORIZATION, 403),
    RATE_LIMITED(Category.OVERLOAD, 429),
    SERVICE_UNAVAILABLE(Category.OVERLOAD, 503),
    NOT_FOUND(Category.STATE, 404),
    TERMINATED(Category.STATE, 410),
    PEER_UNAVAILABLE(Category.STATE, 409),
    INTERNAL(Category.INTEGRITY, 500);

    private final Category category;
    private final int httpStatus;

    ErrorKind(Category category, int httpStatus) {
        this.category = category;
        this.httpStatus = httpStatus;
    }

    public Category category() {
        return category;
    }

    public int httpStatus() {
        return httpStatus;
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean retryable() {
        return category == Category.CAPACITY || category == Category.OVERLOAD;
    }

    public static ErrorKind fromCode(String raw) {
        if (raw == null || raw.isBlank()) {
            return INTERNAL;
        }
        for (ErrorKind value : values()) {
            if (value.code().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        return INTERNAL;
    }

    public enum Category {
        VALIDATION,
        CAPACITY,
        AUTHORIZATION,
        OVERLOAD,
        STATE,
        INTEGRITY
    }
}
