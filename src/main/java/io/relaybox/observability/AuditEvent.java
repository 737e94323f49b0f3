package io.relaybox.observability;

import java.util.Map;

public record AuditEvent(
        String action,
        String actor,
        String resource,
        String result,
        Map<String, Object> details
) {
    public AuditEvent {
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    public static AuditEvent of(String action, String actor, String resource, String result) {
        return new AuditEvent(action, actor, resource, result, Map.of());
    }

    public static AuditEvent of(String action, String actor, String resource, String result, Map<String, Object> details) {
        return new AuditEvent(action, actor, resource, result, details);
    }
}
