package io.relaybox.observability;

@FunctionalInterface
public interface AuditSink {
    AuditSink NOOP = event -> {
    };

    void record(AuditEvent event);
}
