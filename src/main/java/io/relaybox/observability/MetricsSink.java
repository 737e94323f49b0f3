package io.relaybox.observability;

import io.relaybox.model.ErrorKind;

/**
 * Receives counters from the mailbox and relay paths. Implementations must be thread-safe
 * and must not block.
 */
public interface MetricsSink {
    MetricsSink NOOP = new MetricsSink() {
    };

    default void messagePosted() {
    }

    default void messageDelivered() {
    }

    default void messagesEvicted(int count) {
    }

    default void rateLimitHit() {
    }

    default void error(ErrorKind kind) {
    }

    default void requestLatency(long nanos) {
    }

    default void allocationCreated() {
    }

    default void bytesForwarded(long bytes) {
    }

    default void forwardRejected(ErrorKind kind) {
    }
}
