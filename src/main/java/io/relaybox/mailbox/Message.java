package io.relaybox.mailbox;

/**
 * A queued envelope. The payload array is owned by the store and never mutated after enqueue.
 */
public record Message(byte[] payload, long sequence, long receivedAtMs) {
    public int size() {
        return payload.length;
    }

    public boolean expiredAt(long nowMs, long ttlMs) {
        return nowMs - receivedAtMs >= ttlMs;
    }
}
