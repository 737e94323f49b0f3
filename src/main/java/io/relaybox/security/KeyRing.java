package io.relaybox.security;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Rotatable set of verification keys. Readers take a snapshot, so swapping the set never
 * disturbs a verification already in flight.
 */
public final class KeyRing {
    private final AtomicReference<List<VerificationKey>> keys;

    public KeyRing(List<? extends VerificationKey> initial) {
        this.keys = new AtomicReference<>(List.copyOf(initial));
    }

    public static KeyRing empty() {
        return new KeyRing(List.of());
    }

    public List<VerificationKey> candidates(long nowMs) {
        List<VerificationKey> out = new ArrayList<>();
        for (VerificationKey key : keys.get()) {
            if (key.validAt(nowMs)) {
                out.add(key);
            }
        }
        return out;
    }

    public List<VerificationKey> all() {
        return keys.get();
    }

    public void replace(List<? extends VerificationKey> next) {
        keys.set(List.copyOf(next));
    }

    public void add(VerificationKey key) {
        keys.updateAndGet(current -> {
            List<VerificationKey> next = new ArrayList<>(current);
            next.removeIf(existing -> existing.keyId().equals(key.keyId()));
            next.add(key);
            return List.copyOf(next);
        });
    }

    public boolean remove(String keyId) {
        List<VerificationKey> before = keys.getAndUpdate(current -> {
            List<VerificationKey> next = new ArrayList<>(current);
            next.removeIf(existing -> existing.keyId().equals(keyId));
            return List.copyOf(next);
        });
        return before.stream().anyMatch(k -> k.keyId().equals(keyId));
    }

    public int size() {
        return keys.get().size();
    }
}
