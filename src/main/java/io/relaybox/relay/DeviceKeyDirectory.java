package io.relaybox.relay;

import io.relaybox.security.DevicePublicKey;
import io.relaybox.security.KeyRing;
import io.relaybox.security.VerificationKey;
import io.relaybox.util.Hashing;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Pinned public keys per device identity. Several keys per device allow rotation.
 */
public final class DeviceKeyDirectory {
    private final ConcurrentHashMap<String, KeyRing> devices = new ConcurrentHashMap<>();

    public static DeviceKeyDirectory fromConfig(Map<String, List<String>> pinned) {
        DeviceKeyDirectory directory = new DeviceKeyDirectory();
        for (Map.Entry<String, List<String>> entry : pinned.entrySet()) {
            List<VerificationKey> keys = new ArrayList<>();
            for (String encoded : entry.getValue()) {
                keys.add(DevicePublicKey.fromBase64(encoded));
            }
            directory.devices.put(entry.getKey().toLowerCase(Locale.ROOT), new KeyRing(keys));
        }
        return directory;
    }

    public void pin(byte[] deviceId, DevicePublicKey key) {
        devices.computeIfAbsent(Hashing.hex(deviceId), k -> KeyRing.empty()).add(key);
    }

    public List<VerificationKey> candidates(byte[] deviceId, long nowMs) {
        KeyRing ring = devices.get(Hashing.hex(deviceId));
        return ring == null ? List.of() : ring.candidates(nowMs);
    }

    public int size() {
        return devices.size();
    }
}
