package io.relaybox.runtime;

import io.relaybox.mailbox.RecipientId;
import io.relaybox.model.Direction;
import io.relaybox.model.EndpointRole;
import io.relaybox.model.ErrorKind;
import io.relaybox.relay.Allocation;
import io.relaybox.relay.AllocationOutcome;
import io.relaybox.relay.ForwardOutcome;
import io.relaybox.relay.FrameSink;
import io.relaybox.relay.RelayTokenSigner;
import io.relaybox.security.Ed25519Keys;
import io.relaybox.util.Hashing;
import io.relaybox.util.MutableClock;
import io.relaybox.util.TestConfigs;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.security.KeyPair;
import java.time.Duration;
import java.util.Arrays;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Optional;

final class RelayBoxRuntimeTest {
    private static final long NOW = 1_700_000_000_000L;

    @TempDir
    Path tempDir;

    @Test
    void sweepDropsExpiredMessagesAndIdleMailboxes() {
        MutableClock clock = MutableClock.startingAt(NOW);
        try (RelayBoxRuntime runtime = new RelayBoxRuntime(
                TestConfigs.with(Map.of("messageTtlMs", 10_000L, "idleMailboxTtlMs", 60_000L)), clock)) {
            runtime.mailboxService().post(recipient(1), new byte[]{1, 2, 3}, "198.51.100.1", null);
            clock.advance(Duration.ofSeconds(10));

            RelayBoxRuntime.SweepOutcome first = runtime.sweep();
            Assertions.assertEquals(1, first.messagesExpired());
            Assertions.assertEquals(0, first.mailboxesRemoved());

            clock.advance(Duration.ofMinutes(1));
            RelayBoxRuntime.SweepOutcome second = runtime.sweep();
            Assertions.assertEquals(1, second.mailboxesRemoved());
            Assertions.assertEquals(0, runtime.stats().activeMailboxes());
            Assertions.assertEquals(1L, runtime.stats().counters().messagesEvicted());
        }
    }

    @Test
    void healthTracksMemoryPressureAndDrain() {
        MutableClock clock = MutableClock.startingAt(NOW);
        try (RelayBoxRuntime runtime = new RelayBoxRuntime(
                TestConfigs.with(Map.of("memoryLimitBytes", 100L, "maxMessageSize", 100, "maxFrameSize", 1024)), clock)) {
            Assertions.assertEquals(200, runtime.health().httpStatus());

            runtime.mailboxService().post(recipient(1), new byte[90], "198.51.100.1", null);
            RelayBoxRuntime.HealthOutcome pressured = runtime.health();
            Assertions.assertEquals("overloaded", pressured.status());
            Assertions.assertEquals(503, pressured.httpStatus());

            runtime.mailboxService().get(recipient(1), 0L, "198.51.100.1", null).join();
            Assertions.assertEquals("ok", runtime.health().status());

            runtime.drain();
            Assertions.assertEquals("draining", runtime.health().status());
            Assertions.assertTrue(runtime.stats().draining());
        }
    }

    @Test
    void pinnedDevicesFromSettingsAuthorizeRelayTokens() {
        MutableClock clock = MutableClock.startingAt(NOW);
        KeyPair pair = Ed25519Keys.generate();
        byte[] publicKey = Ed25519Keys.rawPublicKey(pair.getPublic());
        byte[] deviceId = Hashing.sha256(publicKey);
        Map<String, Object> settings = Map.of(
                "pinnedDevices", Map.of(Hashing.hex(deviceId), List.of(Base64.getEncoder().encodeToString(publicKey))),
                "auditFile", tempDir.resolve("audit.jsonl").toString(),
                "auditSigningSecret", "audit-secret"
        );
        try (RelayBoxRuntime runtime = new RelayBoxRuntime(TestConfigs.with(settings), clock)) {
            byte[] token = new RelayTokenSigner(pair.getPrivate(), deviceId, clock)
                    .mint(new byte[16], new byte[32], Duration.ofMinutes(5), 0L, 0L);

            AllocationOutcome outcome = runtime.allocations().createOrResume(deviceId, token);

            Assertions.assertTrue(outcome.ok());
            Assertions.assertEquals(1, runtime.stats().activeAllocations());
            Assertions.assertTrue(runtime.metricsText().contains("relaybox_allocations_created_total 1\n"));
        }
    }

    @Test
    void relaySettingsDriveAdmissionAndTheRelayWideBandwidthCap() {
        MutableClock clock = MutableClock.startingAt(NOW);
        KeyPair pair = Ed25519Keys.generate();
        byte[] publicKey = Ed25519Keys.rawPublicKey(pair.getPublic());
        byte[] deviceId = Hashing.sha256(publicKey);
        Map<String, Object> settings = Map.of(
                "pinnedDevices", Map.of(Hashing.hex(deviceId), List.of(Base64.getEncoder().encodeToString(publicKey))),
                "blocklist", List.of("192.0.2.9"),
                "relayConnectionsPerMinute", 1,
                "maxMessageSize", 1024,
                "maxFrameSize", 1024,
                "globalBandwidthBps", 2000L
        );
        try (RelayBoxRuntime runtime = new RelayBoxRuntime(TestConfigs.with(settings), clock)) {
            Assertions.assertEquals(Optional.of(ErrorKind.FORBIDDEN), runtime.relayAdmission().admitConnection("192.0.2.9"));
            Assertions.assertEquals(Optional.empty(), runtime.relayAdmission().admitConnection("198.51.100.1"));
            Assertions.assertEquals(Optional.of(ErrorKind.RATE_LIMITED), runtime.relayAdmission().admitConnection("198.51.100.1"));

            RelayTokenSigner signer = new RelayTokenSigner(pair.getPrivate(), deviceId, clock);
            Allocation first = allocate(runtime, deviceId, signer, 1);
            Allocation second = allocate(runtime, deviceId, signer, 2);

            Assertions.assertTrue(runtime.forwarder().forward(first.id(), Direction.DEVICE_TO_PEER, new byte[1000]).forwarded());
            Assertions.assertTrue(runtime.forwarder().forward(second.id(), Direction.DEVICE_TO_PEER, new byte[1000]).forwarded());
            ForwardOutcome throttled = runtime.forwarder().forward(first.id(), Direction.DEVICE_TO_PEER, new byte[1000]);

            Assertions.assertFalse(throttled.forwarded());
            Assertions.assertEquals(ErrorKind.BANDWIDTH_EXCEEDED, throttled.error());
        }
    }

    private static Allocation allocate(RelayBoxRuntime runtime, byte[] deviceId, RelayTokenSigner signer, int peer) {
        byte[] peerId = new byte[32];
        Arrays.fill(peerId, (byte) peer);
        byte[] token = signer.mint(new byte[16], peerId, Duration.ofMinutes(5), 100_000L, 0L);
        Allocation allocation = runtime.allocations().createOrResume(deviceId, token).allocation();
        runtime.allocations().attach(allocation, EndpointRole.PEER, new FrameSink() {
            @Override
            public void sendData(byte[] payload) {
            }

            @Override
            public void close(ErrorKind reason) {
            }
        });
        return allocation;
    }

    private static RecipientId recipient(int fill) {
        byte[] raw = new byte[RecipientId.LENGTH];
        Arrays.fill(raw, (byte) fill);
        return RecipientId.of(raw);
    }
}
