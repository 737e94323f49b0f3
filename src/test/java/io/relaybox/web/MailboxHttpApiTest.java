package io.relaybox.web;

import com.fasterxml.jackson.databind.JsonNode;
import io.relaybox.config.RelayBoxConfig;
import io.relaybox.mailbox.RecipientId;
import io.relaybox.relay.RelayTokenSigner;
import io.relaybox.runtime.RelayBoxRuntime;
import io.relaybox.security.Ed25519Keys;
import io.relaybox.security.HmacKey;
import io.relaybox.security.MailboxScope;
import io.relaybox.security.MailboxTokenIssuer;
import io.relaybox.util.Hashing;
import io.relaybox.util.Jsons;
import io.relaybox.util.MutableClock;
import io.relaybox.util.TestConfigs;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

final class MailboxHttpApiTest {
    private static final byte[] SECRET = "mailbox-token-secret-0123456789".getBytes(StandardCharsets.UTF_8);
    private static final String ADMIN_TOKEN = "admin-secret";

    private final HttpClient client = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(Duration.ofSeconds(5))
            .build();
    private RelayBoxRuntime runtime;
    private MailboxHttpApi api;

    @AfterEach
    void tearDown() {
        if (api != null) {
            api.close();
        }
        if (runtime != null) {
            runtime.close();
        }
    }

    @Test
    void postedMessageIsReadBackOnceWithQueueLength() throws Exception {
        start(Map.of());
        String r = recipient(1);
        byte[] body = new byte[RelayBoxConfig.DEFAULT_MAX_MESSAGE_SIZE];
        Arrays.fill(body, (byte) 'x');

        HttpResponse<String> posted = post(r, body, null);
        HttpResponse<byte[]> read = get(r, "0", null);
        HttpResponse<byte[]> again = get(r, "0", null);

        Assertions.assertEquals(202, posted.statusCode());
        JsonNode json = Jsons.mapper().readTree(posted.body());
        Assertions.assertEquals("accepted", json.path("status").asText());
        Assertions.assertEquals(1L, json.path("sequence").asLong());
        Assertions.assertEquals(200, read.statusCode());
        Assertions.assertArrayEquals(body, read.body());
        Assertions.assertEquals("0", read.headers().firstValue("X-Queue-Length").orElse(""));
        Assertions.assertEquals("1", read.headers().firstValue("X-Message-Sequence").orElse(""));
        Assertions.assertEquals(204, again.statusCode());
    }

    @Test
    void pendingReadIsAnsweredAsSoonAsAMessageArrives() throws Exception {
        start(Map.of());
        String r = recipient(2);
        long started = System.nanoTime();
        CompletableFuture<HttpResponse<byte[]>> pending = client.sendAsync(
                HttpRequest.newBuilder(uri("/v1/mailbox/" + r + "?wait_ms=5000")).GET().build(),
                HttpResponse.BodyHandlers.ofByteArray());

        Thread.sleep(1_000L);
        Assertions.assertFalse(pending.isDone());
        Assertions.assertEquals(202, post(r, "offer".getBytes(StandardCharsets.UTF_8), null).statusCode());
        HttpResponse<byte[]> read = pending.get(5, TimeUnit.SECONDS);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        Assertions.assertEquals(200, read.statusCode());
        Assertions.assertEquals("offer", new String(read.body(), StandardCharsets.UTF_8));
        Assertions.assertTrue(elapsedMs < 4_000L, "answered after " + elapsedMs + " ms");
    }

    @Test
    void oversizedPostIsRejectedAndLeavesMailboxUnchanged() throws Exception {
        start(Map.of());
        String r = recipient(3);

        HttpResponse<String> rejected = post(r, new byte[RelayBoxConfig.DEFAULT_MAX_MESSAGE_SIZE + 1], null);

        Assertions.assertEquals(413, rejected.statusCode());
        Assertions.assertEquals("message_too_large", Jsons.mapper().readTree(rejected.body()).path("error").asText());
        Assertions.assertEquals(204, get(r, "0", null).statusCode());
    }

    @Test
    void fullQueueAnswersInsufficientStorage() throws Exception {
        start(Map.of("postsPerMinute", 0));
        String r = recipient(4);
        for (int i = 0; i < 100; i++) {
            Assertions.assertEquals(202, post(r, new byte[]{(byte) i}, null).statusCode());
        }

        HttpResponse<String> full = post(r, new byte[]{1}, null);

        Assertions.assertEquals(507, full.statusCode());
        Assertions.assertTrue(full.headers().firstValue("Retry-After").isPresent());
        Assertions.assertEquals(100, runtime.store().summary(RecipientId.parseHex(r)).orElseThrow().queueLength());
    }

    @Test
    void sixtyFirstReadInAMinuteIsRateLimited() throws Exception {
        // Frozen clock: no tokens refill while the loop runs.
        start(Map.of("getsPerMinute", 60), MutableClock.startingAt(System.currentTimeMillis()));
        String r = recipient(5);
        for (int i = 0; i < 60; i++) {
            Assertions.assertEquals(204, get(r, "0", null).statusCode(), "read " + (i + 1));
        }

        HttpResponse<byte[]> limited = get(r, "0", null);

        Assertions.assertEquals(429, limited.statusCode());
        long retryAfter = Long.parseLong(limited.headers().firstValue("Retry-After").orElse("0"));
        Assertions.assertTrue(retryAfter > 0L);
    }

    @Test
    void authFailuresAreIndistinguishableExceptForMissingCredentials() throws Exception {
        start(Map.of(
                "authMode", "per_mailbox",
                "mailboxTokenKeys", List.of(Map.of("kid", "k1", "secret", Base64.getEncoder().encodeToString(SECRET)))
        ));
        String alice = recipient(6);
        String bob = recipient(7);
        MailboxTokenIssuer issuer = new MailboxTokenIssuer(new HmacKey("k1", SECRET, 0L), Clock.systemUTC());
        String aliceGet = "Bearer " + issuer.issueFor(RecipientId.parseHex(alice), MailboxScope.GET, Duration.ofMinutes(5));
        String alicePost = "Bearer " + issuer.issueFor(RecipientId.parseHex(alice), MailboxScope.POST, Duration.ofMinutes(5));

        HttpResponse<byte[]> missing = get(alice, "0", null);
        HttpResponse<byte[]> garbage = get(alice, "0", "Bearer abc.def");
        HttpResponse<byte[]> otherMailbox = get(bob, "0", aliceGet);
        HttpResponse<byte[]> wrongScope = get(alice, "0", alicePost);
        HttpResponse<byte[]> allowed = get(alice, "0", aliceGet);

        Assertions.assertEquals(401, missing.statusCode());
        Assertions.assertEquals("Bearer", missing.headers().firstValue("WWW-Authenticate").orElse(""));
        Assertions.assertEquals(403, garbage.statusCode());
        Assertions.assertEquals(403, otherMailbox.statusCode());
        Assertions.assertEquals(403, wrongScope.statusCode());
        Assertions.assertArrayEquals(garbage.body(), otherMailbox.body());
        Assertions.assertArrayEquals(garbage.body(), wrongScope.body());
        Assertions.assertEquals(204, allowed.statusCode());
    }

    @Test
    void malformedRecipientAndUnsupportedMethodAreRejected() throws Exception {
        start(Map.of());

        HttpResponse<byte[]> malformed = get("not-hex", "0", null);
        HttpResponse<String> put = client.send(
                HttpRequest.newBuilder(uri("/v1/mailbox/" + recipient(8))).PUT(HttpRequest.BodyPublishers.ofString("x")).build(),
                HttpResponse.BodyHandlers.ofString());

        Assertions.assertEquals(400, malformed.statusCode());
        Assertions.assertEquals(405, put.statusCode());
    }

    @Test
    void healthAndMetricsReflectTraffic() throws Exception {
        start(Map.of());
        post(recipient(9), "hello".getBytes(StandardCharsets.UTF_8), null);

        HttpResponse<String> health = client.send(HttpRequest.newBuilder(uri("/health")).GET().build(), HttpResponse.BodyHandlers.ofString());
        HttpResponse<String> metrics = client.send(HttpRequest.newBuilder(uri("/metrics")).GET().build(), HttpResponse.BodyHandlers.ofString());

        Assertions.assertEquals(200, health.statusCode());
        JsonNode body = Jsons.mapper().readTree(health.body());
        Assertions.assertEquals("ok", body.path("status").asText());
        Assertions.assertEquals(RelayBoxConfig.VERSION, body.path("version").asText());
        Assertions.assertTrue(body.has("uptime_seconds"));
        Assertions.assertEquals(200, metrics.statusCode());
        Assertions.assertTrue(metrics.headers().firstValue("Content-Type").orElse("").startsWith("text/plain"));
        Assertions.assertTrue(metrics.body().contains("relaybox_messages_posted_total 1\n"));
        Assertions.assertTrue(metrics.body().contains("relaybox_queued_messages 1\n"));
    }

    @Test
    void drainingServerReportsUnavailable() throws Exception {
        start(Map.of());
        runtime.drain();

        HttpResponse<String> health = client.send(HttpRequest.newBuilder(uri("/health")).GET().build(), HttpResponse.BodyHandlers.ofString());
        HttpResponse<String> posted = post(recipient(10), new byte[]{1}, null);

        Assertions.assertEquals(503, health.statusCode());
        Assertions.assertEquals("draining", Jsons.mapper().readTree(health.body()).path("status").asText());
        Assertions.assertEquals(503, posted.statusCode());
    }

    @Test
    void adminEndpointsRequireTheOperatorToken() throws Exception {
        start(Map.of("adminToken", ADMIN_TOKEN));
        String r = recipient(11);
        post(r, "queued".getBytes(StandardCharsets.UTF_8), null);

        Assertions.assertEquals(401, admin("GET", "/admin/stats", null).statusCode());
        Assertions.assertEquals(403, admin("GET", "/admin/stats", "wrong").statusCode());

        HttpResponse<String> stats = admin("GET", "/admin/stats", ADMIN_TOKEN);
        Assertions.assertEquals(200, stats.statusCode());
        Assertions.assertEquals(1, Jsons.mapper().readTree(stats.body()).path("activeMailboxes").asInt());

        HttpResponse<String> listed = admin("GET", "/admin/mailboxes", ADMIN_TOKEN);
        Assertions.assertEquals(r, Jsons.mapper().readTree(listed.body()).path("mailboxes").get(0).path("recipient").asText());

        Assertions.assertEquals(200, admin("DELETE", "/admin/mailboxes/" + r, ADMIN_TOKEN).statusCode());
        Assertions.assertEquals(404, admin("DELETE", "/admin/mailboxes/" + r, ADMIN_TOKEN).statusCode());
        Assertions.assertEquals(204, get(r, "0", null).statusCode());
        Assertions.assertEquals(404, admin("DELETE", "/admin/allocations/00000000000000000000000000000000", ADMIN_TOKEN).statusCode());
    }

    @Test
    void revokingAnEndedAllocationAgainIsAConflict() throws Exception {
        KeyPair pair = Ed25519Keys.generate();
        byte[] publicKey = Ed25519Keys.rawPublicKey(pair.getPublic());
        byte[] deviceId = Hashing.sha256(publicKey);
        start(Map.of(
                "adminToken", ADMIN_TOKEN,
                "pinnedDevices", Map.of(Hashing.hex(deviceId), List.of(Base64.getEncoder().encodeToString(publicKey)))
        ));
        byte[] token = new RelayTokenSigner(pair.getPrivate(), deviceId, Clock.systemUTC())
                .mint(new byte[16], new byte[32], Duration.ofMinutes(5), 0L, 0L);
        String id = runtime.allocations().createOrResume(deviceId, token).allocation().id();

        HttpResponse<String> first = admin("DELETE", "/admin/allocations/" + id, ADMIN_TOKEN);
        HttpResponse<String> again = admin("DELETE", "/admin/allocations/" + id, ADMIN_TOKEN);

        Assertions.assertEquals(200, first.statusCode());
        Assertions.assertEquals(409, again.statusCode());
        Assertions.assertEquals("already_ended", Jsons.mapper().readTree(again.body()).path("error").asText());
        Assertions.assertEquals(0, runtime.allocations().activeCount());
    }

    private void start(Map<String, ?> overrides) throws IOException {
        start(overrides, Clock.systemUTC());
    }

    private void start(Map<String, ?> overrides, Clock clock) throws IOException {
        runtime = new RelayBoxRuntime(TestConfigs.with(overrides), clock);
        api = new MailboxHttpApi(runtime);
        api.start();
    }

    private URI uri(String path) {
        return URI.create("http://127.0.0.1:" + api.port() + path);
    }

    private HttpResponse<String> post(String recipient, byte[] body, String authorization) throws Exception {
        HttpRequest.Builder request = HttpRequest.newBuilder(uri("/v1/mailbox/" + recipient))
                .POST(HttpRequest.BodyPublishers.ofByteArray(body));
        if (authorization != null) {
            request.header("Authorization", authorization);
        }
        return client.send(request.build(), HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<byte[]> get(String recipient, String waitMs, String authorization) throws Exception {
        HttpRequest.Builder request = HttpRequest.newBuilder(uri("/v1/mailbox/" + recipient + "?wait_ms=" + waitMs)).GET();
        if (authorization != null) {
            request.header("Authorization", authorization);
        }
        return client.send(request.build(), HttpResponse.BodyHandlers.ofByteArray());
    }

    private HttpResponse<String> admin(String method, String path, String token) throws Exception {
        HttpRequest.Builder request = HttpRequest.newBuilder(uri(path)).method(method, HttpRequest.BodyPublishers.noBody());
        if (token != null) {
            request.header("Authorization", "Bearer " + token);
        }
        return client.send(request.build(), HttpResponse.BodyHandlers.ofString());
    }

    private static String recipient(int fill) {
        byte[] raw = new byte[RecipientId.LENGTH];
        Arrays.fill(raw, (byte) fill);
        return RecipientId.of(raw).hex();
    }
}
