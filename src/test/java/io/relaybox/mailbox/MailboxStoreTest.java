package io.relaybox.mailbox;

import io.relaybox.model.ErrorKind;
import io.relaybox.util.MutableClock;
import io.relaybox.util.TestConfigs;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

final class MailboxStoreTest {
    private static final long NOW = 1_700_000_000_000L;
    private ScheduledExecutorService timer;
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        timer = Executors.newSingleThreadScheduledExecutor();
        clock = MutableClock.startingAt(NOW);
    }

    @AfterEach
    void tearDown() {
        timer.shutdownNow();
    }

    @Test
    void deliversInPostOrderAndConsumesOnRead() {
        MailboxStore store = store(Map.of());
        RecipientId alice = recipient(1);
        Assertions.assertEquals(1L, store.enqueue(alice, bytes("a")).sequence());
        Assertions.assertEquals(2L, store.enqueue(alice, bytes("b")).sequence());
        Assertions.assertEquals(3L, store.enqueue(alice, bytes("c")).sequence());

        DequeueOutcome first = store.dequeueOrWait(alice, 0L).join();
        Assertions.assertEquals(DequeueOutcome.Status.DELIVERED, first.status());
        Assertions.assertEquals("a", text(first));
        Assertions.assertEquals(2, first.remaining());
        Assertions.assertEquals("b", text(store.dequeueOrWait(alice, 0L).join()));
        Assertions.assertEquals("c", text(store.dequeueOrWait(alice, 0L).join()));
        Assertions.assertEquals(DequeueOutcome.Status.EMPTY, store.dequeueOrWait(alice, 0L).join().status());
        Assertions.assertEquals(0L, store.bufferedBytes());
        Assertions.assertEquals(0L, store.queuedMessages());
    }

    @Test
    void recipientsDoNotShareQueues() {
        MailboxStore store = store(Map.of());
        store.enqueue(recipient(1), bytes("for-alice"));

        Assertions.assertEquals(DequeueOutcome.Status.EMPTY, store.dequeueOrWait(recipient(2), 0L).join().status());
        Assertions.assertEquals("for-alice", text(store.dequeueOrWait(recipient(1), 0L).join()));
    }

    @Test
    void rejectsOversizedPayloadAndFullQueue() {
        MailboxStore store = store(Map.of("maxMessageSize", 8, "maxQueueLength", 2, "maxFrameSize", 1024));
        RecipientId alice = recipient(1);

        Assertions.assertEquals(ErrorKind.MESSAGE_TOO_LARGE, store.enqueue(alice, new byte[9]).error());
        Assertions.assertTrue(store.enqueue(alice, new byte[8]).accepted());
        Assertions.assertTrue(store.enqueue(alice, new byte[0]).accepted());
        Assertions.assertEquals(ErrorKind.QUEUE_FULL, store.enqueue(alice, new byte[1]).error());
        Assertions.assertEquals(2, store.summary(alice).orElseThrow().queueLength());
    }

    @Test
    void expiredMessagesAreNeverDelivered() {
        MailboxStore store = store(Map.of("messageTtlMs", 1_000L));
        RecipientId alice = recipient(1);
        store.enqueue(alice, bytes("stale"));
        clock.advanceMillis(400L);
        store.enqueue(alice, bytes("fresh"));
        clock.advanceMillis(600L);

        DequeueOutcome outcome = store.dequeueOrWait(alice, 0L).join();
        Assertions.assertEquals("fresh", text(outcome));
        Assertions.assertEquals(0, outcome.remaining());

        store.enqueue(alice, bytes("later"));
        clock.advance(Duration.ofSeconds(5));
        Assertions.assertEquals(1, store.evictExpired().messagesExpired());
        Assertions.assertEquals(0L, store.queuedMessages());
    }

    @Test
    void waitingReaderReceivesTheNextPostDirectly() throws Exception {
        MailboxStore store = store(Map.of());
        RecipientId alice = recipient(1);
        CompletableFuture<DequeueOutcome> pending = store.dequeueOrWait(alice, 10_000L);
        Assertions.assertFalse(pending.isDone());
        Assertions.assertEquals(1, store.summary(alice).orElseThrow().waiters());

        EnqueueOutcome posted = store.enqueue(alice, bytes("offer"));

        Assertions.assertTrue(posted.handedOff());
        DequeueOutcome delivered = pending.get(1, TimeUnit.SECONDS);
        Assertions.assertEquals("offer", text(delivered));
        Assertions.assertEquals(0L, store.queuedMessages());
        Assertions.assertEquals(0L, store.bufferedBytes());
    }

    @Test
    void oldestWaiterIsServedFirst() throws Exception {
        MailboxStore store = store(Map.of());
        RecipientId alice = recipient(1);
        CompletableFuture<DequeueOutcome> first = store.dequeueOrWait(alice, 10_000L);
        CompletableFuture<DequeueOutcome> second = store.dequeueOrWait(alice, 10_000L);

        store.enqueue(alice, bytes("one"));
        Assertions.assertEquals("one", text(first.get(1, TimeUnit.SECONDS)));
        Assertions.assertFalse(second.isDone());

        store.enqueue(alice, bytes("two"));
        Assertions.assertEquals("two", text(second.get(1, TimeUnit.SECONDS)));
    }

    @Test
    void waiterTimesOutEmpty() throws Exception {
        MailboxStore store = store(Map.of());
        RecipientId alice = recipient(1);

        DequeueOutcome outcome = store.dequeueOrWait(alice, 50L).get(5, TimeUnit.SECONDS);

        Assertions.assertEquals(DequeueOutcome.Status.EMPTY, outcome.status());
        Assertions.assertEquals(0, store.summary(alice).orElseThrow().waiters());
        Assertions.assertTrue(store.enqueue(alice, bytes("late")).accepted());
        Assertions.assertEquals(1L, store.queuedMessages());
    }

    @Test
    void shutdownWakesReadersAndRefusesPosts() throws Exception {
        MailboxStore store = store(Map.of());
        RecipientId alice = recipient(1);
        CompletableFuture<DequeueOutcome> pending = store.dequeueOrWait(alice, 60_000L);

        Assertions.assertEquals(1, store.shutdown());

        DequeueOutcome woken = pending.get(1, TimeUnit.SECONDS);
        Assertions.assertEquals(DequeueOutcome.Status.REJECTED, woken.status());
        Assertions.assertEquals(ErrorKind.SERVICE_UNAVAILABLE, woken.error());
        Assertions.assertEquals(ErrorKind.SERVICE_UNAVAILABLE, store.enqueue(alice, bytes("x")).error());
        Assertions.assertEquals(ErrorKind.SERVICE_UNAVAILABLE, store.dequeueOrWait(alice, 0L).join().error());
    }

    @Test
    void readerRacingShutdownIsNeverLeftWaitingOutItsDeadline() throws Exception {
        for (int i = 0; i < 200; i++) {
            MailboxStore store = store(Map.of());
            RecipientId id = recipient(i % 200 + 1);
            RecipientId other = recipient(i % 200 + 2);
            CountDownLatch start = new CountDownLatch(1);
            CompletableFuture<CompletableFuture<DequeueOutcome>> reader = CompletableFuture.supplyAsync(() -> {
                awaitQuietly(start);
                return store.dequeueOrWait(id, 60_000L);
            });
            CompletableFuture<EnqueueOutcome> writer = CompletableFuture.supplyAsync(() -> {
                awaitQuietly(start);
                return store.enqueue(other, bytes("late"));
            });
            start.countDown();
            store.shutdown();

            DequeueOutcome outcome = reader.get(5, TimeUnit.SECONDS).get(2, TimeUnit.SECONDS);
            Assertions.assertEquals(DequeueOutcome.Status.REJECTED, outcome.status());
            Assertions.assertEquals(ErrorKind.SERVICE_UNAVAILABLE, outcome.error());
            EnqueueOutcome posted = writer.get(5, TimeUnit.SECONDS);
            if (posted.error() != ErrorKind.SERVICE_UNAVAILABLE) {
                Assertions.assertEquals(1L, store.queuedMessages());
            }
        }
    }

    @Test
    void idleEmptyMailboxesAreRemoved() {
        MailboxStore store = store(Map.of("idleMailboxTtlMs", 1_000L));
        RecipientId idle = recipient(1);
        RecipientId busy = recipient(2);
        store.enqueue(idle, bytes("x"));
        store.dequeueOrWait(idle, 0L).join();
        CompletableFuture<DequeueOutcome> waiting = store.dequeueOrWait(busy, 60_000L);
        clock.advanceMillis(1_000L);

        EvictionReport report = store.evictExpired();

        Assertions.assertEquals(1, report.mailboxesRemoved());
        Assertions.assertTrue(store.summary(idle).isEmpty());
        Assertions.assertTrue(store.summary(busy).isPresent(), "a mailbox with a pending reader stays");
        Assertions.assertFalse(waiting.isDone());

        store.enqueue(idle, bytes("again"));
        Assertions.assertEquals("again", text(store.dequeueOrWait(idle, 0L).join()));
    }

    @Test
    void globalMemoryBudgetRefusesPostsUntilSpaceFrees() {
        MailboxStore store = store(Map.of("memoryLimitBytes", 10L));
        Assertions.assertTrue(store.enqueue(recipient(1), new byte[6]).accepted());
        Assertions.assertEquals(ErrorKind.STORAGE_EXHAUSTED, store.enqueue(recipient(2), new byte[6]).error());

        store.dequeueOrWait(recipient(1), 0L).join();

        Assertions.assertTrue(store.enqueue(recipient(2), new byte[6]).accepted());
        Assertions.assertEquals(6L, store.bufferedBytes());
    }

    @Test
    void droppingAMailboxDiscardsItsQueue() {
        MailboxStore store = store(Map.of());
        RecipientId alice = recipient(1);
        store.enqueue(alice, bytes("x"));

        Assertions.assertTrue(store.drop(alice));
        Assertions.assertFalse(store.drop(alice));
        Assertions.assertEquals(0L, store.bufferedBytes());
        Assertions.assertEquals(0, store.activeMailboxes());
    }

    @Test
    void racingDeliveryAndTimeoutNeverLoseOrDuplicateAMessage() throws Exception {
        MailboxStore store = store(Map.of());
        int rounds = 300;
        int delivered = 0;
        int queued = 0;
        for (int i = 0; i < rounds; i++) {
            RecipientId id = recipient(i % 200 + 1, i);
            CompletableFuture<DequeueOutcome> pending = store.dequeueOrWait(id, 1L);
            CountDownLatch start = new CountDownLatch(1);
            CompletableFuture<EnqueueOutcome> post = CompletableFuture.supplyAsync(() -> {
                awaitQuietly(start);
                return store.enqueue(id, bytes("m" + id.hex()));
            });
            start.countDown();
            EnqueueOutcome posted = post.get(5, TimeUnit.SECONDS);
            DequeueOutcome outcome = pending.get(5, TimeUnit.SECONDS);
            if (posted.handedOff()) {
                Assertions.assertEquals(DequeueOutcome.Status.DELIVERED, outcome.status());
                delivered++;
            } else {
                Assertions.assertEquals(DequeueOutcome.Status.EMPTY, outcome.status());
                Assertions.assertEquals(DequeueOutcome.Status.DELIVERED, store.dequeueOrWait(id, 0L).join().status());
                queued++;
            }
        }
        Assertions.assertEquals(rounds, delivered + queued);
        Assertions.assertEquals(0L, store.queuedMessages());
    }

    private MailboxStore store(Map<String, ?> overrides) {
        return new MailboxStore(TestConfigs.with(overrides), clock, timer, null);
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    static RecipientId recipient(int fill) {
        return recipient(fill, 0);
    }

    private static RecipientId recipient(int fill, int salt) {
        byte[] raw = new byte[RecipientId.LENGTH];
        Arrays.fill(raw, (byte) fill);
        raw[0] = (byte) (salt >>> 8);
        raw[1] = (byte) salt;
        return RecipientId.of(raw);
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    private static String text(DequeueOutcome outcome) {
        return new String(outcome.message().payload(), StandardCharsets.UTF_8);
    }
}
