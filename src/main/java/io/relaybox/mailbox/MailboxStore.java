package io.relaybox.mailbox;

import io.relaybox.config.RelayBoxConfig;
import io.relaybox.model.ErrorKind;
import io.relaybox.observability.MetricsSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory per-recipient FIFO queues with long-poll waiters.
 *
 * <p>Each mailbox is guarded by its own lock. A reader that finds the queue empty registers
 * a waiter and gets a pending future back; no thread is parked. A post hands its message
 * straight to the oldest waiter when one exists. Removing a waiter from the deque under the
 * mailbox lock decides whether it is completed by delivery or by its deadline, so each waiter
 * resolves exactly once.
 */
public final class MailboxStore {
    private static final Logger log = LoggerFactory.getLogger(MailboxStore.class);

    private final ConcurrentHashMap<RecipientId, Mailbox> mailboxes = new ConcurrentHashMap<>();
    private final AtomicLong bufferedBytes = new AtomicLong();
    private final AtomicLong queuedMessages = new AtomicLong();
    private final Clock clock;
    private final ScheduledExecutorService timer;
    private final MetricsSink metrics;
    private final int maxMessageSize;
    private final int maxQueueLength;
    private final long messageTtlMs;
    private final long idleMailboxTtlMs;
    private final long memoryLimitBytes;
    private volatile boolean closed;

    public MailboxStore(RelayBoxConfig config, Clock clock, ScheduledExecutorService timer, MetricsSink metrics) {
        this.clock = clock;
        this.timer = timer;
        this.metrics = metrics == null ? MetricsSink.NOOP : metrics;
        this.maxMessageSize = config.maxMessageSize();
        this.maxQueueLength = config.maxQueueLength();
        this.messageTtlMs = config.messageTtlMs();
        this.idleMailboxTtlMs = config.idleMailboxTtlMs();
        this.memoryLimitBytes = config.memoryLimitBytes();
    }

    public EnqueueOutcome enqueue(RecipientId recipient, byte[] payload) {
        if (payload == null || payload.length > maxMessageSize) {
            return EnqueueOutcome.rejected(ErrorKind.MESSAGE_TOO_LARGE);
        }
        if (closed) {
            return EnqueueOutcome.rejected(ErrorKind.SERVICE_UNAVAILABLE);
        }
        byte[] owned = payload.clone();
        while (true) {
            Mailbox mailbox = mailboxes.computeIfAbsent(recipient, k -> new Mailbox(clock.millis()));
            Mailbox.Waiter waiter;
            Message message;
            mailbox.lock.lock();
            try {
                if (mailbox.retired) {
                    continue;
                }
                // shutdown() sets closed before taking each lock; seen here, it has or will visit this mailbox.
                if (closed) {
                    return EnqueueOutcome.rejected(ErrorKind.SERVICE_UNAVAILABLE);
                }
                long now = clock.millis();
                dropExpiredLocked(mailbox, now);
                if (mailbox.messages.size() >= maxQueueLength) {
                    return EnqueueOutcome.rejected(ErrorKind.QUEUE_FULL);
                }
                waiter = mailbox.waiters.poll();
                if (waiter == null && !reserveMemory(owned.length)) {
                    return EnqueueOutcome.rejected(ErrorKind.STORAGE_EXHAUSTED);
                }
                message = new Message(owned, mailbox.nextSequence++, now);
                mailbox.lastActivityMs = now;
                if (waiter == null) {
                    mailbox.messages.addLast(message);
                    mailbox.bufferedBytes += owned.length;
                    queuedMessages.incrementAndGet();
                    return EnqueueOutcome.queued(message.sequence());
                }
                waiter.cancelDeadline();
            } finally {
                mailbox.lock.unlock();
            }
            // The waiter is already unlinked, so completing outside the lock cannot race its deadline.
            waiter.future.complete(DequeueOutcome.delivered(message, 0));
            return EnqueueOutcome.handedOff(message.sequence());
        }
    }

    public CompletableFuture<DequeueOutcome> dequeueOrWait(RecipientId recipient, long timeoutMs) {
        if (closed) {
            return CompletableFuture.completedFuture(DequeueOutcome.unavailable());
        }
        while (true) {
            Mailbox mailbox = mailboxes.computeIfAbsent(recipient, k -> new Mailbox(clock.millis()));
            mailbox.lock.lock();
            try {
                if (mailbox.retired) {
                    continue;
                }
                if (closed) {
                    return CompletableFuture.completedFuture(DequeueOutcome.unavailable());
                }
                long now = clock.millis();
                dropExpiredLocked(mailbox, now);
                mailbox.lastActivityMs = now;
                Message head = mailbox.messages.pollFirst();
                if (head != null) {
                    releaseLocked(mailbox, head);
                    return CompletableFuture.completedFuture(DequeueOutcome.delivered(head, mailbox.messages.size()));
                }
                if (timeoutMs <= 0L) {
                    return CompletableFuture.completedFuture(DequeueOutcome.empty());
                }
                Mailbox.Waiter waiter = new Mailbox.Waiter();
                mailbox.waiters.addLast(waiter);
                try {
                    waiter.deadline = timer.schedule(() -> expireWaiter(mailbox, waiter), timeoutMs, TimeUnit.MILLISECONDS);
                } catch (RejectedExecutionException e) {
                    mailbox.waiters.removeLastOccurrence(waiter);
                    return CompletableFuture.completedFuture(DequeueOutcome.unavailable());
                }
                return waiter.future;
            } finally {
                mailbox.lock.unlock();
            }
        }
    }

    private void expireWaiter(Mailbox mailbox, Mailbox.Waiter waiter) {
        boolean removed;
        mailbox.lock.lock();
        try {
            removed = mailbox.waiters.remove(waiter);
            if (removed) {
                mailbox.lastActivityMs = clock.millis();
            }
        } finally {
            mailbox.lock.unlock();
        }
        if (removed) {
            waiter.future.complete(DequeueOutcome.empty());
        }
    }

    public EvictionReport evictExpired() {
        int expired = 0;
        int removed = 0;
        for (Map.Entry<RecipientId, Mailbox> entry : mailboxes.entrySet()) {
            Mailbox mailbox = entry.getValue();
            if (!mailbox.lock.tryLock()) {
                continue;
            }
            try {
                if (mailbox.retired) {
                    continue;
                }
                long now = clock.millis();
                expired += dropExpiredLocked(mailbox, now);
                if (mailbox.messages.isEmpty()
                        && mailbox.waiters.isEmpty()
                        && now - mailbox.lastActivityMs >= idleMailboxTtlMs) {
                    mailbox.retired = true;
                    mailboxes.remove(entry.getKey(), mailbox);
                    removed++;
                }
            } catch (RuntimeException e) {
                log.warn("Eviction failed for mailbox {}", entry.getKey().logLabel(), e);
            } finally {
                mailbox.lock.unlock();
            }
        }
        if (expired > 0 || removed > 0) {
            log.debug("Evicted {} expired messages and {} idle mailboxes", expired, removed);
        }
        return new EvictionReport(expired, removed);
    }

    public boolean drop(RecipientId recipient) {
        Mailbox mailbox = mailboxes.get(recipient);
        if (mailbox == null) {
            return false;
        }
        List<Mailbox.Waiter> woken;
        mailbox.lock.lock();
        try {
            if (mailbox.retired) {
                return false;
            }
            mailbox.retired = true;
            mailboxes.remove(recipient, mailbox);
            while (!mailbox.messages.isEmpty()) {
                releaseLocked(mailbox, mailbox.messages.pollFirst());
            }
            woken = drainWaitersLocked(mailbox);
        } finally {
            mailbox.lock.unlock();
        }
        woken.forEach(w -> w.future.complete(DequeueOutcome.unavailable()));
        return true;
    }

    /**
     * Rejects further posts and wakes every pending reader with {@code service_unavailable}.
     */
    public int shutdown() {
        closed = true;
        int woken = 0;
        for (Mailbox mailbox : mailboxes.values()) {
            List<Mailbox.Waiter> waiters;
            mailbox.lock.lock();
            try {
                waiters = drainWaitersLocked(mailbox);
            } finally {
                mailbox.lock.unlock();
            }
            for (Mailbox.Waiter waiter : waiters) {
                waiter.future.complete(DequeueOutcome.unavailable());
                woken++;
            }
        }
        return woken;
    }

    public Optional<MailboxSummary> summary(RecipientId recipient) {
        Mailbox mailbox = mailboxes.get(recipient);
        return mailbox == null ? Optional.empty() : Optional.of(summarize(recipient, mailbox));
    }

    public List<MailboxSummary> summaries() {
        List<MailboxSummary> out = new ArrayList<>();
        for (Map.Entry<RecipientId, Mailbox> entry : mailboxes.entrySet()) {
            out.add(summarize(entry.getKey(), entry.getValue()));
        }
        return out;
    }

    public int activeMailboxes() {
        return mailboxes.size();
    }

    public long queuedMessages() {
        return queuedMessages.get();
    }

    public long bufferedBytes() {
        return bufferedBytes.get();
    }

    public long memoryLimitBytes() {
        return memoryLimitBytes;
    }

    public boolean closed() {
        return closed;
    }

    private MailboxSummary summarize(RecipientId recipient, Mailbox mailbox) {
        mailbox.lock.lock();
        try {
            return new MailboxSummary(
                    recipient.hex(),
                    mailbox.messages.size(),
                    mailbox.waiters.size(),
                    mailbox.bufferedBytes,
                    mailbox.lastActivityMs
            );
        } finally {
            mailbox.lock.unlock();
        }
    }

    private boolean reserveMemory(int bytes) {
        long after = bufferedBytes.addAndGet(bytes);
        if (after > memoryLimitBytes) {
            bufferedBytes.addAndGet(-bytes);
            return false;
        }
        return true;
    }

    private int dropExpiredLocked(Mailbox mailbox, long now) {
        int dropped = 0;
        Message head = mailbox.messages.peekFirst();
        while (head != null && head.expiredAt(now, messageTtlMs)) {
            mailbox.messages.pollFirst();
            releaseLocked(mailbox, head);
            dropped++;
            head = mailbox.messages.peekFirst();
        }
        if (dropped > 0) {
            metrics.messagesEvicted(dropped);
        }
        return dropped;
    }

    private void releaseLocked(Mailbox mailbox, Message message) {
        mailbox.bufferedBytes -= message.size();
        bufferedBytes.addAndGet(-message.size());
        queuedMessages.decrementAndGet();
    }

    private static List<Mailbox.Waiter> drainWaitersLocked(Mailbox mailbox) {
        List<Mailbox.Waiter> out = new ArrayList<>(mailbox.waiters);
        mailbox.waiters.clear();
        out.forEach(Mailbox.Waiter::cancelDeadline);
        return out;
    }
}
