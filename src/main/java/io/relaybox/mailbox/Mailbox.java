package io.relaybox.mailbox;

import java.util.ArrayDeque;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One recipient's queue and waiter list. All fields are guarded by {@link #lock}; a retired
 * mailbox has been unlinked from the store and must not be mutated again.
 */
final class Mailbox {
    final ReentrantLock lock = new ReentrantLock();
    final ArrayDeque<Message> messages = new ArrayDeque<>();
    final ArrayDeque<Waiter> waiters = new ArrayDeque<>();
    long nextSequence = 1L;
    long lastActivityMs;
    long bufferedBytes;
    boolean retired;

    Mailbox(long createdAtMs) {
        this.lastActivityMs = createdAtMs;
    }

    static final class Waiter {
        final CompletableFuture<DequeueOutcome> future = new CompletableFuture<>();
        ScheduledFuture<?> deadline;

        void cancelDeadline() {
            if (deadline != null) {
                deadline.cancel(false);
            }
        }
    }
}
