package io.relaybox.mailbox;

public record MailboxSummary(String recipient, int queueLength, int waiters, long bufferedBytes, long lastActivityMs) {
}
