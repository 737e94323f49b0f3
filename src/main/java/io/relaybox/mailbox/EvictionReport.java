package io.relaybox.mailbox;

public record EvictionReport(int messagesExpired, int mailboxesRemoved) {
}
