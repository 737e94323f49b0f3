/**
 * RelayBox source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.relaybox.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.relaybox.cli.RelayBoxCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.relaybox.runtime.RelayBoxRuntime} wires the mailbox and relay and runs the sweep.</li>
 *   <li>{@code io.relaybox.mailbox.MailboxStore} holds queues and long-poll waiters.</li>
 *   <li>{@code io.relaybox.relay.AllocationTable} owns relay allocations and their quotas.</li>
 * </ul>
 */
package io.relaybox;
