/**
 * Runtime orchestration package.
 *
 * <p>{@link io.relaybox.runtime.RelayBoxRuntime} assembles the mailbox and relay services
 * from one configuration, owns the periodic eviction/expiry sweep, and sequences graceful
 * shutdown. The CLI and the HTTP layer only talk to the runtime.
 */
package io.relaybox.runtime;
