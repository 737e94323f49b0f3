package io.relaybox.config;

import io.relaybox.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public record RelayBoxConfig(
        String bindHost,
        int mailboxPort,
        int relayPort,
        int maxMessageSize,
        int maxQueueLength,
        long messageTtlMs,
        long idleMailboxTtlMs,
        long evictionIntervalMs,
        long memoryLimitBytes,
        int postsPerMinute,
        int getsPerMinute,
        long rateLimiterIdleMs,
        long defaultWaitMs,
        long maxWaitMs,
        String authMode,
        List<MailboxKey> mailboxTokenKeys,
        List<String> allowlist,
        List<String> blocklist,
        long gracefulShutdownTimeoutMs,
        long defaultQuotaBytes,
        long defaultBandwidthBps,
        int maxAllocations,
        long maxAllocationTtlMs,
        long allocationIdleTimeoutMs,
        Map<String, List<String>> pinnedDevices,
        long clockSkewMs,
        long maxTokenAgeMs,
        int workerThreads,
        int maxFrameSize,
        String adminToken,
        String auditFile,
        String auditSigningSecret,
        int relayConnectionsPerMinute,
        int relayAllocationsPerMinute,
        int maxRelayConnections,
        long globalBandwidthBps
) {
    public static final String SETTINGS_FILE_NAME = "relaybox-settings.json";
    public static final String VERSION = "0.1.0";
    public static final String DEFAULT_BIND_HOST = "0.0.0.0";
    public static final int DEFAULT_MAILBOX_PORT = 8080;
    public static final int DEFAULT_RELAY_PORT = 4433;
    public static final int DEFAULT_MAX_MESSAGE_SIZE = 64 * 1024;
    public static final int DEFAULT_MAX_QUEUE_LENGTH = 100;
    public static final long DEFAULT_MESSAGE_TTL_MS = 5L * 60L * 1000L;
    public static final long DEFAULT_IDLE_MAILBOX_TTL_MS = 60L * 60L * 1000L;
    public static final long DEFAULT_EVICTION_INTERVAL_MS = 30_000L;
    public static final long DEFAULT_MEMORY_LIMIT_BYTES = 50L * 1024L * 1024L;
    public static final int DEFAULT_POSTS_PER_MINUTE = 60;
    public static final int DEFAULT_GETS_PER_MINUTE = 120;
    public static final long DEFAULT_RATE_LIMITER_IDLE_MS = 10L * 60L * 1000L;
    public static final long DEFAULT_WAIT_MS = 30_000L;
    public static final long DEFAULT_MAX_WAIT_MS = 60_000L;
    public static final String DEFAULT_AUTH_MODE = "disabled";
    public static final long DEFAULT_GRACEFUL_SHUTDOWN_TIMEOUT_MS = 30_000L;
    public static final long DEFAULT_QUOTA_BYTES = 1024L * 1024L * 1024L;
    public static final long DEFAULT_BANDWIDTH_BPS = 10L * 1024L * 1024L;
    public static final int DEFAULT_MAX_ALLOCATIONS = 1000;
    public static final long DEFAULT_MAX_ALLOCATION_TTL_MS = 8L * 60L * 60L * 1000L;
    public static final long DEFAULT_ALLOCATION_IDLE_TIMEOUT_MS = 30_000L;
    public static final long DEFAULT_CLOCK_SKEW_MS = 30_000L;
    public static final long DEFAULT_MAX_TOKEN_AGE_MS = 24L * 60L * 60L * 1000L;
    public static final int DEFAULT_WORKER_THREADS = 8;
    public static final int DEFAULT_MAX_FRAME_SIZE = 64 * 1024;
    public static final int DEFAULT_RELAY_CONNECTIONS_PER_MINUTE = 30;
    public static final int DEFAULT_RELAY_ALLOCATIONS_PER_MINUTE = 10;
    public static final int DEFAULT_MAX_RELAY_CONNECTIONS = 2 * DEFAULT_MAX_ALLOCATIONS;

    public RelayBoxConfig {
        mailboxTokenKeys = mailboxTokenKeys == null ? List.of() : List.copyOf(mailboxTokenKeys);
        allowlist = allowlist == null ? List.of() : List.copyOf(allowlist);
        blocklist = blocklist == null ? List.of() : List.copyOf(blocklist);
        pinnedDevices = pinnedDevices == null ? Map.of() : Map.copyOf(pinnedDevices);
    }

    public static RelayBoxConfig defaults() {
        return new RelayBoxConfig(
                DEFAULT_BIND_HOST,
                DEFAULT_MAILBOX_PORT,
                DEFAULT_RELAY_PORT,
                DEFAULT_MAX_MESSAGE_SIZE,
                DEFAULT_MAX_QUEUE_LENGTH,
                DEFAULT_MESSAGE_TTL_MS,
                DEFAULT_IDLE_MAILBOX_TTL_MS,
                DEFAULT_EVICTION_INTERVAL_MS,
                DEFAULT_MEMORY_LIMIT_BYTES,
                DEFAULT_POSTS_PER_MINUTE,
                DEFAULT_GETS_PER_MINUTE,
                DEFAULT_RATE_LIMITER_IDLE_MS,
                DEFAULT_WAIT_MS,
                DEFAULT_MAX_WAIT_MS,
                DEFAULT_AUTH_MODE,
                List.of(),
                List.of(),
                List.of(),
                DEFAULT_GRACEFUL_SHUTDOWN_TIMEOUT_MS,
                DEFAULT_QUOTA_BYTES,
                DEFAULT_BANDWIDTH_BPS,
                DEFAULT_MAX_ALLOCATIONS,
                DEFAULT_MAX_ALLOCATION_TTL_MS,
                DEFAULT_ALLOCATION_IDLE_TIMEOUT_MS,
                Map.of(),
                DEFAULT_CLOCK_SKEW_MS,
                DEFAULT_MAX_TOKEN_AGE_MS,
                DEFAULT_WORKER_THREADS,
                DEFAULT_MAX_FRAME_SIZE,
                "",
                "",
                "",
                DEFAULT_RELAY_CONNECTIONS_PER_MINUTE,
                DEFAULT_RELAY_ALLOCATIONS_PER_MINUTE,
                DEFAULT_MAX_RELAY_CONNECTIONS,
                0L
        );
    }

    public static RelayBoxConfig load(Path file) {
        if (file == null || !Files.exists(file)) {
            return defaults();
        }
        try {
            SettingsFile body = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(body, defaults());
        } catch (IOException e) {
            throw new RuntimeException("Failed to load settings: " + file, e);
        }
    }

    public static RelayBoxConfig fromFile(SettingsFile file, RelayBoxConfig defaults) {
        if (file == null) {
            return defaults;
        }
        long defaultWait = sanitizeLong(file.defaultWaitMs(), defaults.defaultWaitMs(), 0L);
        long maxWait = sanitizeLong(file.maxWaitMs(), defaults.maxWaitMs(), 0L);
        if (defaultWait > maxWait) {
            defaultWait = maxWait;
        }
        return new RelayBoxConfig(
                sanitizeText(file.bindHost(), defaults.bindHost()),
                sanitizeInt(file.mailboxPort(), defaults.mailboxPort(), 0),
                sanitizeInt(file.relayPort(), defaults.relayPort(), 0),
                sanitizeInt(file.maxMessageSize(), defaults.maxMessageSize(), 1),
                sanitizeInt(file.maxQueueLength(), defaults.maxQueueLength(), 1),
                sanitizeLong(file.messageTtlMs(), defaults.messageTtlMs(), 1L),
                sanitizeLong(file.idleMailboxTtlMs(), defaults.idleMailboxTtlMs(), 0L),
                sanitizeLong(file.evictionIntervalMs(), defaults.evictionIntervalMs(), 100L),
                sanitizeLong(file.memoryLimitBytes(), defaults.memoryLimitBytes(), 1L),
                sanitizeInt(file.postsPerMinute(), defaults.postsPerMinute(), 0),
                sanitizeInt(file.getsPerMinute(), defaults.getsPerMinute(), 0),
                sanitizeLong(file.rateLimiterIdleMs(), defaults.rateLimiterIdleMs(), 1_000L),
                defaultWait,
                maxWait,
                sanitizeText(file.authMode(), defaults.authMode()).toLowerCase(Locale.ROOT),
                file.mailboxTokenKeys() == null ? defaults.mailboxTokenKeys() : cleanKeys(file.mailboxTokenKeys()),
                file.allowlist() == null ? defaults.allowlist() : cleanList(file.allowlist()),
                file.blocklist() == null ? defaults.blocklist() : cleanList(file.blocklist()),
                sanitizeLong(file.gracefulShutdownTimeoutMs(), defaults.gracefulShutdownTimeoutMs(), 0L),
                sanitizeLong(file.defaultQuotaBytes(), defaults.defaultQuotaBytes(), 1L),
                sanitizeLong(file.defaultBandwidthBps(), defaults.defaultBandwidthBps(), 1L),
                sanitizeInt(file.maxAllocations(), defaults.maxAllocations(), 1),
                sanitizeLong(file.maxAllocationTtlMs(), defaults.maxAllocationTtlMs(), 1_000L),
                sanitizeLong(file.allocationIdleTimeoutMs(), defaults.allocationIdleTimeoutMs(), 1_000L),
                file.pinnedDevices() == null ? defaults.pinnedDevices() : cleanDevices(file.pinnedDevices()),
                sanitizeLong(file.clockSkewMs(), defaults.clockSkewMs(), 0L),
                sanitizeLong(file.maxTokenAgeMs(), defaults.maxTokenAgeMs(), 1_000L),
                sanitizeInt(file.workerThreads(), defaults.workerThreads(), 1),
                sanitizeInt(file.maxFrameSize(), defaults.maxFrameSize(), 1_024),
                sanitizeSecret(file.adminToken(), defaults.adminToken()),
                sanitizeText(file.auditFile(), defaults.auditFile()),
                sanitizeSecret(file.auditSigningSecret(), defaults.auditSigningSecret()),
                sanitizeInt(file.relayConnectionsPerMinute(), defaults.relayConnectionsPerMinute(), 0),
                sanitizeInt(file.relayAllocationsPerMinute(), defaults.relayAllocationsPerMinute(), 0),
                sanitizeInt(file.maxRelayConnections(), defaults.maxRelayConnections(), 2),
                sanitizeLong(file.globalBandwidthBps(), defaults.globalBandwidthBps(), 0L)
        );
    }

    public void validate() {
        if (maxMessageSize <= 0) {
            throw new IllegalArgumentException("maxMessageSize must be > 0");
        }
        if (maxQueueLength <= 0) {
            throw new IllegalArgumentException("maxQueueLength must be > 0");
        }
        if (messageTtlMs <= 0L) {
            throw new IllegalArgumentException("messageTtlMs must be > 0");
        }
        if (defaultWaitMs > maxWaitMs) {
            throw new IllegalArgumentException("defaultWaitMs must not exceed maxWaitMs");
        }
        if (maxFrameSize < maxMessageSize) {
            throw new IllegalArgumentException("maxFrameSize must be >= maxMessageSize");
        }
        if (globalBandwidthBps > 0L && globalBandwidthBps < maxFrameSize) {
            throw new IllegalArgumentException("globalBandwidthBps must be 0 or >= maxFrameSize");
        }
        if (!"disabled".equals(authMode) && mailboxTokenKeys.isEmpty()) {
            throw new IllegalArgumentException("authMode " + authMode + " requires mailboxTokenKeys");
        }
    }

    public RelayBoxConfig withPorts(int mailbox, int relay) {
        return new RelayBoxConfig(
                bindHost, mailbox, relay, maxMessageSize, maxQueueLength, messageTtlMs, idleMailboxTtlMs,
                evictionIntervalMs, memoryLimitBytes, postsPerMinute, getsPerMinute, rateLimiterIdleMs,
                defaultWaitMs, maxWaitMs, authMode, mailboxTokenKeys, allowlist, blocklist,
                gracefulShutdownTimeoutMs, defaultQuotaBytes, defaultBandwidthBps, maxAllocations,
                maxAllocationTtlMs, allocationIdleTimeoutMs, pinnedDevices, clockSkewMs, maxTokenAgeMs,
                workerThreads, maxFrameSize, adminToken, auditFile, auditSigningSecret,
                relayConnectionsPerMinute, relayAllocationsPerMinute, maxRelayConnections, globalBandwidthBps
        );
    }

    public boolean relayBandwidthCapped() {
        return globalBandwidthBps > 0L;
    }

    public boolean adminEnabled() {
        return adminToken != null && !adminToken.isBlank();
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static String sanitizeText(String raw, String fallback) {
        return raw == null || raw.isBlank() ? fallback : raw.trim();
    }

    private static String sanitizeSecret(String raw, String fallback) {
        return raw == null ? fallback : raw.trim();
    }

    private static List<String> cleanList(List<String> raw) {
        List<String> out = new ArrayList<>();
        for (String value : raw) {
            if (value != null && !value.isBlank()) {
                out.add(value.trim());
            }
        }
        return out;
    }

    private static List<MailboxKey> cleanKeys(List<MailboxKey> raw) {
        List<MailboxKey> out = new ArrayList<>();
        for (MailboxKey key : raw) {
            if (key == null || key.kid() == null || key.kid().isBlank() || key.secret() == null || key.secret().isBlank()) {
                continue;
            }
            out.add(new MailboxKey(key.kid().trim(), key.secret().trim(), key.notAfterMs()));
        }
        return out;
    }

    private static Map<String, List<String>> cleanDevices(Map<String, List<String>> raw) {
        Map<String, List<String>> out = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : raw.entrySet()) {
            if (entry.getKey() == null || entry.getKey().isBlank() || entry.getValue() == null) {
                continue;
            }
            List<String> keys = cleanList(entry.getValue());
            if (!keys.isEmpty()) {
                out.put(entry.getKey().trim().toLowerCase(Locale.ROOT), keys);
            }
        }
        return out;
    }

    public record MailboxKey(String kid, String secret, Long notAfterMs) {
    }

    public record SettingsFile(
            String bindHost,
            Integer mailboxPort,
            Integer relayPort,
            Integer maxMessageSize,
            Integer maxQueueLength,
            Long messageTtlMs,
            Long idleMailboxTtlMs,
            Long evictionIntervalMs,
            Long memoryLimitBytes,
            Integer postsPerMinute,
            Integer getsPerMinute,
            Long rateLimiterIdleMs,
            Long defaultWaitMs,
            Long maxWaitMs,
            String authMode,
            List<MailboxKey> mailboxTokenKeys,
            List<String> allowlist,
            List<String> blocklist,
            Long gracefulShutdownTimeoutMs,
            Long defaultQuotaBytes,
            Long defaultBandwidthBps,
            Integer maxAllocations,
            Long maxAllocationTtlMs,
            Long allocationIdleTimeoutMs,
            Map<String, List<String>> pinnedDevices,
            Long clockSkewMs,
            Long maxTokenAgeMs,
            Integer workerThreads,
            Integer maxFrameSize,
            String adminToken,
            String auditFile,
            String auditSigningSecret,
            Integer relayConnectionsPerMinute,
            Integer relayAllocationsPerMinute,
            Integer maxRelayConnections,
            Long globalBandwidthBps
    ) {
    }
}
