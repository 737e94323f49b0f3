package io.relaybox.observability;

import java.util.Locale;
import java.util.Map;

/**
 * Renders a stats snapshot in the Prometheus text exposition format, version 0.0.4.
 */
public final class PrometheusFormatter {
    public static final String CONTENT_TYPE = "text/plain; version=0.0.4; charset=utf-8";

    private PrometheusFormatter() {
    }

    public static String format(Gauges gauges, RelayBoxMetrics.Snapshot counters) {
        StringBuilder sb = new StringBuilder();
        appendGauge(sb, "relaybox_active_mailboxes", "Mailboxes currently held in memory", gauges.activeMailboxes());
        appendGauge(sb, "relaybox_queued_messages", "Messages waiting for delivery", gauges.queuedMessages());
        appendGauge(sb, "relaybox_buffered_bytes", "Payload bytes buffered across all mailboxes", gauges.bufferedBytes());
        appendGauge(sb, "relaybox_allocations_active", "Relay allocations in ACTIVE state", gauges.activeAllocations());
        appendCounter(sb, "relaybox_messages_posted_total", "Messages accepted by post", counters.messagesPosted());
        appendCounter(sb, "relaybox_messages_delivered_total", "Messages handed to a reader", counters.messagesDelivered());
        appendCounter(sb, "relaybox_messages_evicted_total", "Messages dropped after their TTL", counters.messagesEvicted());
        appendCounter(sb, "relaybox_rate_limit_hits_total", "Requests denied by a source rate limiter", counters.rateLimitHits());
        appendCounter(sb, "relaybox_allocations_created_total", "Relay allocations created", counters.allocationsCreated());
        appendCounter(sb, "relaybox_relay_bytes_forwarded_total", "Bytes forwarded by the relay", counters.bytesForwarded());
        appendLabeledCounter(sb, "relaybox_errors_total", "Rejections grouped by error kind", "kind", counters.errorsByKind());
        appendLabeledCounter(sb, "relaybox_relay_forward_rejected_total", "Rejected relay forwards grouped by error kind", "kind", counters.forwardRejectionsByKind());
        appendHistogram(sb, "relaybox_request_latency_seconds", "Mailbox request latency", counters);
        return sb.toString();
    }

    private static void appendGauge(StringBuilder sb, String metric, String help, long value) {
        header(sb, metric, help, "gauge");
        sb.append(metric).append(' ').append(value).append('\n');
    }

    private static void appendCounter(StringBuilder sb, String metric, String help, long value) {
        header(sb, metric, help, "counter");
        sb.append(metric).append(' ').append(value).append('\n');
    }

    private static void appendLabeledCounter(StringBuilder sb, String metric, String help, String label, Map<String, Long> values) {
        header(sb, metric, help, "counter");
        for (Map.Entry<String, Long> e : values.entrySet()) {
            sb.append(metric).append('{')
                    .append(label).append("=\"").append(escapeLabel(e.getKey())).append("\"}")
                    .append(' ').append(e.getValue()).append('\n');
        }
    }

    private static void appendHistogram(StringBuilder sb, String metric, String help, RelayBoxMetrics.Snapshot counters) {
        header(sb, metric, help, "histogram");
        long[] buckets = counters.latencyBucketCounts();
        for (int i = 0; i < buckets.length; i++) {
            sb.append(metric).append("_bucket{le=\"")
                    .append(formatBound(RelayBoxMetrics.LATENCY_BUCKETS_SECONDS[i]))
                    .append("\"} ").append(buckets[i]).append('\n');
        }
        sb.append(metric).append("_bucket{le=\"+Inf\"} ").append(counters.latencyCount()).append('\n');
        sb.append(metric).append("_sum ").append(String.format(Locale.ROOT, "%.6f", counters.latencySumSeconds())).append('\n');
        sb.append(metric).append("_count ").append(counters.latencyCount()).append('\n');
    }

    private static void header(StringBuilder sb, String metric, String help, String type) {
        sb.append("# HELP ").append(metric).append(' ').append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(' ').append(type).append('\n');
    }

    private static String formatBound(double bound) {
        if (bound == Math.rint(bound)) {
            return String.valueOf((long) bound);
        }
        return String.valueOf(bound);
    }

    private static String escapeLabel(String v) {
        return v.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    public record Gauges(long activeMailboxes, long queuedMessages, long bufferedBytes, long activeAllocations) {
    }
}
