package io.relaybox.web;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.relaybox.config.RelayBoxConfig;
import io.relaybox.mailbox.GetOutcome;
import io.relaybox.mailbox.MailboxService;
import io.relaybox.mailbox.PostOutcome;
import io.relaybox.mailbox.RecipientId;
import io.relaybox.model.ErrorKind;
import io.relaybox.observability.PrometheusFormatter;
import io.relaybox.runtime.RelayBoxRuntime;
import io.relaybox.util.Threads;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * HTTP surface of the signaling mailbox. Long-poll reads do not hold a worker: the handler
 * returns once the read is registered and the response is written when the store completes it.
 */
public final class MailboxHttpApi implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MailboxHttpApi.class);
    static final String MAILBOX_PREFIX = "/v1/mailbox/";

    private final RelayBoxRuntime runtime;
    private final MailboxService service;
    private final RelayBoxConfig config;
    private final ExecutorService workers;
    private HttpServer server;

    public MailboxHttpApi(RelayBoxRuntime runtime) {
        this.runtime = runtime;
        this.service = runtime.mailboxService();
        this.config = runtime.config();
        this.workers = Executors.newFixedThreadPool(config.workerThreads(), Threads.named("relaybox-http"));
    }

    public synchronized void start() throws IOException {
        if (server != null) {
            throw new IllegalStateException("mailbox API already started");
        }
        HttpServer http = HttpServer.create(new InetSocketAddress(config.bindHost(), config.mailboxPort()), 0);
        http.createContext(MAILBOX_PREFIX, this::handleMailbox);
        http.createContext("/health", this::handleHealth);
        http.createContext("/metrics", exchange -> {
            if (!HttpResponses.allowMethods(exchange, "GET")) return;
            HttpResponses.writeText(exchange, runtime.metricsText(), PrometheusFormatter.CONTENT_TYPE, 200);
        });
        if (config.adminEnabled()) {
            new AdminHttpApi(runtime, config.adminToken()).register(http);
        }
        http.setExecutor(workers);
        http.start();
        server = http;
        log.info("Mailbox API listening on http://{}:{} (auth={}, admin={})",
                config.bindHost(), port(), config.authMode(), config.adminEnabled());
    }

    public int port() {
        return server == null ? -1 : server.getAddress().getPort();
    }

    private void handleMailbox(HttpExchange exchange) throws IOException {
        long started = System.nanoTime();
        RecipientId recipient;
        try {
            recipient = RecipientId.parseHex(HttpResponses.pathTail(exchange, MAILBOX_PREFIX));
        } catch (IllegalArgumentException e) {
            runtime.metrics().error(ErrorKind.MALFORMED_REQUEST);
            finishError(exchange, ErrorKind.MALFORMED_REQUEST, 0L, started);
            return;
        }
        String method = exchange.getRequestMethod();
        if ("POST".equalsIgnoreCase(method)) {
            handlePost(exchange, recipient, started);
        } else if ("GET".equalsIgnoreCase(method)) {
            handleGet(exchange, recipient, started);
        } else {
            HttpResponses.allowMethods(exchange, "GET", "POST");
        }
    }

    private void handlePost(HttpExchange exchange, RecipientId recipient, long started) throws IOException {
        byte[] body = HttpResponses.readBody(exchange, config.maxMessageSize() + 1);
        PostOutcome outcome = service.post(
                recipient,
                body,
                HttpResponses.source(exchange),
                exchange.getRequestHeaders().getFirst("Authorization")
        );
        if (!outcome.accepted()) {
            finishError(exchange, outcome.error(), outcome.retryAfterMs(), started);
            return;
        }
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "accepted");
        response.put("sequence", outcome.sequence());
        HttpResponses.writeJson(exchange, response, 202);
        runtime.metrics().requestLatency(System.nanoTime() - started);
    }

    private void handleGet(HttpExchange exchange, RecipientId recipient, long started) {
        String waitRaw = HttpResponses.parseQuery(exchange.getRequestURI()).get("wait_ms");
        service.get(
                recipient,
                service.parseWaitMs(waitRaw),
                HttpResponses.source(exchange),
                exchange.getRequestHeaders().getFirst("Authorization")
        ).whenCompleteAsync((outcome, failure) -> {
            try {
                if (failure != null) {
                    log.warn("Mailbox read for {} failed", recipient.logLabel(), failure);
                    finishError(exchange, ErrorKind.INTERNAL, 0L, started);
                    return;
                }
                writeGet(exchange, outcome, started);
            } catch (IOException e) {
                log.debug("Client went away before mailbox response: {}", e.getMessage());
                exchange.close();
            }
        }, workers);
    }

    private void writeGet(HttpExchange exchange, GetOutcome outcome, long started) throws IOException {
        switch (outcome.status()) {
            case DELIVERED:
                exchange.getResponseHeaders().set("X-Message-Sequence", Long.toString(outcome.sequence()));
                exchange.getResponseHeaders().set("X-Queue-Length", Integer.toString(outcome.queueLength()));
                HttpResponses.writeBytes(exchange, outcome.payload(), 200);
                runtime.metrics().requestLatency(System.nanoTime() - started);
                break;
            case EMPTY:
                HttpResponses.writeEmpty(exchange, 204);
                runtime.metrics().requestLatency(System.nanoTime() - started);
                break;
            default:
                finishError(exchange, outcome.error(), outcome.retryAfterMs(), started);
                break;
        }
    }

    private void handleHealth(HttpExchange exchange) throws IOException {
        if (!HttpResponses.allowMethods(exchange, "GET")) return;
        RelayBoxRuntime.HealthOutcome health = runtime.health();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", health.status());
        body.put("uptime_seconds", health.uptimeSeconds());
        body.put("version", health.version());
        HttpResponses.writeJson(exchange, body, health.httpStatus());
    }

    private void finishError(HttpExchange exchange, ErrorKind error, long retryAfterMs, long started) throws IOException {
        HttpResponses.writeError(exchange, error, retryAfterMs);
        runtime.metrics().requestLatency(System.nanoTime() - started);
    }

    @Override
    public synchronized void close() {
        if (server != null) {
            server.stop(1);
            server = null;
        }
        workers.shutdownNow();
        try {
            if (!workers.awaitTermination(2, TimeUnit.SECONDS)) {
                log.warn("Mailbox API workers did not stop in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
