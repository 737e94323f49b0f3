package io.relaybox.web;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.relaybox.mailbox.RecipientId;
import io.relaybox.model.ErrorKind;
import io.relaybox.observability.AuditEvent;
import io.relaybox.runtime.RelayBoxRuntime;
import io.relaybox.util.Hashing;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Operator endpoints for listing and force-revoking mailboxes and allocations. Only mounted
 * when an admin token is configured.
 */
final class AdminHttpApi {
    private final RelayBoxRuntime runtime;
    private final String adminToken;

    AdminHttpApi(RelayBoxRuntime runtime, String adminToken) {
        this.runtime = runtime;
        this.adminToken = adminToken;
    }

    void register(HttpServer server) {
        server.createContext("/admin/mailboxes", this::handleMailboxes);
        server.createContext("/admin/allocations", this::handleAllocations);
        server.createContext("/admin/stats", exchange -> {
            if (!authorize(exchange)) return;
            if (!HttpResponses.allowMethods(exchange, "GET")) return;
            HttpResponses.writeJson(exchange, runtime.stats(), 200);
        });
    }

    private void handleMailboxes(HttpExchange exchange) throws IOException {
        if (!authorize(exchange)) return;
        String tail = trimSlashes(HttpResponses.pathTail(exchange, "/admin/mailboxes"));
        if (tail.isEmpty()) {
            if (!HttpResponses.allowMethods(exchange, "GET")) return;
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("mailboxes", runtime.store().summaries());
            HttpResponses.writeJson(exchange, out, 200);
            return;
        }
        if (!HttpResponses.allowMethods(exchange, "DELETE")) return;
        RecipientId recipient;
        try {
            recipient = RecipientId.parseHex(tail);
        } catch (IllegalArgumentException e) {
            HttpResponses.writeJson(exchange, Map.of("error", "malformed_request"), 400);
            return;
        }
        boolean dropped = runtime.store().drop(recipient);
        runtime.audit().record(AuditEvent.of("admin.mailbox.drop", "admin", recipient.logLabel(), dropped ? "ok" : "not_found"));
        HttpResponses.writeJson(exchange, Map.of("dropped", dropped), dropped ? 200 : 404);
    }

    private void handleAllocations(HttpExchange exchange) throws IOException {
        if (!authorize(exchange)) return;
        String tail = trimSlashes(HttpResponses.pathTail(exchange, "/admin/allocations"));
        if (tail.isEmpty()) {
            if (!HttpResponses.allowMethods(exchange, "GET")) return;
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("allocations", runtime.allocations().list());
            HttpResponses.writeJson(exchange, out, 200);
            return;
        }
        if (!HttpResponses.allowMethods(exchange, "DELETE")) return;
        if (runtime.allocations().find(tail).isEmpty()) {
            runtime.audit().record(AuditEvent.of("admin.allocation.revoke", "admin", tail, "not_found"));
            HttpResponses.writeJson(exchange, Map.of("terminated", false, "error", ErrorKind.NOT_FOUND.code()), 404);
            return;
        }
        boolean terminated = runtime.allocations().terminate(tail, "admin");
        runtime.audit().record(AuditEvent.of("admin.allocation.revoke", "admin", tail, terminated ? "ok" : "already_ended"));
        if (terminated) {
            HttpResponses.writeJson(exchange, Map.of("terminated", true), 200);
        } else {
            HttpResponses.writeJson(exchange, Map.of("terminated", false, "error", "already_ended"), 409);
        }
    }

    private boolean authorize(HttpExchange exchange) throws IOException {
        String header = exchange.getRequestHeaders().getFirst("Authorization");
        if (header == null || !header.regionMatches(true, 0, "Bearer ", 0, 7)) {
            HttpResponses.writeJson(exchange, Map.of("error", "unauthenticated"), 401);
            return false;
        }
        if (!Hashing.constantTimeEquals(header.substring(7).trim(), adminToken)) {
            HttpResponses.writeJson(exchange, Map.of("error", "forbidden"), 403);
            return false;
        }
        return true;
    }

    private static String trimSlashes(String raw) {
        String out = raw;
        while (out.startsWith("/")) {
            out = out.substring(1);
        }
        while (out.endsWith("/")) {
            out = out.substring(0, out.length() - 1);
        }
        return out;
    }
}
