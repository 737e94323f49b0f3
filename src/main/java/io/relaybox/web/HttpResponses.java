package io.relaybox.web;

import com.sun.net.httpserver.HttpExchange;
import io.relaybox.model.ErrorKind;
import io.relaybox.util.Jsons;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

final class HttpResponses {
    private HttpResponses() {
    }

    static void writeJson(HttpExchange exchange, Object body, int status) throws IOException {
        byte[] bytes = Jsons.toJson(body).getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    static void writeText(HttpExchange exchange, String body, String contentType, int status) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    static void writeBytes(HttpExchange exchange, byte[] body, int status) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/octet-stream");
        exchange.sendResponseHeaders(status, body.length == 0 ? -1 : body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }

    static void writeEmpty(HttpExchange exchange, int status) throws IOException {
        exchange.sendResponseHeaders(status, -1);
        exchange.close();
    }

    /**
     * Error body is {@code {"error": code}} and nothing else, so two rejections of the same
     * kind are byte-identical.
     */
    static void writeError(HttpExchange exchange, ErrorKind error, long retryAfterMs) throws IOException {
        if (error.retryable()) {
            long seconds = retryAfterMs > 0L ? Math.max(1L, (retryAfterMs + 999L) / 1000L) : 1L;
            exchange.getResponseHeaders().set("Retry-After", Long.toString(seconds));
        }
        if (error == ErrorKind.UNAUTHENTICATED) {
            exchange.getResponseHeaders().set("WWW-Authenticate", "Bearer");
        }
        writeJson(exchange, Map.of("error", error.code()), error.httpStatus());
    }

    static boolean allowMethods(HttpExchange exchange, String... methods) throws IOException {
        String method = exchange.getRequestMethod();
        for (String allowed : methods) {
            if (allowed.equalsIgnoreCase(method)) {
                return true;
            }
        }
        exchange.getResponseHeaders().set("Allow", String.join(",", methods));
        writeJson(exchange, Map.of("error", "method_not_allowed"), 405);
        return false;
    }

    /**
     * Reads at most {@code limit} bytes. A body longer than that comes back truncated to
     * {@code limit}, which callers use to detect oversize without buffering it all.
     */
    static byte[] readBody(HttpExchange exchange, int limit) throws IOException {
        try (InputStream in = exchange.getRequestBody()) {
            return in.readNBytes(limit);
        }
    }

    static String source(HttpExchange exchange) {
        InetSocketAddress remote = exchange.getRemoteAddress();
        if (remote == null || remote.getAddress() == null) {
            return "unknown";
        }
        return remote.getAddress().getHostAddress();
    }

    static String pathTail(HttpExchange exchange, String prefix) {
        String path = exchange.getRequestURI().getPath();
        if (path == null || !path.startsWith(prefix)) {
            return "";
        }
        return path.substring(prefix.length());
    }

    static Map<String, String> parseQuery(URI uri) {
        Map<String, String> out = new LinkedHashMap<>();
        String raw = uri.getRawQuery();
        if (raw == null || raw.isBlank()) {
            return out;
        }
        for (String pair : raw.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String key = eq < 0 ? pair : pair.substring(0, eq);
            String value = eq < 0 ? "" : pair.substring(eq + 1);
            out.putIfAbsent(
                    URLDecoder.decode(key, StandardCharsets.UTF_8),
                    URLDecoder.decode(value, StandardCharsets.UTF_8)
            );
        }
        return out;
    }
}
