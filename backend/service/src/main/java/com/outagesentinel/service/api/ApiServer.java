package com.outagesentinel.service.api;

import com.outagesentinel.aggregator.engine.OutageAggregator;
import com.outagesentinel.core.events.OutageScopeChanged;
import com.outagesentinel.core.events.OutageSummaryUpdated;
import com.outagesentinel.core.util.JsonUtils;
import com.outagesentinel.service.store.EventCodec;
import com.outagesentinel.service.store.EventStore;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * HTTP surface of the aggregator. All exchanges run on the supplied executor, which must
 * be the single thread that owns the {@link OutageAggregator}.
 */
public class ApiServer {
    private static final Logger LOGGER = Logger.getLogger(ApiServer.class.getName());
    static final int MAX_BODY_BYTES = 64 * 1024;
    static final int DEFAULT_EVENT_LIMIT = 200;

    private final int port;
    private final OutageAggregator aggregator;
    private final EventStore eventStore;
    private final Clock clock;
    private final Executor executor;

    private HttpServer server;

    public ApiServer(int port, OutageAggregator aggregator, EventStore eventStore, Clock clock, Executor executor) {
        this.port = port;
        this.aggregator = aggregator;
        this.eventStore = eventStore;
        this.clock = clock;
        this.executor = executor;
    }

    public void start() {
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            server.setExecutor(executor);
            server.createContext("/api/health", this::handleHealth);
            server.createContext("/api/node-status", this::handleNodeStatus);
            server.createContext("/api/summary", this::handleSummary);
            server.createContext("/api/scope", this::handleScope);
            server.createContext("/api/events", this::handleEvents);
            server.start();
        } catch (IOException e) {
            throw new IllegalStateException("Failed starting API server on port " + port, e);
        }
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
        }
    }

    public int actualPort() {
        if (server == null) {
            return port;
        }
        return server.getAddress().getPort();
    }

    private void handleHealth(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        Map<String, Object> body = new HashMap<>();
        body.put("status", "ok");
        body.put("knownNodes", aggregator.knownNodes());
        body.put("rejectedMessages", aggregator.rejectedMessages());
        writeJson(exchange, 200, body);
    }

    private void handleNodeStatus(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "POST")) {
            return;
        }
        byte[] body;
        try (InputStream in = exchange.getRequestBody()) {
            body = in.readNBytes(MAX_BODY_BYTES + 1);
        }
        if (body.length > MAX_BODY_BYTES) {
            writeJson(exchange, 413, Map.of("error", "payload_too_large"));
            return;
        }
        Optional<OutageSummaryUpdated> summary;
        try {
            summary = aggregator.onRawMessage(new String(body, StandardCharsets.UTF_8), clock.instant());
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Node status handling failed", e);
            writeJson(exchange, 500, Map.of("error", "internal_error"));
            return;
        }
        if (summary.isEmpty()) {
            writeJson(exchange, 400, Map.of("error", "malformed_node_status"));
            return;
        }
        writeJson(exchange, 202, Map.of("accepted", true));
    }

    private void handleSummary(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        OutageSummaryUpdated summary = aggregator.latestSummary()
                .orElseGet(() -> new OutageSummaryUpdated(clock.instant(), Map.of()));
        writeJson(exchange, 200, summary);
    }

    private void handleScope(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        String provider = queryParams(exchange.getRequestURI()).get("provider");
        if (provider == null || provider.isBlank()) {
            writeJson(exchange, 400, Map.of("error", "provider_required"));
            return;
        }
        Optional<OutageScopeChanged> scope = aggregator.retainedScope(provider);
        if (scope.isEmpty()) {
            writeJson(exchange, 404, Map.of("error", "no_scope", "provider", provider));
            return;
        }
        writeJson(exchange, 200, scope.get());
    }

    private void handleEvents(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }

        Instant since;
        Optional<String> type;
        int limit;
        try {
            Map<String, String> query = queryParams(exchange.getRequestURI());
            since = query.containsKey("since") ? Instant.parse(query.get("since")) : Instant.EPOCH;
            type = Optional.ofNullable(query.get("type")).filter(value -> !value.isBlank());
            limit = query.containsKey("limit") ? Integer.parseInt(query.get("limit")) : DEFAULT_EVENT_LIMIT;
        } catch (RuntimeException invalidParamError) {
            writeJson(exchange, 400, Map.of("error", "invalid_query_params"));
            return;
        }

        List<EventCodec.Envelope> events = eventStore.query(since, type, Math.max(1, limit)).stream()
                .map(EventCodec::envelope)
                .toList();
        writeJson(exchange, 200, events);
    }

    private boolean ensureMethod(HttpExchange exchange, String method) throws IOException {
        if (!method.equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.getResponseHeaders().set("Allow", method);
            exchange.sendResponseHeaders(405, -1);
            exchange.close();
            return false;
        }
        return true;
    }

    private void writeJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] payload = JsonUtils.objectMapper().writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(payload);
        }
    }

    private Map<String, String> queryParams(URI uri) {
        Map<String, String> query = new HashMap<>();
        String raw = uri.getRawQuery();
        if (raw == null || raw.isBlank()) {
            return query;
        }
        for (String entry : raw.split("&")) {
            String[] pair = entry.split("=", 2);
            String key = URLDecoder.decode(pair[0], StandardCharsets.UTF_8);
            String value = pair.length > 1 ? URLDecoder.decode(pair[1], StandardCharsets.UTF_8) : "";
            query.put(key, value);
        }
        return query;
    }
}
