package com.outagesentinel.service.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.outagesentinel.aggregator.config.AggregatorConfig;
import com.outagesentinel.core.bus.EventBus;
import com.outagesentinel.core.util.JsonUtils;
import com.outagesentinel.service.runtime.AggregatorService;
import com.outagesentinel.service.store.EventCodec;
import com.outagesentinel.service.store.JsonlEventStore;
import com.outagesentinel.service.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ApiServerIntegrationTest {
    private static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");

    private final HttpClient client = HttpClient.newHttpClient();
    private final MutableClock clock = new MutableClock(T0);
    private AggregatorService service;

    @AfterEach
    void tearDown() {
        if (service != null) {
            service.shutdown();
        }
    }

    @Test
    void healthReportsCounters() throws Exception {
        start();

        HttpResponse<String> response = get("/api/health");

        assertEquals(200, response.statusCode());
        JsonNode body = json(response);
        assertEquals("ok", body.path("status").asText());
        assertEquals(0, body.path("knownNodes").asInt());
        assertEquals(0, body.path("rejectedMessages").asInt());
    }

    @Test
    void acceptedStatusShowsUpInSummaryAndScope() throws Exception {
        start();

        HttpResponse<String> accepted = post("/api/node-status", """
                {"nodeId":"nyc-1","providerHint":"comcast","state":"NY","controlOk":false,"presence":"ONLINE","ts":"2026-03-01T12:00:00Z"}
                """);
        assertEquals(202, accepted.statusCode());

        JsonNode summary = json(get("/api/summary"));
        JsonNode comcast = summary.path("providers").path("comcast");
        assertEquals("LOCAL", comcast.path("scope").asText());
        assertEquals("minor", comcast.path("severity").asText());
        assertEquals(1, comcast.path("impactedCount").asInt());

        HttpResponse<String> scope = get("/api/scope?provider=comcast");
        assertEquals(200, scope.statusCode());
        assertEquals("comcast", json(scope).path("provider").asText());
        assertEquals("NY", json(scope).path("affectedStates").get(0).asText());

        assertEquals(404, get("/api/scope?provider=verizon").statusCode());
        assertEquals(400, get("/api/scope").statusCode());
    }

    @Test
    void summaryIsEmptyBeforeAnyStatus() throws Exception {
        start();

        HttpResponse<String> response = get("/api/summary");

        assertEquals(200, response.statusCode());
        assertTrue(json(response).path("providers").isEmpty());
    }

    @Test
    void malformedStatusIsRejectedAndCounted() throws Exception {
        start();

        assertEquals(400, post("/api/node-status", "{\"providerHint\":\"comcast\"}").statusCode());
        assertEquals(400, post("/api/node-status", "not json").statusCode());

        JsonNode health = json(get("/api/health"));
        assertEquals(2, health.path("rejectedMessages").asInt());
        assertEquals(0, health.path("knownNodes").asInt());
    }

    @Test
    void wrongMethodIsRejected() throws Exception {
        start();

        assertEquals(405, get("/api/node-status").statusCode());
        assertEquals(405, post("/api/summary", "{}").statusCode());
    }

    @Test
    void eventsEndpointReturnsStoredEnvelopes() throws Exception {
        start();
        post("/api/node-status", """
                {"nodeId":"nyc-1","providerHint":"comcast","state":"NY","presence":"OFFLINE","ts":"2026-03-01T12:00:00Z"}
                """);
        post("/api/node-status", "[]");

        JsonNode all = json(get("/api/events"));
        assertTrue(all.isArray());
        assertTrue(all.size() >= 3, "scope, summary and alert events expected");

        JsonNode scopes = json(get("/api/events?type=carrier_outage_scope"));
        assertEquals(1, scopes.size());
        assertEquals("carrier_outage_scope", scopes.get(0).path("type").asText());
        assertEquals("comcast", scopes.get(0).path("event").path("provider").asText());

        JsonNode limited = json(get("/api/events?limit=1"));
        assertEquals(1, limited.size());
        assertEquals("AlertRaised", limited.get(0).path("type").asText());

        assertEquals(400, get("/api/events?since=yesterday").statusCode());
    }

    private void start() throws Exception {
        JsonlEventStore eventStore = new JsonlEventStore(Files.createTempDirectory("api-events-").resolve("events.jsonl"));
        EventBus eventBus = new EventBus();
        EventCodec.subscribeAll(eventBus, eventStore::append);
        service = new AggregatorService(AggregatorConfig.defaults(), 0, eventBus, eventStore, clock);
        service.start();
    }

    private HttpResponse<String> get(String path) throws Exception {
        return client.send(HttpRequest.newBuilder(uri(path)).GET().build(), HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        return client.send(
                HttpRequest.newBuilder(uri(path)).POST(HttpRequest.BodyPublishers.ofString(body)).build(),
                HttpResponse.BodyHandlers.ofString()
        );
    }

    private URI uri(String path) {
        return URI.create("http://127.0.0.1:" + service.actualPort() + path);
    }

    private static JsonNode json(HttpResponse<String> response) throws Exception {
        return JsonUtils.objectMapper().readTree(response.body());
    }
}
