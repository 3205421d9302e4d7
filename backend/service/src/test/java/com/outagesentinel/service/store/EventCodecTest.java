package com.outagesentinel.service.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.outagesentinel.core.events.AlertRaised;
import com.outagesentinel.core.events.Event;
import com.outagesentinel.core.events.OutageScopeChanged;
import com.outagesentinel.core.events.ProviderOutageReported;
import com.outagesentinel.core.model.ProviderScopeSummary;
import com.outagesentinel.core.model.ProviderState;
import com.outagesentinel.core.model.ProviderType;
import com.outagesentinel.core.model.Scope;
import com.outagesentinel.core.model.Severity;
import com.outagesentinel.core.model.Signal;
import com.outagesentinel.core.util.JsonUtils;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventCodecTest {
    private static final Instant TS = Instant.parse("2026-03-01T12:00:00Z");

    @Test
    void outageLineCarriesEnvelopeAndWireNames() throws Exception {
        Map<String, ProviderState> groups = new LinkedHashMap<>();
        groups.put("mobile", ProviderState.DEGRADED);
        groups.put("isp", ProviderState.OK);
        groups.put("cloud", ProviderState.OK);
        ProviderOutageReported event = new ProviderOutageReported(
                TS,
                "us-east",
                "verizon",
                ProviderType.MOBILE,
                ProviderState.DEGRADED,
                ProviderState.MAJOR_OUTAGE,
                0.65,
                List.of(Signal.passed("control:https://c.example", 40, "HTTP 204"),
                        Signal.failed("dns:verizon.example", 5000, "timeout")),
                TS.minusSeconds(600),
                TS,
                groups
        );

        String line = EventCodec.toJsonLine(event);
        JsonNode node = JsonUtils.objectMapper().readTree(line);

        assertEquals("carrier_outage", node.path("type").asText());
        assertEquals("2026-03-01T12:00:00Z", node.path("timestamp").asText());
        assertEquals("mobile", node.path("event").path("providerType").asText());
        assertEquals(5000, node.path("event").path("signals").get(1).path("ms").asLong());
        assertFalse(line.contains("\n"));

        Event decoded = EventCodec.fromJsonLine(line);
        assertEquals(event, decoded);
    }

    @Test
    void scopeEventDecodesWithoutDerivedFields() {
        OutageScopeChanged event = OutageScopeChanged.of(TS, "comcast", new ProviderScopeSummary(
                Scope.STATE, Severity.MAJOR, 0.82, 3, List.of("NY")));

        String line = EventCodec.toJsonLine(event);

        assertTrue(line.contains("\"severity\":\"major\""));
        assertFalse(line.contains("\"summary\""));
        assertEquals(event, EventCodec.fromJsonLine(line));
    }

    @Test
    void rejectsUnknownTypesAndGarbage() {
        assertThrows(IllegalArgumentException.class,
                () -> EventCodec.fromJsonLine("{\"type\":\"SiteFetched\",\"timestamp\":\"2026-03-01T12:00:00Z\",\"event\":{}}"));
        assertThrows(IllegalArgumentException.class, () -> EventCodec.fromJsonLine("{oops"));
    }

    @Test
    void registersEveryEventType() {
        assertEquals(6, EventCodec.allEventTypes().size());
        assertTrue(EventCodec.typeNames().contains(AlertRaised.TYPE));
        assertTrue(EventCodec.typeNames().contains("carrier_outage_summary"));
    }
}
