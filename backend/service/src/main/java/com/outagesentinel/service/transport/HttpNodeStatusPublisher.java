package com.outagesentinel.service.transport;

import com.outagesentinel.aggregator.codec.NodeStatusCodec;
import com.outagesentinel.core.bus.EventBus;
import com.outagesentinel.core.events.AlertRaised;
import com.outagesentinel.core.model.NodeStatus;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Sends this node's status to an aggregator. Delivery is best effort: a failed post is
 * logged and raised as an alert, and the detector run carries on.
 */
public class HttpNodeStatusPublisher {
    private static final Logger LOGGER = Logger.getLogger(HttpNodeStatusPublisher.class.getName());
    static final String NODE_STATUS_PATH = "/api/node-status";

    private final HttpClient httpClient;
    private final String aggregatorUrl;
    private final Duration timeout;
    private final EventBus eventBus;
    private final Clock clock;

    public HttpNodeStatusPublisher(HttpClient httpClient, String aggregatorUrl, Duration timeout, EventBus eventBus, Clock clock) {
        this.httpClient = httpClient;
        this.aggregatorUrl = Objects.requireNonNull(aggregatorUrl, "aggregatorUrl is required");
        this.timeout = timeout;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    static URI endpointFor(String aggregatorUrl) {
        String base = aggregatorUrl.endsWith("/")
                ? aggregatorUrl.substring(0, aggregatorUrl.length() - 1)
                : aggregatorUrl;
        return URI.create(base + NODE_STATUS_PATH);
    }

    /**
     * Returns whether the aggregator accepted the status. A URL the client cannot use is
     * reported like any other delivery failure.
     */
    public boolean publish(NodeStatus status) {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(endpointFor(aggregatorUrl))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(NodeStatusCodec.encode(status), StandardCharsets.UTF_8))
                    .build();
        } catch (IllegalArgumentException e) {
            return fail(status, "invalid_url: " + e.getMessage());
        }
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() / 100 == 2) {
                LOGGER.fine(() -> "Published status for " + status.nodeId() + " to " + aggregatorUrl);
                return true;
            }
            return fail(status, "HTTP " + response.statusCode());
        } catch (IOException e) {
            return fail(status, e.getClass().getSimpleName() + ": " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return fail(status, "interrupted");
        }
    }

    private boolean fail(NodeStatus status, String reason) {
        LOGGER.warning(() -> "Could not publish status for " + status.nodeId() + " to " + aggregatorUrl + ": " + reason);
        eventBus.publish(new AlertRaised(
                clock.instant(),
                "transport",
                "Node status not delivered",
                Map.of("nodeId", status.nodeId(), "aggregatorUrl", aggregatorUrl, "reason", reason)
        ));
        return false;
    }
}
