package com.outagesentinel.detector.probe;

import com.outagesentinel.core.model.Signal;
import com.outagesentinel.detector.api.Probe;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * HTTP GET reachability check. Statuses 200..399 pass. Only the first few KiB of the
 * body are read, enough to force the exchange to complete on servers that stall
 * until the body is consumed.
 */
public class HttpProbe implements Probe {
    static final int MAX_BODY_BYTES = 8192;
    static final String USER_AGENT = "outage-sentinel/1.0";

    private final HttpClient httpClient;

    public HttpProbe(HttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public Signal check(String signalName, String target, Duration timeout) {
        long startedAt = System.nanoTime();
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(target))
                    .GET()
                    .timeout(timeout)
                    .header("User-Agent", USER_AGENT)
                    .header("Accept", "text/html,application/json;q=0.9,*/*;q=0.8")
                    .build();
        } catch (IllegalArgumentException invalidUrl) {
            return Signal.failed(signalName, 0, "invalid_url");
        }

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofInputStream())
                .thenApply(response -> {
                    discardBody(response.body());
                    return response.statusCode();
                })
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((status, error) -> {
                    long elapsedMillis = elapsedMillis(startedAt);
                    if (error != null) {
                        return Signal.failed(signalName, elapsedMillis, FailureDetails.describe(error));
                    }
                    if (status >= 200 && status < 400) {
                        return Signal.passed(signalName, elapsedMillis, "HTTP " + status);
                    }
                    return Signal.failed(signalName, elapsedMillis, "HTTP " + status);
                })
                .join();
    }

    private static void discardBody(InputStream body) {
        try (InputStream in = body) {
            byte[] buffer = new byte[1024];
            int remaining = MAX_BODY_BYTES;
            while (remaining > 0) {
                int read = in.read(buffer, 0, Math.min(buffer.length, remaining));
                if (read < 0) {
                    break;
                }
                remaining -= read;
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    static long elapsedMillis(long startedAtNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAtNanos);
    }
}
