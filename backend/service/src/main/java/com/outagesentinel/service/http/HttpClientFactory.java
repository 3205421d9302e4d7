package com.outagesentinel.service.http;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * One client per process, shared by probes and the node status publisher. Redirects are
 * followed so a provider landing page that moves still counts as reachable.
 */
public final class HttpClientFactory {
    private HttpClientFactory() {
    }

    public static HttpClient create(Duration connectTimeout) {
        return HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }
}
