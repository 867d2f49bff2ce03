package org.devplatform.health;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * Probes an HTTP(S) endpoint with a single GET.
 * <ul>
 *   <li>2xx: {@code HEALTHY}</li>
 *   <li>5xx: {@code UNHEALTHY}</li>
 *   <li>anything else: {@code DEGRADED}</li>
 * </ul>
 * Connection failures and timeouts raise {@link HealthCheckException}.
 */
public class HttpHealthProbe implements HealthProbe {

    private final HttpClient client;

    public HttpHealthProbe() {
        this(HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build());
    }

    public HttpHealthProbe(final HttpClient client) {
        this.client = client;
    }

    @Override
    public HealthStatus probe(final String target, final Duration timeout) {
        final HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(target))
                .timeout(timeout)
                .GET()
                .build();
        } catch (final IllegalArgumentException e) {
            throw new HealthCheckException("Invalid health check URL '" + target + "': " + e.getMessage(), e);
        }

        try {
            final HttpResponse<Void> response = client.send(request, HttpResponse.BodyHandlers.discarding());
            return classify(response.statusCode());
        } catch (final HttpTimeoutException e) {
            throw new HealthCheckException("Timed out after " + timeout.toMillis() + " ms", e);
        } catch (final IOException e) {
            throw new HealthCheckException("Connection error: " + describe(e), e);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HealthCheckException("Interrupted while probing " + target, e);
        }
    }

    static HealthStatus classify(final int statusCode) {
        if (statusCode >= 200 && statusCode < 300) {
            return HealthStatus.HEALTHY;
        }
        if (statusCode >= 500) {
            return HealthStatus.unhealthy("Server error: " + statusCode);
        }
        return HealthStatus.degraded("Status: " + statusCode);
    }

    private static String describe(final IOException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
