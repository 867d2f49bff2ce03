package org.devplatform.health;

import java.time.Duration;
import java.util.Locale;

/**
 * Dispatches a probe to HTTP or shell-command transport based on the target: URLs starting with
 * {@code http://} or {@code https://} are fetched, anything else is run as a command.
 */
public class HealthProbes implements HealthProbe {

    private final HealthProbe http;
    private final HealthProbe command;

    public HealthProbes() {
        this(new HttpHealthProbe(), new CommandHealthProbe());
    }

    public HealthProbes(final HealthProbe http, final HealthProbe command) {
        this.http = http;
        this.command = command;
    }

    @Override
    public HealthStatus probe(final String target, final Duration timeout) {
        return isHttp(target) ? http.probe(target, timeout) : command.probe(target, timeout);
    }

    public static boolean isHttp(final String target) {
        final String lower = target.trim().toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://");
    }
}
