package org.devplatform.health;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Probes by running a shell command through {@code sh -c}. Exit code 0 is healthy, anything
 * else is unhealthy. A command that outlives the timeout is killed.
 */
public class CommandHealthProbe implements HealthProbe {

    private static final String SHELL = "sh";

    @Override
    public HealthStatus probe(final String target, final Duration timeout) {
        final ProcessBuilder builder = new ProcessBuilder(SHELL, "-c", target)
            .redirectErrorStream(true)
            .redirectOutput(ProcessBuilder.Redirect.DISCARD);

        final Process process;
        try {
            process = builder.start();
        } catch (final IOException e) {
            throw new HealthCheckException("Failed to run health check command: " + e.getMessage(), e);
        }

        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new HealthCheckException("Health check command timed out after " + timeout.toMillis() + " ms");
            }
        } catch (final InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new HealthCheckException("Interrupted while running health check command", e);
        }

        final int exitCode = process.exitValue();
        return exitCode == 0
            ? HealthStatus.HEALTHY
            : HealthStatus.unhealthy("Command exited with code " + exitCode);
    }
}
