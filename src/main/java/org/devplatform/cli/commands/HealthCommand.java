package org.devplatform.cli.commands;

import org.devplatform.cli.CommandLineInterface;
import org.devplatform.config.ManifestLoader;
import org.devplatform.health.HealthCheck;
import org.devplatform.health.HealthMonitor;
import org.devplatform.health.ServiceHealth;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.Callable;

@Command(
    name = "health",
    description = "Probes every configured health check once. Exits with 1 if any service is unhealthy."
)
public class HealthCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Override
    public Integer call() {
        final Map<String, HealthCheck> checks =
            new ManifestLoader(parent.getConfig(), parent.getWorkspaceRoot()).healthChecks();
        if (checks.isEmpty()) {
            System.out.println("No health checks configured.");
            return 0;
        }

        try (HealthMonitor monitor = new HealthMonitor()) {
            checks.forEach(monitor::register);
            monitor.checkAll();

            System.out.printf("%-20s %-40s %s%n", "SERVICE", "STATUS", "LATENCY");
            for (final ServiceHealth health : new TreeMap<>(monitor.allHealth()).values()) {
                final String latency = health.responseTime() != null ? health.responseTime().toMillis() + " ms" : "-";
                System.out.printf("%-20s %-40s %s%n", health.name(), health.status(), latency);
            }

            final List<String> unhealthy = monitor.unhealthyServices();
            if (!unhealthy.isEmpty()) {
                System.err.println("Unhealthy: " + String.join(", ", unhealthy));
                return 1;
            }
            return 0;
        }
    }
}
