package org.devplatform.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigValue;
import org.devplatform.health.HealthCheck;
import org.devplatform.supervisor.RestartPolicy;
import org.devplatform.supervisor.ServiceConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Reads the service manifest from the {@code services} block of the workspace configuration.
 *
 * <h3>Manifest Structure:</h3>
 * <pre>
 * services {
 *   api {
 *     command = "./gradlew"
 *     args = ["run"]
 *     working-dir = "api"                       # relative to the workspace root
 *     env { PORT = "8080" }
 *     health-check = "http://localhost:8080/health"   # or a shell command
 *     health-check-interval = 10s               # default: health.default-interval
 *     startup-timeout = 30s                     # default: supervisor.startup-timeout
 *     restart-policy = on-failure               # never | on-failure | always | unless-stopped
 *     log-file = "logs/api.log"                 # default: logs.directory/&lt;name&gt;.log
 *     ports = [8080]
 *   }
 * }
 * </pre>
 *
 * Malformed entries fail the whole load with a {@link ConfigException}, before any service starts.
 */
public class ManifestLoader {

    private static final Logger log = LoggerFactory.getLogger(ManifestLoader.class);
    private static final String SERVICES_PATH = "services";

    private final Config config;
    private final Path workspaceRoot;
    private final Duration defaultInterval;
    private final Duration defaultTimeout;
    private final int defaultRetries;
    private final Duration defaultStartupTimeout;
    private final Path logDirectory;

    public ManifestLoader(final Config config, final Path workspaceRoot) {
        this.config = config;
        this.workspaceRoot = workspaceRoot.toAbsolutePath().normalize();
        this.defaultInterval = durationOr(config, "health.default-interval", Duration.ofSeconds(10));
        this.defaultTimeout = durationOr(config, "health.default-timeout", Duration.ofSeconds(5));
        this.defaultRetries = config.hasPath("health.default-retries") ? config.getInt("health.default-retries") : 3;
        this.defaultStartupTimeout = durationOr(config, "supervisor.startup-timeout", Duration.ZERO);
        this.logDirectory = this.workspaceRoot.resolve(
            config.hasPath("logs.directory") ? config.getString("logs.directory") : ".logs");
    }

    /**
     * @return every service in the manifest, sorted by name.
     */
    public List<ServiceConfig> services() {
        final List<ServiceConfig> result = new ArrayList<>();
        if (!config.hasPath(SERVICES_PATH)) {
            log.debug("No services configured.");
            return result;
        }
        final Config servicesConfig = config.getConfig(SERVICES_PATH);
        for (final String name : new TreeSet<>(config.getObject(SERVICES_PATH).keySet())) {
            result.add(service(name, servicesConfig.getConfig(quote(name))));
        }
        log.debug("Loaded {} service definitions", result.size());
        return result;
    }

    public Optional<ServiceConfig> service(final String name) {
        return services().stream().filter(s -> s.name().equals(name)).findFirst();
    }

    /**
     * Health checks of every service that declares a target, keyed by service name, for the
     * standalone {@link org.devplatform.health.HealthMonitor}.
     */
    public Map<String, HealthCheck> healthChecks() {
        final Map<String, HealthCheck> checks = new LinkedHashMap<>();
        if (!config.hasPath(SERVICES_PATH)) {
            return checks;
        }
        final Config servicesConfig = config.getConfig(SERVICES_PATH);
        for (final ServiceConfig service : services()) {
            if (!service.hasHealthCheck()) {
                continue;
            }
            final Config definition = servicesConfig.getConfig(quote(service.name()));
            final Duration timeout = durationOr(definition, "health-check-timeout", defaultTimeout);
            final int retries = definition.hasPath("health-check-retries")
                ? definition.getInt("health-check-retries") : defaultRetries;
            checks.put(service.name(),
                new HealthCheck(service.healthCheck(), service.healthCheckInterval(), timeout, retries));
        }
        return checks;
    }

    public Path logDirectory() {
        return logDirectory;
    }

    private ServiceConfig service(final String name, final Config definition) {
        final ServiceConfig.Builder builder = ServiceConfig.builder(name, definition.getString("command"))
            .workingDirectory(definition.hasPath("working-dir")
                ? workspaceRoot.resolve(definition.getString("working-dir")).normalize()
                : workspaceRoot)
            .healthCheckInterval(durationOr(definition, "health-check-interval", defaultInterval))
            .startupTimeout(durationOr(definition, "startup-timeout", defaultStartupTimeout))
            .logFile(definition.hasPath("log-file")
                ? workspaceRoot.resolve(definition.getString("log-file")).normalize()
                : logDirectory.resolve(name + ".log"));

        if (definition.hasPath("args")) {
            builder.args(definition.getStringList("args"));
        }
        if (definition.hasPath("env")) {
            for (final Map.Entry<String, ConfigValue> entry : definition.getObject("env").entrySet()) {
                builder.env(entry.getKey(), String.valueOf(entry.getValue().unwrapped()));
            }
        }
        if (definition.hasPath("health-check")) {
            builder.healthCheck(definition.getString("health-check"));
        }
        if (definition.hasPath("restart-policy")) {
            try {
                builder.restartPolicy(RestartPolicy.fromString(definition.getString("restart-policy")));
            } catch (final IllegalArgumentException e) {
                throw new ConfigException.BadValue(definition.origin(), "restart-policy", e.getMessage(), e);
            }
        }
        if (definition.hasPath("ports")) {
            final List<String> ports = new ArrayList<>();
            definition.getList("ports").forEach(v -> ports.add(String.valueOf(v.unwrapped())));
            builder.ports(ports);
        }
        try {
            return builder.build();
        } catch (final IllegalArgumentException e) {
            throw new ConfigException.BadValue(definition.origin(), SERVICES_PATH + "." + name, e.getMessage(), e);
        }
    }

    private static String quote(final String key) {
        return "\"" + key.replace("\"", "\\\"") + "\"";
    }

    private static Duration durationOr(final Config config, final String path, final Duration fallback) {
        return config.hasPath(path) ? config.getDuration(path) : fallback;
    }
}
