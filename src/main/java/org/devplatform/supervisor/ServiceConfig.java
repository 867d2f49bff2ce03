package org.devplatform.supervisor;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable description of one service to supervise. Owned by the caller and copied into the
 * supervisor's registry on start.
 *
 * @param name                Unique registry key.
 * @param command             Executable path or name on {@code PATH}.
 * @param args                Command arguments.
 * @param workingDirectory    Directory the child runs in.
 * @param environment         Extra environment variables, added to the supervisor's own.
 * @param healthCheck         HTTP(S) URL or shell command probed while running, or {@code null}.
 * @param healthCheckInterval Time between health probes.
 * @param startupTimeout      Health failures within this window after start are recorded but do not
 *                            trigger restarts, so an unhealthy service restarts no earlier than this.
 *                            Zero by default: the first failed check counts.
 * @param restartPolicy       When to restart automatically.
 * @param logFile             File that receives stdout and stderr, or {@code null} to log them.
 * @param ports               Informational only.
 */
public record ServiceConfig(
    String name,
    String command,
    List<String> args,
    Path workingDirectory,
    Map<String, String> environment,
    String healthCheck,
    Duration healthCheckInterval,
    Duration startupTimeout,
    RestartPolicy restartPolicy,
    Path logFile,
    List<String> ports
) {

    public ServiceConfig {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Service name must not be blank");
        }
        if (command == null || command.isBlank()) {
            throw new IllegalArgumentException("Service '" + name + "' has no command");
        }
        Objects.requireNonNull(workingDirectory, "workingDirectory");
        Objects.requireNonNull(healthCheckInterval, "healthCheckInterval");
        Objects.requireNonNull(startupTimeout, "startupTimeout");
        Objects.requireNonNull(restartPolicy, "restartPolicy");
        if (startupTimeout.isNegative()) {
            throw new IllegalArgumentException("Service '" + name + "' has a negative startup timeout");
        }
        if (healthCheckInterval.isNegative() || healthCheckInterval.isZero()) {
            throw new IllegalArgumentException("Service '" + name + "' needs a positive health check interval");
        }
        args = args == null ? List.of() : List.copyOf(args);
        environment = environment == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(environment));
        ports = ports == null ? List.of() : List.copyOf(ports);
        if (healthCheck != null && healthCheck.isBlank()) {
            healthCheck = null;
        }
    }

    public static Builder builder(final String name, final String command) {
        return new Builder(name, command);
    }

    public boolean hasHealthCheck() {
        return healthCheck != null;
    }

    public static final class Builder {
        private final String name;
        private final String command;
        private final List<String> args = new ArrayList<>();
        private Path workingDirectory = Path.of("").toAbsolutePath();
        private final Map<String, String> environment = new LinkedHashMap<>();
        private String healthCheck;
        private Duration healthCheckInterval = Duration.ofSeconds(10);
        private Duration startupTimeout = Duration.ZERO;
        private RestartPolicy restartPolicy = RestartPolicy.NEVER;
        private Path logFile;
        private final List<String> ports = new ArrayList<>();

        private Builder(final String name, final String command) {
            this.name = name;
            this.command = command;
        }

        public Builder args(final String... values) {
            args.addAll(List.of(values));
            return this;
        }

        public Builder args(final List<String> values) {
            args.addAll(values);
            return this;
        }

        public Builder workingDirectory(final Path directory) {
            this.workingDirectory = directory;
            return this;
        }

        public Builder env(final String key, final String value) {
            environment.put(key, value);
            return this;
        }

        public Builder healthCheck(final String target) {
            this.healthCheck = target;
            return this;
        }

        public Builder healthCheckInterval(final Duration interval) {
            this.healthCheckInterval = interval;
            return this;
        }

        public Builder startupTimeout(final Duration timeout) {
            this.startupTimeout = timeout;
            return this;
        }

        public Builder restartPolicy(final RestartPolicy policy) {
            this.restartPolicy = policy;
            return this;
        }

        public Builder logFile(final Path file) {
            this.logFile = file;
            return this;
        }

        public Builder ports(final List<String> values) {
            ports.addAll(values);
            return this;
        }

        public ServiceConfig build() {
            return new ServiceConfig(name, command, args, workingDirectory, environment, healthCheck,
                healthCheckInterval, startupTimeout, restartPolicy, logFile, ports);
        }
    }
}
