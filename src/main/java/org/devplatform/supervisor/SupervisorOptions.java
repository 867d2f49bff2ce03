package org.devplatform.supervisor;

import com.typesafe.config.Config;

import java.time.Duration;

/**
 * Timing settings of the {@link ProcessSupervisor}.
 *
 * @param gracePeriod   Wait after a graceful termination signal before killing.
 * @param settleDelay   Pause between stop and start during a restart.
 * @param forceKillWait Wait for a killed process to be reaped.
 * @param healthTimeout Upper bound for one health probe.
 */
public record SupervisorOptions(Duration gracePeriod, Duration settleDelay, Duration forceKillWait, Duration healthTimeout) {

    public static final SupervisorOptions DEFAULTS = new SupervisorOptions(
        Duration.ofSeconds(5), Duration.ofSeconds(1), Duration.ofSeconds(5), Duration.ofSeconds(5));

    /**
     * Reads the {@code supervisor} block; missing keys keep their defaults.
     */
    public static SupervisorOptions fromConfig(final Config options) {
        return new SupervisorOptions(
            duration(options, "grace-period", DEFAULTS.gracePeriod),
            duration(options, "settle-delay", DEFAULTS.settleDelay),
            duration(options, "force-kill-wait", DEFAULTS.forceKillWait),
            duration(options, "health-timeout", DEFAULTS.healthTimeout));
    }

    private static Duration duration(final Config options, final String path, final Duration fallback) {
        return options.hasPath(path) ? options.getDuration(path) : fallback;
    }
}
