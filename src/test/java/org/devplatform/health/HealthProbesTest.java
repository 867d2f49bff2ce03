package org.devplatform.health;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Tag("unit")
class HealthProbesTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(2);

    @Test
    @DisplayName("URLs go to the HTTP probe and everything else to the command probe")
    void probe_dispatchesByTarget() {
        final HealthProbe http = mock(HealthProbe.class);
        final HealthProbe command = mock(HealthProbe.class);
        when(http.probe("https://example.test/health", TIMEOUT)).thenReturn(HealthStatus.HEALTHY);
        final HealthProbes probes = new HealthProbes(http, command);

        assertThat(probes.probe("https://example.test/health", TIMEOUT)).isEqualTo(HealthStatus.HEALTHY);
        verify(command, never()).probe("https://example.test/health", TIMEOUT);
        assertThat(HealthProbes.isHttp("HTTP://localhost")).isTrue();
        assertThat(HealthProbes.isHttp("pg_isready")).isFalse();
    }

    @Test
    @DisplayName("Status codes map to health states")
    void classify_statusCodes() {
        assertThat(HttpHealthProbe.classify(204)).isEqualTo(HealthStatus.HEALTHY);
        assertThat(HttpHealthProbe.classify(302).state()).isEqualTo(HealthStatus.State.DEGRADED);
        assertThat(HttpHealthProbe.classify(500)).isEqualTo(HealthStatus.unhealthy("Server error: 500"));
    }

    @Test
    @DisplayName("Command exit code decides health")
    void commandProbe_exitCode() {
        final CommandHealthProbe probe = new CommandHealthProbe();

        assertThat(probe.probe("exit 0", TIMEOUT)).isEqualTo(HealthStatus.HEALTHY);
        assertThat(probe.probe("exit 3", TIMEOUT)).isEqualTo(HealthStatus.unhealthy("Command exited with code 3"));
    }

    @Test
    @DisplayName("A command that outlives its timeout fails the probe")
    void commandProbe_timeout() {
        assertThatThrownBy(() -> new CommandHealthProbe().probe("sleep 5", Duration.ofMillis(200)))
            .isInstanceOf(HealthCheckException.class);
    }
}
