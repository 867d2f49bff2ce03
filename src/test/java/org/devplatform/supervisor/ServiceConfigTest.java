package org.devplatform.supervisor;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ServiceConfigTest {

    @Test
    @DisplayName("Builder defaults leave health-driven restarts undelayed")
    void builder_defaults() {
        final ServiceConfig config = ServiceConfig.builder("api", "sh").build();

        assertThat(config.startupTimeout()).isZero();
        assertThat(config.healthCheckInterval()).isEqualTo(Duration.ofSeconds(10));
        assertThat(config.restartPolicy()).isEqualTo(RestartPolicy.NEVER);
        assertThat(config.hasHealthCheck()).isFalse();
        assertThat(config.logFile()).isNull();
    }

    @Test
    @DisplayName("Invalid definitions are rejected")
    void constructor_validation() {
        assertThatThrownBy(() -> ServiceConfig.builder(" ", "sh").build())
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ServiceConfig.builder("api", "").build())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("api");
        assertThatThrownBy(() -> ServiceConfig.builder("api", "sh").healthCheckInterval(Duration.ZERO).build())
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ServiceConfig.builder("api", "sh").startupTimeout(Duration.ofSeconds(-1)).build())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("startup timeout");
    }

    @Test
    @DisplayName("A blank health check target means no health check")
    void blankHealthCheck() {
        assertThat(ServiceConfig.builder("api", "sh").healthCheck("  ").build().hasHealthCheck()).isFalse();
    }
}
