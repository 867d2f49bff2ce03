package org.devplatform.supervisor;

import io.javalin.Javalin;
import org.devplatform.health.HealthProbes;
import org.devplatform.health.HealthStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

@Tag("integration")
class HealthPollingIntegrationTest {

    private static final SupervisorOptions OPTIONS = new SupervisorOptions(
        Duration.ofMillis(500), Duration.ofMillis(50), Duration.ofSeconds(2), Duration.ofMillis(200));

    @TempDir
    Path tempDir;

    private Javalin server;
    private final AtomicInteger okHits = new AtomicInteger();
    private ProcessSupervisor supervisor;
    private final List<HealthStatus> healthChanges = new CopyOnWriteArrayList<>();
    private final List<ProcessState> stateChanges = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        server = Javalin.create()
            .get("/ok", ctx -> {
                okHits.incrementAndGet();
                ctx.status(200);
            })
            .get("/slow", ctx -> {
                Thread.sleep(1000);
                ctx.status(200);
            })
            .start(0);

        supervisor = new ProcessSupervisor(OPTIONS, new HealthProbes(), null);
        supervisor.addListener(new ServiceStateListener() {
            @Override
            public void onStateChange(final String service, final ProcessState from, final ProcessState to) {
                stateChanges.add(to);
            }

            @Override
            public void onHealthChange(final String service, final HealthStatus status) {
                healthChanges.add(status);
            }
        });
    }

    @AfterEach
    void tearDown() {
        supervisor.close();
        server.stop();
    }

    private ServiceConfig service(final String path, final RestartPolicy policy) {
        return ServiceConfig.builder("api", "sh")
            .args("-c", "sleep 30")
            .workingDirectory(tempDir)
            .healthCheck("http://localhost:" + server.port() + path)
            .healthCheckInterval(Duration.ofMillis(200))
            .restartPolicy(policy)
            .build();
    }

    private ServiceSnapshot status() {
        return supervisor.status("api").orElseThrow();
    }

    @Test
    @DisplayName("A timing-out health check under ON_FAILURE goes UNHEALTHY, then RESTARTING, then runs again")
    void unhealthyServiceIsRestarted() {
        supervisor.start(service("/slow", RestartPolicy.ON_FAILURE));

        await().atMost(Duration.ofSeconds(10)).untilAsserted(() -> {
            final ServiceSnapshot snapshot = status();
            assertThat(snapshot.restartCount()).isGreaterThanOrEqualTo(1);
            assertThat(snapshot.state()).isEqualTo(ProcessState.RUNNING);
        });
        assertThat(healthChanges).anyMatch(s -> s.state() == HealthStatus.State.UNHEALTHY);
        assertThat(stateChanges).contains(ProcessState.RESTARTING);
        assertThat(stateChanges.indexOf(ProcessState.RESTARTING))
            .isLessThan(stateChanges.lastIndexOf(ProcessState.RUNNING));
    }

    @Test
    @DisplayName("Under NEVER an unhealthy service is reported but not restarted")
    void unhealthyServiceWithoutPolicyKeepsRunning() throws InterruptedException {
        supervisor.start(service("/slow", RestartPolicy.NEVER));

        await().atMost(Duration.ofSeconds(5)).until(() -> status().health().state() == HealthStatus.State.UNHEALTHY);
        Thread.sleep(500);

        assertThat(status().restartCount()).isZero();
        assertThat(status().state()).isEqualTo(ProcessState.RUNNING);
        assertThat(stateChanges).doesNotContain(ProcessState.RESTARTING);
    }

    @Test
    @DisplayName("A healthy service is recorded healthy and never restarted")
    void healthyServiceIsLeftAlone() throws InterruptedException {
        supervisor.start(service("/ok", RestartPolicy.ALWAYS));

        await().atMost(Duration.ofSeconds(5)).until(() -> status().health().isHealthy());
        Thread.sleep(500);

        assertThat(status().restartCount()).isZero();
        assertThat(status().lastHealthCheck()).isNotNull();
    }

    @Test
    @DisplayName("Failures within the startup window do not restart the service")
    void startupWindowSuppressesRestart() throws InterruptedException {
        supervisor.start(ServiceConfig.builder("api", "sh")
            .args("-c", "sleep 30")
            .workingDirectory(tempDir)
            .healthCheck("http://localhost:" + server.port() + "/slow")
            .healthCheckInterval(Duration.ofMillis(200))
            .startupTimeout(Duration.ofSeconds(30))
            .restartPolicy(RestartPolicy.ON_FAILURE)
            .build());

        await().atMost(Duration.ofSeconds(5)).until(() -> status().health().state() == HealthStatus.State.UNHEALTHY);

        assertThat(status().restartCount()).isZero();
    }

    @Test
    @DisplayName("Polling ends when the service is stopped")
    void pollingStopsWithService() throws InterruptedException {
        supervisor.start(service("/ok", RestartPolicy.NEVER));
        await().atMost(Duration.ofSeconds(5)).until(() -> okHits.get() >= 2);

        supervisor.stop("api", false);
        Thread.sleep(100);
        final int hitsAfterStop = okHits.get();
        Thread.sleep(600);

        assertThat(okHits.get()).isEqualTo(hitsAfterStop);
    }

    @Test
    @DisplayName("Shell command targets are probed as well")
    void commandHealthCheck() {
        supervisor.start(ServiceConfig.builder("api", "sh")
            .args("-c", "sleep 30")
            .workingDirectory(tempDir)
            .healthCheck("exit 0")
            .healthCheckInterval(Duration.ofMillis(100))
            .build());

        await().atMost(Duration.ofSeconds(5)).until(() -> status().health().isHealthy());
    }
}
