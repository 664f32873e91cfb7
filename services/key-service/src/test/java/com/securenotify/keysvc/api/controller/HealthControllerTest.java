package com.securenotify.keysvc.api.controller;

import com.securenotify.keysvc.config.GracefulShutdownConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class HealthControllerTest {

    private final GracefulShutdownConfig shutdown = new GracefulShutdownConfig();

    @Test
    @DisplayName("Ready when the database is up, even with the rate limit circuit open")
    void readyWithOpenCircuit() {
        HealthController controller = new HealthController(
                () -> Health.up().withDetail("database", "PostgreSQL").build(),
                () -> Health.down().withDetail("mode", "fail-closed").build(),
                shutdown);

        ResponseEntity<Map<String, Object>> response = controller.ready();

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).containsEntry("status", "UP");
        assertThat(response.getBody().get("rateLimitStore").toString()).contains("DOWN", "fail-closed");
    }

    @Test
    @DisplayName("Not ready when the database is down")
    void notReadyWithoutDatabase() {
        HealthController controller = new HealthController(
                () -> Health.down().withDetail("error", "refused").build(),
                () -> Health.up().build(),
                shutdown);

        assertThat(controller.ready().getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    }

    @Test
    @DisplayName("Not ready once shutdown has begun")
    void notReadyWhileDraining() {
        HealthController controller = new HealthController(
                () -> Health.up().build(), () -> Health.up().build(), shutdown);
        shutdown.markDraining();

        ResponseEntity<Map<String, Object>> response = controller.ready();

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody()).containsEntry("draining", true);
    }
}
