package com.securenotify.keysvc.api.controller;

import com.securenotify.keysvc.config.GracefulShutdownConfig;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Plain probes for orchestrators that do not speak the actuator format.
 * Readiness needs the database and no shutdown in progress. The rate limit store state is
 * reported but does not affect readiness.
 */
@RestController
@Tag(name = "Health", description = "Liveness and readiness probes")
public class HealthController {

    private final HealthIndicator keyStore;
    private final HealthIndicator rateLimitStore;
    private final GracefulShutdownConfig shutdown;

    public HealthController(@Qualifier("keyStoreHealthIndicator") HealthIndicator keyStore,
                            @Qualifier("rateLimitStoreHealthIndicator") HealthIndicator rateLimitStore,
                            GracefulShutdownConfig shutdown) {
        this.keyStore = keyStore;
        this.rateLimitStore = rateLimitStore;
        this.shutdown = shutdown;
    }

    @GetMapping("/health")
    @Operation(summary = "Liveness probe")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "UP"));
    }

    @GetMapping("/health/ready")
    @Operation(summary = "Readiness probe", description = "Checks the database and the rate limit store")
    public ResponseEntity<Map<String, Object>> ready() {
        Health database = keyStore.health();
        Health limiter = rateLimitStore.health();
        boolean ready = !shutdown.isDraining() && Status.UP.equals(database.getStatus());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", ready ? "UP" : "DOWN");
        body.put("draining", shutdown.isDraining());
        body.put("database", summarize(database));
        body.put("rateLimitStore", summarize(limiter));
        return ResponseEntity.status(ready ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    private Map<String, Object> summarize(Health health) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("status", health.getStatus().getCode());
        summary.putAll(health.getDetails());
        return summary;
    }
}
