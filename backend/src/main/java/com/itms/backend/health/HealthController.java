package com.itms.backend.health;

import java.time.Clock;
import java.time.Instant;

import org.springframework.boot.actuate.health.CompositeHealth;
import org.springframework.boot.actuate.health.HealthComponent;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.boot.actuate.health.Status;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness and readiness probes.
 */
@RestController
public class HealthController {

    private static final String SERVICE_NAME = "itms-backend";

    private final HealthEndpoint healthEndpoint;
    private final Clock clock;

    public HealthController(HealthEndpoint healthEndpoint, Clock clock) {
        this.healthEndpoint = healthEndpoint;
        this.clock = clock;
    }

    /**
     * Liveness only: the process answers.
     */
    @GetMapping("/healthz")
    public HealthResponse healthz() {
        return new HealthResponse(Status.UP.getCode(), SERVICE_NAME, now());
    }

    /**
     * Readiness follows the database indicator; 503 while it is not UP.
     */
    @GetMapping("/readyz")
    public ResponseEntity<HealthResponse> readyz() {
        String status;
        try {
            HealthComponent healthComponent = healthEndpoint.health();
            status = healthComponent.getStatus().getCode();
            if (healthComponent instanceof CompositeHealth composite) {
                HealthComponent db = composite.getComponents().get("db");
                if (db != null) {
                    status = db.getStatus().getCode();
                }
            }
        } catch (RuntimeException e) {
            status = Status.DOWN.getCode();
        }
        HttpStatus httpStatus = Status.UP.getCode().equals(status) ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(httpStatus).body(new HealthResponse(status, SERVICE_NAME, now()));
    }

    @GetMapping("/health")
    public HealthResponse health() {
        return healthz();
    }

    private String now() {
        return Instant.now(clock).toString();
    }

    public record HealthResponse(
            String status,
            String service,
            String timestamp
    ) {
    }
}
