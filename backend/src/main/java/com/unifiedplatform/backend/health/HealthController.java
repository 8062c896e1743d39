package com.unifiedplatform.backend.health;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

import org.springframework.boot.actuate.health.CompositeHealth;
import org.springframework.boot.actuate.health.HealthComponent;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.boot.actuate.health.Status;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness, readiness and store diagnostics.
 */
@RestController
public class HealthController {

    static final String BANNER = "Unified Platform Backend Running";

    private final HealthEndpoint healthEndpoint;
    private final StoreDiagnostics storeDiagnostics;
    private final Clock clock;

    public HealthController(HealthEndpoint healthEndpoint, StoreDiagnostics storeDiagnostics, Clock clock) {
        this.healthEndpoint = healthEndpoint;
        this.storeDiagnostics = storeDiagnostics;
        this.clock = clock;
    }

    @GetMapping("/")
    public RootResponse root() {
        return new RootResponse(BANNER);
    }

    @GetMapping("/healthz")
    public HealthResponse healthz() {
        return new HealthResponse(Status.UP.getCode(), now());
    }

    /**
     * Ready once the database health indicator reports UP.
     */
    @GetMapping("/readyz")
    public ResponseEntity<HealthResponse> readyz() {
        String status;
        try {
            HealthComponent health = healthEndpoint.health();
            status = health.getStatus().getCode();
            if (health instanceof CompositeHealth composite) {
                HealthComponent db = composite.getComponents().get("db");
                if (db != null) {
                    status = db.getStatus().getCode();
                }
            }
        } catch (RuntimeException ex) {
            status = Status.DOWN.getCode();
        }
        HttpStatus httpStatus = Status.UP.getCode().equals(status) ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(httpStatus).body(new HealthResponse(status, now()));
    }

    @GetMapping("/test")
    public DiagnosticsResponse diagnostics() {
        StoreDiagnostics.Probe probe = storeDiagnostics.probe();
        return new DiagnosticsResponse(
                "running",
                probe.connected() ? "connected" : "unavailable",
                probe.urlConfigured() ? "set" : "not_set",
                probe.connected() ? "Connected" : "Not Connected",
                probe.tables(),
                probe.error()
        );
    }

    private String now() {
        return Instant.now(clock).toString();
    }

    public record RootResponse(String message) {
    }

    public record HealthResponse(
            String status,
            String timestamp
    ) {
    }

    public record DiagnosticsResponse(
            String backend,
            String database,
            String databaseUrl,
            String connectionStatus,
            List<String> collections,
            String error
    ) {
    }
}
