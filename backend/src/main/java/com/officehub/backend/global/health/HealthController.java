package com.officehub.backend.global.health;

import java.time.Clock;

import org.springframework.boot.actuate.health.CompositeHealth;
import org.springframework.boot.actuate.health.HealthComponent;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {

    private final HealthEndpoint healthEndpoint;
    private final Clock clock;

    public HealthController(HealthEndpoint healthEndpoint, Clock clock) {
        this.healthEndpoint = healthEndpoint;
        this.clock = clock;
    }

    /**
     * Liveness only; does not touch the database.
     */
    @GetMapping({"/health", "/healthz"})
    public HealthResponse healthz() {
        return new HealthResponse("UP", clock.instant().toString());
    }

    /**
     * Readiness follows the database indicator when one is present.
     */
    @GetMapping("/readyz")
    public HealthResponse readyz() {
        HealthComponent health = healthEndpoint.health();
        String status = health.getStatus().getCode();
        if (health instanceof CompositeHealth composite) {
            HealthComponent db = composite.getComponents().get("db");
            if (db != null) {
                status = db.getStatus().getCode();
            }
        }
        return new HealthResponse(status, clock.instant().toString());
    }

    public record HealthResponse(String status, String timestamp) {
    }
}
