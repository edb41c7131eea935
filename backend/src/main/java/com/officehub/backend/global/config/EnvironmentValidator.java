package com.officehub.backend.global.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.stereotype.Component;

/**
 * Fails startup when a required setting is missing or unusable.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String DEFAULT_DEV_SECRET = "officehub-dev-secret-change-me-officehub-dev-secret";

    private static final String[] REQUIRED_PROPERTIES = {
            "spring.datasource.url",
            "jwt.secret",
            "jwt.expiration",
            "app.office-zone"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = collectProblems();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Configuration problem: {}", problem));
            throw new IllegalStateException("Invalid configuration: " + String.join("; ", problems));
        }
        if (environment.acceptsProfiles(Profiles.of("prod"))
                && DEFAULT_DEV_SECRET.equals(environment.getProperty("jwt.secret"))) {
            throw new IllegalStateException("jwt.secret must be overridden in the prod profile");
        }
        log.info("Environment validated");
    }

    List<String> collectProblems() {
        List<String> problems = new ArrayList<>();
        for (String property : REQUIRED_PROPERTIES) {
            Optional<String> value = Optional.ofNullable(environment.getProperty(property));
            if (value.map(String::trim).orElse("").isEmpty()) {
                problems.add(property + " is missing");
            }
        }

        Optional.ofNullable(environment.getProperty("jwt.expiration")).ifPresent(raw -> {
            try {
                long expiration = Long.parseLong(raw.trim());
                if (expiration < 300_000 || expiration > 86_400_000) {
                    problems.add("jwt.expiration must be between 300000 and 86400000 ms");
                }
            } catch (NumberFormatException ex) {
                problems.add("jwt.expiration must be numeric");
            }
        });

        Optional.ofNullable(environment.getProperty("jwt.secret"))
                .filter(secret -> !secret.isBlank() && secret.length() < 32)
                .ifPresent(secret -> problems.add("jwt.secret must be at least 32 characters"));
        return problems;
    }
}
