package com.itms.backend.global.config;

import java.time.Duration;
import java.time.format.DateTimeParseException;
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
 * Fails startup when a required setting is missing or out of range.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String DEFAULT_DEV_SECRET = "dev-itms-jwt-secret-change-me-before-deploying-2025";
    private static final long MIN_JWT_EXPIRATION_MILLIS = 300_000L;
    private static final long MAX_JWT_EXPIRATION_MILLIS = 86_400_000L;

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = collectProblems();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Invalid configuration: {}", problem));
            throw new IllegalStateException("Configuration validation failed: " + String.join("; ", problems));
        }
        log.info("Configuration validated");
    }

    List<String> collectProblems() {
        List<String> problems = new ArrayList<>();

        String[] requiredKeys = {
                "spring.datasource.url",
                "jwt.secret",
                "jwt.expiration",
                "app.cors.allowed-origins"
        };
        for (String key : requiredKeys) {
            if (property(key).isEmpty()) {
                problems.add(key + " is required");
            }
        }

        boolean productionProfile = environment.acceptsProfiles(Profiles.of("prod"));
        if (productionProfile && property("jwt.secret").filter(DEFAULT_DEV_SECRET::equals).isPresent()) {
            problems.add("jwt.secret must be replaced with a random value in production");
        }

        property("jwt.expiration").ifPresent(raw -> {
            try {
                long expiration = Long.parseLong(raw);
                if (expiration < MIN_JWT_EXPIRATION_MILLIS || expiration > MAX_JWT_EXPIRATION_MILLIS) {
                    problems.add("jwt.expiration must be between 300000 and 86400000 milliseconds");
                }
            } catch (NumberFormatException e) {
                problems.add("jwt.expiration must be a number");
            }
        });

        property("app.booking.sweep-interval").ifPresent(raw -> {
            try {
                Duration interval = Duration.parse(raw);
                if (interval.isNegative() || interval.isZero()) {
                    problems.add("app.booking.sweep-interval must be positive");
                }
            } catch (DateTimeParseException e) {
                problems.add("app.booking.sweep-interval must be an ISO-8601 duration");
            }
        });
        return problems;
    }

    private Optional<String> property(String key) {
        return Optional.ofNullable(environment.getProperty(key))
                .map(String::trim)
                .filter(value -> !value.isEmpty());
    }
}
