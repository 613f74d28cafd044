package com.libraria.backend.global.config;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Fails startup when required settings are missing or out of range.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);
    private static final String DEV_JWT_SECRET = "dev-jwt-secret-key-change-in-production-2025";

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> missingVars = new ArrayList<>();
        List<String> invalidVars = new ArrayList<>();

        String[] requiredVars = {
            "spring.datasource.url",
            "jwt.secret",
            "jwt.expiration",
            "app.cors.allowed-origins"
        };

        for (String var : requiredVars) {
            Optional<String> value = Optional.ofNullable(environment.getProperty(var));
            if (value.isEmpty() || value.map(String::trim).orElse("").isEmpty()) {
                missingVars.add(var);
            }
        }

        if (environment.matchesProfiles("prod")
                && DEV_JWT_SECRET.equals(environment.getProperty("jwt.secret"))) {
            invalidVars.add("jwt.secret: replace the development default with a random secret");
        }

        Optional.ofNullable(environment.getProperty("jwt.expiration")).ifPresent(raw -> {
            try {
                long expiration = Long.parseLong(raw);
                if (expiration < 300000 || expiration > 86400000) {
                    invalidVars.add("jwt.expiration: must be between 300000 and 86400000 ms");
                }
            } catch (NumberFormatException e) {
                invalidVars.add("jwt.expiration: must be numeric");
            }
        });

        Optional.ofNullable(environment.getProperty("app.loan.daily-fine-rate")).ifPresent(raw -> {
            try {
                if (new BigDecimal(raw).signum() < 0) {
                    invalidVars.add("app.loan.daily-fine-rate: must not be negative");
                }
            } catch (NumberFormatException e) {
                invalidVars.add("app.loan.daily-fine-rate: must be a decimal amount");
            }
        });

        if (!missingVars.isEmpty() || !invalidVars.isEmpty()) {
            if (!missingVars.isEmpty()) {
                log.error("Missing required settings: {}", String.join(", ", missingVars));
            }
            invalidVars.forEach(v -> log.error("Invalid setting: {}", v));
            throw new IllegalStateException("Environment validation failed");
        }

        log.info("Environment validation passed");
    }
}
