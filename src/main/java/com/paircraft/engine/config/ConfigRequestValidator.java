package com.paircraft.engine.config;

import com.paircraft.engine.config.dto.PairingConfigRequest;
import com.paircraft.engine.config.dto.TiebreakConfigRequest;
import com.paircraft.engine.error.InvalidConfigurationException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Runs Bean Validation on settings DTOs and converts them, so that every configuration
 * problem surfaces as an {@link InvalidConfigurationException} before any computation.
 */
@Component
public class ConfigRequestValidator {

    private final Validator validator;

    public ConfigRequestValidator(Validator validator) {
        this.validator = validator;
    }

    public PairingConfig toPairingConfig(PairingConfigRequest request) {
        check(request);
        return request.toConfig();
    }

    public TiebreakConfig toTiebreakConfig(TiebreakConfigRequest request) {
        check(request);
        return request.toConfig();
    }

    private <T> void check(T request) {
        if (request == null) {
            throw new InvalidConfigurationException("Configuration is missing");
        }
        Set<ConstraintViolation<T>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            String details = violations.stream()
                .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                .map(v -> v.getPropertyPath() + " " + v.getMessage())
                .collect(Collectors.joining("; "));
            throw new InvalidConfigurationException("Invalid configuration: " + details);
        }
    }
}
