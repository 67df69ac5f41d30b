package io.github.riemr.pto.application.service;

import io.github.riemr.pto.application.exception.InvalidConfigurationException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Runs bean validation and turns violations into an {@link InvalidConfigurationException}.
 */
@Component
@RequiredArgsConstructor
public class ConfigurationValidator {
    private final Validator validator;

    public <T> T validate(T value, String subject) {
        if (value == null) throw new InvalidConfigurationException(subject, subject + " is required");
        Set<ConstraintViolation<T>> violations = validator.validate(value);
        if (!violations.isEmpty()) {
            List<String> messages = violations.stream()
                    .map(ConfigurationValidator::describe)
                    .sorted()
                    .collect(Collectors.toList());
            throw new InvalidConfigurationException(subject, messages);
        }
        return value;
    }

    private static String describe(ConstraintViolation<?> v) {
        String path = v.getPropertyPath().toString();
        // class-level @AssertTrue getters carry a self-describing message
        if (path.endsWith("Consistent") || path.endsWith("Valid")) return v.getMessage();
        return path + " " + v.getMessage();
    }
}
