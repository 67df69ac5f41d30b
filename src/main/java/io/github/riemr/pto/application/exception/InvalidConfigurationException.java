package io.github.riemr.pto.application.exception;

import java.util.List;

/**
 * A rule, settings value or preference set that cannot be computed with.
 * Raised before the ledger or optimizer runs so the caller can show every problem at once.
 */
public class InvalidConfigurationException extends RuntimeException {
    private final List<String> violations;

    public InvalidConfigurationException(String subject, List<String> violations) {
        super("Invalid " + subject + ": " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public InvalidConfigurationException(String subject, String violation) {
        this(subject, List.of(violation));
    }

    public List<String> getViolations() {
        return violations;
    }
}
