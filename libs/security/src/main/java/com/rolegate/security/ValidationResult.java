package com.rolegate.security;

import java.util.List;

/**
 * Result of a configuration-time check: either valid (no errors) or invalid with every
 * problem found, so a misconfigured deployment reports all of them at once.
 *
 * @param valid  whether the check passed
 * @param errors error messages (empty if valid)
 */
public record ValidationResult(boolean valid, List<String> errors) {

    public ValidationResult {
        errors = List.copyOf(errors);
    }

    /** Creates a passing result. */
    public static ValidationResult ok() {
        return new ValidationResult(true, List.of());
    }

    /** Creates a failing result with one or more error messages. */
    public static ValidationResult fail(List<String> errors) {
        return new ValidationResult(false, errors);
    }

    /**
     * Throws {@link IllegalStateException} listing every error if this result is invalid.
     *
     * @param subject what was validated, used as the message prefix
     */
    public void orThrow(String subject) {
        if (!valid) {
            throw new IllegalStateException("Invalid " + subject + ": " + String.join("; ", errors));
        }
    }
}
