package com.mainframe.migration.validation;

import lombok.Value;

/**
 * Job-level pass threshold: validation succeeds once at least
 * {@code minimumPassing} programs pass.
 */
@Value
public class ValidationPolicy {

    public static final ValidationPolicy AT_LEAST_ONE = new ValidationPolicy(1);

    int minimumPassing;

    public ValidationPolicy(int minimumPassing) {
        if (minimumPassing < 0) {
            throw new IllegalArgumentException("minimumPassing must not be negative: " + minimumPassing);
        }
        this.minimumPassing = minimumPassing;
    }

    public static ValidationPolicy atLeast(int minimumPassing) {
        return new ValidationPolicy(minimumPassing);
    }

    public boolean isSatisfiedBy(int passed) {
        return passed >= minimumPassing;
    }
}
