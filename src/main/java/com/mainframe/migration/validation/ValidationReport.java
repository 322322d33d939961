package com.mainframe.migration.validation;

import java.util.Map;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Per-program validation results plus the job-level verdict.
 */
@Value
@Builder
public class ValidationReport {

    @Singular
    Map<String, ValidationResult> results;

    int passed;

    int failed;

    boolean success;

    @NonNull
    ValidationPolicy policy;

    public int getTotal() {
        return results.size();
    }

    /**
     * Percentage of passing programs, 0 when nothing was validated.
     */
    public double getPassRate() {
        return results.isEmpty() ? 0.0 : passed * 100.0 / results.size();
    }
}
