package com.mainframe.migration.validation;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Validation outcome for one generated program and its paired test.
 */
@Value
@Builder
public class ValidationResult {

    String programName;

    boolean syntaxValid;

    /**
     * False as well when no paired test was generated.
     */
    boolean pairedTestSyntaxValid;

    /**
     * Same as {@link #isSyntaxValid()}; nothing is compiled.
     */
    boolean compilable;

    TestOutcome testOutcome;

    public boolean isPassed() {
        return syntaxValid && pairedTestSyntaxValid;
    }

    public static ValidationResult of(String programName, boolean syntaxValid, boolean pairedTestSyntaxValid,
                                      List<String> errors) {
        boolean passed = syntaxValid && pairedTestSyntaxValid;
        return ValidationResult.builder()
                .programName(programName)
                .syntaxValid(syntaxValid)
                .pairedTestSyntaxValid(pairedTestSyntaxValid)
                .compilable(syntaxValid)
                .testOutcome(TestOutcome.builder()
                        .passed(passed)
                        .failed(!passed)
                        .errors(errors)
                        .build())
                .build();
    }

    @Value
    @Builder
    public static class TestOutcome {
        boolean passed;
        boolean failed;
        @Singular
        List<String> errors;
    }
}
