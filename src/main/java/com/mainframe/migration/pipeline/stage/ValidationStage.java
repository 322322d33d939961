package com.mainframe.migration.pipeline.stage;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.migration.codegen.model.GeneratedArtifact;
import com.mainframe.migration.pipeline.ProgramWorkPool;
import com.mainframe.migration.pipeline.StageResult;
import com.mainframe.migration.validation.ProgramValidator;
import com.mainframe.migration.validation.ValidationPolicy;
import com.mainframe.migration.validation.ValidationReport;
import com.mainframe.migration.validation.ValidationResult;

import lombok.RequiredArgsConstructor;

/**
 * Checks every generated class and its paired test.
 *
 * The report always comes back as a successful stage result; whether the
 * job-level verdict passed is carried in {@link ValidationReport#isSuccess()}.
 */
@RequiredArgsConstructor
public class ValidationStage {
    private static final Logger log = LoggerFactory.getLogger(ValidationStage.class);

    private final ProgramValidator validator;
    private final ValidationPolicy policy;

    public StageResult<ValidationReport> run(String jobId, Map<String, GeneratedArtifact> artifacts,
                                             TestGenerationOutput tests, ProgramWorkPool pool) {
        log.info("[{}] Starting validation for {} Java classes", jobId, artifacts.size());

        List<Map.Entry<String, GeneratedArtifact>> entries = new ArrayList<>(artifacts.entrySet());
        List<ValidationResult> results = pool.map(entries, entry -> {
            ValidationResult result = validator.validate(entry.getKey(), entry.getValue(),
                    tests.getTests().get(entry.getKey()));
            log.info("[{}] Validation for {}: syntax={}, test_syntax={}", jobId, entry.getKey(),
                    result.isSyntaxValid() ? "valid" : "invalid",
                    result.isPairedTestSyntaxValid() ? "valid" : "invalid");
            return result;
        });

        ValidationReport.ValidationReportBuilder report = ValidationReport.builder().policy(policy);
        int passed = 0;
        for (int i = 0; i < entries.size(); i++) {
            ValidationResult result = results.get(i);
            report.result(entries.get(i).getKey(), result);
            if (result.isPassed()) {
                passed++;
            }
        }
        int failed = entries.size() - passed;

        return StageResult.success(report
                .passed(passed)
                .failed(failed)
                .success(policy.isSatisfiedBy(passed))
                .build());
    }
}
