package com.mainframe.migration.cli.output;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.migration.cli.model.ValidatedMigrateOptions;
import com.mainframe.migration.pipeline.JobMetrics;
import com.mainframe.migration.pipeline.JobSnapshot;
import com.mainframe.migration.pipeline.MigrationJob;
import com.mainframe.migration.pipeline.MigrationResult;
import com.mainframe.migration.pipeline.PipelineConfig;
import com.mainframe.migration.validation.ValidationResult;

/**
 * Responsible only for printing CLI output for the "migrate" command.
 * No validation, no execution.
 */
public class MigrationResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(MigrationResultsPrinter.class);

    public void printBanner(ValidatedMigrateOptions v) {
        MigrationJob job = v.getJob();
        PipelineConfig config = v.getConfig();
        log.info("=================================================");
        log.info("COBOL Migration Pipeline");
        log.info("=================================================");
        log.info("Job ID: {}", job.getJobId());
        log.info("Repository: {}", job.getRepositoryPath());
        log.info("Branch: {}", job.getBranch());
        log.info("Commit: {}", job.getCommit() != null ? job.getCommit() : "None");
        log.info("Selected Programs: {}", job.getSelectedPrograms().isEmpty() ? "All" : job.getSelectedPrograms());
        log.info("Target Stack: {}", job.getTargetStack());
        log.info("Target Package: {}", config.getTargetPackage());
        log.info("Output Directory: {}", config.jobDir(job.getJobId()));
        log.info("Worker Threads: {}", config.getWorkerThreads());
        log.info("=================================================");
    }

    public void printSuccess(ValidatedMigrateOptions v, MigrationResult result) {
        JobSnapshot job = result.getJob();
        PipelineConfig config = v.getConfig();

        log.info("");
        log.info("=================================================");
        log.info("MIGRATION COMPLETED");
        log.info("=================================================");
        log.info("Java Sources: {}", config.javaOutputDir(job.getJobId()));
        log.info("Tests: {}", config.testsOutputDir(job.getJobId()));

        job.getMetrics().ifPresent(this::printMetrics);

        if (!result.getValidationResults().isEmpty()) {
            log.info("");
            log.info("Validation:");
            for (Map.Entry<String, ValidationResult> entry : result.getValidationResults().entrySet()) {
                ValidationResult r = entry.getValue();
                log.info("  {}: {} (syntax={}, test syntax={})", entry.getKey(),
                        r.isPassed() ? "PASSED" : "FAILED",
                        r.isSyntaxValid() ? "valid" : "invalid",
                        r.isPairedTestSyntaxValid() ? "valid" : "invalid");
            }
        }
        log.info("=================================================");
    }

    public void printFailure(MigrationResult result) {
        JobSnapshot job = result.getJob();
        log.error("Migration {} at {}%: {}", job.getStatus(), job.getProgress(),
                job.getErrorMessage().orElse("no error message"));
        job.getCurrentStage().ifPresent(stage -> log.error("Last stage: {}", stage.getDisplayName()));
    }

    private void printMetrics(JobMetrics metrics) {
        log.info("");
        log.info("Summary:");
        log.info("  Programs Processed: {}", metrics.getProgramsProcessed());
        log.info("  Programs Translated: {}", metrics.getProgramsTranslated());
        log.info("  Programs Skipped: {}", metrics.getProgramsSkipped());
        log.info("  Programs Failed: {}", metrics.getProgramsFailed());
        log.info("  Tests Generated: {}", metrics.getTestsGenerated());
        log.info("  Validation Passed: {}", metrics.getTestsPassed());
        log.info("  Validation Failed: {}", metrics.getTestsFailed());
        log.info("  Validation Success: {}", metrics.isValidationSuccess());
    }
}
