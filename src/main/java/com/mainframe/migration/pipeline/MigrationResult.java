package com.mainframe.migration.pipeline;

import java.util.Map;

import com.mainframe.migration.codegen.model.GeneratedArtifact;
import com.mainframe.migration.codegen.model.GeneratedTest;
import com.mainframe.migration.validation.ValidationResult;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Everything a finished pipeline run hands back: the final job snapshot and
 * whatever the stages produced before it ended.
 */
@Value
@Builder
public class MigrationResult {

    @NonNull
    JobSnapshot job;

    @Singular
    Map<String, GeneratedArtifact> artifacts;

    @Singular
    Map<String, GeneratedTest> tests;

    @Singular
    Map<String, ValidationResult> validationResults;

    public boolean isCompleted() {
        return job.getStatus() == JobStatus.COMPLETED;
    }
}
