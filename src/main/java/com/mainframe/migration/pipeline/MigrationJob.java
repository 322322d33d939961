package com.mainframe.migration.pipeline;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import com.mainframe.migration.model.ProgramDescriptor;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Input of one pipeline run.
 *
 * The repository is already materialized on disk; branch and commit are
 * carried for reporting only.
 */
@Value
@Builder
public class MigrationJob {

    public static final String DEFAULT_TARGET_STACK = "springboot";

    @NonNull
    String jobId;

    @NonNull
    Path repositoryPath;

    String branch;

    String commit;

    /**
     * Relative paths or file names to migrate; empty migrates every program.
     */
    @Singular
    List<String> selectedPrograms;

    /**
     * Programs discovered earlier by an external inventory. When set the
     * discovery stage does not scan the repository.
     */
    List<ProgramDescriptor> programs;

    /**
     * Advisory hint selecting the template family.
     */
    @Builder.Default
    String targetStack = DEFAULT_TARGET_STACK;

    public Optional<List<ProgramDescriptor>> getPrograms() {
        return Optional.ofNullable(programs);
    }
}
