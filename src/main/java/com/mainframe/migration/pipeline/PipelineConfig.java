package com.mainframe.migration.pipeline;

import java.nio.file.Path;
import java.util.Set;

import com.mainframe.migration.codegen.util.NamingUtil;
import com.mainframe.migration.discovery.FileSystemProgramDiscovery;
import com.mainframe.migration.validation.ValidationPolicy;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Settings for pipeline runs, fixed when the pipeline is built.
 */
@Value
@Builder(toBuilder = true)
public class PipelineConfig {

    public static final String DEFAULT_TARGET_PACKAGE = "com.mainframe.migrated";

    /**
     * Root of the per-job output areas.
     */
    @NonNull
    @Builder.Default
    Path artifactsDir = Path.of("artifacts");

    /**
     * Package of generated classes and tests.
     */
    @NonNull
    @Builder.Default
    String targetPackage = DEFAULT_TARGET_PACKAGE;

    /**
     * Prefix stripped from COBOL names; empty keeps names whole.
     */
    @NonNull
    @Builder.Default
    String reservedPrefix = NamingUtil.DEFAULT_RESERVED_PREFIX;

    /**
     * Per-program parallelism inside a stage; 1 runs sequentially.
     */
    @Builder.Default
    int workerThreads = 1;

    @NonNull
    @Builder.Default
    ValidationPolicy validationPolicy = ValidationPolicy.AT_LEAST_ONE;

    @NonNull
    @Builder.Default
    Set<String> sourceExtensions = FileSystemProgramDiscovery.DEFAULT_SOURCE_EXTENSIONS;

    public static PipelineConfig defaults() {
        return PipelineConfig.builder().build();
    }

    /**
     * Output area of one job: {@code <artifactsDir>/<jobId>}.
     */
    public Path jobDir(String jobId) {
        return artifactsDir.resolve(jobId);
    }

    public Path javaOutputDir(String jobId) {
        return jobDir(jobId).resolve("java");
    }

    public Path testsOutputDir(String jobId) {
        return jobDir(jobId).resolve("tests");
    }
}
