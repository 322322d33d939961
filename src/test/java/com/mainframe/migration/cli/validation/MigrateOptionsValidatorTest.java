package com.mainframe.migration.cli.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.mainframe.migration.cli.exception.OptionsValidationException;
import com.mainframe.migration.cli.model.MigrateOptions;
import com.mainframe.migration.cli.model.ValidatedMigrateOptions;
import com.mainframe.migration.pipeline.MigrationJob;
import com.mainframe.migration.pipeline.PipelineConfig;

import picocli.CommandLine;

import static org.assertj.core.api.Assertions.*;

class MigrateOptionsValidatorTest {

    @TempDir
    Path tempDir;

    private final MigrateOptionsValidator validator = new MigrateOptionsValidator();

    @Test
    void testDefaultsBuildJobAndConfig() {
        ValidatedMigrateOptions validated = validator.validate(parse("--repo", tempDir.toString(), "-j", "job-1"));

        MigrationJob job = validated.getJob();
        assertThat(job.getJobId()).isEqualTo("job-1");
        assertThat(job.getRepositoryPath()).isEqualTo(tempDir.toAbsolutePath().normalize());
        assertThat(job.getBranch()).isEqualTo("main");
        assertThat(job.getTargetStack()).isEqualTo("springboot");
        assertThat(job.getSelectedPrograms()).isEmpty();

        PipelineConfig config = validated.getConfig();
        assertThat(config.getTargetPackage()).isEqualTo("com.mainframe.migrated");
        assertThat(config.getReservedPrefix()).isEqualTo("WS-");
        assertThat(config.getWorkerThreads()).isEqualTo(1);
        assertThat(config.getValidationPolicy().getMinimumPassing()).isEqualTo(1);
        assertThat(config.getSourceExtensions()).containsExactlyInAnyOrder(".cbl", ".cob", ".cobol");
        assertThat(config.getArtifactsDir()).isAbsolute();
    }

    @Test
    void testGeneratesJobIdWhenMissing() {
        ValidatedMigrateOptions validated = validator.validate(parse("--repo", tempDir.toString()));

        assertThat(validated.getJob().getJobId()).isNotBlank();
    }

    @Test
    void testCustomOptions() {
        ValidatedMigrateOptions validated = validator.validate(parse(
                "--repo", tempDir.toString(),
                "-j", "nightly_2",
                "-p", "src/CALC.cbl,GREET.cob",
                "--package", "org.acme.legacy",
                "--reserved-prefix", "",
                "--threads", "4",
                "--min-passing", "0",
                "--extensions", "CBL,.Cpy"));

        assertThat(validated.getJob().getSelectedPrograms()).containsExactly("src/CALC.cbl", "GREET.cob");
        assertThat(validated.getConfig().getTargetPackage()).isEqualTo("org.acme.legacy");
        assertThat(validated.getConfig().getReservedPrefix()).isEmpty();
        assertThat(validated.getConfig().getWorkerThreads()).isEqualTo(4);
        assertThat(validated.getConfig().getValidationPolicy().isSatisfiedBy(0)).isTrue();
        assertThat(validated.getConfig().getSourceExtensions()).containsExactly(".cbl", ".cpy");
    }

    @Test
    void testCollectsAllErrors() throws IOException {
        Path file = Files.writeString(tempDir.resolve("artifacts.txt"), "not a directory");

        assertThatThrownBy(() -> validator.validate(parse(
                "--repo", tempDir.resolve("missing").toString(),
                "-j", "../escape",
                "--package", "1bad.package",
                "--threads", "0",
                "--min-passing", "-1",
                "-o", file.toString())))
                .isInstanceOfSatisfying(OptionsValidationException.class, e -> assertThat(e.getErrors())
                        .hasSize(6)
                        .anyMatch(error -> error.startsWith("Repository directory does not exist"))
                        .anyMatch(error -> error.startsWith("Job id may only contain"))
                        .anyMatch(error -> error.startsWith("Package must be"))
                        .anyMatch(error -> error.startsWith("Worker threads"))
                        .anyMatch(error -> error.startsWith("Minimum passing"))
                        .anyMatch(error -> error.startsWith("Artifacts path exists")));
    }

    @Test
    void testRejectsDotJobId() {
        assertThatThrownBy(() -> validator.validate(parse("--repo", tempDir.toString(), "-j", "..")))
                .isInstanceOf(OptionsValidationException.class);
    }

    private static MigrateOptions parse(String... args) {
        MigrateOptions options = new MigrateOptions();
        new CommandLine(options).parseArgs(args);
        return options;
    }
}
