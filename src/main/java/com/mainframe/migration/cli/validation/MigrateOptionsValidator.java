package com.mainframe.migration.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;

import com.mainframe.migration.cli.exception.OptionsValidationException;
import com.mainframe.migration.cli.model.MigrateOptions;
import com.mainframe.migration.cli.model.ValidatedMigrateOptions;
import com.mainframe.migration.pipeline.MigrationJob;
import com.mainframe.migration.pipeline.PipelineConfig;
import com.mainframe.migration.validation.ValidationPolicy;

public class MigrateOptionsValidator {

	private static final Pattern PACKAGE_NAME = Pattern.compile("[a-zA-Z_]\\w*(\\.[a-zA-Z_]\\w*)*");

	private static final Pattern JOB_ID = Pattern.compile("[\\w.-]+");

	public ValidatedMigrateOptions validate(MigrateOptions o) {
		List<String> errors = new ArrayList<>();

		if (o.getRepositoryPath() == null) {
			errors.add("Repository path is required (--repo / -r).");
		} else if (!Files.isDirectory(o.getRepositoryPath())) {
			errors.add("Repository directory does not exist or is not a directory: " + o.getRepositoryPath());
		}

		String jobId = isBlank(o.getJobId()) ? UUID.randomUUID().toString() : o.getJobId().trim();
		// The job id names the output directory
		if (!JOB_ID.matcher(jobId).matches() || ".".equals(jobId) || "..".equals(jobId)) {
			errors.add("Job id may only contain letters, digits, '.', '_' and '-'. Got: " + jobId);
		}

		if (isBlank(o.getTargetPackage()) || !PACKAGE_NAME.matcher(o.getTargetPackage()).matches()) {
			errors.add("Package must be a valid Java package name. Got: " + o.getTargetPackage());
		}

		if (o.getWorkerThreads() < 1) {
			errors.add("Worker threads must be >= 1. Got: " + o.getWorkerThreads());
		}
		if (o.getMinimumPassing() < 0) {
			errors.add("Minimum passing programs must be >= 0. Got: " + o.getMinimumPassing());
		}

		Set<String> extensions = normalizeExtensions(o.getSourceExtensions());
		if (extensions.isEmpty()) {
			errors.add("At least one source extension is required (--extensions).");
		}

		Path artifactsDir = o.getArtifactsDir() == null ? Path.of("artifacts") : o.getArtifactsDir();
		Path normalizedArtifactsDir = artifactsDir.toAbsolutePath().normalize();
		if (Files.exists(normalizedArtifactsDir) && !Files.isDirectory(normalizedArtifactsDir)) {
			errors.add("Artifacts path exists and is not a directory: " + normalizedArtifactsDir);
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		MigrationJob job = MigrationJob.builder()
				.jobId(jobId)
				.repositoryPath(o.getRepositoryPath().toAbsolutePath().normalize())
				.branch(o.getBranch())
				.commit(o.getCommit())
				.selectedPrograms(o.getSelectedPrograms() == null ? List.of() : o.getSelectedPrograms())
				.targetStack(isBlank(o.getTargetStack()) ? MigrationJob.DEFAULT_TARGET_STACK : o.getTargetStack())
				.build();

		PipelineConfig config = PipelineConfig.builder()
				.artifactsDir(normalizedArtifactsDir)
				.targetPackage(o.getTargetPackage())
				.reservedPrefix(o.getReservedPrefix() == null ? "" : o.getReservedPrefix())
				.workerThreads(o.getWorkerThreads())
				.validationPolicy(ValidationPolicy.atLeast(o.getMinimumPassing()))
				.sourceExtensions(extensions)
				.build();

		return new ValidatedMigrateOptions(job, config);
	}

	/**
	 * Lower-cased, with a leading dot added where missing.
	 */
	private static Set<String> normalizeExtensions(List<String> raw) {
		Set<String> result = new LinkedHashSet<>();
		if (raw == null) {
			return result;
		}
		for (String ext : raw) {
			if (isBlank(ext)) {
				continue;
			}
			String trimmed = ext.trim().toLowerCase(Locale.ROOT);
			result.add(trimmed.startsWith(".") ? trimmed : "." + trimmed);
		}
		return result;
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}
}
