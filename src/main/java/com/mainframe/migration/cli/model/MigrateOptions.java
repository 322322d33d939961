package com.mainframe.migration.cli.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "migrate" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class MigrateOptions {

	@Option(names = { "--repo", "-r" }, required = true, description = "Local checkout of the repository to migrate")
	private Path repositoryPath;

	@Option(names = { "--job-id", "-j" }, description = "Job identifier (defaults to a random UUID)")
	private String jobId;

	@Option(names = { "--branch", "-b" }, defaultValue = "main", description = "Branch of the checkout, for reporting")
	private String branch;

	@Option(names = { "--commit" }, description = "Commit of the checkout, for reporting")
	private String commit;

	@Option(names = { "--program", "-p" }, split = ",",
			description = "Program to migrate, by relative path or file name (repeatable or comma-separated)")
	private List<String> selectedPrograms = new ArrayList<>();

	@Option(names = { "--target-stack" }, defaultValue = "springboot", description = "Target stack hint")
	private String targetStack;

	@Option(names = { "--artifacts-dir", "-o" }, defaultValue = "artifacts",
			description = "Root directory of per-job output (default: artifacts)")
	private Path artifactsDir;

	@Option(names = { "--package" }, defaultValue = "com.mainframe.migrated",
			description = "Package of generated classes")
	private String targetPackage;

	@Option(names = { "--reserved-prefix" }, defaultValue = "WS-",
			description = "Prefix stripped from COBOL names; empty keeps names whole")
	private String reservedPrefix;

	@Option(names = { "--threads", "-t" }, defaultValue = "1", description = "Worker threads per stage")
	private int workerThreads;

	@Option(names = { "--min-passing" }, defaultValue = "1",
			description = "Programs that must pass validation for the job to count as validated")
	private int minimumPassing;

	@Option(names = { "--extensions" }, split = ",", defaultValue = ".cbl,.cob,.cobol",
			description = "COBOL source file extensions (comma-separated)")
	private List<String> sourceExtensions;
}
