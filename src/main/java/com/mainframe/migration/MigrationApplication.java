package com.mainframe.migration;

import com.mainframe.migration.cli.MigrateCommand;

import picocli.CommandLine;

/**
 * Main entry point of the COBOL migration pipeline.
 * Scans a checked-out repository for COBOL programs and writes Java classes,
 * paired tests and a validation summary per job.
 */
public class MigrationApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MigrateCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
