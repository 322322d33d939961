package com.mainframe.migration.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.migration.cli.exception.OptionsValidationException;
import com.mainframe.migration.cli.model.MigrateOptions;
import com.mainframe.migration.cli.model.ValidatedMigrateOptions;
import com.mainframe.migration.cli.output.MigrationResultsPrinter;
import com.mainframe.migration.cli.validation.MigrateOptionsValidator;
import com.mainframe.migration.pipeline.MigrationPipeline;
import com.mainframe.migration.pipeline.MigrationResult;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command running one migration job over a local repository checkout.
 */
@Command(
        name = "migrate",
        mixinStandardHelpOptions = true,
        version = "cobol-migration-pipeline 1.0.0",
        description = "Analyzes COBOL programs and generates Java classes, JUnit tests and a validation summary."
)
public class MigrateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(MigrateCommand.class);

    @Mixin
    private MigrateOptions options = new MigrateOptions();

    private final MigrateOptionsValidator validator = new MigrateOptionsValidator();
    private final MigrationResultsPrinter printer = new MigrationResultsPrinter();

    @Override
    public Integer call() {
        ValidatedMigrateOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(error -> log.error(error));
            return 1;
        }

        printer.printBanner(validated);
        try {
            MigrationResult result = new MigrationPipeline(validated.getConfig()).run(validated.getJob());
            if (!result.isCompleted()) {
                printer.printFailure(result);
                return 1;
            }
            printer.printSuccess(validated, result);
            return 0;
        } catch (Exception e) {
            log.error("Migration failed with exception", e);
            return 1;
        }
    }
}
