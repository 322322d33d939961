package com.mainframe.migration.validation;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.migration.codegen.model.GeneratedArtifact;
import com.mainframe.migration.codegen.model.GeneratedTest;
import com.mainframe.migration.codegen.util.FileWriteUtil;

import lombok.RequiredArgsConstructor;

/**
 * Validates one generated class together with its paired test.
 */
@RequiredArgsConstructor
public class ProgramValidator {
    private static final Logger log = LoggerFactory.getLogger(ProgramValidator.class);

    private final SourceSyntaxValidator syntaxValidator;

    public ProgramValidator() {
        this(new SourceSyntaxValidator());
    }

    /**
     * @param test paired test, null when none was generated
     */
    public ValidationResult validate(String programName, GeneratedArtifact artifact, GeneratedTest test) {
        List<String> errors = new ArrayList<>();

        boolean syntaxValid = checkFile(artifact.getPath(), "source", errors);
        boolean testSyntaxValid = false;
        if (test == null) {
            errors.add("test: no paired test generated");
        } else {
            testSyntaxValid = checkFile(test.getPath(), "test", errors);
        }

        if (syntaxValid && testSyntaxValid) {
            log.debug("Validation passed for {}", programName);
        } else {
            log.warn("Validation failed for {}: {}", programName, errors);
        }
        return ValidationResult.of(programName, syntaxValid, testSyntaxValid, errors);
    }

    private boolean checkFile(Path file, String label, List<String> errors) {
        String content;
        try {
            content = FileWriteUtil.readString(file);
        } catch (IOException e) {
            errors.add(label + ": cannot read " + file + ": " + e.getMessage());
            return false;
        }
        List<String> problems = syntaxValidator.findProblems(content);
        for (String problem : problems) {
            errors.add(label + ": " + problem);
        }
        return problems.isEmpty();
    }
}
