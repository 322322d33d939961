package com.mainframe.migration.analyzer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.migration.model.ProgramDescriptor;
import com.mainframe.migration.model.StructuralModel;

import lombok.RequiredArgsConstructor;

/**
 * Reads a program from disk and runs the analyzer on it.
 */
@RequiredArgsConstructor
public class ProgramAnalyzerService {
    private static final Logger log = LoggerFactory.getLogger(ProgramAnalyzerService.class);

    private final ProgramAnalyzer analyzer;

    public ProgramAnalyzerService() {
        this(new ProgramAnalyzer());
    }

    /**
     * Analyze one discovered program.
     *
     * @return the model, or empty when the file cannot be read; the caller
     *         substitutes a placeholder
     */
    public Optional<StructuralModel> analyze(ProgramDescriptor program, String programName) {
        if (program.getPath() == null || program.getPath().isBlank()) {
            log.warn("No source path for program {}", programName);
            return Optional.empty();
        }

        String source;
        try {
            source = readSource(Path.of(program.getPath()));
        } catch (IOException | InvalidPathException e) {
            log.warn("Cannot read program {} from {}: {}", programName, program.getPath(), e.getMessage());
            return Optional.empty();
        }

        log.info("Analyzing program: {}", programName);
        StructuralModel model = analyzer.analyze(source, programName);
        log.debug("Analyzed {}: {} data items, {} procedures, {} file controls",
                programName, model.getDataItems().size(), model.getProcedures().size(),
                model.getFileControls().size());
        return Optional.of(model);
    }

    /**
     * Decodes as UTF-8; malformed bytes become U+FFFD instead of failing.
     */
    static String readSource(Path path) throws IOException {
        byte[] bytes = Files.readAllBytes(path);
        return new String(bytes, StandardCharsets.UTF_8);
    }
}
