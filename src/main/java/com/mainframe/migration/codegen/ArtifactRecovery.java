package com.mainframe.migration.codegen;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.migration.codegen.model.GeneratedArtifact;
import com.mainframe.migration.codegen.util.NamingUtil;

/**
 * Rebuilds artifact records from a generation output directory.
 *
 * Used when a later step needs the artifact map and the in-memory one is
 * gone. Only file name and package are known afterwards; source paths stay
 * empty. Paired tests live in a separate directory, so every class found
 * here is a program class. Running it twice gives the same result.
 */
public class ArtifactRecovery {
    private static final Logger log = LoggerFactory.getLogger(ArtifactRecovery.class);

    private static final String JAVA_EXTENSION = ".java";

    /**
     * Scan {@code outputDir} (not recursively) for generated classes.
     *
     * @return artifacts keyed by class name, in file-name order; empty when
     *         the directory does not exist
     * @throws IOException if the directory cannot be listed
     */
    public Map<String, GeneratedArtifact> rebuild(Path outputDir, String packageName) throws IOException {
        Map<String, GeneratedArtifact> artifacts = new LinkedHashMap<>();
        if (!Files.isDirectory(outputDir)) {
            log.warn("Output directory {} does not exist, nothing to recover", outputDir);
            return artifacts;
        }

        List<Path> sources;
        try (Stream<Path> files = Files.list(outputDir)) {
            sources = files
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(JAVA_EXTENSION))
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .collect(Collectors.toList());
        }

        for (Path source : sources) {
            String className = NamingUtil.fileStem(source.getFileName().toString());
            artifacts.put(className, GeneratedArtifact.builder()
                    .path(source)
                    .className(className)
                    .packageName(packageName)
                    .programName(className)
                    .recovered(true)
                    .build());
        }

        log.info("Recovered {} artifacts from {}", artifacts.size(), outputDir);
        return artifacts;
    }
}
