package com.mainframe.migration.discovery;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.migration.codegen.util.NamingUtil;
import com.mainframe.migration.model.ProgramDescriptor;

/**
 * Walks a local source tree and lists COBOL programs, copybooks and JCL.
 */
public class FileSystemProgramDiscovery implements ProgramDiscovery {
    private static final Logger log = LoggerFactory.getLogger(FileSystemProgramDiscovery.class);

    public static final Set<String> DEFAULT_SOURCE_EXTENSIONS = Set.of(".cbl", ".cob", ".cobol");

    private static final Set<String> COPYBOOK_EXTENSIONS = Set.of(".cpy", ".copy");
    private static final Set<String> JCL_EXTENSIONS = Set.of(".jcl");

    private final Set<String> sourceExtensions;

    public FileSystemProgramDiscovery() {
        this(DEFAULT_SOURCE_EXTENSIONS);
    }

    public FileSystemProgramDiscovery(Set<String> sourceExtensions) {
        this.sourceExtensions = sourceExtensions.stream()
                .map(ext -> ext.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public DiscoveryOutput discover(Path repositoryRoot, List<String> selectedPrograms) throws IOException {
        if (!Files.isDirectory(repositoryRoot)) {
            throw new NoSuchFileException(repositoryRoot.toString(), null, "Repository directory not found");
        }

        List<Path> files;
        try (Stream<Path> stream = Files.walk(repositoryRoot)) {
            files = stream.filter(Files::isRegularFile)
                    .sorted(Comparator.comparing(p -> relativize(repositoryRoot, p)))
                    .collect(Collectors.toList());
        }

        Set<String> selection = normalizeSelection(selectedPrograms);
        DiscoveryOutput.DiscoveryOutputBuilder output = DiscoveryOutput.builder();
        for (Path file : files) {
            String relativePath = relativize(repositoryRoot, file);
            String fileName = file.getFileName().toString();
            if (hasExtension(fileName, sourceExtensions)) {
                if (isSelected(relativePath, fileName, selection)) {
                    output.program(describe(file, relativePath, fileName));
                }
            } else if (hasExtension(fileName, COPYBOOK_EXTENSIONS)) {
                output.copybook(relativePath);
            } else if (hasExtension(fileName, JCL_EXTENSIONS)) {
                output.jclFile(relativePath);
            }
        }

        DiscoveryOutput result = output.build();
        log.info("Scan of {} complete: {} programs, {} copybooks, {} JCL files", repositoryRoot,
                result.getPrograms().size(), result.getCopybooks().size(), result.getJclFiles().size());
        return result;
    }

    /**
     * A file that cannot be read is still listed, with no lines and no
     * copybooks; the analyzer gives it a placeholder model later.
     */
    private ProgramDescriptor describe(Path file, String relativePath, String fileName) {
        long size = 0;
        List<String> lines = List.of();
        try {
            size = Files.size(file);
            lines = readLines(file);
        } catch (IOException e) {
            log.warn("Cannot read {}, listing it without line count or copybooks: {}", relativePath, e.toString());
        }
        int dot = fileName.lastIndexOf('.');
        return ProgramDescriptor.builder()
                .path(file.toAbsolutePath().toString())
                .relativePath(relativePath)
                .name(NamingUtil.fileStem(fileName))
                .extension(dot >= 0 ? fileName.substring(dot) : "")
                .sizeBytes(size)
                .linesOfCode(countLinesOfCode(lines))
                .copybooks(extractCopybooks(lines))
                .build();
    }

    List<String> readLines(Path file) throws IOException {
        String content = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        return content.lines().collect(Collectors.toList());
    }

    static int countLinesOfCode(List<String> lines) {
        return (int) lines.stream().filter(line -> !line.isBlank()).count();
    }

    /**
     * Names following a COPY keyword, e.g. "COPY CUSTREC." -> CUSTREC. Kept in
     * order of appearance, duplicates removed.
     */
    static List<String> extractCopybooks(List<String> lines) {
        Set<String> copybooks = new LinkedHashSet<>();
        for (String line : lines) {
            String[] tokens = line.toUpperCase(Locale.ROOT).replace(".", " ").trim().split("\\s+");
            for (int i = 0; i < tokens.length - 1; i++) {
                if ("COPY".equals(tokens[i])) {
                    copybooks.add(tokens[i + 1].replaceAll("^['\"]|['\"]$", ""));
                    break;
                }
            }
        }
        return new ArrayList<>(copybooks);
    }

    private static Set<String> normalizeSelection(List<String> selectedPrograms) {
        if (selectedPrograms == null) {
            return Set.of();
        }
        return selectedPrograms.stream()
                .filter(s -> s != null && !s.isBlank())
                .map(s -> s.trim().replace('\\', '/').toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
    }

    private static boolean isSelected(String relativePath, String fileName, Set<String> selection) {
        return selection.isEmpty()
                || selection.contains(relativePath.toLowerCase(Locale.ROOT))
                || selection.contains(fileName.toLowerCase(Locale.ROOT));
    }

    private static boolean hasExtension(String fileName, Set<String> extensions) {
        int dot = fileName.lastIndexOf('.');
        return dot >= 0 && extensions.contains(fileName.substring(dot).toLowerCase(Locale.ROOT));
    }

    /**
     * Relative path with '/' separators on every platform.
     */
    private static String relativize(Path root, Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }
}
