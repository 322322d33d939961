package com.mainframe.migration.codegen.model;

import java.nio.file.Path;
import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A generated Java class on disk and where it came from.
 */
@Value
@Builder(toBuilder = true)
public class GeneratedArtifact {

    @NonNull
    Path path;

    @NonNull
    String className;

    @NonNull
    String packageName;

    /**
     * Resolved program name; key of the artifact map.
     */
    @NonNull
    String programName;

    /**
     * Absolute path of the originating COBOL source, null when recovered from disk.
     */
    String sourcePath;

    String sourceRelativePath;

    /**
     * Identifier of the persisted program record, once an external store assigned one.
     */
    String programRecordId;

    /**
     * True when rebuilt from the output directory rather than produced by a generation run.
     */
    boolean recovered;

    public Optional<String> getProgramRecordId() {
        return Optional.ofNullable(programRecordId);
    }
}
