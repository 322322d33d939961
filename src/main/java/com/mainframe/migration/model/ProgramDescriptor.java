package com.mainframe.migration.model;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * One COBOL source file found in the repository.
 *
 * Produced by program discovery, consumed read-only by the analyzer and the
 * code generator. Paths are kept as strings since an external inventory may
 * hand over partial descriptors with blank paths.
 */
@Value
@Builder(toBuilder = true)
public class ProgramDescriptor {

    /**
     * Absolute path of the source file.
     */
    String path;

    /**
     * Path relative to the repository root.
     */
    String relativePath;

    /**
     * Program name inferred from the file name (stem).
     */
    String name;

    /**
     * File extension including the dot, e.g. ".cbl".
     */
    String extension;

    long sizeBytes;

    /**
     * Non-blank line count.
     */
    int linesOfCode;

    /**
     * Identifier of the persisted program record, null until an external
     * store assigned one.
     */
    String recordId;

    /**
     * Copybook names referenced by COPY statements.
     */
    @Singular
    List<String> copybooks;
}
