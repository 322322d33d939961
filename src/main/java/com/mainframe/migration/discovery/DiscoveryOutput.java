package com.mainframe.migration.discovery;

import java.util.List;

import com.mainframe.migration.model.ProgramDescriptor;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Inventory of a repository: the programs to migrate plus related files.
 */
@Value
@Builder
public class DiscoveryOutput {

    @Singular
    List<ProgramDescriptor> programs;

    /**
     * Relative paths of copybook files (.cpy, .copy).
     */
    @Singular
    List<String> copybooks;

    /**
     * Relative paths of JCL files.
     */
    @Singular
    List<String> jclFiles;
}
