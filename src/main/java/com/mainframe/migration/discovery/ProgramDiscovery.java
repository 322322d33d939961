package com.mainframe.migration.discovery;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Finds the programs to migrate in a materialized repository.
 */
public interface ProgramDiscovery {

    /**
     * @param repositoryRoot    checked-out source tree
     * @param selectedPrograms  relative paths or file names to keep; empty keeps all
     * @throws IOException if the tree cannot be walked
     */
    DiscoveryOutput discover(Path repositoryRoot, List<String> selectedPrograms) throws IOException;
}
