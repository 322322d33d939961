package com.mainframe.migration.pipeline;

import com.mainframe.migration.codegen.model.GeneratedArtifact;

/**
 * Optional collaborator run on each artifact after generation, e.g. an
 * external rewrite or indexing service.
 *
 * Failures never fail the job: the pipeline logs them and keeps the original
 * artifact.
 */
@FunctionalInterface
public interface ArtifactPostProcessor {

    /**
     * @return the artifact to keep, possibly the same instance
     * @throws Exception on any failure; the original artifact is kept
     */
    GeneratedArtifact process(String jobId, GeneratedArtifact artifact) throws Exception;

    default String getName() {
        return getClass().getSimpleName();
    }
}
