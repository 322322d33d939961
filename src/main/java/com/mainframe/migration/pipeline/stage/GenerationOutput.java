package com.mainframe.migration.pipeline.stage;

import java.nio.file.Path;
import java.util.Map;

import com.mainframe.migration.codegen.model.GeneratedArtifact;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Generated classes keyed by program name, in generation order.
 */
@Value
@Builder(toBuilder = true)
public class GenerationOutput {

    @Singular
    Map<String, GeneratedArtifact> artifacts;

    int translated;

    int skipped;

    int failed;

    @NonNull
    Path outputDir;
}
