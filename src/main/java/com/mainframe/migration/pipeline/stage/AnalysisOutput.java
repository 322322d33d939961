package com.mainframe.migration.pipeline.stage;

import java.util.Map;
import java.util.Optional;

import com.mainframe.migration.model.StructuralModel;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Structural models keyed by resolved program name.
 */
@Value
@Builder
public class AnalysisOutput {

    @Singular
    Map<String, StructuralModel> models;

    /**
     * Programs that could not be read; generation uses placeholders for them.
     */
    int unreadable;

    public Optional<StructuralModel> modelFor(String programName) {
        return Optional.ofNullable(models.get(programName));
    }
}
