package com.mainframe.migration.pipeline.stage;

import java.util.Map;

import com.mainframe.migration.codegen.model.GeneratedTest;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Paired tests keyed by program name.
 */
@Value
@Builder
public class TestGenerationOutput {

    @Singular
    Map<String, GeneratedTest> tests;

    int failed;

    public int getGenerated() {
        return tests.size();
    }
}
