package com.mainframe.migration.pipeline.stage;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.migration.codegen.TestSourceGenerator;
import com.mainframe.migration.codegen.model.GeneratedArtifact;
import com.mainframe.migration.codegen.model.GeneratedTest;
import com.mainframe.migration.pipeline.ProgramWorkPool;
import com.mainframe.migration.pipeline.StageResult;

import lombok.RequiredArgsConstructor;

/**
 * Writes a JUnit test for every generated class into the job's tests area.
 */
@RequiredArgsConstructor
public class TestGenerationStage {
    private static final Logger log = LoggerFactory.getLogger(TestGenerationStage.class);

    private final TestSourceGenerator testGenerator;

    public StageResult<TestGenerationOutput> run(String jobId, Map<String, GeneratedArtifact> artifacts,
                                                 Path testsDir, ProgramWorkPool pool) {
        log.info("[{}] Generating tests for {} classes", jobId, artifacts.size());

        List<Map.Entry<String, GeneratedArtifact>> entries = new ArrayList<>(artifacts.entrySet());
        List<GeneratedTest> generated = pool.map(entries, entry -> generateOne(jobId, entry, testsDir));

        TestGenerationOutput.TestGenerationOutputBuilder output = TestGenerationOutput.builder();
        int failed = 0;
        for (int i = 0; i < entries.size(); i++) {
            GeneratedTest test = generated.get(i);
            if (test == null) {
                failed++;
            } else {
                output.test(entries.get(i).getKey(), test);
            }
        }

        TestGenerationOutput result = output.failed(failed).build();
        log.info("[{}] Test generation complete: {} generated, {} failed", jobId, result.getGenerated(), failed);
        return StageResult.success(result);
    }

    private GeneratedTest generateOne(String jobId, Map.Entry<String, GeneratedArtifact> entry, Path testsDir) {
        try {
            return testGenerator.generate(entry.getValue(), testsDir);
        } catch (IOException e) {
            log.error("[{}] Failed to generate test for {}: {}", jobId, entry.getKey(), e.getMessage(), e);
            return null;
        }
    }
}
