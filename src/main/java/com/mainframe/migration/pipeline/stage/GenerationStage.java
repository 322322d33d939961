package com.mainframe.migration.pipeline.stage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.migration.codegen.ProgramClassGenerator;
import com.mainframe.migration.codegen.model.GeneratedArtifact;
import com.mainframe.migration.codegen.template.TemplateRenderingException;
import com.mainframe.migration.codegen.util.FileWriteUtil;
import com.mainframe.migration.codegen.util.NamingUtil;
import com.mainframe.migration.model.ProgramDescriptor;
import com.mainframe.migration.model.StructuralModel;
import com.mainframe.migration.pipeline.ProgramWorkPool;
import com.mainframe.migration.pipeline.StageResult;

import lombok.RequiredArgsConstructor;
import lombok.Value;

/**
 * Writes one Java class per program into the job's java output area.
 *
 * A program without any name is skipped and counted. A program without a
 * model gets the placeholder model. A program whose generation fails is
 * logged and counted while the others continue.
 */
@RequiredArgsConstructor
public class GenerationStage {
    private static final Logger log = LoggerFactory.getLogger(GenerationStage.class);

    private final ProgramClassGenerator generator;
    private final String packageName;

    public StageResult<GenerationOutput> run(String jobId, List<ProgramDescriptor> programs,
                                             AnalysisOutput analysis, String targetStack,
                                             Path outputDir, ProgramWorkPool pool) {
        log.info("[{}] Generating Java for {} programs (stack: {})", jobId, programs.size(), targetStack);
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            return StageResult.failure("Cannot create output directory " + outputDir + ": " + e.getMessage());
        }

        List<Outcome> outcomes = pool.map(programs,
                program -> generateOne(jobId, program, analysis, targetStack, outputDir));

        GenerationOutput.GenerationOutputBuilder output = GenerationOutput.builder().outputDir(outputDir);
        int translated = 0;
        int skipped = 0;
        int failed = 0;
        for (Outcome outcome : outcomes) {
            switch (outcome.getKind()) {
                case TRANSLATED -> {
                    output.artifact(outcome.getArtifact().getProgramName(), outcome.getArtifact());
                    translated++;
                }
                case SKIPPED -> skipped++;
                case FAILED -> failed++;
            }
        }

        if (skipped > 0) {
            log.info("[{}] {} programs lacked identifiers and were skipped", jobId, skipped);
        }
        log.info("[{}] Generation complete: {} translated, {} skipped, {} failed",
                jobId, translated, skipped, failed);
        return StageResult.success(output.translated(translated).skipped(skipped).failed(failed).build());
    }

    private Outcome generateOne(String jobId, ProgramDescriptor program, AnalysisOutput analysis,
                                String targetStack, Path outputDir) {
        Optional<String> resolved = ProgramNames.resolve(program);
        if (resolved.isEmpty()) {
            log.warn("[{}] Program without identifiable name, skipping entry: {}", jobId, program);
            return Outcome.skipped();
        }
        String programName = resolved.get();

        StructuralModel model = analysis.modelFor(programName).orElseGet(() -> {
            log.warn("[{}] No structural model for {}; generating placeholder structure", jobId, programName);
            return StructuralModel.placeholder(programName);
        });

        log.info("[{}] Translating {} to Java", jobId, programName);
        String className = NamingUtil.toClassName(programName);
        Path javaFile = outputDir.resolve(className + ".java");
        try {
            String source = generator.generate(programName, model, targetStack);
            FileWriteUtil.safeWriteString(javaFile, source);
        } catch (IOException | TemplateRenderingException e) {
            log.error("[{}] Failed to generate {}: {}", jobId, programName, e.getMessage(), e);
            return Outcome.failed();
        }

        log.info("[{}] Translated {} successfully", jobId, programName);
        return Outcome.translated(GeneratedArtifact.builder()
                .path(javaFile)
                .className(className)
                .packageName(packageName)
                .programName(programName)
                .sourcePath(program.getPath())
                .sourceRelativePath(program.getRelativePath())
                .programRecordId(program.getRecordId())
                .build());
    }

    private enum Kind { TRANSLATED, SKIPPED, FAILED }

    @Value
    private static class Outcome {
        Kind kind;
        GeneratedArtifact artifact;

        static Outcome translated(GeneratedArtifact artifact) {
            return new Outcome(Kind.TRANSLATED, artifact);
        }

        static Outcome skipped() {
            return new Outcome(Kind.SKIPPED, null);
        }

        static Outcome failed() {
            return new Outcome(Kind.FAILED, null);
        }
    }
}
