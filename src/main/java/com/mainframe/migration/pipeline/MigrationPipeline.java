package com.mainframe.migration.pipeline;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.migration.analyzer.ProgramAnalyzerService;
import com.mainframe.migration.codegen.ArtifactRecovery;
import com.mainframe.migration.codegen.ProgramClassGenerator;
import com.mainframe.migration.codegen.TestSourceGenerator;
import com.mainframe.migration.codegen.model.GeneratedArtifact;
import com.mainframe.migration.codegen.template.TemplateRenderer;
import com.mainframe.migration.discovery.DiscoveryOutput;
import com.mainframe.migration.discovery.FileSystemProgramDiscovery;
import com.mainframe.migration.discovery.ProgramDiscovery;
import com.mainframe.migration.model.ProgramDescriptor;
import com.mainframe.migration.pipeline.stage.AnalysisOutput;
import com.mainframe.migration.pipeline.stage.AnalysisStage;
import com.mainframe.migration.pipeline.stage.DiscoveryStage;
import com.mainframe.migration.pipeline.stage.GenerationOutput;
import com.mainframe.migration.pipeline.stage.GenerationStage;
import com.mainframe.migration.pipeline.stage.TestGenerationOutput;
import com.mainframe.migration.pipeline.stage.TestGenerationStage;
import com.mainframe.migration.pipeline.stage.ValidationStage;
import com.mainframe.migration.validation.ProgramValidator;
import com.mainframe.migration.validation.ValidationReport;

/**
 * Runs one migration job through discovery, analysis, generation, test
 * generation and validation.
 *
 * Progress checkpoints are 0, 10, 30, 50, 70, 85 and 100. A failing stage
 * fails the job with its message; a failing validation verdict is only
 * logged. Post-processors run between generation and test generation and
 * can never fail the job.
 */
public class MigrationPipeline {
    private static final Logger log = LoggerFactory.getLogger(MigrationPipeline.class);

    private final PipelineConfig config;
    private final DiscoveryStage discoveryStage;
    private final AnalysisStage analysisStage;
    private final GenerationStage generationStage;
    private final TestGenerationStage testGenerationStage;
    private final ValidationStage validationStage;
    private final ArtifactRecovery artifactRecovery;
    private final List<ArtifactPostProcessor> postProcessors;

    public MigrationPipeline(PipelineConfig config) {
        this(config, new FileSystemProgramDiscovery(config.getSourceExtensions()), List.of());
    }

    public MigrationPipeline(PipelineConfig config, ProgramDiscovery discovery,
                             List<ArtifactPostProcessor> postProcessors) {
        this.config = config;
        this.discoveryStage = new DiscoveryStage(discovery);
        this.analysisStage = new AnalysisStage(new ProgramAnalyzerService());
        this.generationStage = new GenerationStage(
                new ProgramClassGenerator(new TemplateRenderer(), config.getTargetPackage(), config.getReservedPrefix()),
                config.getTargetPackage());
        this.testGenerationStage = new TestGenerationStage(new TestSourceGenerator());
        this.validationStage = new ValidationStage(new ProgramValidator(), config.getValidationPolicy());
        this.artifactRecovery = new ArtifactRecovery();
        this.postProcessors = List.copyOf(postProcessors);
    }

    public MigrationResult run(MigrationJob job) {
        return run(job, new JobState(job.getJobId()));
    }

    /**
     * Run {@code job}, reporting transitions on {@code state}.
     *
     * Never throws for stage failures; the outcome is in the returned
     * snapshot.
     */
    public MigrationResult run(MigrationJob job, JobState state) {
        String jobId = job.getJobId();
        MigrationResult.MigrationResultBuilder result = MigrationResult.builder();

        log.info("Starting migration job: {}", jobId);
        if (!state.start()) {
            return result.job(state.snapshot()).build();
        }

        try (ProgramWorkPool pool = new ProgramWorkPool(config.getWorkerThreads())) {
            // Step 1: Discovery
            log.info("[{}] Step 1: Discovering programs...", jobId);
            state.advance(PipelineStage.DISCOVERY);
            DiscoveryOutput discovery = discoveryStage.run(job).orElseThrow(PipelineStage.DISCOVERY);
            List<ProgramDescriptor> programs = discovery.getPrograms();

            // Step 2: Analysis
            log.info("[{}] Step 2: Analyzing programs...", jobId);
            state.advance(PipelineStage.ANALYSIS);
            AnalysisOutput analysis = analysisStage.run(jobId, programs, pool)
                    .orElseThrow(PipelineStage.ANALYSIS);

            // Step 3: Generation
            log.info("[{}] Step 3: Generating Java classes...", jobId);
            state.advance(PipelineStage.GENERATION);
            GenerationOutput generation = generationStage.run(jobId, programs, analysis, job.getTargetStack(),
                    config.javaOutputDir(jobId), pool).orElseThrow(PipelineStage.GENERATION);
            Map<String, GeneratedArtifact> artifacts = postProcess(jobId, artifactsOf(jobId, generation));
            result.artifacts(artifacts);

            // Step 4: Test generation
            log.info("[{}] Step 4: Generating tests...", jobId);
            state.advance(PipelineStage.TEST_GENERATION);
            TestGenerationOutput tests = testGenerationStage.run(jobId, artifacts, config.testsOutputDir(jobId), pool)
                    .orElseThrow(PipelineStage.TEST_GENERATION);
            result.tests(tests.getTests());

            // Step 5: Validation, advisory
            log.info("[{}] Step 5: Validating generated code...", jobId);
            state.advance(PipelineStage.VALIDATION);
            ValidationReport report = validationStage.run(jobId, artifacts, tests, pool)
                    .orElseThrow(PipelineStage.VALIDATION);
            result.validationResults(report.getResults());
            if (!report.isSuccess()) {
                log.warn("[{}] Validation reported issues: {} of {} programs passed, {} required", jobId,
                        report.getPassed(), report.getTotal(), report.getPolicy().getMinimumPassing());
            }

            JobMetrics metrics = JobMetrics.builder()
                    .programsProcessed(programs.size())
                    .programsTranslated(generation.getTranslated())
                    .programsSkipped(generation.getSkipped())
                    .programsFailed(generation.getFailed())
                    .testsGenerated(tests.getGenerated())
                    .testsPassed(report.getPassed())
                    .testsFailed(report.getFailed())
                    .validationSuccess(report.isSuccess())
                    .build();
            if (state.complete(metrics)) {
                log.info("[{}] Migration job completed successfully", jobId);
            }
        } catch (StageFailedException e) {
            log.error("[{}] Migration job failed: {}", jobId, e.getMessage());
            state.fail(e.getMessage());
        } catch (RuntimeException e) {
            log.error("[{}] Migration job failed: {}", jobId, e.getMessage(), e);
            state.fail(e.getClass().getSimpleName() + ": " + e.getMessage());
        }

        return result.job(state.snapshot()).build();
    }

    /**
     * Artifacts from generation. When generation handed back no artifact
     * records, classes already in the job's java output area are rebuilt from
     * disk so tests and validation still cover them.
     */
    private Map<String, GeneratedArtifact> artifactsOf(String jobId, GenerationOutput generation) {
        if (!generation.getArtifacts().isEmpty()) {
            return generation.getArtifacts();
        }
        Path outputDir = generation.getOutputDir();
        Map<String, GeneratedArtifact> recovered;
        try {
            recovered = artifactRecovery.rebuild(outputDir, config.getTargetPackage());
        } catch (IOException e) {
            throw new StageFailedException(PipelineStage.GENERATION,
                    "Cannot recover artifacts from " + outputDir + ": " + e.getMessage(), e);
        }
        if (!recovered.isEmpty()) {
            log.warn("[{}] Artifact metadata missing, recovered {} classes from {}", jobId, recovered.size(), outputDir);
        }
        return recovered;
    }

    private Map<String, GeneratedArtifact> postProcess(String jobId, Map<String, GeneratedArtifact> artifacts) {
        if (postProcessors.isEmpty()) {
            return artifacts;
        }
        Map<String, GeneratedArtifact> processed = new LinkedHashMap<>();
        for (Map.Entry<String, GeneratedArtifact> entry : artifacts.entrySet()) {
            GeneratedArtifact artifact = entry.getValue();
            for (ArtifactPostProcessor processor : postProcessors) {
                artifact = applySafely(jobId, processor, artifact);
            }
            processed.put(entry.getKey(), artifact);
        }
        return processed;
    }

    private GeneratedArtifact applySafely(String jobId, ArtifactPostProcessor processor, GeneratedArtifact artifact) {
        try {
            GeneratedArtifact updated = processor.process(jobId, artifact);
            return updated != null ? updated : artifact;
        } catch (Exception e) {
            log.warn("[{}] Post-processor {} failed for {}, keeping original artifact: {}", jobId,
                    processor.getName(), artifact.getProgramName(), e.getMessage());
            return artifact;
        }
    }
}
