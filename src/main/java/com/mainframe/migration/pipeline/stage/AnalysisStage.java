package com.mainframe.migration.pipeline.stage;

import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.migration.analyzer.ProgramAnalyzerService;
import com.mainframe.migration.model.ProgramDescriptor;
import com.mainframe.migration.model.StructuralModel;
import com.mainframe.migration.pipeline.ProgramWorkPool;
import com.mainframe.migration.pipeline.StageResult;

import lombok.RequiredArgsConstructor;
import lombok.Value;

/**
 * Builds a structural model for each discovered program.
 */
@RequiredArgsConstructor
public class AnalysisStage {
    private static final Logger log = LoggerFactory.getLogger(AnalysisStage.class);

    private final ProgramAnalyzerService analyzerService;

    public StageResult<AnalysisOutput> run(String jobId, List<ProgramDescriptor> programs, ProgramWorkPool pool) {
        log.info("[{}] Analyzing {} programs", jobId, programs.size());

        List<Analyzed> analyzed = pool.map(programs, program -> analyze(jobId, program));

        AnalysisOutput.AnalysisOutputBuilder output = AnalysisOutput.builder();
        int unreadable = 0;
        for (Analyzed result : analyzed) {
            if (result == null) {
                continue;
            }
            if (result.getModel().isPresent()) {
                output.model(result.getProgramName(), result.getModel().get());
            } else {
                unreadable++;
            }
        }

        AnalysisOutput result = output.unreadable(unreadable).build();
        log.info("[{}] Analysis complete: {} models, {} unreadable", jobId, result.getModels().size(), unreadable);
        return StageResult.success(result);
    }

    private Analyzed analyze(String jobId, ProgramDescriptor program) {
        Optional<String> name = ProgramNames.resolve(program);
        if (name.isEmpty()) {
            log.warn("[{}] Program without identifiable name, not analyzed: {}", jobId, program);
            return null;
        }
        return new Analyzed(name.get(), analyzerService.analyze(program, name.get()));
    }

    @Value
    private static class Analyzed {
        String programName;
        Optional<StructuralModel> model;
    }
}
