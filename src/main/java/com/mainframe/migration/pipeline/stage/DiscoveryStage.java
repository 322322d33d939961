package com.mainframe.migration.pipeline.stage;

import java.io.IOException;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.migration.discovery.DiscoveryOutput;
import com.mainframe.migration.discovery.ProgramDiscovery;
import com.mainframe.migration.model.ProgramDescriptor;
import com.mainframe.migration.pipeline.MigrationJob;
import com.mainframe.migration.pipeline.StageResult;

import lombok.RequiredArgsConstructor;

/**
 * Lists the programs of the job's repository, or takes the pre-discovered list.
 */
@RequiredArgsConstructor
public class DiscoveryStage {
    private static final Logger log = LoggerFactory.getLogger(DiscoveryStage.class);

    private final ProgramDiscovery discovery;

    public StageResult<DiscoveryOutput> run(MigrationJob job) {
        String jobId = job.getJobId();
        if (job.getPrograms().isPresent()) {
            List<ProgramDescriptor> programs = job.getPrograms().get();
            log.info("[{}] Using {} pre-discovered programs", jobId, programs.size());
            return StageResult.success(DiscoveryOutput.builder().programs(programs).build());
        }

        log.info("[{}] Scanning repository {} (branch {}, commit {})", jobId, job.getRepositoryPath(),
                job.getBranch(), job.getCommit());
        try {
            DiscoveryOutput output = discovery.discover(job.getRepositoryPath(), job.getSelectedPrograms());
            log.info("[{}] Found {} programs", jobId, output.getPrograms().size());
            return StageResult.success(output);
        } catch (IOException e) {
            log.error("[{}] Repository scan failed: {}", jobId, e.getMessage());
            return StageResult.failure("Repository scan failed: " + e);
        }
    }
}
