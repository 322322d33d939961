package com.mainframe.migration.pipeline;

/**
 * Pipeline stages in execution order with the progress reported on entry.
 */
public enum PipelineStage {
    DISCOVERY("Discovery", 10),
    ANALYSIS("Analysis", 30),
    GENERATION("Generation", 50),
    TEST_GENERATION("TestGeneration", 70),
    VALIDATION("Validation", 85),
    COMPLETED("Completed", 100);

    private final String displayName;
    private final int checkpoint;

    PipelineStage(String displayName, int checkpoint) {
        this.displayName = displayName;
        this.checkpoint = checkpoint;
    }

    public String getDisplayName() {
        return displayName;
    }

    public int getCheckpoint() {
        return checkpoint;
    }
}
