package com.mainframe.migration.pipeline;

/**
 * A stage could not produce its output; the job fails with this message.
 */
public class StageFailedException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final PipelineStage stage;

    public StageFailedException(PipelineStage stage, String message) {
        super(stage.getDisplayName() + " failed: " + message);
        this.stage = stage;
    }

    public StageFailedException(PipelineStage stage, String message, Throwable cause) {
        super(stage.getDisplayName() + " failed: " + message, cause);
        this.stage = stage;
    }

    public PipelineStage getStage() {
        return stage;
    }
}
