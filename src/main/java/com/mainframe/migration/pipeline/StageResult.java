package com.mainframe.migration.pipeline;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of one stage: a typed payload on success, a message on failure.
 *
 * @param <T> stage payload type
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class StageResult<T> {

    boolean success;

    T payload;

    String message;

    public static <T> StageResult<T> success(T payload) {
        return new StageResult<>(true, payload, null);
    }

    public static <T> StageResult<T> failure(String message) {
        return new StageResult<>(false, null, message);
    }

    /**
     * Payload of a successful result.
     *
     * @throws StageFailedException if the stage failed
     */
    public T orElseThrow(PipelineStage stage) {
        if (!success) {
            throw new StageFailedException(stage, message);
        }
        return payload;
    }
}
