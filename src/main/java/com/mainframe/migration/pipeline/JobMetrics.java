package com.mainframe.migration.pipeline;

import java.util.LinkedHashMap;
import java.util.Map;

import lombok.Builder;
import lombok.Value;

/**
 * Counters recorded when a job completes.
 */
@Value
@Builder
public class JobMetrics {

    int programsProcessed;

    int programsTranslated;

    /**
     * Descriptors without any usable name.
     */
    int programsSkipped;

    /**
     * Programs whose generation failed with an error.
     */
    int programsFailed;

    int testsGenerated;

    int testsPassed;

    int testsFailed;

    boolean validationSuccess;

    /**
     * Flat view with snake_case keys, as reported to job consumers.
     */
    public Map<String, Object> asMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("programs_processed", programsProcessed);
        map.put("programs_translated", programsTranslated);
        map.put("programs_skipped", programsSkipped);
        map.put("programs_failed", programsFailed);
        map.put("tests_generated", testsGenerated);
        map.put("tests_passed", testsPassed);
        map.put("tests_failed", testsFailed);
        map.put("validation_success", validationSuccess);
        return map;
    }
}
