package com.mainframe.migration.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * SELECT ... ASSIGN TO ... entry from FILE-CONTROL.
 *
 * Dependency metadata only; code generation does not consume it.
 */
@Value
@Builder
public class FileControlEntry {

    @NonNull
    String logicalFileName;

    @NonNull
    String assignedTarget;
}
