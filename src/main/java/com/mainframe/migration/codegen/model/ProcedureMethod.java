package com.mainframe.migration.codegen.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Stub method generated for one COBOL paragraph.
 */
@Value
@Builder
public class ProcedureMethod {

    @NonNull
    String sourceName;

    @NonNull
    String name;
}
