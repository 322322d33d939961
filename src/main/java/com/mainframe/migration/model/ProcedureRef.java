package com.mainframe.migration.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Named paragraph discovered in the PROCEDURE DIVISION.
 */
@Value
@Builder
public class ProcedureRef {

    @NonNull
    String name;

    @NonNull
    @Builder.Default
    ProcedureKind kind = ProcedureKind.PARAGRAPH;
}
