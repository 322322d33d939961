package com.mainframe.migration.model;

import java.util.List;
import java.util.Set;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Extracted shape of one COBOL program.
 *
 * Created once by the analyzer and never mutated afterwards. All collections
 * are immutable copies made by the Lombok builder.
 */
@Value
@Builder(toBuilder = true)
public class StructuralModel {

    public static final String UNKNOWN_PROGRAM_ID = "UNKNOWN";

    /**
     * Declared PROGRAM-ID, or the file-derived program name when absent.
     * Never empty.
     */
    @NonNull
    String programId;

    @Singular
    Set<Division> divisions;

    @Singular
    List<DataItem> dataItems;

    @Singular
    List<ProcedureRef> procedures;

    @Singular
    List<FileControlEntry> fileControls;

    /**
     * Empty model used when the analyzer produced nothing for a program.
     */
    public static StructuralModel placeholder(String programName) {
        String id = programName == null || programName.isBlank() ? UNKNOWN_PROGRAM_ID : programName;
        return StructuralModel.builder().programId(id).build();
    }

    public boolean isEmpty() {
        return divisions.isEmpty() && dataItems.isEmpty() && procedures.isEmpty() && fileControls.isEmpty();
    }
}
