package com.mainframe.migration.codegen.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Everything the class template needs to render one migrated program.
 */
@Value
@Builder
public class ProgramClassDefinition {

    @NonNull
    String packageName;

    @NonNull
    String className;

    /**
     * PROGRAM-ID from the structural model, shown in the class Javadoc.
     */
    @NonNull
    String programId;

    @Singular
    List<FieldDefinition> fields;

    @Singular
    List<ProcedureMethod> methods;

    /**
     * Original paragraph names joined in source order, for the main logic comment.
     */
    public String getProcedureSummary() {
        if (methods.isEmpty()) {
            return "none";
        }
        StringBuilder sb = new StringBuilder();
        for (ProcedureMethod method : methods) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(method.getSourceName());
        }
        return sb.toString();
    }

    public boolean isUsesBigDecimal() {
        return fields.stream().anyMatch(f -> "BigDecimal".equals(f.getJavaType()));
    }
}
