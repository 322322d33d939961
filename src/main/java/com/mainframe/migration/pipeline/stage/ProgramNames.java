package com.mainframe.migration.pipeline.stage;

import java.util.Optional;

import com.mainframe.migration.codegen.util.NamingUtil;
import com.mainframe.migration.model.ProgramDescriptor;

import lombok.experimental.UtilityClass;

/**
 * Resolves the name a program is keyed by across stages.
 */
@UtilityClass
public class ProgramNames {

    /**
     * Descriptor name, else the stem of the relative path, else the stem of
     * the absolute path. Empty when all three are blank.
     */
    public static Optional<String> resolve(ProgramDescriptor program) {
        if (program.getName() != null && !program.getName().isBlank()) {
            return Optional.of(program.getName().trim());
        }
        String fromRelative = NamingUtil.fileStem(program.getRelativePath());
        if (!fromRelative.isEmpty()) {
            return Optional.of(fromRelative);
        }
        String fromAbsolute = NamingUtil.fileStem(program.getPath());
        return fromAbsolute.isEmpty() ? Optional.empty() : Optional.of(fromAbsolute);
    }
}
