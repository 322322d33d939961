package com.mainframe.migration.codegen.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One generated field with its accessor names.
 *
 * Pure structure consumed by the class template.
 */
@Value
@Builder
public class FieldDefinition {

    /**
     * Original COBOL data name.
     */
    @NonNull
    String sourceName;

    @NonNull
    String name;

    @NonNull
    String javaType;

    /**
     * Java expression for the initial value.
     */
    @NonNull
    String initializer;

    @NonNull
    String getterName;

    @NonNull
    String setterName;
}
