package com.mainframe.migration.model;

import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Elementary WORKING-STORAGE item with a PIC clause.
 *
 * The inferred type is fixed at extraction time; consumers never re-derive it
 * from the picture.
 */
@Value
@Builder(toBuilder = true)
public class DataItem {

    /**
     * Two-digit level number as written in the source, e.g. "01" or "05".
     */
    @NonNull
    String level;

    /**
     * COBOL name, e.g. "WS-CUSTOMER-NAME".
     */
    @NonNull
    String name;

    /**
     * Raw picture string, e.g. "S9(7)V99".
     */
    @NonNull
    String picture;

    /**
     * Raw VALUE literal, null when absent.
     */
    String value;

    @NonNull
    InferredType inferredType;

    public Optional<String> getValue() {
        return Optional.ofNullable(value);
    }
}
