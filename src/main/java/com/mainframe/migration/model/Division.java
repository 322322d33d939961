package com.mainframe.migration.model;

/**
 * The four canonical COBOL divisions.
 */
public enum Division {
    IDENTIFICATION,
    ENVIRONMENT,
    DATA,
    PROCEDURE
}
