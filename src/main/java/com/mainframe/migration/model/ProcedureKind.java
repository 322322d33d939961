package com.mainframe.migration.model;

/**
 * Kinds of executable blocks recognized in the PROCEDURE DIVISION.
 */
public enum ProcedureKind {
    PARAGRAPH
}
