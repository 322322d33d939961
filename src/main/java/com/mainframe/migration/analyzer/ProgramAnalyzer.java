package com.mainframe.migration.analyzer;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.migration.model.DataItem;
import com.mainframe.migration.model.Division;
import com.mainframe.migration.model.FileControlEntry;
import com.mainframe.migration.model.ProcedureKind;
import com.mainframe.migration.model.ProcedureRef;
import com.mainframe.migration.model.StructuralModel;

/**
 * Best-effort structural scanner for one COBOL program.
 *
 * This is pattern extraction, not parsing: anything that does not match the
 * expected line shapes is skipped. Each section is located first and only the
 * text of that section is scanned, so a PIC line in LINKAGE SECTION or a
 * period-terminated word outside the PROCEDURE DIVISION is never picked up.
 */
public class ProgramAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(ProgramAnalyzer.class);

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.MULTILINE;

    private static final Pattern PROGRAM_ID = Pattern.compile(
            "PROGRAM-ID\\s*\\.?\\s+['\"]?([A-Z0-9][A-Z0-9_-]*)", FLAGS);

    private static final Pattern DIVISION = Pattern.compile(
            "\\b(IDENTIFICATION|ID|ENVIRONMENT|DATA|PROCEDURE)\\s+DIVISION\\b", FLAGS);

    private static final Pattern WORKING_STORAGE = Pattern.compile(
            "WORKING-STORAGE\\s+SECTION\\s*\\.(.*?)(?=^\\s*[A-Z][A-Z0-9-]*\\s+SECTION\\s*\\.|PROCEDURE\\s+DIVISION|\\z)",
            FLAGS | Pattern.DOTALL);

    // <level> <name> PIC[TURE] [IS] <picture> [usage] [VALUE [IS] <literal>] [.]
    // A period inside the picture is kept when it is followed by more picture characters.
    private static final Pattern DATA_ITEM = Pattern.compile(
            "^\\s*(\\d{2})\\s+([A-Z0-9][A-Z0-9_-]*)\\s+PIC(?:TURE)?\\s+(?:IS\\s+)?((?:[^\\s.]|\\.(?=[^\\s.]))+)"
                    + "(?:\\s+(?:USAGE\\s+(?:IS\\s+)?)?(?:COMP(?:UTATIONAL)?(?:-[1-5])?|BINARY|PACKED-DECIMAL|DISPLAY))?"
                    + "(?:\\s+VALUES?\\s+(?:IS\\s+)?(.+?))?\\s*\\.?\\s*$",
            FLAGS);

    private static final Pattern PROCEDURE_DIVISION = Pattern.compile(
            "PROCEDURE\\s+DIVISION[^.]*\\.(.*)\\z", FLAGS | Pattern.DOTALL);

    private static final Pattern PARAGRAPH = Pattern.compile(
            "^\\s*([A-Z0-9][A-Z0-9-]*)\\s*\\.(?=\\s|$)", FLAGS);

    private static final Pattern HAS_LETTER = Pattern.compile("[A-Z]", Pattern.CASE_INSENSITIVE);

    private static final Pattern FILE_CONTROL = Pattern.compile(
            "FILE-CONTROL\\s*\\.(.*?)(?=DATA\\s+DIVISION|^\\s*[A-Z][A-Z0-9-]*\\s+SECTION\\s*\\.|\\z)",
            FLAGS | Pattern.DOTALL);

    private static final Pattern SELECT = Pattern.compile(
            "SELECT\\s+(?:OPTIONAL\\s+)?([A-Z0-9][A-Z0-9_-]*)\\s+ASSIGN\\s+(?:TO\\s+)?('[^']*'|\"[^\"]*\"|[^\\s.]+)",
            FLAGS);

    /**
     * Statement verbs and scope terminators that can stand alone on a line
     * followed by a period and must never become paragraph names.
     */
    static final Set<String> STATEMENT_KEYWORDS = Set.of(
            "STOP", "DISPLAY", "MOVE", "ADD", "COMPUTE", "PERFORM", "IF", "ELSE", "END-IF",
            "EXIT", "GOBACK", "CONTINUE", "SUBTRACT", "MULTIPLY", "DIVIDE", "CALL", "READ", "WRITE",
            "OPEN", "CLOSE", "ACCEPT", "EVALUATE", "WHEN", "INITIALIZE", "STRING", "UNSTRING",
            "END-PERFORM", "END-EVALUATE", "END-READ", "END-WRITE", "END-COMPUTE", "END-CALL",
            "END-STRING", "END-UNSTRING", "END-ADD", "END-SUBTRACT", "END-MULTIPLY", "END-DIVIDE",
            "END-SEARCH", "END-START", "END-REWRITE", "END-DELETE", "END-RETURN", "END-EXEC");

    /**
     * Extracts a structural model from raw source text.
     *
     * @param source       program text, may be null
     * @param fallbackName program name used when no PROGRAM-ID is declared
     * @return the model; never null and never throws on malformed input
     */
    public StructuralModel analyze(String source, String fallbackName) {
        String text = source == null ? "" : source;

        StructuralModel.StructuralModelBuilder builder = StructuralModel.builder()
                .programId(extractProgramId(text, fallbackName));

        scan("divisions", fallbackName, () -> extractDivisions(text, builder));
        scan("data items", fallbackName, () -> extractDataItems(text, builder, fallbackName));
        scan("procedures", fallbackName, () -> extractProcedures(text, builder));
        scan("file controls", fallbackName, () -> extractFileControls(text, builder));

        return builder.build();
    }

    /**
     * Runs one extractor; a failure only costs that part of the model.
     */
    private void scan(String part, String programName, Runnable extractor) {
        try {
            extractor.run();
        } catch (RuntimeException e) {
            log.warn("Could not extract {} of {}: {}", part, programName, e.toString());
        }
    }

    String extractProgramId(String text, String fallbackName) {
        Matcher m = PROGRAM_ID.matcher(text);
        if (m.find()) {
            return m.group(1);
        }
        if (fallbackName != null && !fallbackName.isBlank()) {
            return fallbackName;
        }
        return StructuralModel.UNKNOWN_PROGRAM_ID;
    }

    private void extractDivisions(String text, StructuralModel.StructuralModelBuilder builder) {
        Matcher m = DIVISION.matcher(text);
        while (m.find()) {
            String keyword = m.group(1).toUpperCase(Locale.ROOT);
            builder.division("ID".equals(keyword) ? Division.IDENTIFICATION : Division.valueOf(keyword));
        }
    }

    private void extractDataItems(String text, StructuralModel.StructuralModelBuilder builder, String programName) {
        Matcher section = WORKING_STORAGE.matcher(text);
        if (!section.find()) {
            return;
        }
        Matcher m = DATA_ITEM.matcher(section.group(1));
        while (m.find()) {
            try {
                builder.dataItem(toDataItem(m));
            } catch (RuntimeException e) {
                log.warn("Skipping data item {} of {}: {}", m.group(2), programName, e.toString());
            }
        }
    }

    DataItem toDataItem(Matcher m) {
        String picture = m.group(3);
        String value = m.group(4) != null ? m.group(4).trim() : null;
        return DataItem.builder()
                .level(m.group(1))
                .name(m.group(2))
                .picture(picture)
                .value(value == null || value.isEmpty() ? null : value)
                .inferredType(PictureTypeInference.inferType(picture))
                .build();
    }

    private void extractProcedures(String text, StructuralModel.StructuralModelBuilder builder) {
        Matcher section = PROCEDURE_DIVISION.matcher(text);
        if (!section.find()) {
            return;
        }
        Matcher m = PARAGRAPH.matcher(section.group(1));
        while (m.find()) {
            String name = m.group(1);
            // Bare numbers like "100." are literals, not paragraph names
            if (!HAS_LETTER.matcher(name).find() || STATEMENT_KEYWORDS.contains(name.toUpperCase(Locale.ROOT))) {
                continue;
            }
            builder.procedure(ProcedureRef.builder()
                    .name(name)
                    .kind(ProcedureKind.PARAGRAPH)
                    .build());
        }
    }

    private void extractFileControls(String text, StructuralModel.StructuralModelBuilder builder) {
        Matcher section = FILE_CONTROL.matcher(text);
        if (!section.find()) {
            return;
        }
        Matcher m = SELECT.matcher(section.group(1));
        while (m.find()) {
            builder.fileControl(FileControlEntry.builder()
                    .logicalFileName(m.group(1))
                    .assignedTarget(m.group(2))
                    .build());
        }
    }
}
