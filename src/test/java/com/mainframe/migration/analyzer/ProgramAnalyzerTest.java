package com.mainframe.migration.analyzer;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.regex.Matcher;

import org.junit.jupiter.api.Test;

import com.mainframe.migration.model.DataItem;
import com.mainframe.migration.model.Division;
import com.mainframe.migration.model.FileControlEntry;
import com.mainframe.migration.model.InferredType;
import com.mainframe.migration.model.ProcedureKind;
import com.mainframe.migration.model.ProcedureRef;
import com.mainframe.migration.model.StructuralModel;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for structural extraction from COBOL source text.
 */
class ProgramAnalyzerTest {

    private final ProgramAnalyzer analyzer = new ProgramAnalyzer();

    @Test
    void testCalcScenario() {
        String source = """
                       IDENTIFICATION DIVISION.
                       PROGRAM-ID. CALC.
                       DATA DIVISION.
                       WORKING-STORAGE SECTION.
                       01 WS-RESULT PIC 9(6) VALUE ZERO.
                       PROCEDURE DIVISION.
                           STOP RUN.
                """;

        StructuralModel model = analyzer.analyze(source, "calc-file");

        assertThat(model.getProgramId()).isEqualTo("CALC");
        assertThat(model.getDataItems()).hasSize(1);
        DataItem item = model.getDataItems().get(0);
        assertThat(item.getLevel()).isEqualTo("01");
        assertThat(item.getName()).isEqualTo("WS-RESULT");
        assertThat(item.getPicture()).isEqualTo("9(6)");
        assertThat(item.getInferredType()).isEqualTo(InferredType.INTEGER);
        assertThat(item.getValue()).contains("ZERO");
        assertThat(model.getProcedures()).isEmpty();
    }

    @Test
    void testFullProgramFromFixture() throws IOException {
        StructuralModel model = analyzer.analyze(readFixture("/programs/PAYROLL.cbl"), "PAYROLL");

        assertThat(model.getProgramId()).isEqualTo("PAYROLL");
        assertThat(model.getDivisions()).containsExactlyInAnyOrder(
                Division.IDENTIFICATION, Division.ENVIRONMENT, Division.DATA, Division.PROCEDURE);

        assertThat(model.getDataItems())
                .extracting(DataItem::getName)
                .containsExactly("WS-EMPLOYEE-COUNT", "WS-TOTAL-PAY", "WS-EOF-FLAG",
                        "WS-COMPANY-NAME", "WS-RECORD-TOTAL");
        assertThat(model.getDataItems())
                .extracting(DataItem::getInferredType)
                .containsExactly(InferredType.SHORT_INTEGER, InferredType.DECIMAL, InferredType.STRING,
                        InferredType.STRING, InferredType.LONG_INTEGER);
        assertThat(model.getDataItems().get(1).getPicture()).isEqualTo("S9(7)V99");
        assertThat(model.getDataItems().get(2).getValue()).contains("'N'");
        assertThat(model.getDataItems().get(3).getValue()).contains("\"ACME CORP\"");

        assertThat(model.getProcedures())
                .extracting(ProcedureRef::getName)
                .containsExactly("MAIN-PARA", "INIT-PARA", "PROCESS-PARA", "FINISH-PARA");
        assertThat(model.getProcedures())
                .extracting(ProcedureRef::getKind)
                .containsOnly(ProcedureKind.PARAGRAPH);

        assertThat(model.getFileControls())
                .extracting(FileControlEntry::getLogicalFileName, FileControlEntry::getAssignedTarget)
                .containsExactly(
                        tuple("EMPLOYEE-FILE", "'EMPLOYEE.DAT'"),
                        tuple("REPORT-FILE", "PAYRPT"));
    }

    @Test
    void testStatementKeywordsAreNeverParagraphs() {
        String source = """
                       PROCEDURE DIVISION.
                       MAIN-LOGIC.
                           IF WS-A > 0
                               DISPLAY 'POSITIVE'
                           ELSE.
                           END-IF.
                           CONTINUE.
                           GOBACK.
                       STOP.
                       EXIT.
                       DONE-PARA.
                           EXIT.
                """;

        StructuralModel model = analyzer.analyze(source, "X");

        assertThat(model.getProcedures())
                .extracting(ProcedureRef::getName)
                .containsExactly("MAIN-LOGIC", "DONE-PARA");
    }

    @Test
    void testPeriodTerminatedWordsOutsideProcedureDivisionAreIgnored() {
        String source = """
                       IDENTIFICATION DIVISION.
                       PROGRAM-ID. NOPROC.
                       AUTHOR.
                       DATA DIVISION.
                """;

        StructuralModel model = analyzer.analyze(source, "NOPROC");

        assertThat(model.getProcedures()).isEmpty();
    }

    @Test
    void testDataItemsOnlyFromWorkingStorage() {
        String source = """
                       DATA DIVISION.
                       FILE SECTION.
                       01 FILE-REC PIC X(80).
                       WORKING-STORAGE SECTION.
                       01 WS-KEPT PIC 9(3).
                       LINKAGE SECTION.
                       01 LK-DROPPED PIC X(10).
                       PROCEDURE DIVISION.
                       01 NOT-DATA PIC 9.
                """;

        StructuralModel model = analyzer.analyze(source, "SECTIONS");

        assertThat(model.getDataItems()).extracting(DataItem::getName).containsExactly("WS-KEPT");
    }

    @Test
    void testDataItemVariants() {
        String source = """
                       WORKING-STORAGE SECTION.
                       05 WS-AMOUNT PICTURE IS ZZ9.99.
                       05 WS-COUNTER PIC S9(4) USAGE IS COMP VALUE IS 10.
                       05 WS-LABEL PIC X(12) VALUE 'TOTAL. DUE'.
                       05 WS-BARE PIC 9(2)
                """;

        StructuralModel model = analyzer.analyze(source, "VARIANTS");

        assertThat(model.getDataItems())
                .extracting(DataItem::getName, DataItem::getPicture, DataItem::getLevel)
                .containsExactly(
                        tuple("WS-AMOUNT", "ZZ9.99", "05"),
                        tuple("WS-COUNTER", "S9(4)", "05"),
                        tuple("WS-LABEL", "X(12)", "05"),
                        tuple("WS-BARE", "9(2)", "05"));
        assertThat(model.getDataItems().get(0).getInferredType()).isEqualTo(InferredType.DECIMAL);
        assertThat(model.getDataItems().get(0).getValue()).isEmpty();
        assertThat(model.getDataItems().get(1).getValue()).contains("10");
        assertThat(model.getDataItems().get(2).getValue()).contains("'TOTAL. DUE'");
    }

    @Test
    void testIdDivisionAbbreviationCountsAsIdentification() {
        StructuralModel model = analyzer.analyze("       ID DIVISION.\n       PROGRAM-ID. SHORTID.\n", null);

        assertThat(model.getDivisions()).containsExactly(Division.IDENTIFICATION);
    }

    @Test
    void testProgramIdFallsBackToNameThenUnknown() {
        assertThat(analyzer.analyze("       PROCEDURE DIVISION.\n", "FROMFILE").getProgramId())
                .isEqualTo("FROMFILE");
        assertThat(analyzer.analyze("", "  ").getProgramId()).isEqualTo(StructuralModel.UNKNOWN_PROGRAM_ID);
        assertThat(analyzer.analyze(null, null).getProgramId()).isEqualTo(StructuralModel.UNKNOWN_PROGRAM_ID);
    }

    @Test
    void testQuotedProgramId() {
        assertThat(analyzer.analyze("       PROGRAM-ID. 'QUOTED-ID'.\n", "x").getProgramId())
                .isEqualTo("QUOTED-ID");
    }

    @Test
    void testGarbageInputYieldsEmptyModel() {
        StructuralModel model = analyzer.analyze("\0\1 not cobol at all (((", "JUNK");

        assertThat(model.getProgramId()).isEqualTo("JUNK");
        assertThat(model.isEmpty()).isTrue();
    }

    @Test
    void testHugePictureKeepsLaterItemsAndProcedures() {
        String source = """
                       PROGRAM-ID. BIG.
                       DATA DIVISION.
                       WORKING-STORAGE SECTION.
                       01 WS-BIG PIC 9(99999999999).
                       01 WS-HUGE PIC 9(2000000000).
                       01 WS-RESULT PIC 9(6) VALUE ZERO.
                       PROCEDURE DIVISION.
                       MAIN-PARA.
                           STOP RUN.
                """;

        StructuralModel model = analyzer.analyze(source, "BIG");

        assertThat(model.getDataItems())
                .extracting(DataItem::getName, DataItem::getInferredType)
                .containsExactly(
                        tuple("WS-BIG", InferredType.LONG_INTEGER),
                        tuple("WS-HUGE", InferredType.LONG_INTEGER),
                        tuple("WS-RESULT", InferredType.INTEGER));
        assertThat(model.getProcedures()).extracting(ProcedureRef::getName).containsExactly("MAIN-PARA");
    }

    @Test
    void testFailingDataItemIsSkippedAndScanningContinues() {
        ProgramAnalyzer failingOnBad = new ProgramAnalyzer() {
            @Override
            DataItem toDataItem(Matcher m) {
                if ("WS-BAD".equals(m.group(2))) {
                    throw new IllegalArgumentException("unsupported picture");
                }
                return super.toDataItem(m);
            }
        };
        String source = """
                       WORKING-STORAGE SECTION.
                       01 WS-FIRST PIC X(3).
                       01 WS-BAD PIC 9(4).
                       01 WS-LAST PIC 9(4).
                       PROCEDURE DIVISION.
                       MAIN-PARA.
                           STOP RUN.
                """;

        StructuralModel model = failingOnBad.analyze(source, "PARTIAL");

        assertThat(model.getDataItems()).extracting(DataItem::getName).containsExactly("WS-FIRST", "WS-LAST");
        assertThat(model.getProcedures()).extracting(ProcedureRef::getName).containsExactly("MAIN-PARA");
    }

    @Test
    void testParagraphNamesMayStartWithDigits() {
        String source = """
                       PROCEDURE DIVISION.
                       0000-MAIN.
                           PERFORM 1000-INIT.
                           STOP RUN.
                       1000-INIT.
                           MOVE 0 TO WS-COUNT.
                       2000.
                           EXIT.
                """;

        StructuralModel model = analyzer.analyze(source, "NUMBERED");

        assertThat(model.getProcedures())
                .extracting(ProcedureRef::getName)
                .containsExactly("0000-MAIN", "1000-INIT");
    }

    private static String readFixture(String resource) throws IOException {
        try (InputStream in = ProgramAnalyzerTest.class.getResourceAsStream(resource)) {
            assertThat(in).as("fixture %s", resource).isNotNull();
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
