package com.mainframe.migration.codegen;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.junit.jupiter.api.Test;

import com.mainframe.migration.analyzer.PictureTypeInference;
import com.mainframe.migration.codegen.model.ProgramClassDefinition;
import com.mainframe.migration.codegen.template.TemplateRenderer;
import com.mainframe.migration.model.DataItem;
import com.mainframe.migration.model.ProcedureRef;
import com.mainframe.migration.model.StructuralModel;
import com.mainframe.migration.validation.SourceSyntaxValidator;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for Java class generation from structural models.
 */
class ProgramClassGeneratorTest {

    private static final String PACKAGE = "com.example.migrated";

    private static final Pattern STUB = Pattern.compile("private void (\\w+)\\(\\) \\{\\s+log\\.info");

    private final TemplateRenderer renderer = new TemplateRenderer();
    private final ProgramClassGenerator generator = new ProgramClassGenerator(renderer, PACKAGE, "WS-");
    private final SourceSyntaxValidator validator = new SourceSyntaxValidator();

    @Test
    void testCalcScenarioWithoutPrefixStripping() {
        ProgramClassGenerator keepPrefix = new ProgramClassGenerator(renderer, PACKAGE, "");

        String source = keepPrefix.generate("CALC", calcModel(), "springboot");

        assertThat(source).contains("private int wsResult = 0;");
        assertThat(source).contains("public int getWsResult()");
        assertThat(source).contains("public void setWsResult(int wsResult)");
    }

    @Test
    void testCalcScenarioWithDefaultPrefix() {
        String source = generator.generate("CALC", calcModel(), "springboot");

        assertThat(source).startsWith("package " + PACKAGE + ";");
        assertThat(source).contains("public class CALC {");
        assertThat(source).contains("Migrated from COBOL program: CALC");
        assertThat(source).contains("private int result = 0;");
        assertThat(source).doesNotContain("import java.math.BigDecimal;");
        assertThat(validator.isSyntaxValid(source)).isTrue();
    }

    @Test
    void testPlaceholderModelProducesValidClass() {
        String source = generator.generate("ORPHAN", StructuralModel.placeholder("ORPHAN"), "springboot");

        assertThat(validator.findProblems(source)).isEmpty();
        assertThat(source).contains("public class ORPHAN {");
        assertThat(source).contains("Original COBOL procedures in source order: none");
        assertThat(countOccurrences(source, "public void execute()")).isEqualTo(1);
        assertThat(STUB.matcher(source).find()).isFalse();
    }

    @Test
    void testOneStubPerProcedureInSourceOrder() {
        StructuralModel model = StructuralModel.builder()
                .programId("ORDERS")
                .procedure(paragraph("MAIN-PARA"))
                .procedure(paragraph("READ-ORDERS"))
                .procedure(paragraph("WS-CLEANUP"))
                .procedure(paragraph("FINISH"))
                .build();

        String source = generator.generate("ORDERS", model, "java");

        assertThat(stubNames(source)).containsExactly("mainPara", "readOrders", "cleanup", "finish");
        assertThat(countOccurrences(source, "throw new UnsupportedOperationException")).isEqualTo(4);
        assertThat(source).contains("Paragraph READ-ORDERS is not yet implemented");
        assertThat(source).contains("MAIN-PARA, READ-ORDERS, WS-CLEANUP, FINISH");
        assertThat(validator.isSyntaxValid(source)).isTrue();
    }

    @Test
    void testFieldsAndAccessorsInDeclarationOrder() {
        StructuralModel model = StructuralModel.builder()
                .programId("BILLING")
                .dataItem(item("WS-CUSTOMER-NAME", "X(30)", "'NONE'"))
                .dataItem(item("WS-BALANCE", "S9(7)V99", "0"))
                .dataItem(item("WS-INVOICE-COUNT", "9(10)", null))
                .build();

        String source = generator.generate("BILLING", model, "springboot");

        assertThat(source).contains("import java.math.BigDecimal;");
        assertThat(source).containsSubsequence(
                "private String customerName = \"NONE\";",
                "private BigDecimal balance = new BigDecimal(\"0\");",
                "private long invoiceCount = 0L;",
                "public String getCustomerName()",
                "public void setCustomerName(String customerName)",
                "public BigDecimal getBalance()",
                "public long getInvoiceCount()");
        assertThat(validator.isSyntaxValid(source)).isTrue();
    }

    @Test
    void testCollidingAndIllegalNamesAreMadeUnique() {
        StructuralModel model = StructuralModel.builder()
                .programId("ODDNAMES")
                .dataItem(item("FILLER", "X(2)", null))
                .dataItem(item("FILLER", "X(4)", null))
                .dataItem(item("WS-CLASS", "X", null))
                .dataItem(item("LOG", "9", null))
                .procedure(paragraph("1000-INIT"))
                .procedure(paragraph("EXECUTE"))
                .build();

        ProgramClassDefinition definition = generator.buildDefinition("ODDNAMES", model);

        assertThat(definition.getFields())
                .extracting("name")
                .containsExactly("filler", "filler2", "classValue", "log2");
        assertThat(definition.getMethods())
                .extracting("name")
                .containsExactly("para1000Init", "execute2");
        assertThat(validator.isSyntaxValid(generator.generate("ODDNAMES", model, null))).isTrue();
    }

    @Test
    void testBracketsInLiteralsKeepOutputBalanced() {
        StructuralModel model = StructuralModel.builder()
                .programId("BRACKETS")
                .dataItem(item("WS-MSG", "X(20)", "'RESULT (PARTIAL'"))
                .dataItem(item("WS-OPEN", "X", "'{'"))
                .build();

        String source = generator.generate("BRACKETS", model, "springboot");

        assertThat(validator.isSyntaxValid(source)).isTrue();
    }

    @Test
    void testIllegalProgramNameBecomesLegalClassName() {
        String source = generator.generate("PAY-ROLL", StructuralModel.placeholder("PAY-ROLL"), "springboot");

        assertThat(source).contains("public class PAY_ROLL {");
        assertThat(source).contains("Migrated from COBOL program: PAY-ROLL");
    }

    private static StructuralModel calcModel() {
        return StructuralModel.builder()
                .programId("CALC")
                .dataItem(item("WS-RESULT", "9(6)", "ZERO"))
                .build();
    }

    private static DataItem item(String name, String picture, String value) {
        return DataItem.builder()
                .level("01")
                .name(name)
                .picture(picture)
                .value(value)
                .inferredType(PictureTypeInference.inferType(picture))
                .build();
    }

    private static ProcedureRef paragraph(String name) {
        return ProcedureRef.builder().name(name).build();
    }

    private static List<String> stubNames(String source) {
        List<String> names = new ArrayList<>();
        Matcher m = STUB.matcher(source);
        while (m.find()) {
            names.add(m.group(1));
        }
        return names;
    }

    private static int countOccurrences(String text, String needle) {
        int count = 0;
        int index = text.indexOf(needle);
        while (index >= 0) {
            count++;
            index = text.indexOf(needle, index + needle.length());
        }
        return count;
    }
}
