package com.mainframe.migration.codegen;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.migration.codegen.model.GeneratedArtifact;
import com.mainframe.migration.codegen.model.GeneratedTest;
import com.mainframe.migration.codegen.util.FileWriteUtil;
import com.mainframe.migration.codegen.util.NamingUtil;

import lombok.Value;

/**
 * Generates a JUnit 5 test class for each generated program class.
 *
 * Generated tests include:
 * - a smoke test that execute() runs without throwing
 * - a getter/setter round trip per field
 *
 * Accessors are read back from the generated source, so the same generator
 * works for artifacts rebuilt from disk.
 */
public class TestSourceGenerator {
    private static final Logger log = LoggerFactory.getLogger(TestSourceGenerator.class);

    private static final Pattern GETTER = Pattern.compile(
            "public\\s+([\\w.]+)\\s+get(\\w+)\\(\\)\\s*\\{");

    /**
     * Generates the paired test for {@code artifact} into {@code testsDir}.
     *
     * @param artifact the generated class
     * @param testsDir directory receiving the test source
     * @return the written test
     * @throws IOException if the class cannot be read or the test cannot be written
     */
    public GeneratedTest generate(GeneratedArtifact artifact, Path testsDir) throws IOException {
        String source = FileWriteUtil.readString(artifact.getPath());
        List<Accessor> accessors = findAccessors(source);

        String testClassName = artifact.getClassName() + "Test";
        Path testFile = testsDir.resolve(testClassName + ".java");
        FileWriteUtil.safeWriteString(testFile, render(artifact, testClassName, accessors));
        log.debug("Generated {} with {} accessor tests", testClassName, accessors.size());

        return GeneratedTest.builder()
                .path(testFile)
                .className(testClassName)
                .artifact(artifact)
                .build();
    }

    static List<Accessor> findAccessors(String source) {
        List<Accessor> accessors = new ArrayList<>();
        Matcher matcher = GETTER.matcher(source);
        while (matcher.find()) {
            String type = matcher.group(1);
            String property = matcher.group(2);
            if (source.contains("public void set" + property + "(" + type + " ")) {
                accessors.add(new Accessor(type, property));
            }
        }
        return accessors;
    }

    private String render(GeneratedArtifact artifact, String testClassName, List<Accessor> accessors) {
        String className = artifact.getClassName();
        boolean usesBigDecimal = accessors.stream().anyMatch(a -> a.getType().endsWith("BigDecimal"));

        StringBuilder accessorTests = new StringBuilder();
        for (Accessor accessor : accessors) {
            accessorTests.append("""

                        @Test
                        void get%1$sReturnsValueFromSet%1$s() {
                            %2$s program = new %2$s();
                            %3$s value = %4$s;

                            program.set%1$s(value);

                            assertThat(program.get%1$s()).isEqualTo(value);
                        }
                    """.formatted(accessor.getProperty(), className, accessor.getType(), sampleValue(accessor.getType())));
        }

        return """
                package %s;

                %simport org.junit.jupiter.api.Test;

                import static org.assertj.core.api.Assertions.assertThat;
                import static org.assertj.core.api.Assertions.assertThatCode;

                /**
                 * Tests for %s.
                 *
                 * Original program: %s
                 */
                class %s {

                    @Test
                    void executeRunsWithoutError() {
                        %s program = new %s();

                        assertThatCode(program::execute).doesNotThrowAnyException();
                    }
                %s}
                """.formatted(
                artifact.getPackageName(),
                usesBigDecimal ? "import java.math.BigDecimal;\n\n" : "",
                className,
                NamingUtil.toCommentSafe(artifact.getProgramName()),
                testClassName,
                className, className,
                accessorTests);
    }

    static String sampleValue(String javaType) {
        return switch (javaType) {
            case "short" -> "(short) 7";
            case "int" -> "42";
            case "long" -> "42L";
            case "BigDecimal", "java.math.BigDecimal" -> "new BigDecimal(\"12.34\")";
            default -> "\"sample\"";
        };
    }

    @Value
    static class Accessor {
        String type;
        String property;
    }
}
