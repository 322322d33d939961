package com.mainframe.migration.analyzer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.mainframe.migration.model.ProgramDescriptor;
import com.mainframe.migration.model.StructuralModel;

import static org.assertj.core.api.Assertions.*;

class ProgramAnalyzerServiceTest {

    @TempDir
    Path tempDir;

    private final ProgramAnalyzerService service = new ProgramAnalyzerService();

    @Test
    void testAnalyzesFileOnDisk() throws IOException {
        Path file = tempDir.resolve("ORDERS.cbl");
        Files.writeString(file, "       PROGRAM-ID. ORDERS.\n       PROCEDURE DIVISION.\n       MAIN-PARA.\n");

        Optional<StructuralModel> model = service.analyze(descriptor(file), "ORDERS");

        assertThat(model).isPresent();
        assertThat(model.get().getProgramId()).isEqualTo("ORDERS");
        assertThat(model.get().getProcedures()).hasSize(1);
    }

    @Test
    void testMalformedBytesAreReplacedNotFatal() throws IOException {
        Path file = tempDir.resolve("LATIN.cbl");
        byte[] prefix = "       PROGRAM-ID. LATIN.\n       * caf".getBytes(StandardCharsets.US_ASCII);
        byte[] content = new byte[prefix.length + 2];
        System.arraycopy(prefix, 0, content, 0, prefix.length);
        content[prefix.length] = (byte) 0xE9;
        content[prefix.length + 1] = '\n';
        Files.write(file, content);

        assertThat(ProgramAnalyzerService.readSource(file)).contains("caf\uFFFD");
        assertThat(service.analyze(descriptor(file), "LATIN"))
                .get()
                .extracting(StructuralModel::getProgramId)
                .isEqualTo("LATIN");
    }

    @Test
    void testUnreadableFileYieldsEmpty() {
        Optional<StructuralModel> model = service.analyze(descriptor(tempDir.resolve("MISSING.cbl")), "MISSING");

        assertThat(model).isEmpty();
    }

    @Test
    void testBlankPathYieldsEmpty() {
        ProgramDescriptor blank = ProgramDescriptor.builder().name("NOPATH").path(" ").build();

        assertThat(service.analyze(blank, "NOPATH")).isEmpty();
    }

    private static ProgramDescriptor descriptor(Path file) {
        return ProgramDescriptor.builder()
                .path(file.toString())
                .relativePath(file.getFileName().toString())
                .name(file.getFileName().toString().replaceFirst("\\.cbl$", ""))
                .extension(".cbl")
                .build();
    }
}
