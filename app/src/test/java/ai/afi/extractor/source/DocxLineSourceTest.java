package ai.afi.extractor.source;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DocxLineSourceTest {

    @TempDir
    Path tempDir;

    private final DocxLineSource source = new DocxLineSource();

    @Test
    void readsParagraphsThenTableCellsAsNormalizedLines() throws Exception {
        Path document = TestDocuments.writeDocx(tempDir.resolve("report.docx"),
                List.of("Process 1.0   Intake", "   ", "Areas for Improvement:"),
                List.of(List.of("1 \u2013 Late forms (Major \u2014 Ops)", "Recommendations:"), List.of("1 - Digitize forms")));

        List<String> lines;
        try (Stream<String> stream = source.lines(document)) {
            lines = stream.collect(Collectors.toList());
        }

        assertThat(lines).containsExactly(
                "Process 1.0 Intake",
                "Areas for Improvement:",
                "1 - Late forms (Major - Ops)",
                "Recommendations:",
                "1 - Digitize forms");
    }

    @Test
    void supportsOnlyDocxExtension() {
        assertThat(source.supports(Path.of("A.DOCX"))).isTrue();
        assertThat(source.supports(Path.of("a.pdf"))).isFalse();
    }

    @Test
    void corruptFileRaisesReadException() throws Exception {
        Path broken = Files.writeString(tempDir.resolve("broken.docx"), "not a zip archive");

        assertThatThrownBy(() -> source.lines(broken))
                .isInstanceOf(DocumentReadException.class)
                .hasMessageContaining("broken.docx");
    }
}
