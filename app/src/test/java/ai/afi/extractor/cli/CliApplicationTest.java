package ai.afi.extractor.cli;

import static org.assertj.core.api.Assertions.assertThat;

import ai.afi.extractor.batch.BatchRunner;
import ai.afi.extractor.batch.DocumentDiscovery;
import ai.afi.extractor.config.ConfigLoader;
import ai.afi.extractor.parse.SectionStateMachine;
import ai.afi.extractor.source.DocumentLineSource;
import ai.afi.extractor.source.TestDocuments;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.apache.poi.ss.SpreadsheetVersion;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class CliApplicationTest {

    @TempDir
    Path tempDir;

    private final CliApplication application = new CliApplication(
            new ConfigLoader(key -> Optional.empty()),
            new DocumentDiscovery(),
            new BatchRunner(new DocumentLineSource(), new SectionStateMachine()));

    @Test
    void extractsDocumentsIntoWorkbook() throws Exception {
        TestDocuments.writeDocx(tempDir.resolve("b-report.docx"),
                List.of("Process 1.0 Intake", "Areas for Improvement:", "1 - Bad process (Major - Ops)",
                        "Recommendations:", "1 - Fix it"),
                List.of());
        TestDocuments.writePdf(tempDir.resolve("A-report.pdf"), List.of(
                List.of("Table of Contents", "Value ........ 2"),
                List.of("Value", "Areas for Improvement:", "Unclear goals (Other - Strategy)")));
        Files.writeString(tempDir.resolve("broken.docx"), "not a document");
        Path output = tempDir.resolve("out/All_AFIs.xlsx");

        int exitCode = application.run(new String[] {
                "--input-dir", tempDir.toString(),
                "--output", output.toString()
        });

        assertThat(exitCode).isZero();
        try (InputStream input = Files.newInputStream(output); XSSFWorkbook workbook = new XSSFWorkbook(input)) {
            Sheet sheet = workbook.getSheet("Sheet1");
            assertThat(sheet.getLastRowNum()).isEqualTo(2);
            Row first = sheet.getRow(1);
            assertThat(first.getCell(0).getStringCellValue()).isEqualTo("Unclear goals");
            assertThat(first.getCell(4).getStringCellValue()).isEqualTo("Value");
            assertThat(first.getCell(5).getStringCellValue()).isEqualTo("A-report.pdf");
            Row second = sheet.getRow(2);
            assertThat(second.getCell(0).getStringCellValue()).isEqualTo("Bad process");
            assertThat(second.getCell(1).getStringCellValue()).isEqualTo("Major");
            assertThat(second.getCell(2).getStringCellValue()).isEqualTo("Fix it");
            assertThat(second.getCell(3).getStringCellValue()).isEqualTo("Ops");
        }
    }

    @Test
    void oversizedRecommendationIsClippedWithoutLosingOtherDocuments() throws Exception {
        List<String> appendix = new ArrayList<>(List.of(
                "Process 1 Intake", "Areas for Improvement:", "1 - Bad process (Major - Ops)",
                "Recommendations:", "1 - Fix it"));
        for (int i = 0; i < 400; i++) {
            appendix.add("Appendix narrative paragraph describing supporting evidence gathered during fieldwork");
        }
        TestDocuments.writeDocx(tempDir.resolve("a-appendix.docx"), appendix, List.of());
        TestDocuments.writeDocx(tempDir.resolve("b-valid.docx"),
                List.of("Process 2 Payments", "Areas for Improvement:", "1 - Slow payments (Other - Finance)"),
                List.of());
        Path output = tempDir.resolve("All_AFIs.xlsx");

        int exitCode = application.run(new String[] {"--input-dir", tempDir.toString()});

        assertThat(exitCode).isZero();
        try (InputStream input = Files.newInputStream(output); XSSFWorkbook workbook = new XSSFWorkbook(input)) {
            Sheet sheet = workbook.getSheet("Sheet1");
            assertThat(sheet.getLastRowNum()).isEqualTo(2);
            assertThat(sheet.getRow(1).getCell(2).getStringCellValue())
                    .startsWith("Fix it | Appendix narrative")
                    .hasSize(SpreadsheetVersion.EXCEL2007.getMaxTextLength());
            assertThat(sheet.getRow(2).getCell(0).getStringCellValue()).isEqualTo("Slow payments");
            assertThat(sheet.getRow(2).getCell(5).getStringCellValue()).isEqualTo("b-valid.docx");
        }
    }

    @Test
    void versionIsDeclared() {
        String[] version = CliArguments.class.getAnnotation(CommandLine.Command.class).version();

        assertThat(version).singleElement().asString().startsWith("afi-extractor ");
        assertThat(application.run(new String[] {"--version"})).isZero();
    }

    @Test
    void failFastAbortsOnUnreadableDocument() throws Exception {
        Files.writeString(tempDir.resolve("broken.pdf"), "not a document");

        int exitCode = application.run(new String[] {"--input-dir", tempDir.toString(), "--fail-fast"});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_ABORTED);
        assertThat(tempDir.resolve("All_AFIs.xlsx")).doesNotExist();
    }

    @Test
    void unknownOptionIsRejected() {
        int exitCode = application.run(new String[] {"--bogus"});

        assertThat(exitCode).isEqualTo(2);
    }

    @Test
    void helpPrintsUsage() {
        assertThat(application.run(new String[] {"--help"})).isZero();
    }
}
