package ai.afi.extractor.sink;

import static org.assertj.core.api.Assertions.assertThat;

import ai.afi.extractor.model.OutputRecord;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.apache.poi.ss.SpreadsheetVersion;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class WorkbookRecordSinkTest {

    private static final OutputRecord RECORD = new OutputRecord(
            "Bad process", "Major", "Ops", "Fix it", "Process \u2013 1.0 Intake", "report.docx");

    @TempDir
    Path tempDir;

    @Test
    void createsWorkbookWithHeadersAndDefaultColumns() throws Exception {
        Path output = tempDir.resolve("All_AFIs.xlsx");

        try (WorkbookRecordSink sink = WorkbookRecordSink.openOrCreate(output, "Sheet1")) {
            sink.append(RECORD);
            sink.save();
            assertThat(sink.columns()).isEqualTo(new ColumnLayout(1, 2, 3, 4, 5, 6));
        }
        try (Workbook workbook = read(output)) {
            Sheet sheet = workbook.getSheet("Sheet1");
            assertThat(cellTexts(sheet.getRow(0), 6)).containsExactly(
                    "AFI", "Classification", "Recommendation", "Entity", "EE/FA", "Source File");
            assertThat(cellTexts(sheet.getRow(1), 6)).containsExactly(
                    "Bad process", "Major", "Fix it", "Ops", "Process \u2013 1.0 Intake", "report.docx");
        }
    }

    @Test
    void appendsAfterExistingRowsUsingHeaderPositions() throws Exception {
        Path output = tempDir.resolve("existing.xlsx");
        try (Workbook workbook = new XSSFWorkbook()) {
            Sheet sheet = workbook.createSheet("Findings");
            String[] headers = {"source file", "Entity", "Notes", "afi", "EE/FA", "RECOMMENDATION", "Classification"};
            Row header = sheet.createRow(0);
            for (int i = 0; i < headers.length; i++) {
                header.createCell(i).setCellValue(headers[i]);
            }
            sheet.createRow(1).createCell(2).setCellValue("earlier row");
            try (OutputStream stream = Files.newOutputStream(output)) {
                workbook.write(stream);
            }
        }

        try (WorkbookRecordSink sink = WorkbookRecordSink.openOrCreate(output, "Findings")) {
            sink.append(RECORD);
            sink.save();
            assertThat(sink.columns()).isEqualTo(new ColumnLayout(4, 7, 6, 2, 5, 1));
        }
        try (Workbook workbook = read(output)) {
            Row row = workbook.getSheet("Findings").getRow(2);
            assertThat(row.getCell(0).getStringCellValue()).isEqualTo("report.docx");
            assertThat(row.getCell(1).getStringCellValue()).isEqualTo("Ops");
            assertThat(row.getCell(3).getStringCellValue()).isEqualTo("Bad process");
            assertThat(row.getCell(5).getStringCellValue()).isEqualTo("Fix it");
            assertThat(row.getCell(6).getStringCellValue()).isEqualTo("Major");
            assertThat(row.getCell(2)).isNull();
        }
    }

    @Test
    void unmatchedHeadersFallBackToDefaultPositions() throws Exception {
        Path output = tempDir.resolve("custom.xlsx");
        try (Workbook workbook = new XSSFWorkbook()) {
            Row header = workbook.createSheet("Sheet1").createRow(0);
            header.createCell(0).setCellValue("Finding");
            header.createCell(1).setCellValue("Entity");
            try (OutputStream stream = Files.newOutputStream(output)) {
                workbook.write(stream);
            }
        }

        try (WorkbookRecordSink sink = WorkbookRecordSink.openOrCreate(output, "Sheet1")) {
            assertThat(sink.columns()).isEqualTo(new ColumnLayout(1, 2, 3, 2, 5, 7));
        }
    }

    @Test
    void missingSheetFallsBackToActiveSheet() throws Exception {
        Path output = tempDir.resolve("other.xlsx");
        try (Workbook workbook = new XSSFWorkbook()) {
            workbook.createSheet("Data");
            try (OutputStream stream = Files.newOutputStream(output)) {
                workbook.write(stream);
            }
        }

        try (WorkbookRecordSink sink = WorkbookRecordSink.openOrCreate(output, "Sheet1")) {
            sink.append(RECORD);
            sink.save();
        }

        try (Workbook workbook = read(output)) {
            Sheet sheet = workbook.getSheet("Data");
            assertThat(sheet.getRow(0).getCell(0).getStringCellValue()).isEqualTo("AFI");
            assertThat(sheet.getRow(1).getCell(0).getStringCellValue()).isEqualTo("Bad process");
            assertThat(workbook.getSheet("Sheet1")).isNull();
        }
    }

    private static Workbook read(Path path) throws Exception {
        try (InputStream input = Files.newInputStream(path)) {
            return new XSSFWorkbook(input);
        }
    }

    private static String[] cellTexts(Row row, int count) {
        String[] values = new String[count];
        for (int i = 0; i < count; i++) {
            values[i] = row.getCell(i).getStringCellValue();
        }
        return values;
    }

    @Test
    void overlongValuesAreClippedToCellLimit() throws Exception {
        Path output = tempDir.resolve("long.xlsx");
        String recommendation = "Fix it | ".repeat(5000);
        OutputRecord oversized = new OutputRecord(
                "Bad process", "Major", "Ops", recommendation, "Process \u2013 1.0 Intake", "appendix.docx");

        try (WorkbookRecordSink sink = WorkbookRecordSink.openOrCreate(output, "Sheet1")) {
            sink.appendAll(List.of(oversized, RECORD));
            sink.save();
        }

        try (Workbook workbook = read(output)) {
            Sheet sheet = workbook.getSheet("Sheet1");
            assertThat(sheet.getLastRowNum()).isEqualTo(2);
            String clipped = sheet.getRow(1).getCell(2).getStringCellValue();
            assertThat(clipped).hasSize(SpreadsheetVersion.EXCEL2007.getMaxTextLength());
            assertThat(recommendation).startsWith(clipped);
            assertThat(sheet.getRow(2).getCell(2).getStringCellValue()).isEqualTo("Fix it");
        }
    }

    @Test
    void clipKeepsSurrogatePairsWhole() {
        String value = "a".repeat(WorkbookRecordSink.MAX_CELL_LENGTH - 1) + "\uD83D\uDE00tail";

        String clipped = WorkbookRecordSink.clip(value, "AFI", "emoji.docx");

        assertThat(clipped).hasSize(WorkbookRecordSink.MAX_CELL_LENGTH - 1);
        assertThat(WorkbookRecordSink.clip("short", "AFI", "emoji.docx")).isEqualTo("short");
    }
}
