package ai.afi.extractor.sink;

import ai.afi.extractor.model.OutputRecord;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.apache.poi.ss.SpreadsheetVersion;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Appends output rows to a sheet of an {@code .xlsx} workbook, creating the workbook when absent.
 */
public class WorkbookRecordSink implements RecordSink {

    private static final Logger LOGGER = LoggerFactory.getLogger(WorkbookRecordSink.class);
    static final int MAX_CELL_LENGTH = SpreadsheetVersion.EXCEL2007.getMaxTextLength();

    private final Path path;
    private final Workbook workbook;
    private final Sheet sheet;
    private final ColumnLayout columns;
    private int nextRowIndex;
    private int appended;

    private WorkbookRecordSink(Path path, Workbook workbook, Sheet sheet) {
        this.path = path;
        this.workbook = workbook;
        this.sheet = sheet;
        this.columns = detectColumns(sheet);
        // zero-based index of the first free row; row 0 always holds the headers
        this.nextRowIndex = Math.max(sheet.getLastRowNum() + 1, 1);
    }

    public static WorkbookRecordSink openOrCreate(Path path, String sheetName) {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(sheetName, "sheetName");
        if (Files.exists(path)) {
            Workbook workbook = load(path);
            Sheet sheet = workbook.getSheet(sheetName);
            if (sheet == null) {
                sheet = workbook.getSheetAt(workbook.getActiveSheetIndex());
            }
            if (sheet.getPhysicalNumberOfRows() == 0) {
                writeHeaders(sheet);
            }
            LOGGER.info("Appending to existing workbook {} (sheet '{}')", path, sheet.getSheetName());
            return new WorkbookRecordSink(path, workbook, sheet);
        }
        Workbook workbook = new XSSFWorkbook();
        Sheet sheet = workbook.createSheet(sheetName);
        writeHeaders(sheet);
        LOGGER.info("Creating workbook {} (sheet '{}')", path, sheetName);
        return new WorkbookRecordSink(path, workbook, sheet);
    }

    public ColumnLayout columns() {
        return columns;
    }

    @Override
    public synchronized void append(OutputRecord record) {
        Objects.requireNonNull(record, "record");
        String source = record.sourceFileName();
        String afi = clip(record.afiText(), "AFI", source);
        String classification = clip(record.classification(), "classification", source);
        String recommendation = clip(record.recommendationText(), "recommendation", source);
        String entity = clip(record.entity(), "entity", source);
        String process = clip(record.processLabel(), "process", source);
        Row row = sheet.createRow(nextRowIndex++);
        setCell(row, columns.afi(), afi);
        setCell(row, columns.classification(), classification);
        setCell(row, columns.recommendation(), recommendation);
        setCell(row, columns.entity(), entity);
        setCell(row, columns.process(), process);
        setCell(row, columns.sourceFile(), clip(source, "source file", source));
        appended++;
    }

    /**
     * Appends the rows of one document while holding the sink lock, so no other writer interleaves.
     */
    @Override
    public synchronized void appendAll(List<OutputRecord> records) {
        Objects.requireNonNull(records, "records");
        records.forEach(this::append);
    }

    @Override
    public synchronized void save() {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream output = Files.newOutputStream(path)) {
                workbook.write(output);
            }
            LOGGER.debug("Saved {} new rows to {}", appended, path);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to save workbook: " + path, ex);
        }
    }

    @Override
    public synchronized void close() {
        try {
            workbook.close();
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to close workbook: " + path, ex);
        }
    }

    private static Workbook load(Path path) {
        try (InputStream input = Files.newInputStream(path)) {
            return new XSSFWorkbook(input);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to open workbook: " + path, ex);
        }
    }

    private static void writeHeaders(Sheet sheet) {
        Row header = sheet.createRow(0);
        for (int i = 0; i < ColumnLayout.HEADERS.size(); i++) {
            header.createCell(i).setCellValue(ColumnLayout.HEADERS.get(i));
        }
    }

    private static ColumnLayout detectColumns(Sheet sheet) {
        Row header = sheet.getRow(0);
        Map<String, Integer> positions = new HashMap<>();
        if (header != null) {
            for (Cell cell : header) {
                if (cell.getCellType() != CellType.STRING) {
                    continue;
                }
                String name = cell.getStringCellValue().strip().toLowerCase(Locale.ROOT);
                if (!name.isEmpty()) {
                    positions.put(name, cell.getColumnIndex() + 1);
                }
            }
        }
        return ColumnLayout.fromHeaders(positions);
    }

    /**
     * Cuts values longer than a workbook cell accepts, keeping surrogate pairs intact.
     */
    static String clip(String value, String field, String sourceFile) {
        if (value == null || value.length() <= MAX_CELL_LENGTH) {
            return value;
        }
        int end = MAX_CELL_LENGTH;
        if (Character.isHighSurrogate(value.charAt(end - 1))) {
            end--;
        }
        LOGGER.warn("Clipped {} text of {} from {} to {} characters", field, sourceFile, value.length(), end);
        return value.substring(0, end);
    }

    private static void setCell(Row row, int oneBasedColumn, String value) {
        row.createCell(oneBasedColumn - 1).setCellValue(value);
    }
}
