package ai.afi.extractor.source;

import ai.afi.extractor.text.TextNormalizer;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;

/**
 * Reads body paragraphs followed by the text of every table cell from a Word document.
 */
public class DocxLineSource implements LineSource {

    @Override
    public boolean supports(Path document) {
        return document.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".docx");
    }

    @Override
    public Stream<String> lines(Path document) {
        XWPFDocument docx = open(document);
        Stream<String> paragraphs = docx.getParagraphs().stream()
                .map(XWPFParagraph::getText);
        Stream<String> cells = docx.getTables().stream()
                .flatMap(DocxLineSource::cellTexts)
                .flatMap(String::lines);
        return Stream.concat(paragraphs, cells)
                .map(TextNormalizer::normalize)
                .filter(line -> !line.isEmpty())
                .onClose(() -> close(docx, document));
    }

    private static Stream<String> cellTexts(XWPFTable table) {
        return table.getRows().stream()
                .map(XWPFTableRow::getTableCells)
                .flatMap(List::stream)
                .flatMap(cell -> cell.getParagraphs().stream())
                .map(XWPFParagraph::getText);
    }

    private static XWPFDocument open(Path document) {
        try (InputStream input = Files.newInputStream(document)) {
            return new XWPFDocument(input);
        } catch (IOException | RuntimeException ex) {
            throw new DocumentReadException("Failed to open Word document: " + document, ex);
        }
    }

    private static void close(XWPFDocument docx, Path document) {
        try {
            docx.close();
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to close Word document: " + document, ex);
        }
    }
}
