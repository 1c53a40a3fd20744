package ai.afi.extractor.source;

import ai.afi.extractor.text.TextNormalizer;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extracts text page by page from a PDF, skipping table-of-contents pages.
 */
public class PdfLineSource implements LineSource {

    private static final Logger LOGGER = LoggerFactory.getLogger(PdfLineSource.class);

    private final TocPageDetector tocPageDetector;

    public PdfLineSource() {
        this(new TocPageDetector());
    }

    public PdfLineSource(TocPageDetector tocPageDetector) {
        this.tocPageDetector = Objects.requireNonNull(tocPageDetector, "tocPageDetector");
    }

    @Override
    public boolean supports(Path document) {
        return document.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".pdf");
    }

    @Override
    public Stream<String> lines(Path document) {
        PDDocument pdf = open(document);
        PDFTextStripper stripper = new PDFTextStripper();
        return IntStream.rangeClosed(1, pdf.getNumberOfPages())
                .mapToObj(page -> pageLines(pdf, stripper, page, document))
                .filter(lines -> {
                    boolean toc = tocPageDetector.isTableOfContents(lines);
                    if (toc) {
                        LOGGER.debug("Skipping table-of-contents page in {}", document.getFileName());
                    }
                    return !toc;
                })
                .flatMap(List::stream)
                .onClose(() -> close(pdf, document));
    }

    private static List<String> pageLines(PDDocument pdf, PDFTextStripper stripper, int page, Path document) {
        stripper.setStartPage(page);
        stripper.setEndPage(page);
        String text;
        try {
            text = stripper.getText(pdf);
        } catch (IOException ex) {
            throw new DocumentReadException("Failed to extract text from page " + page + " of " + document, ex);
        }
        return text.lines()
                .map(TextNormalizer::normalize)
                .filter(line -> !line.isEmpty())
                .collect(Collectors.toList());
    }

    private static PDDocument open(Path document) {
        try {
            return Loader.loadPDF(document.toFile());
        } catch (IOException | RuntimeException ex) {
            throw new DocumentReadException("Failed to open PDF document: " + document, ex);
        }
    }

    private static void close(PDDocument pdf, Path document) {
        try {
            pdf.close();
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to close PDF document: " + document, ex);
        }
    }
}
