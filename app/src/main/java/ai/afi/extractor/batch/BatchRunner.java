package ai.afi.extractor.batch;

import ai.afi.extractor.model.OutputRecord;
import ai.afi.extractor.parse.SectionStateMachine;
import ai.afi.extractor.sink.RecordSink;
import ai.afi.extractor.source.DocumentReadException;
import ai.afi.extractor.source.LineSource;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Processes every document of a run and appends the resulting rows to the sink.
 */
public class BatchRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(BatchRunner.class);
    static final String MDC_DOCUMENT = "document";

    private final LineSource lineSource;
    private final SectionStateMachine parser;

    public BatchRunner(LineSource lineSource, SectionStateMachine parser) {
        this.lineSource = Objects.requireNonNull(lineSource, "lineSource");
        this.parser = Objects.requireNonNull(parser, "parser");
    }

    /**
     * @param failFast rethrow the first read failure instead of recording it and moving on
     */
    public BatchOutcome run(List<Path> documents, RecordSink sink, boolean failFast) {
        Objects.requireNonNull(documents, "documents");
        Objects.requireNonNull(sink, "sink");
        LOGGER.info("Found {} files (.docx/.pdf).", documents.size());
        List<DocumentOutcome> outcomes = new ArrayList<>(documents.size());
        int position = 0;
        for (Path document : documents) {
            position++;
            String fileName = document.getFileName().toString();
            LOGGER.info("[{}/{}] {}", position, documents.size(), fileName);
            MDC.put(MDC_DOCUMENT, fileName);
            try {
                DocumentOutcome outcome = process(document, failFast);
                sink.appendAll(outcome.records());
                outcomes.add(outcome);
            } finally {
                MDC.remove(MDC_DOCUMENT);
            }
        }
        return new BatchOutcome(outcomes);
    }

    public DocumentOutcome process(Path document, boolean failFast) {
        String fileName = document.getFileName().toString();
        try {
            List<OutputRecord> records = parser.parse(fileName, readLines(document));
            LOGGER.debug("{} produced {} records", fileName, records.size());
            return DocumentOutcome.ok(fileName, records);
        } catch (DocumentReadException ex) {
            if (failFast) {
                throw ex;
            }
            LOGGER.error("Failed to read {}: {}", fileName, ex.getMessage(), ex);
            return DocumentOutcome.readFailed(fileName, ex.getMessage());
        }
    }

    private List<String> readLines(Path document) {
        try (Stream<String> lines = lineSource.lines(document)) {
            return lines.collect(Collectors.toList());
        } catch (DocumentReadException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new DocumentReadException("Failed to read document: " + document, ex);
        }
    }
}
