package ai.afi.extractor.source;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Routes a document to the first line source that supports its format.
 */
public class DocumentLineSource implements LineSource {

    private final List<LineSource> delegates;

    public DocumentLineSource() {
        this(List.of(new DocxLineSource(), new PdfLineSource()));
    }

    public DocumentLineSource(List<LineSource> delegates) {
        this.delegates = List.copyOf(Objects.requireNonNull(delegates, "delegates"));
    }

    @Override
    public boolean supports(Path document) {
        return delegates.stream().anyMatch(source -> source.supports(document));
    }

    @Override
    public Stream<String> lines(Path document) {
        return delegates.stream()
                .filter(source -> source.supports(document))
                .findFirst()
                .orElseThrow(() -> new DocumentReadException("Unsupported document format: " + document))
                .lines(document);
    }
}
