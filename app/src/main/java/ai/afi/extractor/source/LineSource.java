package ai.afi.extractor.source;

import java.nio.file.Path;
import java.util.stream.Stream;

/**
 * Produces the normalized, non-empty text lines of a document.
 *
 * <p>The returned stream is lazy and may hold the document open; callers must close it.
 */
public interface LineSource {

    boolean supports(Path document);

    Stream<String> lines(Path document);
}
