package ai.afi.extractor.source;

/**
 * Runtime exception raised when a document cannot be opened or its text cannot be extracted.
 */
public class DocumentReadException extends RuntimeException {

    public DocumentReadException(String message) {
        super(message);
    }

    public DocumentReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
