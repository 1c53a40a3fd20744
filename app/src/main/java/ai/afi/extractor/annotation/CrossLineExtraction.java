package ai.afi.extractor.annotation;

import java.util.Objects;

/**
 * Outcome of an extraction that may have consumed continuation lines.
 *
 * @param lastConsumedIndex index of the last source line belonging to the annotation
 */
public record CrossLineExtraction(AnnotatedText result, int lastConsumedIndex) {

    public CrossLineExtraction {
        Objects.requireNonNull(result, "result");
        if (lastConsumedIndex < 0) {
            throw new IllegalArgumentException("lastConsumedIndex must not be negative");
        }
    }
}
