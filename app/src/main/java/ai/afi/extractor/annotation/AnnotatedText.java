package ai.afi.extractor.annotation;

import java.util.Objects;

/**
 * Text with its annotation removed, plus the classification and entity found in it.
 */
public record AnnotatedText(String text, String classification, String entity) {

    public AnnotatedText {
        text = Objects.requireNonNull(text, "text");
        classification = classification == null ? "" : classification;
        entity = entity == null ? "" : entity;
    }

    public static AnnotatedText unannotated(String text) {
        return new AnnotatedText(text, "", "");
    }

    public boolean hasAnnotation() {
        return !classification.isEmpty() || !entity.isEmpty();
    }
}
