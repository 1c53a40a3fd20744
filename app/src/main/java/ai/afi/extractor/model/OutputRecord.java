package ai.afi.extractor.model;

import java.util.Objects;

/**
 * One output row: an AFI item joined with its recommendation and process context.
 */
public record OutputRecord(String afiText,
                           String classification,
                           String entity,
                           String recommendationText,
                           String processLabel,
                           String sourceFileName) {

    public OutputRecord {
        Objects.requireNonNull(afiText, "afiText");
        classification = classification == null ? "" : classification;
        entity = entity == null ? "" : entity;
        recommendationText = recommendationText == null ? "" : recommendationText;
        Objects.requireNonNull(processLabel, "processLabel");
        Objects.requireNonNull(sourceFileName, "sourceFileName");
    }
}
