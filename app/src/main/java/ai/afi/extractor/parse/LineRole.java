package ai.afi.extractor.parse;

/**
 * Structural role of a document line, listed in classification priority order.
 */
public enum LineRole {
    PROCESS_HEADER,
    AFI_HEADER,
    RECOMMENDATION_HEADER,
    ANNOTATION_ONLY,
    NUMBERED_ITEM,
    PARENTHESIZED_TEXT,
    TEXT
}
