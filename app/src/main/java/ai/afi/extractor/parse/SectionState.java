package ai.afi.extractor.parse;

/**
 * Which list of a process block the parser is currently collecting.
 */
public enum SectionState {
    NEUTRAL,
    IN_AFI,
    IN_RECO
}
