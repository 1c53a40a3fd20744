package ai.afi.extractor.sink;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * One-based column positions of the six output fields.
 */
public record ColumnLayout(int afi, int classification, int recommendation, int entity, int process, int sourceFile) {

    static final String AFI = "AFI";
    static final String CLASSIFICATION = "Classification";
    static final String RECOMMENDATION = "Recommendation";
    static final String ENTITY = "Entity";
    static final String PROCESS = "EE/FA";
    static final String SOURCE_FILE = "Source File";

    public static final List<String> HEADERS = List.of(AFI, CLASSIFICATION, RECOMMENDATION, ENTITY, PROCESS, SOURCE_FILE);
    public static final ColumnLayout DEFAULT = new ColumnLayout(1, 2, 3, 4, 5, 7);

    public ColumnLayout {
        for (int column : new int[] {afi, classification, recommendation, entity, process, sourceFile}) {
            if (column < 1) {
                throw new IllegalArgumentException("Column positions are one-based: " + column);
            }
        }
    }

    /**
     * Resolves positions from header names, keyed lower-case; unmatched fields keep their default column.
     */
    public static ColumnLayout fromHeaders(Map<String, Integer> headerColumns) {
        return new ColumnLayout(
                lookup(headerColumns, AFI, DEFAULT.afi()),
                lookup(headerColumns, CLASSIFICATION, DEFAULT.classification()),
                lookup(headerColumns, RECOMMENDATION, DEFAULT.recommendation()),
                lookup(headerColumns, ENTITY, DEFAULT.entity()),
                lookup(headerColumns, PROCESS, DEFAULT.process()),
                lookup(headerColumns, SOURCE_FILE, DEFAULT.sourceFile()));
    }

    private static int lookup(Map<String, Integer> headerColumns, String header, int fallback) {
        return headerColumns.getOrDefault(header.toLowerCase(Locale.ROOT), fallback);
    }
}
