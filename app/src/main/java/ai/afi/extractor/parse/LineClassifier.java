package ai.afi.extractor.parse;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tags lines by applying the structural patterns in priority order.
 */
public class LineClassifier {

    static final String LABEL_SEPARATOR = " \u2013 ";

    private static final Pattern PROCESS = Pattern.compile("(?i)^\\s*process\\s*[:\\-]?\\s*([0-9]+(?:\\.[0-9]+)*)\\s+(.+)$");
    private static final Pattern PROCESS_SIMPLE = Pattern.compile("(?i)^\\s*(Value|Operational|Business)\\b(?:\\s*[:\\-\\u2013\\u2014]\\s*(.+))?$");
    private static final Pattern AFI_HEADER = Pattern.compile("(?i)^\\s*areas?\\s+(for|of)\\s+improvement\\s*:?\\s*$");
    private static final Pattern RECOMMENDATION_HEADER = Pattern.compile("(?i)^\\s*recommendations?\\s*:?\\s*$");
    private static final Pattern ANNOTATION_ONLY = Pattern.compile("\\([^)]*\\)");
    private static final Pattern NUMBERED_ITEM = Pattern.compile("^\\s*(\\d+)\\s*-\\s*(.+?)\\s*$");

    public TaggedLine classify(String line, int index) {
        Matcher process = PROCESS.matcher(line);
        if (process.matches()) {
            String label = "Process" + LABEL_SEPARATOR + process.group(1) + " " + process.group(2).strip();
            return new TaggedLine(LineRole.PROCESS_HEADER, index, line, null, null, label);
        }
        Matcher simple = PROCESS_SIMPLE.matcher(line);
        if (simple.matches()) {
            return new TaggedLine(LineRole.PROCESS_HEADER, index, line, null, null, simpleLabel(simple));
        }
        if (AFI_HEADER.matcher(line).matches()) {
            return TaggedLine.of(LineRole.AFI_HEADER, index, line);
        }
        if (RECOMMENDATION_HEADER.matcher(line).matches()) {
            return TaggedLine.of(LineRole.RECOMMENDATION_HEADER, index, line);
        }
        if (ANNOTATION_ONLY.matcher(line).matches()) {
            return TaggedLine.of(LineRole.ANNOTATION_ONLY, index, line);
        }
        Matcher numbered = NUMBERED_ITEM.matcher(line);
        if (numbered.matches()) {
            return new TaggedLine(LineRole.NUMBERED_ITEM, index, line, numbered.group(1), numbered.group(2), null);
        }
        if (line.indexOf('(') >= 0) {
            return TaggedLine.of(LineRole.PARENTHESIZED_TEXT, index, line);
        }
        return TaggedLine.of(LineRole.TEXT, index, line);
    }

    private static String simpleLabel(Matcher simple) {
        String head = simple.group(1).toLowerCase(Locale.ROOT);
        head = Character.toUpperCase(head.charAt(0)) + head.substring(1);
        String tail = simple.group(2);
        if (tail == null || tail.isBlank()) {
            return head;
        }
        return head + LABEL_SEPARATOR + tail.strip();
    }
}
