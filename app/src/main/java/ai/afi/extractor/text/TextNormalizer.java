package ai.afi.extractor.text;

import java.text.Normalizer;
import java.util.regex.Pattern;

/**
 * Canonicalizes raw document lines and trims extracted fields.
 */
public final class TextNormalizer {

    private static final Pattern INVISIBLE_MARKS = Pattern.compile("[\\u200B-\\u200F\\u2060\\uFEFF\\u202A-\\u202E\\u2066-\\u2069]");
    private static final Pattern HORIZONTAL_SPACE = Pattern.compile("[ \\t]+");
    private static final Pattern DASHES = Pattern.compile("[\\u2010-\\u2015\\u2053\\u2212\\u2E3A\\u2E3B\\uFE31\\uFE32\\uFE58\\uFE63\\uFF0D-]");
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s{2,}");
    private static final String TIDY_EDGE_CHARS = " -.()[]:;";

    private TextNormalizer() {
    }

    /**
     * Returns the cleaned line, or an empty string when nothing printable remains.
     */
    public static String normalize(String raw) {
        if (raw == null || raw.isEmpty()) {
            return "";
        }
        String value = Normalizer.normalize(raw, Normalizer.Form.NFC);
        value = INVISIBLE_MARKS.matcher(value).replaceAll("");
        value = value.replace('\u00A0', ' ').replace('\r', '\n');
        value = HORIZONTAL_SPACE.matcher(value).replaceAll(" ");
        value = normalizeDashes(value);
        return value.strip();
    }

    public static String normalizeDashes(String value) {
        return DASHES.matcher(value).replaceAll("-");
    }

    /**
     * Collapses whitespace runs and strips separator punctuation from both ends of an extracted field.
     */
    public static String tidy(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        String collapsed = WHITESPACE_RUN.matcher(value).replaceAll(" ");
        int start = 0;
        int end = collapsed.length();
        while (start < end && isTidyEdge(collapsed.charAt(start))) {
            start++;
        }
        while (end > start && isTidyEdge(collapsed.charAt(end - 1))) {
            end--;
        }
        return collapsed.substring(start, end).strip();
    }

    private static boolean isTidyEdge(char ch) {
        return TIDY_EDGE_CHARS.indexOf(ch) >= 0;
    }
}
