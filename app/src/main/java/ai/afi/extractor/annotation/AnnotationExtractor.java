package ai.afi.extractor.annotation;

import ai.afi.extractor.text.TextNormalizer;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a {@code (classification - entity)} annotation out of free text.
 *
 * <p>The rightmost parenthesized group wins. When no group yields a value, a keyword form such as
 * {@code "Major - Logistics"} is tried instead.
 */
public class AnnotationExtractor {

    private static final Pattern PARENTHESIZED = Pattern.compile("\\(([^)]*?)\\)");
    private static final Pattern KEYWORD = Pattern.compile("\\b(major|other)\\b", Pattern.CASE_INSENSITIVE);

    public AnnotatedText extract(String text) {
        Objects.requireNonNull(text, "text");
        Matcher group = lastMatch(PARENTHESIZED, text);
        if (group != null) {
            AnnotatedText parsed = splitAnnotation(group.group(1));
            if (parsed.hasAnnotation()) {
                String cleaned = (text.substring(0, group.start()) + " " + text.substring(group.end())).strip();
                return new AnnotatedText(TextNormalizer.tidy(cleaned), parsed.classification(), parsed.entity());
            }
        }
        Matcher keyword = lastMatch(KEYWORD, text);
        if (keyword != null) {
            int dash = text.indexOf('-', keyword.start());
            if (dash >= 0) {
                String entity = TextNormalizer.tidy(text.substring(dash + 1));
                if (!entity.isEmpty()) {
                    String remaining = TextNormalizer.tidy(text.substring(0, keyword.start()));
                    return new AnnotatedText(remaining, capitalize(keyword.group(1)), entity);
                }
            }
        }
        return AnnotatedText.unannotated(text);
    }

    /**
     * Extracts an annotation whose closing parenthesis may sit on a later line.
     *
     * @param lines     the whole document
     * @param index     position of the line that {@code firstLine} was taken from
     * @param firstLine the text to clean, possibly a suffix of {@code lines.get(index)}
     */
    public CrossLineExtraction extractAcrossLines(List<String> lines, int index, String firstLine) {
        Objects.requireNonNull(lines, "lines");
        Objects.requireNonNull(firstLine, "firstLine");
        int open = firstLine.indexOf('(');
        if (open < 0 || firstLine.indexOf(')') >= 0) {
            return new CrossLineExtraction(extract(firstLine), index);
        }

        String head = firstLine.substring(open);
        StringBuilder span = new StringBuilder(head);
        int cursor = index + 1;
        while (cursor < lines.size()) {
            String continuation = lines.get(cursor);
            span.append(' ').append(continuation);
            if (continuation.indexOf(')') >= 0) {
                break;
            }
            cursor++;
        }
        int lastConsumed = Math.max(index, Math.min(cursor, lines.size() - 1));

        String combined = TextNormalizer.normalize(span.toString());
        Matcher group = lastMatch(PARENTHESIZED, combined);
        if (group == null) {
            return new CrossLineExtraction(AnnotatedText.unannotated(firstLine), lastConsumed);
        }
        AnnotatedText parsed = splitAnnotation(group.group(1));
        if (!parsed.hasAnnotation()) {
            return new CrossLineExtraction(AnnotatedText.unannotated(firstLine), lastConsumed);
        }
        String cleaned = firstLine;
        String normalizedHead = TextNormalizer.normalize(head);
        if (group.start() < normalizedHead.length()) {
            cleaned = firstLine.substring(0, open + group.start());
        }
        AnnotatedText result = new AnnotatedText(TextNormalizer.tidy(cleaned), parsed.classification(), parsed.entity());
        return new CrossLineExtraction(result, lastConsumed);
    }

    private AnnotatedText splitAnnotation(String inside) {
        String body = TextNormalizer.normalizeDashes(inside).strip();
        int dash = body.indexOf('-');
        String classification = TextNormalizer.tidy(dash < 0 ? body : body.substring(0, dash));
        String entity = dash < 0 ? "" : TextNormalizer.tidy(body.substring(dash + 1));
        return new AnnotatedText("", classification, entity);
    }

    private static Matcher lastMatch(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        int start = -1;
        while (matcher.find()) {
            start = matcher.start();
        }
        if (start < 0) {
            return null;
        }
        matcher.find(start);
        return matcher;
    }

    private static String capitalize(String word) {
        String lower = word.toLowerCase(Locale.ROOT);
        return Character.toUpperCase(lower.charAt(0)) + lower.substring(1);
    }
}
