package ai.afi.extractor.parse;

import java.util.Objects;

/**
 * A line tagged with its role and the groups captured while classifying it.
 *
 * @param number item number for {@link LineRole#NUMBERED_ITEM}, otherwise {@code null}
 * @param body   item text for numbered lines, otherwise the full line
 * @param label  process label for {@link LineRole#PROCESS_HEADER}, otherwise {@code null}
 */
public record TaggedLine(LineRole role, int index, String text, String number, String body, String label) {

    public TaggedLine {
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(text, "text");
        body = body == null ? text : body;
    }

    static TaggedLine of(LineRole role, int index, String text) {
        return new TaggedLine(role, index, text, null, null, null);
    }
}
