package ai.afi.extractor.source;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Recognizes table-of-contents pages by title or by dotted leader lines ending in a page number.
 */
public class TocPageDetector {

    private static final Pattern TOC_TITLE = Pattern.compile("(?i)\\btable of contents\\b|\\bcontents\\b");
    private static final Pattern DOT_LEADER = Pattern.compile(".{2,}\\.{3,}\\s*\\d+\\s*$");
    private static final int DOT_LEADER_THRESHOLD = 3;

    public boolean isTableOfContents(List<String> pageLines) {
        int dotLeaders = 0;
        for (String line : pageLines) {
            if (TOC_TITLE.matcher(line).find()) {
                return true;
            }
            if (DOT_LEADER.matcher(line).find()) {
                dotLeaders++;
            }
        }
        return dotLeaders >= DOT_LEADER_THRESHOLD;
    }
}
