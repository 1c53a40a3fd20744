package ai.afi.extractor.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Collects recommendation fragments per item number and merges them into one text per number.
 */
public final class RecommendationAccumulator {

    static final String SEPARATOR = " | ";
    private static final String DEFAULT_KEY = "1";

    private final Map<String, String> merged = new LinkedHashMap<>();
    private final List<String> openFragments = new ArrayList<>();
    private String openKey;

    /**
     * Flushes the open key and starts a new one seeded with {@code firstFragment}.
     */
    public void open(String key, String firstFragment) {
        flush();
        openKey = key;
        openFragments.add(firstFragment);
    }

    /**
     * Adds a continuation fragment to the open key, opening key {@code "1"} when none is open.
     */
    public void append(String fragment) {
        if (openKey == null) {
            openKey = DEFAULT_KEY;
        }
        openFragments.add(fragment);
    }

    public void flush() {
        if (openKey != null) {
            List<String> parts = new ArrayList<>(openFragments.size());
            for (String fragment : openFragments) {
                if (fragment != null && !fragment.isEmpty()) {
                    parts.add(fragment);
                }
            }
            String text = String.join(SEPARATOR, parts);
            if (!text.isEmpty()) {
                merged.merge(openKey, text, (previous, next) -> previous + SEPARATOR + next);
            }
        }
        openKey = null;
        openFragments.clear();
    }

    public Optional<String> openKey() {
        return Optional.ofNullable(openKey);
    }

    public String textFor(String key) {
        return merged.getOrDefault(key, "");
    }

    public boolean isEmpty() {
        return merged.isEmpty() && openKey == null;
    }

    public Map<String, String> merged() {
        return Collections.unmodifiableMap(merged);
    }
}
