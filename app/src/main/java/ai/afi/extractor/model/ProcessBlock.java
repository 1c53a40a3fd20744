package ai.afi.extractor.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One labeled process section holding its AFI items and recommendations until flush.
 */
public final class ProcessBlock {

    private final String label;
    private final List<AfiItem> items = new ArrayList<>();
    private final RecommendationAccumulator recommendations = new RecommendationAccumulator();

    public ProcessBlock(String label) {
        this.label = Objects.requireNonNull(label, "label");
    }

    public String label() {
        return label;
    }

    /**
     * Appends an item and returns its position, usable as a handle for later in-place updates.
     */
    public int addItem(AfiItem item) {
        items.add(Objects.requireNonNull(item, "item"));
        return items.size() - 1;
    }

    public AfiItem item(int handle) {
        return items.get(handle);
    }

    public List<AfiItem> items() {
        return Collections.unmodifiableList(items);
    }

    public RecommendationAccumulator recommendations() {
        return recommendations;
    }

    public boolean hasContent() {
        return !items.isEmpty() || !recommendations.isEmpty();
    }
}
