package ai.afi.extractor.model;

import java.util.Objects;

/**
 * A single area-for-improvement finding collected from a process block.
 *
 * <p>Items are mutable while their block is open: annotation-only continuation lines may fill in a
 * missing classification or entity, and unnumbered items receive a fallback number at flush time.
 */
public final class AfiItem {

    private Integer number;
    private final String text;
    private String classification;
    private String entity;

    public AfiItem(Integer number, String text, String classification, String entity) {
        this.number = number;
        this.text = Objects.requireNonNull(text, "text");
        this.classification = classification == null ? "" : classification;
        this.entity = entity == null ? "" : entity;
    }

    public Integer number() {
        return number;
    }

    public boolean hasNumber() {
        return number != null;
    }

    public String text() {
        return text;
    }

    public String classification() {
        return classification;
    }

    public String entity() {
        return entity;
    }

    public void assignNumber(int value) {
        if (number != null) {
            throw new IllegalStateException("Item already numbered: " + number);
        }
        this.number = value;
    }

    /**
     * Sets classification and entity where they are still empty; existing values are kept.
     */
    public void fillMissing(String classification, String entity) {
        if (this.classification.isEmpty() && classification != null) {
            this.classification = classification;
        }
        if (this.entity.isEmpty() && entity != null) {
            this.entity = entity;
        }
    }

    @Override
    public String toString() {
        return "AfiItem{" + number + ", '" + text + "', " + classification + "/" + entity + '}';
    }
}
