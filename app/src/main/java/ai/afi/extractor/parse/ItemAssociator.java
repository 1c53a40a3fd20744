package ai.afi.extractor.parse;

import ai.afi.extractor.annotation.AnnotatedText;
import ai.afi.extractor.annotation.AnnotationExtractor;
import ai.afi.extractor.model.AfiItem;
import ai.afi.extractor.model.OutputRecord;
import ai.afi.extractor.model.ProcessBlock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Resolves item numbers of a finished block and joins each AFI item to its recommendation.
 *
 * <p>A last extraction pass over each item's text fills a classification or entity that is still
 * missing. The text is only rewritten when that pass contributes a value.
 */
public class ItemAssociator {

    private final AnnotationExtractor annotationExtractor;

    public ItemAssociator(AnnotationExtractor annotationExtractor) {
        this.annotationExtractor = Objects.requireNonNull(annotationExtractor, "annotationExtractor");
    }

    /**
     * Numbers unnumbered items 1, 2, 3... in insertion order. Explicit numbers are left alone and
     * are not skipped by the fallback counter.
     */
    public void resolveNumbers(ProcessBlock block) {
        int next = 1;
        for (AfiItem item : block.items()) {
            if (!item.hasNumber()) {
                item.assignNumber(next++);
            }
        }
    }

    public List<OutputRecord> associate(ProcessBlock block, String sourceFile) {
        block.recommendations().flush();
        resolveNumbers(block);
        List<AfiItem> ordered = new ArrayList<>(block.items());
        ordered.sort(Comparator.comparingInt(AfiItem::number));

        List<OutputRecord> records = new ArrayList<>(ordered.size());
        for (AfiItem item : ordered) {
            String recommendation = block.recommendations().textFor(String.valueOf(item.number()));
            records.add(toRecord(item, recommendation, block.label(), sourceFile));
        }
        return records;
    }

    private OutputRecord toRecord(AfiItem item, String recommendation, String label, String sourceFile) {
        AnnotatedText cleaned = annotationExtractor.extract(item.text());
        boolean fillsClassification = item.classification().isEmpty() && !cleaned.classification().isEmpty();
        boolean fillsEntity = item.entity().isEmpty() && !cleaned.entity().isEmpty();
        if (!fillsClassification && !fillsEntity) {
            // nothing left to recover; keep the text as extracted
            return new OutputRecord(item.text(), item.classification(), item.entity(), recommendation, label, sourceFile);
        }
        String classification = fillsClassification ? cleaned.classification() : item.classification();
        String entity = fillsEntity ? cleaned.entity() : item.entity();
        return new OutputRecord(cleaned.text(), classification, entity, recommendation, label, sourceFile);
    }
}
