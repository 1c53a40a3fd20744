package ai.afi.extractor.parse;

import ai.afi.extractor.annotation.AnnotatedText;
import ai.afi.extractor.annotation.AnnotationExtractor;
import ai.afi.extractor.annotation.CrossLineExtraction;
import ai.afi.extractor.model.AfiItem;
import ai.afi.extractor.model.OutputRecord;
import ai.afi.extractor.model.ProcessBlock;
import ai.afi.extractor.text.TextNormalizer;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks the lines of one document, collecting AFI items and recommendations per process block.
 *
 * <p>Lines are tagged by {@link LineClassifier} and dispatched through a (state, role) handler
 * table. Header roles behave the same in every state; everything else is ignored unless the
 * current state registers a handler for it.
 */
public class SectionStateMachine {

    private static final Logger LOGGER = LoggerFactory.getLogger(SectionStateMachine.class);

    private final LineClassifier classifier;
    private final AnnotationExtractor annotationExtractor;
    private final ItemAssociator associator;
    private final Map<SectionState, Map<LineRole, LineHandler>> handlers = new EnumMap<>(SectionState.class);

    public SectionStateMachine() {
        this(new LineClassifier(), new AnnotationExtractor());
    }

    public SectionStateMachine(LineClassifier classifier, AnnotationExtractor annotationExtractor) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.annotationExtractor = Objects.requireNonNull(annotationExtractor, "annotationExtractor");
        this.associator = new ItemAssociator(annotationExtractor);
        registerHandlers();
    }

    public List<OutputRecord> parse(String sourceFile, List<String> lines) {
        return run(sourceFile, lines).records();
    }

    /**
     * Parses a document and returns the final context, including the number of flushed blocks.
     */
    public ParserContext run(String sourceFile, List<String> lines) {
        ParserContext context = new ParserContext(sourceFile, lines);
        int index = 0;
        while (index < context.lines().size()) {
            TaggedLine line = classifier.classify(context.lines().get(index), index);
            LineHandler handler = handlers.get(context.state()).getOrDefault(line.role(), LineHandler.IGNORE);
            int lastConsumed = handler.handle(context, line);
            index = Math.max(index, lastConsumed) + 1;
        }
        flushBlock(context, context.block());
        LOGGER.debug("Parsed {}: {} lines, {} blocks, {} records",
                sourceFile, context.lines().size(), context.flushedBlocks(), context.records().size());
        return context;
    }

    private void registerHandlers() {
        for (SectionState state : SectionState.values()) {
            Map<LineRole, LineHandler> table = new EnumMap<>(LineRole.class);
            table.put(LineRole.PROCESS_HEADER, this::onProcessHeader);
            table.put(LineRole.AFI_HEADER, this::onAfiHeader);
            table.put(LineRole.RECOMMENDATION_HEADER, this::onRecommendationHeader);
            handlers.put(state, table);
        }

        Map<LineRole, LineHandler> afi = handlers.get(SectionState.IN_AFI);
        afi.put(LineRole.ANNOTATION_ONLY, this::onAnnotationOnly);
        afi.put(LineRole.NUMBERED_ITEM, this::onNumberedAfi);
        afi.put(LineRole.PARENTHESIZED_TEXT, this::onUnnumberedAfi);

        Map<LineRole, LineHandler> reco = handlers.get(SectionState.IN_RECO);
        reco.put(LineRole.NUMBERED_ITEM, this::onNumberedRecommendation);
        reco.put(LineRole.ANNOTATION_ONLY, this::onRecommendationContinuation);
        reco.put(LineRole.PARENTHESIZED_TEXT, this::onRecommendationContinuation);
        reco.put(LineRole.TEXT, this::onRecommendationContinuation);
    }

    private int onProcessHeader(ParserContext context, TaggedLine line) {
        ProcessBlock closed = context.startBlock(line.label());
        flushBlock(context, closed);
        return line.index();
    }

    private int onAfiHeader(ParserContext context, TaggedLine line) {
        context.block().recommendations().flush();
        context.enter(SectionState.IN_AFI);
        context.clearLastItem();
        return line.index();
    }

    private int onRecommendationHeader(ParserContext context, TaggedLine line) {
        context.block().recommendations().flush();
        context.enter(SectionState.IN_RECO);
        return line.index();
    }

    private int onAnnotationOnly(ParserContext context, TaggedLine line) {
        AnnotatedText annotation = annotationExtractor.extract(line.text());
        OptionalInt last = context.lastItem();
        if (last.isPresent() && annotation.hasAnnotation()) {
            context.block().item(last.getAsInt()).fillMissing(annotation.classification(), annotation.entity());
        }
        return line.index();
    }

    private int onNumberedAfi(ParserContext context, TaggedLine line) {
        CrossLineExtraction extraction = annotationExtractor.extractAcrossLines(context.lines(), line.index(), line.body());
        AnnotatedText result = extraction.result();
        context.addItem(new AfiItem(parseNumber(line.number()), result.text(), result.classification(), result.entity()));
        return Math.max(line.index(), extraction.lastConsumedIndex());
    }

    private int onUnnumberedAfi(ParserContext context, TaggedLine line) {
        CrossLineExtraction extraction = annotationExtractor.extractAcrossLines(context.lines(), line.index(), line.text());
        AnnotatedText result = extraction.result();
        if (!result.hasAnnotation()) {
            return line.index();
        }
        context.addItem(new AfiItem(null, result.text(), result.classification(), result.entity()));
        return extraction.lastConsumedIndex();
    }

    private int onNumberedRecommendation(ParserContext context, TaggedLine line) {
        context.block().recommendations().open(line.number(), TextNormalizer.tidy(line.body()));
        return line.index();
    }

    private int onRecommendationContinuation(ParserContext context, TaggedLine line) {
        context.block().recommendations().append(TextNormalizer.tidy(line.text()));
        return line.index();
    }

    private void flushBlock(ParserContext context, ProcessBlock block) {
        block.recommendations().flush();
        List<OutputRecord> records = block.hasContent()
                ? associator.associate(block, context.sourceFile())
                : List.of();
        if (!records.isEmpty()) {
            LOGGER.debug("Flushed block '{}' of {} with {} records", block.label(), context.sourceFile(), records.size());
        }
        context.emit(records);
    }

    private static Integer parseNumber(String raw) {
        try {
            return Integer.valueOf(raw);
        } catch (NumberFormatException ex) {
            LOGGER.debug("Item number {} out of range; numbering by position instead", raw);
            return null;
        }
    }
}
