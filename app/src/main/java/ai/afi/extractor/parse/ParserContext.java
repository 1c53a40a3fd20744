package ai.afi.extractor.parse;

import ai.afi.extractor.model.AfiItem;
import ai.afi.extractor.model.OutputRecord;
import ai.afi.extractor.model.ProcessBlock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Mutable parsing state for one document. A fresh context is created per document.
 */
public final class ParserContext {

    private final String sourceFile;
    private final List<String> lines;
    private final List<OutputRecord> records = new ArrayList<>();
    private SectionState state = SectionState.NEUTRAL;
    private ProcessBlock block = new ProcessBlock("");
    private OptionalInt lastItem = OptionalInt.empty();
    private int flushedBlocks;

    ParserContext(String sourceFile, List<String> lines) {
        this.sourceFile = Objects.requireNonNull(sourceFile, "sourceFile");
        this.lines = List.copyOf(lines);
    }

    public String sourceFile() {
        return sourceFile;
    }

    public List<String> lines() {
        return lines;
    }

    public SectionState state() {
        return state;
    }

    void enter(SectionState next) {
        this.state = next;
    }

    public ProcessBlock block() {
        return block;
    }

    /**
     * Replaces the current block with an empty one and returns the block being closed.
     */
    ProcessBlock startBlock(String label) {
        ProcessBlock closed = block;
        block = new ProcessBlock(label);
        lastItem = OptionalInt.empty();
        state = SectionState.NEUTRAL;
        return closed;
    }

    void addItem(AfiItem item) {
        lastItem = OptionalInt.of(block.addItem(item));
    }

    OptionalInt lastItem() {
        return lastItem;
    }

    void clearLastItem() {
        lastItem = OptionalInt.empty();
    }

    void emit(List<OutputRecord> blockRecords) {
        records.addAll(blockRecords);
        flushedBlocks++;
    }

    public int flushedBlocks() {
        return flushedBlocks;
    }

    public List<OutputRecord> records() {
        return Collections.unmodifiableList(records);
    }
}
