package ai.afi.extractor.sink;

import ai.afi.extractor.model.OutputRecord;
import java.util.List;

/**
 * Destination for output rows. Rows are appended in the order given and persisted on {@link #save()}.
 */
public interface RecordSink extends AutoCloseable {

    void append(OutputRecord record);

    default void appendAll(List<OutputRecord> records) {
        for (OutputRecord record : records) {
            append(record);
        }
    }

    void save();

    @Override
    default void close() {
    }
}
