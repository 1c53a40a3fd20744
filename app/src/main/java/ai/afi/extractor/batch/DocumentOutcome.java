package ai.afi.extractor.batch;

import ai.afi.extractor.model.OutputRecord;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of processing a single document: either its records or the reason reading it failed.
 */
public record DocumentOutcome(String fileName, List<OutputRecord> records, Optional<String> failure) {

    public DocumentOutcome {
        Objects.requireNonNull(fileName, "fileName");
        records = List.copyOf(Objects.requireNonNull(records, "records"));
        failure = failure == null ? Optional.empty() : failure;
        if (failure.isPresent() && !records.isEmpty()) {
            throw new IllegalArgumentException("A failed document carries no records");
        }
    }

    public static DocumentOutcome ok(String fileName, List<OutputRecord> records) {
        return new DocumentOutcome(fileName, records, Optional.empty());
    }

    public static DocumentOutcome readFailed(String fileName, String reason) {
        return new DocumentOutcome(fileName, List.of(), Optional.of(reason));
    }

    public boolean succeeded() {
        return failure.isEmpty();
    }
}
