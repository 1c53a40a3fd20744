package ai.afi.extractor.batch;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Aggregate of document outcomes for a batch run.
 */
public record BatchOutcome(List<DocumentOutcome> documents) {

    public BatchOutcome {
        documents = List.copyOf(Objects.requireNonNull(documents, "documents"));
    }

    public int recordCount() {
        int total = 0;
        for (DocumentOutcome document : documents) {
            total += document.records().size();
        }
        return total;
    }

    public List<String> failedFiles() {
        List<String> failed = new ArrayList<>();
        for (DocumentOutcome document : documents) {
            if (!document.succeeded()) {
                failed.add(document.fileName());
            }
        }
        return failed;
    }
}
