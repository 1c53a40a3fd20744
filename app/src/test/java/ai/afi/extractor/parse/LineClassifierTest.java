package ai.afi.extractor.parse;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class LineClassifierTest {

    private final LineClassifier classifier = new LineClassifier();

    @Test
    void numberedProcessHeaderBuildsLabel() {
        TaggedLine line = classifier.classify("Process 1.2 Some process name", 4);

        assertThat(line.role()).isEqualTo(LineRole.PROCESS_HEADER);
        assertThat(line.label()).isEqualTo("Process – 1.2 Some process name");
        assertThat(line.index()).isEqualTo(4);
    }

    @Test
    void processHeaderAcceptsSeparatorBeforeNumber() {
        TaggedLine line = classifier.classify("PROCESS: 3 Closing", 0);

        assertThat(line.label()).isEqualTo("Process – 3 Closing");
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "Value|Value",
            "OPERATIONAL|Operational",
            "business - Partner onboarding|Business – Partner onboarding",
            "Value: Customer outcomes|Value – Customer outcomes"
    })
    void simpleProcessLabels(String input, String expectedLabel) {
        TaggedLine line = classifier.classify(input, 0);

        assertThat(line.role()).isEqualTo(LineRole.PROCESS_HEADER);
        assertThat(line.label()).isEqualTo(expectedLabel);
    }

    @Test
    void simpleLabelNeedsSeparatorBeforeTail() {
        assertThat(classifier.classify("Business processes are mature", 0).role()).isEqualTo(LineRole.TEXT);
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "Areas for Improvement:|AFI_HEADER",
            "area of improvement|AFI_HEADER",
            "Recommendations:|RECOMMENDATION_HEADER",
            "recommendation|RECOMMENDATION_HEADER",
            "(Major - Ops)|ANNOTATION_ONLY",
            "12 - Close the gap|NUMBERED_ITEM",
            "Missing sign-off (Major - Ops)|PARENTHESIZED_TEXT",
            "Plain continuation text|TEXT"
    })
    void tagsStructuralRoles(String input, LineRole expected) {
        assertThat(classifier.classify(input, 0).role()).isEqualTo(expected);
    }

    @Test
    void numberedItemCapturesNumberAndBody() {
        TaggedLine line = classifier.classify("3 - Fix the intake queue ", 0);

        assertThat(line.number()).isEqualTo("3");
        assertThat(line.body()).isEqualTo("Fix the intake queue");
    }
}
