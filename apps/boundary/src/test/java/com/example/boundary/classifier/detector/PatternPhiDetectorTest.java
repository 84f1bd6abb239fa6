package com.example.boundary.classifier.detector;

import com.example.boundary.classifier.model.DetectedSpan;
import com.example.boundary.classifier.model.PhiCategory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PatternPhiDetector")
class PatternPhiDetectorTest {

    private PatternPhiDetector detector;

    @BeforeEach
    void setUp() {
        detector = new PatternPhiDetector();
    }

    private List<PhiCategory> categories(String text) {
        return detector.detect(text).stream().map(DetectedSpan::category).toList();
    }

    @Nested
    @DisplayName("Identifiers")
    class Identifiers {

        @Test
        @DisplayName("should find a name and a date of birth in a referral sentence")
        void shouldFindNameAndDob() {
            String text = "My client John Smith, DOB 1990-01-01, reports...";

            List<DetectedSpan> spans = detector.detect(text);

            assertThat(spans).extracting(DetectedSpan::category)
                    .containsExactly(PhiCategory.NAME, PhiCategory.DATE_OF_BIRTH);
            DetectedSpan name = spans.get(0);
            assertThat(text.substring(name.start(), name.end())).isEqualTo("John Smith");
            DetectedSpan dob = spans.get(1);
            assertThat(text.substring(dob.start(), dob.end())).isEqualTo("DOB 1990-01-01");
        }

        @Test
        @DisplayName("should find social security numbers")
        void shouldFindSsn() {
            assertThat(categories("ssn on file is 123-45-6789")).containsExactly(PhiCategory.SSN);
        }

        @Test
        @DisplayName("should find email addresses and phone numbers")
        void shouldFindContactDetails() {
            assertThat(categories("reach out at someone@example.org or 555-123-4567"))
                    .containsExactly(PhiCategory.EMAIL, PhiCategory.PHONE);
        }

        @Test
        @DisplayName("should find diagnostic codes with or without a prefix")
        void shouldFindDiagnosticCodes() {
            assertThat(categories("coded as ICD-10 F41.1 last year")).contains(PhiCategory.DIAGNOSTIC_CODE);
            assertThat(categories("presentation consistent with F32.1")).containsExactly(PhiCategory.DIAGNOSTIC_CODE);
        }

        @Test
        @DisplayName("should find medical record numbers")
        void shouldFindMrn() {
            assertThat(categories("see MRN: 44-1902A for history")).containsExactly(PhiCategory.MEDICAL_RECORD_NUMBER);
        }

        @Test
        @DisplayName("should find long verbatim quotes")
        void shouldFindQuotes() {
            assertThat(categories("she said \"I cannot keep doing this every single night\""))
                    .containsExactly(PhiCategory.QUOTE);
        }

        @Test
        @DisplayName("should find names after a relationship keyword")
        void shouldFindRelationshipNames() {
            String text = "it started when my wife Maria left";

            List<DetectedSpan> spans = detector.detect(text);

            assertThat(spans).singleElement().satisfies(span -> {
                assertThat(span.category()).isEqualTo(PhiCategory.NAME);
                assertThat(text.substring(span.start(), span.end())).isEqualTo("Maria");
            });
        }

        @Test
        @DisplayName("should find self-disclosure phrases")
        void shouldFindSelfDisclosure() {
            assertThat(categories("ok so my name is private")).containsExactly(PhiCategory.SELF_DISCLOSURE);
        }
    }

    @Nested
    @DisplayName("Clinical vocabulary")
    class ClinicalVocabulary {

        @ParameterizedTest
        @ValueSource(strings = {
                "Clients with avoidant attachment often report...",
                "evidence-based interventions for Gottman Method in therapy",
                "Emotionally Focused therapy for pursuer-distancer patterns",
                "Dialectical Behavior therapy skills for emotion regulation",
                "clinical research on intellectualization in couples therapy",
                "Internal Family Systems parts work"
        })
        @DisplayName("should not flag framework language")
        void shouldNotFlagFrameworkLanguage(String text) {
            assertThat(detector.detect(text)).isEmpty();
        }

        @Test
        @DisplayName("should not flag street names as personal names")
        void shouldNotFlagStreetAsName() {
            assertThat(categories("office moved to Maple Street")).containsExactly(PhiCategory.LOCATION);
        }
    }

    @Nested
    @DisplayName("Overlaps")
    class Overlaps {

        @Test
        @DisplayName("should keep the higher-priority category when spans overlap")
        void shouldKeepHigherPriority() {
            List<DetectedSpan> spans = detector.detect("born on 04/12/1985 in spring");

            assertThat(spans).extracting(DetectedSpan::category).contains(PhiCategory.DATE_OF_BIRTH)
                    .doesNotContain(PhiCategory.DATE);
        }

        @Test
        @DisplayName("should return non-overlapping spans in text order")
        void shouldReturnOrderedDisjointSpans() {
            List<DetectedSpan> spans = detector.detect(
                    "Patient Jane Doe, DOB 1980-02-03, phone 555-123-4567, email jane@example.com");

            for (int i = 1; i < spans.size(); i++) {
                assertThat(spans.get(i).start()).isGreaterThanOrEqualTo(spans.get(i - 1).end());
            }
            assertThat(spans).extracting(DetectedSpan::category)
                    .containsExactly(PhiCategory.NAME, PhiCategory.DATE_OF_BIRTH, PhiCategory.PHONE, PhiCategory.EMAIL);
        }
    }
}
