package io.stelli.core.validation;

import static io.stelli.core.testkit.TestLists.values;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.stelli.core.error.FieldValueShapeException;
import io.stelli.core.model.EntryCandidate;
import io.stelli.core.model.FieldDefinition;
import io.stelli.core.model.FieldType;
import io.stelli.core.model.RatingType;
import io.stelli.core.model.UserList;
import io.stelli.core.testkit.TestLists;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/** Tests for {@link ValidationEngine}. */
class ValidationEngineTest {

    private final ValidationEngine engine = new ValidationEngine();

    @Test
    @DisplayName("Empty required multi-select on a stars list is the only failure")
    void emptyGenreIsTheOnlyFailure() {
        ValidationResult result = engine.validate(
                TestLists.books(), new EntryCandidate(4.0, values("1", "Dune", "genre", List.of())));

        assertThat(result.valid()).isFalse();
        assertThat(result.failures())
                .containsExactly(new ValidationFailure("genre", FailureReason.EMPTY_MULTISELECT));
    }

    @Test
    void completeCandidateIsValid() {
        ValidationResult result = engine.validate(
                TestLists.books(), new EntryCandidate(4.5, values("1", "Dune", "genre", List.of("A"))));

        assertThat(result.valid()).isTrue();
        assertThat(result).isSameAs(ValidationResult.ok());
    }

    @Test
    @DisplayName("Failures are reported together, in rule order")
    void allFailuresInRuleOrder() {
        ValidationResult result = engine.validate(TestLists.books(), new EntryCandidate(null, values("1", " ")));

        assertThat(result.failures())
                .extracting(ValidationFailure::toString)
                .containsExactly("1:empty-name", "rating:rating-required", "genre:empty-multiselect");
    }

    @Nested
    class Name {

        @Test
        void synonymKeySatisfiesName() {
            ValidationResult result = engine.validate(TestLists.places(),
                    new EntryCandidate(null, values("name", "Oslo trip", "visited", false, "city", "Oslo")));

            assertThat(result.valid()).isTrue();
        }

        @Test
        void whitespaceNameFails() {
            ValidationResult result = engine.validate(TestLists.places(),
                    new EntryCandidate(null, values("1", "\t ", "visited", true, "city", "Oslo")));

            assertThat(result.has("1", FailureReason.EMPTY_NAME)).isTrue();
        }
    }

    @Nested
    class Rating {

        @ParameterizedTest
        @ValueSource(doubles = {0, -2, 3, 7.5})
        @DisplayName("Unrated lists never require a rating")
        void unratedListNeverRequiresRating(double rating) {
            ValidationResult result = engine.validate(TestLists.places(),
                    new EntryCandidate(rating, values("1", "x", "visited", true, "city", "Rome")));

            assertThat(result.has(ValidationFailure.RATING, FailureReason.RATING_REQUIRED)).isFalse();
        }

        @Test
        void zeroIsUnset() {
            ValidationResult result = engine.validate(
                    TestLists.books(), new EntryCandidate(0.0, values("1", "Dune", "genre", List.of("A"))));

            assertThat(result.failures())
                    .containsExactly(new ValidationFailure(ValidationFailure.RATING, FailureReason.RATING_REQUIRED));
        }

        @Test
        void starsAboveFiveAreOutOfRange() {
            ValidationResult result = engine.validate(
                    TestLists.books(), new EntryCandidate(5.5, values("1", "Dune", "genre", List.of("A"))));

            assertThat(result.has(ValidationFailure.RATING, FailureReason.RATING_OUT_OF_RANGE)).isTrue();
        }

        @Test
        void starsMinimumIsConfigurable() {
            var strict = new ValidationEngine(
                    new ValidationOptions(1, RatingPrecision.ANY, RatingPrecision.INTEGER, RatingPrecision.INTEGER, true));
            var candidate = new EntryCandidate(0.5, values("1", "Dune", "genre", List.of("A")));

            assertThat(engine.validate(TestLists.books(), candidate).valid()).isTrue();
            assertThat(strict.validate(TestLists.books(), candidate).has("rating", FailureReason.RATING_OUT_OF_RANGE))
                    .isTrue();
        }

        @Test
        void pointsMustBeWholeByDefault() {
            ValidationResult result =
                    engine.validate(TestLists.points(100), new EntryCandidate(42.5, values("1", "Run")));

            assertThat(result.failures())
                    .containsExactly(new ValidationFailure(ValidationFailure.RATING, FailureReason.RATING_PRECISION));
        }

        @Test
        void oneDecimalPrecisionAdmitsTenths() {
            var lenient = new ValidationEngine(new ValidationOptions(
                    0.5, RatingPrecision.ANY, RatingPrecision.ONE_DECIMAL, RatingPrecision.INTEGER, true));

            assertThat(lenient.validate(TestLists.points(100), new EntryCandidate(42.5, values("1", "Run"))).valid())
                    .isTrue();
            assertThat(lenient.validate(TestLists.points(100), new EntryCandidate(42.55, values("1", "Run")))
                            .has("rating", FailureReason.RATING_PRECISION))
                    .isTrue();
        }

        @Test
        void scaleMaximumFollowsOptions() {
            var fixedScale = new ValidationEngine(new ValidationOptions(
                    0.5, RatingPrecision.ANY, RatingPrecision.INTEGER, RatingPrecision.INTEGER, false));
            var candidate = new EntryCandidate(15.0, values("1", "Gig"));

            assertThat(engine.validate(TestLists.scale(20), candidate).valid()).isTrue();
            assertThat(fixedScale.validate(TestLists.scale(20), candidate).has("rating", FailureReason.RATING_OUT_OF_RANGE))
                    .isTrue();
        }
    }

    @Nested
    class RequiredFields {

        @Test
        void falseAnswersYesNo() {
            ValidationResult result = engine.validate(TestLists.places(),
                    new EntryCandidate(null, values("1", "Trip", "visited", false, "city", "Rome")));

            assertThat(result.valid()).isTrue();
        }

        @Test
        void missingYesNoAndBlankDropdownFail() {
            ValidationResult result =
                    engine.validate(TestLists.places(), new EntryCandidate(null, values("1", "Trip", "city", "  ")));

            assertThat(result.failures())
                    .containsExactly(
                            new ValidationFailure("visited", FailureReason.UNANSWERED_YES_NO),
                            new ValidationFailure("city", FailureReason.REQUIRED_FIELD_EMPTY));
        }

        @Test
        void emptyPhotoListIsBlank() {
            UserList list = UserList.builder("gallery")
                    .field(FieldDefinition.of("photos", "Photos", FieldType.PHOTOS, true, 1))
                    .build();

            assertThat(engine.validate(list, new EntryCandidate(null, values("1", "x", "photos", List.of())))
                            .has("photos", FailureReason.REQUIRED_FIELD_EMPTY))
                    .isTrue();
            assertThat(engine.validate(list, new EntryCandidate(null, values("1", "x", "photos", List.of("a.jpg"))))
                            .valid())
                    .isTrue();
        }

        @Test
        void zeroNumberIsAnAnswer() {
            UserList list = UserList.builder("counts")
                    .ratingType(RatingType.NONE)
                    .field(FieldDefinition.of("count", "Count", FieldType.NUMBER, true, 1))
                    .build();

            assertThat(engine.validate(list, new EntryCandidate(null, values("1", "x", "count", 0))).valid())
                    .isTrue();
        }
    }

    @Nested
    class MalformedInput {

        @Test
        void scalarMultiSelectValueThrows() {
            assertThatThrownBy(() -> engine.validate(
                            TestLists.books(), new EntryCandidate(4.0, values("1", "Dune", "genre", "A"))))
                    .isInstanceOf(FieldValueShapeException.class)
                    .satisfies(e -> assertThat(((FieldValueShapeException) e).fieldId()).isEqualTo("genre"));
        }

        @Test
        void stringYesNoValueThrows() {
            assertThatThrownBy(() -> engine.validate(TestLists.places(),
                            new EntryCandidate(null, values("1", "Trip", "visited", "yes", "city", "Oslo"))))
                    .isInstanceOf(FieldValueShapeException.class)
                    .hasMessageContaining("boolean");
        }

        @Test
        void nullValueMapThrows() {
            assertThatThrownBy(() -> engine.validate(TestLists.books(), new EntryCandidate(4.0, null)))
                    .isInstanceOf(FieldValueShapeException.class);
        }
    }
}
