package io.stelli.core.spec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.stelli.core.error.ListParseException;
import io.stelli.core.error.SchemaInvariantException;
import io.stelli.core.error.SchemaLoadException;
import io.stelli.core.error.SchemaValidationException;
import io.stelli.core.error.UnknownFieldTypeException;
import io.stelli.core.model.FieldDefinition;
import io.stelli.core.model.FieldType;
import io.stelli.core.model.RatingConfig;
import io.stelli.core.model.RatingType;
import io.stelli.core.model.UserList;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Tests for {@link ListSchemaParser}: valid YAML and JSON documents, then each rejection gate
 * (schema, unknown keys, field types, invariants).
 */
class ListSchemaParserTest {

    private final ListSchemaParser parser = new ListSchemaParser();

    private static Path resource(String name) throws URISyntaxException {
        return Path.of(ListSchemaParserTest.class.getResource("/lists/" + name).toURI());
    }

    @Nested
    class ValidDocuments {

        @Test
        @DisplayName("YAML list with wire-named field types")
        void parsesYamlList() throws Exception {
            UserList list = parser.parse(resource("books.yaml"));

            assertThat(list.id()).isEqualTo("books");
            assertThat(list.ratingType()).isEqualTo(RatingType.STARS);
            assertThat(list.ratingConfig()).isNull();
            assertThat(list.fieldDefinitions())
                    .extracting(FieldDefinition::type)
                    .containsExactly(FieldType.TEXT, FieldType.MULTI_SELECT, FieldType.YES_NO, FieldType.NUMBER);
            assertThat(list.field("genre")).get().extracting(FieldDefinition::options)
                    .isEqualTo(List.of("Fiction", "Essays", "Poetry"));
            assertThat(list.field("finished")).get().extracting(FieldDefinition::required).isEqualTo(false);
        }

        @Test
        @DisplayName("JSON list; rating step defaults to 1 for points")
        void parsesJsonList() throws Exception {
            UserList list = parser.parse(resource("scores.json"));

            assertThat(list.ratingType()).isEqualTo(RatingType.POINTS);
            assertThat(list.ratingConfig()).isEqualTo(new RatingConfig(50, 1));
            assertThat(list.field("played")).get().extracting(FieldDefinition::type).isEqualTo(FieldType.DATE);
        }

        @Test
        void starsStepDefaultsToHalf() {
            UserList list = parser.parse("""
                    id: l
                    rating_type: stars
                    rating_config: {max: 5}
                    field_definitions:
                      - {id: "1", name: Name, type: text, required: true, order: 0}
                    """, "inline");

            assertThat(list.ratingConfig()).isEqualTo(new RatingConfig(5, 0.5));
        }

        @Test
        void readsFromTempFile(@TempDir Path dir) throws Exception {
            Path file = dir.resolve("list.yaml");
            Files.writeString(file, """
                    id: temp
                    rating_type: none
                    field_definitions:
                      - {id: "1", name: Name, type: text, required: true, order: 0}
                    """);

            assertThat(parser.parse(file).isRated()).isFalse();
        }
    }

    @Nested
    class InvalidDocuments {

        @Test
        void missingFieldDefinitionsFailsSchema() {
            assertThatThrownBy(() -> parser.parse("id: l\nrating_type: stars\n", "inline"))
                    .isInstanceOf(SchemaValidationException.class)
                    .satisfies(e -> assertThat(((SchemaLoadException) e).source()).isEqualTo("inline"));
        }

        @Test
        void unknownRatingTypeFailsSchema() {
            assertThatThrownBy(() -> parser.parse("""
                            id: l
                            rating_type: hearts
                            field_definitions:
                              - {id: "1", name: Name, type: text, required: true, order: 0}
                            """, "inline"))
                    .isInstanceOf(SchemaValidationException.class);
        }

        @Test
        @DisplayName("Misspelled key is rejected, not ignored")
        void unknownKeyIsRejected() {
            assertThatThrownBy(() -> parser.parse("""
                            id: l
                            rating_type: none
                            ratingType: stars
                            field_definitions:
                              - {id: "1", name: Name, type: text, required: true, order: 0}
                            """, "inline"))
                    .isInstanceOf(ListParseException.class)
                    .hasMessageContaining("[ratingType]")
                    .satisfies(e -> assertThat(((ListParseException) e).listId()).isEqualTo("l"));
        }

        @Test
        void unknownFieldTypeIsRejected() {
            assertThatThrownBy(() -> parser.parse("""
                            id: l
                            rating_type: none
                            field_definitions:
                              - {id: "1", name: Name, type: text, required: true, order: 0}
                              - {id: "2", name: Mood, type: emoji, order: 1}
                            """, "inline"))
                    .isInstanceOf(UnknownFieldTypeException.class)
                    .satisfies(e -> assertThat(((UnknownFieldTypeException) e).fieldType()).isEqualTo("emoji"));
        }

        @Test
        void missingNameFieldIsAnInvariantViolation() {
            assertThatThrownBy(() -> parser.parse("""
                            id: l
                            rating_type: none
                            field_definitions:
                              - {id: "2", name: Notes, type: text, order: 0}
                            """, "inline"))
                    .isInstanceOf(SchemaInvariantException.class)
                    .satisfies(e -> assertThat(((SchemaInvariantException) e).source()).isEqualTo("inline"));
        }

        @Test
        void pointsMaximumBelowOneIsAnInvariantViolation() {
            assertThatThrownBy(() -> parser.parse("""
                            id: l
                            rating_type: points
                            rating_config: {max: 0.5}
                            field_definitions:
                              - {id: "1", name: Name, type: text, required: true, order: 0}
                            """, "inline"))
                    .isInstanceOf(SchemaInvariantException.class)
                    .hasMessageContaining("rating_config.max of a points list must be at least 1")
                    .satisfies(e -> assertThat(((SchemaInvariantException) e).listId()).isEqualTo("l"));
        }

        @Test
        void optionsOnNumberFieldAreRejected() {
            assertThatThrownBy(() -> parser.parse("""
                            id: l
                            rating_type: none
                            field_definitions:
                              - {id: "1", name: Name, type: text, required: true, order: 0}
                              - {id: "2", name: Size, type: number, order: 1, options: [S, M]}
                            """, "inline"))
                    .isInstanceOf(SchemaInvariantException.class);
        }

        @Test
        void malformedYamlIsAParseError() {
            assertThatThrownBy(() -> parser.parse("id: [unclosed", "inline")).isInstanceOf(ListParseException.class);
        }

        @Test
        void missingFileIsAParseError(@TempDir Path dir) {
            assertThatThrownBy(() -> parser.parse(dir.resolve("absent.yaml")))
                    .isInstanceOf(ListParseException.class);
        }
    }
}
