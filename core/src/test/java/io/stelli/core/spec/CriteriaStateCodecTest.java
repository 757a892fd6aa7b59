package io.stelli.core.spec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.stelli.core.criteria.CriteriaPool;
import io.stelli.core.criteria.DateFilterCriterion;
import io.stelli.core.criteria.DateRange;
import io.stelli.core.criteria.FilterCriterion;
import io.stelli.core.criteria.FilterType;
import io.stelli.core.criteria.RatingFilterCriterion;
import io.stelli.core.criteria.RatingFilterMode;
import io.stelli.core.criteria.RatingRange;
import io.stelli.core.criteria.SortCriterion;
import io.stelli.core.engine.SortEngine;
import io.stelli.core.error.CriteriaStateException;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Tests for {@link CriteriaStateCodec}. */
class CriteriaStateCodecTest {

    private final CriteriaStateCodec codec = new CriteriaStateCodec();

    @Test
    void sortPoolUsesLowercaseWireNames() {
        ObjectNode node = codec.writeSortPool(SortEngine.defaultPool());

        assertThat(node.path("active").get(0).path("key").asText()).isEqualTo("date");
        assertThat(node.path("active").get(0).path("direction").asText()).isEqualTo("desc");
        assertThat(node.path("available")).hasSize(2);
    }

    @Test
    @DisplayName("Saved sort session restores to an equal pool")
    void sortPoolSurvivesJsonText() {
        CriteriaPool<SortCriterion> pool = SortEngine.defaultPool();

        String json = codec.toJson(codec.writeSortPool(pool));

        assertThat(codec.readSortPool(codec.fromJson(json))).isEqualTo(pool);
    }

    @Test
    @DisplayName("Filter session keeps mode, range and open date bounds")
    void filterPoolSurvivesJsonText() {
        CriteriaPool<FilterCriterion> pool = new CriteriaPool<>(
                List.of(
                        new RatingFilterCriterion("rating", "Rating", "star", RatingFilterMode.ABOVE,
                                new RatingRange(3.5, 5)),
                        new DateFilterCriterion("date", "Date Range", "calendar",
                                new DateRange(Instant.parse("2026-01-01T00:00:00Z"), null))),
                List.of());

        JsonNode node = codec.fromJson(codec.toJson(codec.writeFilterPool(pool)));

        assertThat(node.path("active").get(0).path("ratingFilterMode").asText()).isEqualTo("above");
        assertThat(node.path("active").get(1).path("dateRange").path("to").isNull()).isTrue();
        assertThat(codec.readFilterPool(node)).isEqualTo(pool);
    }

    @Test
    void unconfiguredTemplatesRoundTrip() {
        CriteriaPool<FilterCriterion> pool = new CriteriaPool<>(
                List.of(), List.of(FilterCriterion.template(FilterType.RATING), FilterCriterion.template(FilterType.DATE)));

        assertThat(codec.readFilterPool(codec.writeFilterPool(pool))).isEqualTo(pool);
    }

    @Test
    void duplicateIdsAreRejectedOnRead() {
        JsonNode node = codec.fromJson("""
                {"active": [{"id": "date", "key": "date", "direction": "desc"}],
                 "available": [{"id": "date", "key": "date", "direction": "asc"}]}
                """);

        assertThatThrownBy(() -> codec.readSortPool(node)).isInstanceOf(CriteriaStateException.class);
    }

    @Test
    void unknownFilterTypeIsRejected() {
        JsonNode node = codec.fromJson("""
                {"active": [{"id": "x", "type": "color"}], "available": []}
                """);

        assertThatThrownBy(() -> codec.readFilterPool(node))
                .isInstanceOf(CriteriaStateException.class)
                .hasMessageContaining("color");
    }

    @Test
    void missingArrayIsRejected() {
        assertThatThrownBy(() -> codec.readSortPool(codec.fromJson("{\"active\": []}")))
                .isInstanceOf(CriteriaStateException.class)
                .hasMessageContaining("available");
    }

    @Test
    void invalidJsonIsRejected() {
        assertThatThrownBy(() -> codec.fromJson("{not json")).isInstanceOf(CriteriaStateException.class);
    }
}
