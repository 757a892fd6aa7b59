package io.stelli.core.migration;

import static org.assertj.core.api.Assertions.assertThat;

import io.stelli.core.model.FieldDefinition;
import io.stelli.core.model.FieldType;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for {@link SchemaChangeAnalyzer}. */
class SchemaChangeAnalyzerTest {

    private static final FieldDefinition NAME = FieldDefinition.nameField();

    @Test
    void identicalSchemasHaveNoChanges() {
        List<FieldDefinition> fields = List.of(NAME, FieldDefinition.of("2", "Notes", FieldType.TEXT, false, 1));

        assertThat(SchemaChangeAnalyzer.analyze(fields, fields)).isEmpty();
    }

    @Test
    void classifiesEveryKindOfChange() {
        List<FieldDefinition> before = List.of(
                NAME,
                FieldDefinition.of("gone", "Gone", FieldType.TEXT, false, 1),
                FieldDefinition.of("count", "Count", FieldType.TEXT, false, 2),
                FieldDefinition.choice("tag", "Tag", FieldType.DROPDOWN, false, 3, List.of("a")));
        List<FieldDefinition> after = List.of(
                FieldDefinition.of("1", "Title", FieldType.TEXT, true, 0),
                FieldDefinition.of("count", "Count", FieldType.NUMBER, false, 2),
                FieldDefinition.choice("tag", "Tag", FieldType.DROPDOWN, false, 3, List.of("a", "b")),
                FieldDefinition.of("new", "New", FieldType.YES_NO, false, 4));

        List<FieldChange> changes = SchemaChangeAnalyzer.analyze(before, after);

        assertThat(changes)
                .containsExactly(
                        new FieldChange(FieldChange.Type.REMOVED, "gone", "Gone", null, null),
                        new FieldChange(FieldChange.Type.TYPE_CHANGED, "count", "Count", FieldType.TEXT, FieldType.NUMBER),
                        new FieldChange(FieldChange.Type.MODIFIED, "tag", "Tag", null, null),
                        new FieldChange(FieldChange.Type.ADDED, "new", "New", null, null));
        assertThat(SchemaChangeAnalyzer.hasBreakingChanges(changes)).isTrue();
    }

    @Test
    void additionsAndRenamesAreNotBreaking() {
        List<FieldDefinition> before = List.of(NAME, FieldDefinition.of("2", "Notes", FieldType.TEXT, false, 1));
        List<FieldDefinition> after = List.of(
                NAME,
                FieldDefinition.of("2", "Comments", FieldType.TEXT, true, 1),
                FieldDefinition.of("3", "Year", FieldType.NUMBER, false, 2));

        List<FieldChange> changes = SchemaChangeAnalyzer.analyze(before, after);

        assertThat(changes).extracting(FieldChange::type)
                .containsExactly(FieldChange.Type.MODIFIED, FieldChange.Type.ADDED);
        assertThat(SchemaChangeAnalyzer.hasBreakingChanges(changes)).isFalse();
    }
}
