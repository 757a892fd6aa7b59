package io.stelli.core.migration;

import io.stelli.core.model.FieldDefinition;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Compares two versions of a list's field definitions. The Name field is never reported.
 *
 * <p>Removals are listed first in old-field order, followed by additions, type changes and
 * modifications in new-field order.
 */
public final class SchemaChangeAnalyzer {

    private SchemaChangeAnalyzer() {}

    public static List<FieldChange> analyze(List<FieldDefinition> oldFields, List<FieldDefinition> newFields) {
        Objects.requireNonNull(oldFields, "oldFields must not be null");
        Objects.requireNonNull(newFields, "newFields must not be null");
        Map<String, FieldDefinition> oldById = index(oldFields);
        Map<String, FieldDefinition> newById = index(newFields);

        List<FieldChange> changes = new ArrayList<>();
        for (FieldDefinition before : oldFields) {
            if (!before.isNameField() && !newById.containsKey(before.id())) {
                changes.add(FieldChange.removed(before));
            }
        }
        for (FieldDefinition after : newFields) {
            if (after.isNameField()) {
                continue;
            }
            FieldDefinition before = oldById.get(after.id());
            if (before == null) {
                changes.add(FieldChange.added(after));
            } else if (before.type() != after.type()) {
                changes.add(FieldChange.typeChanged(before, after));
            } else if (!before.name().equals(after.name())
                    || before.required() != after.required()
                    || !before.options().equals(after.options())) {
                changes.add(FieldChange.modified(after));
            }
        }
        return List.copyOf(changes);
    }

    /** True iff any change removes a field or changes its type. */
    public static boolean hasBreakingChanges(List<FieldChange> changes) {
        return changes.stream().anyMatch(change -> change.type().isBreaking());
    }

    private static Map<String, FieldDefinition> index(List<FieldDefinition> fields) {
        Map<String, FieldDefinition> byId = new LinkedHashMap<>();
        fields.forEach(field -> byId.put(field.id(), field));
        return byId;
    }
}
