package io.stelli.core.migration;

import io.stelli.core.model.FieldDefinition;
import io.stelli.core.model.FieldType;
import java.util.Objects;

/**
 * One difference between two versions of a list's field definitions.
 *
 * @param type      kind of change
 * @param fieldId   affected field id
 * @param fieldName field name in the newer version, or the removed field's name
 * @param oldType   previous type, set only for {@link Type#TYPE_CHANGED}
 * @param newType   new type, set only for {@link Type#TYPE_CHANGED}
 */
public record FieldChange(Type type, String fieldId, String fieldName, FieldType oldType, FieldType newType) {

    /** Kind of field change. */
    public enum Type {
        ADDED,
        REMOVED,
        /** Name, requiredness or options changed; the type is the same. */
        MODIFIED,
        TYPE_CHANGED;

        /** Whether existing entry values must be rewritten. */
        public boolean isBreaking() {
            return this == REMOVED || this == TYPE_CHANGED;
        }
    }

    public FieldChange {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(fieldId, "fieldId must not be null");
    }

    static FieldChange added(FieldDefinition field) {
        return new FieldChange(Type.ADDED, field.id(), field.name(), null, null);
    }

    static FieldChange removed(FieldDefinition field) {
        return new FieldChange(Type.REMOVED, field.id(), field.name(), null, null);
    }

    static FieldChange modified(FieldDefinition field) {
        return new FieldChange(Type.MODIFIED, field.id(), field.name(), null, null);
    }

    static FieldChange typeChanged(FieldDefinition before, FieldDefinition after) {
        return new FieldChange(Type.TYPE_CHANGED, after.id(), after.name(), before.type(), after.type());
    }

    @Override
    public String toString() {
        return type == Type.TYPE_CHANGED
                ? "FieldChange[" + type + " " + fieldId + " " + oldType.wireName() + "->" + newType.wireName() + "]"
                : "FieldChange[" + type + " " + fieldId + "]";
    }
}
