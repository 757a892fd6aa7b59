package io.stelli.core.migration;

import io.stelli.core.model.Entry;
import io.stelli.core.model.FieldDefinition;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites entry values after a list's field definitions changed.
 *
 * <p>For every field of the new schema: the Name is preserved under whichever keys it was stored,
 * added fields start unanswered, fields whose type changed are converted with
 * {@link FieldValueConverter}, and unchanged fields keep their value. Values of removed fields are
 * dropped. Rating and timestamps are untouched; persisting the result is up to the caller.
 */
public final class EntryMigrator {

    private static final Logger LOG = LoggerFactory.getLogger(EntryMigrator.class);

    public Entry migrate(Entry entry, List<FieldDefinition> oldFields, List<FieldDefinition> newFields) {
        Map<String, FieldDefinition> oldById = new LinkedHashMap<>();
        oldFields.forEach(field -> oldById.put(field.id(), field));
        Map<String, Object> source = entry.fieldValues();
        Map<String, Object> migrated = new LinkedHashMap<>();

        for (String nameKey : List.of(FieldDefinition.NAME_FIELD_ID, FieldDefinition.NAME_ALIAS_KEY)) {
            if (source.containsKey(nameKey)) {
                migrated.put(nameKey, source.get(nameKey));
            }
        }

        for (FieldDefinition after : newFields) {
            if (after.isNameField()) {
                continue;
            }
            FieldDefinition before = oldById.get(after.id());
            Object existing = source.get(after.id());
            if (before == null) {
                migrated.put(after.id(), null);
            } else if (before.type() != after.type()) {
                Object converted = FieldValueConverter.convert(existing, before.type(), after.type());
                if (existing != null && converted == null) {
                    LOG.warn(
                            "migration.value_discarded entry_id={} field_id={} from={} to={}",
                            entry.id(),
                            after.id(),
                            before.type().wireName(),
                            after.type().wireName());
                }
                migrated.put(after.id(), converted);
            } else {
                migrated.put(after.id(), existing);
            }
        }

        source.keySet().stream()
                .filter(key -> !migrated.containsKey(key) && source.get(key) != null)
                .forEach(key -> LOG.warn("migration.value_discarded entry_id={} field_id={} reason=removed",
                        entry.id(), key));
        return entry.withFieldValues(migrated, entry.updatedAt());
    }

    /**
     * Migrates every entry when the change set is breaking.
     *
     * @return the migrated entries, or empty when no change requires rewriting values
     */
    public Optional<List<Entry>> migrateAll(
            List<Entry> entries, List<FieldDefinition> oldFields, List<FieldDefinition> newFields) {
        List<FieldChange> changes = SchemaChangeAnalyzer.analyze(oldFields, newFields);
        if (!SchemaChangeAnalyzer.hasBreakingChanges(changes)) {
            LOG.debug("migration.skipped changes={}", changes.size());
            return Optional.empty();
        }
        List<Entry> migrated = new ArrayList<>(entries.size());
        entries.forEach(entry -> migrated.add(migrate(entry, oldFields, newFields)));
        LOG.info("migration.applied entries={} changes={}", migrated.size(), changes);
        return Optional.of(migrated);
    }
}
