package com.rfqlog.application.service;

import com.rfqlog.domain.exception.ValidationException;
import com.rfqlog.domain.model.ChangeKind;
import com.rfqlog.domain.model.ChangeRecord;
import com.rfqlog.domain.model.FieldDefinition;
import com.rfqlog.domain.model.FieldSchema;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Computes the field changes between two snapshots of a record.
 *
 * <p>Pure: the result depends only on the schema and the snapshots. Records are returned in
 * schema order as drafts without id, entity, timestamp or actor.
 */
@Slf4j
public class DiffEngine {

    private final SnapshotValidator validator;

    public DiffEngine(SnapshotValidator validator) {
        this.validator = validator;
    }

    public DiffEngine() {
        this(new SnapshotValidator());
    }

    /**
     * Diff two snapshots
     * @param schema Tracked fields
     * @param oldSnapshot Values before the save, null when the record is new
     * @param newSnapshot Values being saved
     * @return Changes in schema order, empty when nothing tracked changed
     * @throws ValidationException if a snapshot misses a required field or holds a value its field cannot serialize
     */
    public List<ChangeRecord> diff(FieldSchema schema, Map<String, ?> oldSnapshot, Map<String, ?> newSnapshot) {
        List<String> errors = new ArrayList<>(validator.validate(schema, newSnapshot, true).errors());
        if (schema != null && oldSnapshot != null) {
            validator.validate(schema, oldSnapshot, false).errors()
                    .forEach(error -> errors.add("previous " + error));
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }

        List<ChangeRecord> changes = oldSnapshot == null
                ? creationChanges(schema, newSnapshot)
                : updateChanges(schema, oldSnapshot, newSnapshot);

        log.debug("Diffed {} snapshot against schema {}: {} change(s)",
                oldSnapshot == null ? "new" : "existing", schema.getName(), changes.size());
        return Collections.unmodifiableList(changes);
    }

    private List<ChangeRecord> creationChanges(FieldSchema schema, Map<String, ?> newSnapshot) {
        List<ChangeRecord> changes = new ArrayList<>();

        for (FieldDefinition field : schema.getFields()) {
            String newValue = field.serialize(newSnapshot.get(field.getName()));
            if (field.isUnset(newValue)) {
                continue;
            }
            changes.add(ChangeRecord.builder()
                    .fieldName(field.getName())
                    .oldValue(null)
                    .newValue(newValue)
                    .changeKind(ChangeKind.CREATED)
                    .build());
        }

        return changes;
    }

    private List<ChangeRecord> updateChanges(FieldSchema schema, Map<String, ?> oldSnapshot, Map<String, ?> newSnapshot) {
        List<ChangeRecord> changes = new ArrayList<>();

        for (FieldDefinition field : schema.getFields()) {
            String oldValue = field.serialize(oldSnapshot.get(field.getName()));
            String newValue = field.serialize(newSnapshot.get(field.getName()));
            if (oldValue.equals(newValue)) {
                continue;
            }
            changes.add(ChangeRecord.builder()
                    .fieldName(field.getName())
                    .oldValue(oldValue)
                    .newValue(newValue)
                    .changeKind(ChangeKind.UPDATED)
                    .build());
        }

        return changes;
    }
}
