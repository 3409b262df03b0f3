package com.rfqlog.application.service;

import com.rfqlog.domain.model.FieldDefinition;
import com.rfqlog.domain.model.FieldSchema;
import com.rfqlog.domain.model.FieldType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Validates snapshots against a field schema before they are diffed
 */
public class SnapshotValidator {

    /** Column width of OLD_VALUE / NEW_VALUE */
    public static final int MAX_VALUE_LENGTH = FieldType.MAX_LENGTH;

    public static final int MAX_ACTOR_LENGTH = 100;

    /**
     * Validate a snapshot
     * @param schema Tracked fields
     * @param snapshot Field values
     * @param requireFields Whether required fields must carry a value (true for the snapshot being saved)
     */
    public ValidationResult validate(FieldSchema schema, Map<String, ?> snapshot, boolean requireFields) {
        List<String> errors = new ArrayList<>();

        if (schema == null) {
            errors.add("schema is required");
            return ValidationResult.invalid(errors);
        }
        if (snapshot == null) {
            errors.add("snapshot is required");
            return ValidationResult.invalid(errors);
        }

        for (FieldDefinition field : schema.getFields()) {
            String canonical;
            try {
                canonical = field.serialize(snapshot.get(field.getName()));
            } catch (IllegalArgumentException e) {
                errors.add(field.getName() + ": " + e.getMessage());
                continue;
            }

            if (requireFields && field.isRequired() && canonical.isEmpty()) {
                errors.add(field.getName() + " is required");
            }
            if (canonical.length() > MAX_VALUE_LENGTH) {
                errors.add(field.getName() + " exceeds maximum length of " + MAX_VALUE_LENGTH + " characters");
            }
        }

        return ValidationResult.of(errors);
    }

    /**
     * Validate the identity a change is attributed to
     */
    public ValidationResult validateActor(String actor) {
        if (actor == null || actor.isBlank()) {
            return ValidationResult.invalid("actor is required");
        }
        if (actor.length() > MAX_ACTOR_LENGTH) {
            return ValidationResult.invalid("actor exceeds maximum length of " + MAX_ACTOR_LENGTH + " characters");
        }
        return ValidationResult.valid();
    }

    /**
     * Validate the optional annotation copied onto every change of a save
     */
    public ValidationResult validateNotes(String notes) {
        if (notes != null && notes.strip().length() > MAX_VALUE_LENGTH) {
            return ValidationResult.invalid("notes exceed maximum length of " + MAX_VALUE_LENGTH + " characters");
        }
        return ValidationResult.valid();
    }
}
