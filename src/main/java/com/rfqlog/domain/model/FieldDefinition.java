package com.rfqlog.domain.model;

import lombok.Value;

import java.util.List;

/**
 * A tracked field: canonical name, display label and serialization rule
 */
@Value
public class FieldDefinition {
    String name;
    String label;
    FieldType type;
    boolean required;
    List<String> allowedValues;  // only for CHOICE

    public static FieldDefinition text(String name, String label) {
        return new FieldDefinition(name, label, FieldType.TEXT, false, List.of());
    }

    public static FieldDefinition decimal(String name, String label) {
        return new FieldDefinition(name, label, FieldType.DECIMAL, false, List.of());
    }

    public static FieldDefinition integer(String name, String label) {
        return new FieldDefinition(name, label, FieldType.INTEGER, false, List.of());
    }

    public static FieldDefinition bool(String name, String label) {
        return new FieldDefinition(name, label, FieldType.BOOLEAN, false, List.of());
    }

    public static FieldDefinition choice(String name, String label, String... allowedValues) {
        if (allowedValues.length == 0) {
            throw new IllegalArgumentException("choice field " + name + " needs at least one allowed value");
        }
        return new FieldDefinition(name, label, FieldType.CHOICE, false, List.of(allowedValues));
    }

    public FieldDefinition asRequired() {
        return new FieldDefinition(name, label, type, true, allowedValues);
    }

    public String serialize(Object value) {
        return type.serialize(value, allowedValues);
    }

    public boolean isUnset(String canonical) {
        return type.isUnset(canonical);
    }
}
