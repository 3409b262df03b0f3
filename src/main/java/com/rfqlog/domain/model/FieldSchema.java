package com.rfqlog.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered, immutable set of tracked fields.
 * The same schema drives change detection and the rendering of logged values.
 */
public final class FieldSchema {

    /** Rendering of an absent or empty value */
    public static final String NO_VALUE = "-";

    private final String name;
    private final Map<String, FieldDefinition> fields;

    private FieldSchema(String name, List<FieldDefinition> definitions) {
        Map<String, FieldDefinition> byName = new LinkedHashMap<>();
        for (FieldDefinition definition : definitions) {
            if (definition.getName() == null || definition.getName().isBlank()) {
                throw new IllegalArgumentException("Field name must not be blank in schema " + name);
            }
            if (byName.put(definition.getName(), definition) != null) {
                throw new IllegalArgumentException("Duplicate field " + definition.getName() + " in schema " + name);
            }
        }
        this.name = name;
        this.fields = Collections.unmodifiableMap(byName);
    }

    public static FieldSchema of(String name, FieldDefinition... definitions) {
        return new FieldSchema(name, List.of(definitions));
    }

    public String getName() {
        return name;
    }

    public List<FieldDefinition> getFields() {
        return List.copyOf(fields.values());
    }

    public Optional<FieldDefinition> field(String fieldName) {
        return Optional.ofNullable(fields.get(fieldName));
    }

    /**
     * Display label of a field, falling back to the raw name for fields no longer in the schema
     */
    public String labelOf(String fieldName) {
        return field(fieldName)
                .map(FieldDefinition::getLabel)
                .orElse(fieldName);
    }

    /**
     * Render a logged canonical value for display
     */
    public String display(String canonical) {
        return canonical == null || canonical.isEmpty() ? NO_VALUE : canonical;
    }

    @Override
    public String toString() {
        return "FieldSchema{" + name + ", fields=" + fields.keySet() + "}";
    }
}
