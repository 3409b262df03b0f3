package com.rfqlog.domain.model;

/**
 * Kind of a logged field change
 */
public enum ChangeKind {
    CREATED("CREATED"),   // field set for the first time, no prior value
    UPDATED("UPDATED");   // field changed from one present value to another

    private final String value;

    ChangeKind(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static ChangeKind fromValue(String value) {
        for (ChangeKind kind : values()) {
            if (kind.value.equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown change kind: " + value);
    }
}
