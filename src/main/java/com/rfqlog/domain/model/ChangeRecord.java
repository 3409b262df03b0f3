package com.rfqlog.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * ChangeRecord - one logged field mutation of a business record
 * Immutable; never updated or deleted once persisted.
 *
 * <p>Records produced by the diff engine are drafts: {@code id}, {@code entityId},
 * {@code changedAt} and {@code changedBy} are filled in by the revision store.
 */
@Value
@Builder(toBuilder = true)
public class ChangeRecord {
    Long id;                // Assigned by the store
    Long entityId;          // Owning part
    String fieldName;       // Canonical name from the field schema
    String oldValue;        // Canonical form, null when absent (creation)
    String newValue;        // Canonical form
    ChangeKind changeKind;  // CREATED or UPDATED
    Instant changedAt;
    String changedBy;
    String notes;

    public boolean isPersisted() {
        return id != null;
    }

    public boolean isCreation() {
        return ChangeKind.CREATED.equals(changeKind);
    }
}
