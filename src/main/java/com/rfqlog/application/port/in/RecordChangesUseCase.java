package com.rfqlog.application.port.in;

import com.rfqlog.application.port.out.EntityWriter;
import com.rfqlog.domain.model.ChangeRecord;
import com.rfqlog.domain.model.FieldSchema;
import io.vertx.core.Future;

import java.util.List;
import java.util.Map;

/**
 * Input port - save hook invoked whenever a business record is created or edited
 */
public interface RecordChangesUseCase {

    /**
     * Save a record and log its field changes in one transaction
     * @param command Snapshots, schema and actor of the save
     * @param writer Persists the business record itself on the transaction's connection
     * @return Future with the entity id and the change records that were persisted
     */
    Future<SaveResult> recordChanges(RecordChangesCommand command, EntityWriter writer);

    /**
     * Command object for a save
     * @param schema Tracked fields
     * @param oldSnapshot Field values before the save, null for a new record
     * @param newSnapshot Field values being saved
     * @param actor User or session responsible
     * @param notes Optional annotation copied onto every logged change
     */
    record RecordChangesCommand(
            FieldSchema schema,
            Map<String, ?> oldSnapshot,
            Map<String, ?> newSnapshot,
            String actor,
            String notes
    ) {
        public boolean isCreation() {
            return oldSnapshot == null;
        }
    }

    /**
     * Outcome of a successful save
     */
    record SaveResult(Long entityId, List<ChangeRecord> changes) {

        public boolean hasChanges() {
            return !changes.isEmpty();
        }
    }
}
