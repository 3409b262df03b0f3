package com.rfqlog.application.port.out;

import com.rfqlog.domain.model.ChangeRecord;
import io.vertx.core.Future;
import io.vertx.sqlclient.SqlConnection;

import java.time.Instant;
import java.util.List;

/**
 * Output port - append-only revision log.
 * Entries are never updated or deleted.
 */
public interface RevisionRepository {

    /**
     * Append a batch of changes within the caller's transaction
     * @param entityId Owning record id
     * @param drafts Changes in the order they should be logged
     * @param actor User or session responsible, must not be blank
     * @param timestamp Time of the change, used for drafts without their own timestamp
     * @param connection Connection of the enclosing transaction
     * @return Future with the persisted records (ids and timestamps assigned)
     */
    Future<List<ChangeRecord>> append(Long entityId, List<ChangeRecord> drafts, String actor,
                                      Instant timestamp, SqlConnection connection);

    /**
     * Append a batch of changes in a transaction of its own; all or nothing
     */
    Future<List<ChangeRecord>> append(Long entityId, List<ChangeRecord> drafts, String actor, Instant timestamp);

    /**
     * All changes of an entity ordered by (changedAt, id)
     * @param entityId Owning record id
     * @return Future with the ordered changes, empty for an entity without history
     */
    Future<List<ChangeRecord>> listFor(Long entityId);
}
