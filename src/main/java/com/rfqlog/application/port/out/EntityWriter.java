package com.rfqlog.application.port.out;

import io.vertx.core.Future;
import io.vertx.sqlclient.SqlConnection;

/**
 * Output port - persists the audited business record itself.
 * Implemented by the owner of the record (the part dialog in the desktop client).
 */
@FunctionalInterface
public interface EntityWriter {

    /**
     * Insert or update the record on the given connection
     * @param connection Connection of the transaction that also appends the change log
     * @return Future with the record's id
     */
    Future<Long> save(SqlConnection connection);

    /**
     * Writer for a record that is already stored under a known id
     */
    static EntityWriter existing(Long entityId) {
        return connection -> Future.succeededFuture(entityId);
    }
}
