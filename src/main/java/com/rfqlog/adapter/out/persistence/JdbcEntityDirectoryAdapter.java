package com.rfqlog.adapter.out.persistence;

import com.rfqlog.application.port.out.EntityDirectory;
import com.rfqlog.domain.exception.PersistenceException;
import io.vertx.core.Future;
import io.vertx.sqlclient.SqlClient;
import io.vertx.sqlclient.Tuple;
import lombok.extern.slf4j.Slf4j;

import java.util.regex.Pattern;

/**
 * Checks entity existence against the table holding the audited records
 */
@Slf4j
public class JdbcEntityDirectoryAdapter implements EntityDirectory {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final SqlClient sqlClient;
    private final String sql;

    public JdbcEntityDirectoryAdapter(SqlClient sqlClient, String table, String idColumn) {
        if (table == null || !IDENTIFIER.matcher(table).matches()) {
            throw new IllegalArgumentException("Invalid table name: " + table);
        }
        if (idColumn == null || !IDENTIFIER.matcher(idColumn).matches()) {
            throw new IllegalArgumentException("Invalid id column: " + idColumn);
        }
        this.sqlClient = sqlClient;
        this.sql = "SELECT COUNT(*) AS CNT FROM " + table + " WHERE " + idColumn + " = ?";
    }

    @Override
    public Future<Boolean> exists(Long entityId) {
        return sqlClient.preparedQuery(sql)
                .execute(Tuple.of(entityId))
                .map(rows -> rows.iterator().next().getLong("CNT") > 0)
                .recover(error -> {
                    log.error("Failed to check existence of entity {}: {}", entityId, error.getMessage());
                    return Future.failedFuture(PersistenceException.wrap("Failed to check entity " + entityId, error));
                });
    }
}
