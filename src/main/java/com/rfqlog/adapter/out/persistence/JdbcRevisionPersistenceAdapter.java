package com.rfqlog.adapter.out.persistence;

import com.rfqlog.application.port.out.RevisionRepository;
import com.rfqlog.application.service.SnapshotValidator;
import com.rfqlog.domain.exception.PersistenceException;
import com.rfqlog.domain.exception.ValidationException;
import com.rfqlog.domain.model.ChangeKind;
import com.rfqlog.domain.model.ChangeRecord;
import io.vertx.core.Future;
import io.vertx.jdbcclient.JDBCPool;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.SqlConnection;
import io.vertx.sqlclient.Tuple;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * JDBC implementation of RevisionRepository.
 * CHANGED_AT is stored as a UTC timestamp with millisecond precision.
 *
 * <p>Every batch first locks the entity's row in REVISION_LOG_HEAD, so batches of one entity are
 * written one after the other while other entities are not blocked.
 */
@Slf4j
@RequiredArgsConstructor
public class JdbcRevisionPersistenceAdapter implements RevisionRepository {

    private static final String INSERT_SQL = "INSERT INTO REVISION_LOG " +
            "(ENTITY_ID, FIELD_NAME, OLD_VALUE, NEW_VALUE, CHANGE_KIND, CHANGED_AT, CHANGED_BY, NOTES) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?)";

    private static final String LOCK_HEAD_SQL = "SELECT LAST_CHANGED_AT FROM REVISION_LOG_HEAD " +
            "WHERE ENTITY_ID = ? FOR UPDATE";

    private static final String CREATE_HEAD_SQL = "INSERT INTO REVISION_LOG_HEAD (ENTITY_ID, LAST_CHANGED_AT) " +
            "SELECT CAST(? AS BIGINT), MAX(CHANGED_AT) FROM REVISION_LOG WHERE ENTITY_ID = ?";

    private static final String UPDATE_HEAD_SQL = "UPDATE REVISION_LOG_HEAD SET LAST_CHANGED_AT = ? WHERE ENTITY_ID = ?";

    private static final String LIST_SQL = "SELECT ID, ENTITY_ID, FIELD_NAME, OLD_VALUE, NEW_VALUE, CHANGE_KIND, " +
            "CHANGED_AT, CHANGED_BY, NOTES FROM REVISION_LOG " +
            "WHERE ENTITY_ID = ? ORDER BY CHANGED_AT, ID";

    private final JDBCPool jdbcPool;

    @Override
    public Future<List<ChangeRecord>> append(Long entityId, List<ChangeRecord> drafts, String actor,
                                             Instant timestamp, SqlConnection connection) {
        try {
            validateAppend(entityId, drafts, actor, timestamp);
        } catch (ValidationException e) {
            return Future.failedFuture(e);
        }
        if (drafts.isEmpty()) {
            return Future.succeededFuture(Collections.emptyList());
        }

        return lockHead(entityId, connection)
                .compose(latest -> insertAll(entityId, drafts, actor, timestamp, latest, connection))
                .compose(records -> updateHead(entityId, records, connection))
                .onSuccess(records -> log.debug("Appended {} change(s) for entity {}", records.size(), entityId))
                .recover(error -> {
                    log.error("Failed to append changes for entity {}: {}", entityId, error.getMessage());
                    return Future.failedFuture(PersistenceException.wrap("Failed to append changes for entity " + entityId, error));
                });
    }

    @Override
    public Future<List<ChangeRecord>> append(Long entityId, List<ChangeRecord> drafts, String actor, Instant timestamp) {
        return jdbcPool.withTransaction(connection -> append(entityId, drafts, actor, timestamp, connection));
    }

    @Override
    public Future<List<ChangeRecord>> listFor(Long entityId) {
        if (entityId == null) {
            return Future.failedFuture(new ValidationException("entityId is required"));
        }

        return jdbcPool.preparedQuery(LIST_SQL)
                .execute(Tuple.of(entityId))
                .map(rows -> {
                    List<ChangeRecord> records = new ArrayList<>();
                    rows.forEach(row -> records.add(toChangeRecord(row)));
                    return Collections.unmodifiableList(records);
                })
                .recover(error -> {
                    log.error("Failed to list changes for entity {}: {}", entityId, error.getMessage());
                    return Future.failedFuture(PersistenceException.wrap("Failed to list changes for entity " + entityId, error));
                });
    }

    private void validateAppend(Long entityId, List<ChangeRecord> drafts, String actor, Instant timestamp) {
        List<String> errors = new ArrayList<>();
        if (entityId == null) {
            errors.add("entityId is required");
        }
        if (drafts == null) {
            errors.add("changes are required");
        }
        if (actor == null || actor.isBlank()) {
            errors.add("actor is required");
        } else if (actor.length() > SnapshotValidator.MAX_ACTOR_LENGTH) {
            errors.add("actor exceeds maximum length of " + SnapshotValidator.MAX_ACTOR_LENGTH + " characters");
        }
        if (timestamp == null) {
            errors.add("timestamp is required");
        }
        if (drafts != null) {
            for (ChangeRecord draft : drafts) {
                if (draft.isPersisted()) {
                    errors.add("change " + draft.getId() + " is already persisted");
                } else if (draft.getFieldName() == null || draft.getChangeKind() == null) {
                    errors.add("change is missing field name or kind");
                } else if (draft.getNewValue() == null || draft.getNewValue().equals(draft.getOldValue())) {
                    errors.add("change of " + draft.getFieldName() + " does not change the value");
                } else if (exceedsColumn(draft.getOldValue()) || exceedsColumn(draft.getNewValue()) || exceedsColumn(draft.getNotes())) {
                    errors.add("change of " + draft.getFieldName() + " exceeds maximum length of "
                            + SnapshotValidator.MAX_VALUE_LENGTH + " characters");
                }
            }
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
    }

    private static boolean exceedsColumn(String value) {
        return value != null && value.length() > SnapshotValidator.MAX_VALUE_LENGTH;
    }

    // Locks the entity's head row and yields the latest CHANGED_AT logged for it, null if none
    private Future<Instant> lockHead(Long entityId, SqlConnection connection) {
        return connection.preparedQuery(LOCK_HEAD_SQL)
                .execute(Tuple.of(entityId))
                .compose(rows -> {
                    if (rows.size() > 0) {
                        return Future.succeededFuture(toInstant(rows.iterator().next().getValue("LAST_CHANGED_AT")));
                    }
                    return createHead(entityId, connection);
                });
    }

    // A concurrent first batch makes the insert wait and then fail on the key; its row is locked instead
    private Future<Instant> createHead(Long entityId, SqlConnection connection) {
        return connection.preparedQuery(CREATE_HEAD_SQL)
                .execute(Tuple.of(entityId, entityId))
                .compose(
                        created -> relockHead(entityId, connection, null),
                        error -> {
                            log.debug("Head of entity {} created by another batch: {}", entityId, error.getMessage());
                            return relockHead(entityId, connection, error);
                        });
    }

    private Future<Instant> relockHead(Long entityId, SqlConnection connection, Throwable createError) {
        return connection.preparedQuery(LOCK_HEAD_SQL)
                .execute(Tuple.of(entityId))
                .compose(rows -> {
                    if (rows.size() == 0) {
                        return Future.failedFuture(new PersistenceException("No revision head for entity " + entityId, createError));
                    }
                    return Future.succeededFuture(toInstant(rows.iterator().next().getValue("LAST_CHANGED_AT")));
                });
    }

    private Future<List<ChangeRecord>> updateHead(Long entityId, List<ChangeRecord> records, SqlConnection connection) {
        Instant last = records.get(records.size() - 1).getChangedAt();
        return connection.preparedQuery(UPDATE_HEAD_SQL)
                .execute(Tuple.of(LocalDateTime.ofInstant(last, ZoneOffset.UTC), entityId))
                .map(rows -> records);
    }

    private Future<List<ChangeRecord>> insertAll(Long entityId, List<ChangeRecord> drafts, String actor,
                                                 Instant timestamp, Instant latest, SqlConnection connection) {
        List<ChangeRecord> persisted = new ArrayList<>();
        Future<Instant> chain = Future.succeededFuture(latest);

        // Sequential inserts keep ids in batch order
        for (ChangeRecord draft : drafts) {
            chain = chain.compose(previous -> {
                Instant changedAt = notBefore(draft.getChangedAt() != null ? draft.getChangedAt() : timestamp, previous);
                ChangeRecord record = draft.toBuilder()
                        .entityId(entityId)
                        .changedAt(changedAt)
                        .changedBy(actor)
                        .build();
                return insert(record, connection)
                        .map(id -> {
                            persisted.add(record.toBuilder().id(id).build());
                            return changedAt;
                        });
            });
        }

        return chain.map(v -> Collections.unmodifiableList(persisted));
    }

    private Future<Long> insert(ChangeRecord record, SqlConnection connection) {
        Tuple params = Tuple.of(
                record.getEntityId(),
                record.getFieldName(),
                record.getOldValue(),
                record.getNewValue(),
                record.getChangeKind().getValue(),
                LocalDateTime.ofInstant(record.getChangedAt(), ZoneOffset.UTC),
                record.getChangedBy(),
                record.getNotes()
        );

        return connection.preparedQuery(INSERT_SQL)
                .execute(params)
                .compose(rows -> {
                    Row keys = rows.property(JDBCPool.GENERATED_KEYS);
                    if (keys == null || keys.getLong(0) == null) {
                        return Future.failedFuture(new PersistenceException("No id generated for change of " + record.getFieldName(), null));
                    }
                    return Future.succeededFuture(keys.getLong(0));
                });
    }

    private static Instant notBefore(Instant candidate, Instant floor) {
        Instant truncated = candidate.truncatedTo(ChronoUnit.MILLIS);
        return floor != null && truncated.isBefore(floor) ? floor : truncated;
    }

    private ChangeRecord toChangeRecord(Row row) {
        return ChangeRecord.builder()
                .id(row.getLong("ID"))
                .entityId(row.getLong("ENTITY_ID"))
                .fieldName(row.getString("FIELD_NAME"))
                .oldValue(row.getString("OLD_VALUE"))
                .newValue(row.getString("NEW_VALUE"))
                .changeKind(ChangeKind.fromValue(row.getString("CHANGE_KIND")))
                .changedAt(toInstant(row.getValue("CHANGED_AT")))
                .changedBy(row.getString("CHANGED_BY"))
                .notes(row.getString("NOTES"))
                .build();
    }

    static Instant toInstant(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).toInstant(ZoneOffset.UTC);
        }
        if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).toInstant();
        }
        if (value instanceof Timestamp) {
            return ((Timestamp) value).toLocalDateTime().toInstant(ZoneOffset.UTC);
        }
        if (value instanceof Instant) {
            return (Instant) value;
        }
        throw new IllegalStateException("Unexpected timestamp value: " + value.getClass().getName());
    }
}
