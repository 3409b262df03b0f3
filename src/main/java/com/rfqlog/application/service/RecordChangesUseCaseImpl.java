package com.rfqlog.application.service;

import com.rfqlog.application.port.in.RecordChangesUseCase;
import com.rfqlog.application.port.out.EntityWriter;
import com.rfqlog.application.port.out.RevisionRepository;
import com.rfqlog.domain.exception.PersistenceException;
import com.rfqlog.domain.exception.ValidationException;
import com.rfqlog.domain.model.ChangeRecord;
import io.vertx.core.Future;
import io.vertx.jdbcclient.JDBCPool;
import io.vertx.sqlclient.SqlConnection;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Application service implementing the save hook.
 * The business record and its change log are written in one transaction.
 */
@Slf4j
public class RecordChangesUseCaseImpl implements RecordChangesUseCase {

    private final DiffEngine diffEngine;
    private final SnapshotValidator validator;
    private final RevisionRepository revisionRepository;
    private final JDBCPool jdbcPool;
    private final Clock clock;

    public RecordChangesUseCaseImpl(
            DiffEngine diffEngine,
            SnapshotValidator validator,
            RevisionRepository revisionRepository,
            JDBCPool jdbcPool,
            Clock clock
    ) {
        this.diffEngine = diffEngine;
        this.validator = validator;
        this.revisionRepository = revisionRepository;
        this.jdbcPool = jdbcPool;
        this.clock = clock;
    }

    @Override
    public Future<SaveResult> recordChanges(RecordChangesCommand command, EntityWriter writer) {
        if (command == null || writer == null) {
            return Future.failedFuture(new ValidationException("command and writer are required"));
        }
        log.info("Recording changes for {} record by {}", command.isCreation() ? "new" : "existing", command.actor());

        // Step 0: Validate and diff before touching the database
        List<ChangeRecord> drafts;
        try {
            List<String> errors = new ArrayList<>(validator.validateActor(command.actor()).errors());
            errors.addAll(validator.validateNotes(command.notes()).errors());
            if (!errors.isEmpty()) {
                throw new ValidationException(errors);
            }
            drafts = annotate(diffEngine.diff(command.schema(), command.oldSnapshot(), command.newSnapshot()), command.notes());
        } catch (ValidationException e) {
            log.warn("Save rejected: {}", e.getErrors());
            return Future.failedFuture(e);
        } catch (RuntimeException e) {
            log.error("Failed to diff record of {}: {}", command.actor(), e.getMessage(), e);
            return Future.failedFuture(e);
        }

        Instant timestamp = clock.instant();

        return jdbcPool.withTransaction(connection -> executeSaveSteps(connection, command, drafts, timestamp, writer))
                .recover(error -> Future.failedFuture(PersistenceException.wrap("Failed to save record", error)))
                .onSuccess(result -> log.info("Saved entity {} with {} logged change(s)", result.entityId(), result.changes().size()))
                .onFailure(error -> log.error("Failed to save record by {}: {}", command.actor(), error.getMessage()));
    }

    private Future<SaveResult> executeSaveSteps(
            SqlConnection connection,
            RecordChangesCommand command,
            List<ChangeRecord> drafts,
            Instant timestamp,
            EntityWriter writer
    ) {
        // Step 1: Save the business record
        return saveEntity(writer, connection)
                .compose(entityId -> {
                    if (entityId == null) {
                        return Future.failedFuture(new PersistenceException("Entity writer returned no id", null));
                    }
                    log.debug("Step 1: Saved entity {}", entityId);

                    // Step 2: Append the change log
                    return revisionRepository.append(entityId, drafts, command.actor(), timestamp, connection)
                            .map(changes -> new SaveResult(entityId, changes));
                });
    }

    private Future<Long> saveEntity(EntityWriter writer, SqlConnection connection) {
        try {
            return writer.save(connection);
        } catch (RuntimeException e) {
            return Future.failedFuture(e);
        }
    }

    private List<ChangeRecord> annotate(List<ChangeRecord> drafts, String notes) {
        if (notes == null || notes.isBlank()) {
            return drafts;
        }
        String trimmed = notes.strip();
        return drafts.stream()
                .map(draft -> draft.toBuilder().notes(trimmed).build())
                .collect(Collectors.toList());
    }
}
