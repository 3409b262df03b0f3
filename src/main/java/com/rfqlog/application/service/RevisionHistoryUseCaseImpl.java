package com.rfqlog.application.service;

import com.rfqlog.application.port.in.RevisionHistoryUseCase;
import com.rfqlog.application.port.out.EntityDirectory;
import com.rfqlog.application.port.out.RevisionRepository;
import com.rfqlog.domain.exception.NotFoundException;
import com.rfqlog.domain.exception.ValidationException;
import com.rfqlog.domain.model.ChangeRecord;
import com.rfqlog.domain.model.RevisionTree;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Use case implementation for revision history queries.
 * Without an {@link EntityDirectory} an unknown entity simply has an empty history.
 */
@Slf4j
public class RevisionHistoryUseCaseImpl implements RevisionHistoryUseCase {

    private final RevisionRepository revisionRepository;
    private final RevisionTreeBuilder treeBuilder;
    private final EntityDirectory entityDirectory;

    public RevisionHistoryUseCaseImpl(
            RevisionRepository revisionRepository,
            RevisionTreeBuilder treeBuilder,
            EntityDirectory entityDirectory
    ) {
        this.revisionRepository = revisionRepository;
        this.treeBuilder = treeBuilder;
        this.entityDirectory = entityDirectory;
    }

    public RevisionHistoryUseCaseImpl(RevisionRepository revisionRepository, RevisionTreeBuilder treeBuilder) {
        this(revisionRepository, treeBuilder, null);
    }

    @Override
    public Future<List<ChangeRecord>> changesFor(Long entityId) {
        if (entityId == null) {
            return Future.failedFuture(new ValidationException("entityId is required"));
        }
        log.info("Querying revisions of entity {}", entityId);

        return checkExists(entityId)
                .compose(v -> revisionRepository.listFor(entityId))
                .onSuccess(changes -> log.debug("Entity {} has {} logged change(s)", entityId, changes.size()));
    }

    @Override
    public Future<RevisionTree> historyFor(Long entityId) {
        return changesFor(entityId).map(treeBuilder::build);
    }

    private Future<Void> checkExists(Long entityId) {
        if (entityDirectory == null) {
            return Future.succeededFuture();
        }
        return entityDirectory.exists(entityId)
                .compose(exists -> {
                    if (Boolean.TRUE.equals(exists)) {
                        return Future.succeededFuture();
                    }
                    log.warn("Revision history requested for unknown entity {}", entityId);
                    return Future.failedFuture(new NotFoundException(entityId));
                });
    }
}
