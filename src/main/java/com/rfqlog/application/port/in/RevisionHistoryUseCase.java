package com.rfqlog.application.port.in;

import com.rfqlog.domain.model.ChangeRecord;
import com.rfqlog.domain.model.RevisionTree;
import io.vertx.core.Future;

import java.util.List;

/**
 * Input port - history query behind the "Revisions" view of a record
 */
public interface RevisionHistoryUseCase {

    /**
     * All logged changes of an entity, oldest first
     * @param entityId Owning record id
     * @return Future with the ordered changes, empty when nothing was logged
     */
    Future<List<ChangeRecord>> changesFor(Long entityId);

    /**
     * Logged changes of an entity grouped by date and actor
     * @param entityId Owning record id
     * @return Future with the revision tree, empty when nothing was logged
     */
    Future<RevisionTree> historyFor(Long entityId);
}
