package com.rfqlog.adapter.in.web.history;

import com.rfqlog.adapter.in.web.history.RevisionHistoryResponse.ActorView;
import com.rfqlog.adapter.in.web.history.RevisionHistoryResponse.ChangeView;
import com.rfqlog.adapter.in.web.history.RevisionHistoryResponse.DateView;
import com.rfqlog.application.port.in.RevisionHistoryUseCase;
import com.rfqlog.domain.exception.NotFoundException;
import com.rfqlog.domain.exception.ValidationException;
import com.rfqlog.domain.model.ChangeRecord;
import com.rfqlog.domain.model.FieldSchema;
import com.rfqlog.domain.model.RevisionTree;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.extern.slf4j.Slf4j;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.stream.Collectors;

/**
 * HTTP handler for the revision history of a part
 * Handles GET /api/parts/:entityId/revisions
 */
@Slf4j
public class RevisionHistoryHandler implements Handler<RoutingContext> {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm:ss");

    private final RevisionHistoryUseCase historyUseCase;
    private final FieldSchema schema;
    private final ZoneId zone;

    public RevisionHistoryHandler(RevisionHistoryUseCase historyUseCase, FieldSchema schema, ZoneId zone) {
        this.historyUseCase = historyUseCase;
        this.schema = schema;
        this.zone = zone;
    }

    @Override
    public void handle(RoutingContext context) {
        String rawId = context.pathParam("entityId");

        Long entityId;
        try {
            entityId = Long.valueOf(rawId);
        } catch (NumberFormatException e) {
            log.warn("Invalid entity id in revision query: {}", rawId);
            sendError(context, 400, "Invalid entity id: " + rawId);
            return;
        }

        historyUseCase.historyFor(entityId)
                .onSuccess(tree -> {
                    log.info("Returning {} change(s) for entity {}", tree.totalChanges(), entityId);
                    context.response()
                            .setStatusCode(200)
                            .putHeader("Content-Type", "application/json")
                            .end(JsonObject.mapFrom(toResponse(entityId, tree)).encode());
                })
                .onFailure(error -> {
                    int statusCode = 500;
                    String message = "Failed to retrieve revision history";

                    if (error instanceof NotFoundException) {
                        statusCode = 404;
                        message = error.getMessage();
                    } else if (error instanceof ValidationException) {
                        statusCode = 400;
                        message = error.getMessage();
                    } else {
                        log.error("Failed to retrieve revisions of entity {}: {}", entityId, error.getMessage(), error);
                    }

                    sendError(context, statusCode, message);
                });
    }

    RevisionHistoryResponse toResponse(Long entityId, RevisionTree tree) {
        return RevisionHistoryResponse.builder()
                .status("success")
                .entityId(entityId)
                .timeZone(zone.getId())
                .totalChanges(tree.totalChanges())
                .dates(tree.getDates().stream()
                        .map(date -> DateView.builder()
                                .date(date.getDate().toString())
                                .actors(date.getActors().stream()
                                        .map(actor -> ActorView.builder()
                                                .actor(actor.getActor())
                                                .changes(actor.getChanges().stream()
                                                        .map(this::toChangeView)
                                                        .collect(Collectors.toList()))
                                                .build())
                                        .collect(Collectors.toList()))
                                .build())
                        .collect(Collectors.toList()))
                .build();
    }

    private ChangeView toChangeView(ChangeRecord change) {
        return ChangeView.builder()
                .id(change.getId())
                .field(change.getFieldName())
                .label(schema.labelOf(change.getFieldName()))
                .changeKind(change.getChangeKind().getValue())
                .oldValue(change.getOldValue())
                .newValue(change.getNewValue())
                .displayOld(schema.display(change.getOldValue()))
                .displayNew(schema.display(change.getNewValue()))
                .changedAt(change.getChangedAt().toString())
                .time(change.getChangedAt().atZone(zone).format(TIME_FORMAT))
                .notes(change.getNotes())
                .build();
    }

    private void sendError(RoutingContext context, int statusCode, String message) {
        RevisionHistoryResponse response = RevisionHistoryResponse.error(message);
        context.response()
                .setStatusCode(statusCode)
                .putHeader("Content-Type", "application/json")
                .end(JsonObject.mapFrom(response).encode());
    }
}
