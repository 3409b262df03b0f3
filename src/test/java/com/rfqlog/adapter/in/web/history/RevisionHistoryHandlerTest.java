package com.rfqlog.adapter.in.web.history;

import com.rfqlog.application.port.in.RevisionHistoryUseCase;
import com.rfqlog.application.service.RevisionTreeBuilder;
import com.rfqlog.domain.exception.NotFoundException;
import com.rfqlog.domain.exception.PersistenceException;
import com.rfqlog.domain.model.ChangeKind;
import com.rfqlog.domain.model.ChangeRecord;
import com.rfqlog.domain.model.PartFieldSchema;
import com.rfqlog.domain.model.RevisionTree;
import io.vertx.core.Future;
import io.vertx.core.http.HttpServerResponse;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.sql.SQLException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit test for RevisionHistoryHandler
 */
class RevisionHistoryHandlerTest {

    private static final ZoneId BERLIN = ZoneId.of("Europe/Berlin");

    @Mock
    private RevisionHistoryUseCase historyUseCase;

    @Mock
    private RoutingContext context;

    @Mock
    private HttpServerResponse response;

    private AutoCloseable mocks;
    private RevisionHistoryHandler handler;

    @BeforeEach
    void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        when(context.response()).thenReturn(response);
        when(response.setStatusCode(anyInt())).thenReturn(response);
        when(response.putHeader(anyString(), anyString())).thenReturn(response);
        handler = new RevisionHistoryHandler(historyUseCase, PartFieldSchema.PART, BERLIN);
    }

    @AfterEach
    void tearDown() throws Exception {
        mocks.close();
    }

    @Test
    void handle_shouldRenderTree() {
        // Given
        ChangeRecord creation = ChangeRecord.builder()
                .id(1L).entityId(7L)
                .fieldName("name").newValue("Widget")
                .changeKind(ChangeKind.CREATED)
                .changedAt(Instant.parse("2026-01-25T23:30:00Z"))
                .changedBy("user1")
                .build();
        ChangeRecord update = ChangeRecord.builder()
                .id(2L).entityId(7L)
                .fieldName("weight_g").oldValue("").newValue("120.5")
                .changeKind(ChangeKind.UPDATED)
                .changedAt(Instant.parse("2026-01-26T09:15:00Z"))
                .changedBy("user2")
                .notes("New CAD revision")
                .build();
        RevisionTree tree = new RevisionTreeBuilder(BERLIN).build(List.of(creation, update));
        when(context.pathParam("entityId")).thenReturn("7");
        when(historyUseCase.historyFor(7L)).thenReturn(Future.succeededFuture(tree));

        // When
        handler.handle(context);

        // Then
        verify(response).setStatusCode(200);
        JsonObject body = capturedBody();
        assertEquals("success", body.getString("status"));
        assertEquals(7L, body.getLong("entityId"));
        assertEquals("Europe/Berlin", body.getString("timeZone"));
        assertEquals(2, body.getInteger("totalChanges"));

        // 23:30 UTC is already the 26th in Berlin, so both land on one date
        JsonArray dates = body.getJsonArray("dates");
        assertEquals(1, dates.size());
        JsonObject date = dates.getJsonObject(0);
        assertEquals("2026-01-26", date.getString("date"));

        JsonArray actors = date.getJsonArray("actors");
        assertEquals("user1", actors.getJsonObject(0).getString("actor"));
        JsonObject created = actors.getJsonObject(0).getJsonArray("changes").getJsonObject(0);
        assertEquals("Name", created.getString("label"));
        assertEquals("CREATED", created.getString("changeKind"));
        assertFalse(created.containsKey("oldValue"));
        assertEquals("-", created.getString("displayOld"));
        assertEquals("00:30:00", created.getString("time"));

        JsonObject updated = actors.getJsonObject(1).getJsonArray("changes").getJsonObject(0);
        assertEquals("Weight (g)", updated.getString("label"));
        assertEquals("", updated.getString("oldValue"));
        assertEquals("-", updated.getString("displayOld"));
        assertEquals("120.5", updated.getString("displayNew"));
        assertEquals("2026-01-26T09:15:00Z", updated.getString("changedAt"));
        assertEquals("New CAD revision", updated.getString("notes"));
    }

    @Test
    void handle_shouldRenderEmptyHistory() {
        when(context.pathParam("entityId")).thenReturn("8");
        when(historyUseCase.historyFor(8L)).thenReturn(Future.succeededFuture(RevisionTree.empty()));

        handler.handle(context);

        verify(response).setStatusCode(200);
        JsonObject body = capturedBody();
        assertEquals(0, body.getInteger("totalChanges"));
        assertTrue(body.getJsonArray("dates").isEmpty());
    }

    @Test
    void handle_shouldRejectNonNumericId() {
        when(context.pathParam("entityId")).thenReturn("abc");

        handler.handle(context);

        verify(response).setStatusCode(400);
        verify(historyUseCase, never()).historyFor(any());
        assertEquals("error", capturedBody().getString("status"));
    }

    @Test
    void handle_shouldMapNotFoundTo404() {
        when(context.pathParam("entityId")).thenReturn("9");
        when(historyUseCase.historyFor(9L)).thenReturn(Future.failedFuture(new NotFoundException(9L)));

        handler.handle(context);

        verify(response).setStatusCode(404);
    }

    @Test
    void handle_shouldReportStorageFailure() {
        when(context.pathParam("entityId")).thenReturn("7");
        when(historyUseCase.historyFor(7L)).thenReturn(Future.failedFuture(
                new PersistenceException("Failed to list changes for entity 7", new SQLException("gone"))));

        handler.handle(context);

        verify(response).setStatusCode(500);
        JsonObject body = capturedBody();
        assertEquals("error", body.getString("status"));
        assertEquals("Failed to retrieve revision history", body.getString("message"));
        assertFalse(body.containsKey("dates"));
    }

    private JsonObject capturedBody() {
        ArgumentCaptor<String> captor = ArgumentCaptor.forClass(String.class);
        verify(response).end(captor.capture());
        return new JsonObject(captor.getValue());
    }
}
