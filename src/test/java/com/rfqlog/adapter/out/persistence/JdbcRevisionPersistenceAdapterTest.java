package com.rfqlog.adapter.out.persistence;

import com.rfqlog.domain.exception.PersistenceException;
import com.rfqlog.domain.exception.ValidationException;
import com.rfqlog.domain.model.ChangeKind;
import com.rfqlog.domain.model.ChangeRecord;
import com.rfqlog.support.TestDatabase;
import io.vertx.core.Future;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static com.rfqlog.support.TestDatabase.await;
import static com.rfqlog.support.TestDatabase.awaitFailure;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for JdbcRevisionPersistenceAdapter against an in-memory H2 database
 */
class JdbcRevisionPersistenceAdapterTest {

    private static final Instant T0 = Instant.parse("2026-01-26T09:15:00Z");

    private TestDatabase database;
    private JdbcRevisionPersistenceAdapter repository;

    @BeforeEach
    void setUp() throws Exception {
        database = TestDatabase.create();
        repository = new JdbcRevisionPersistenceAdapter(database.pool());
    }

    @AfterEach
    void tearDown() throws Exception {
        database.close();
    }

    @Test
    void append_shouldAssignIdsTimestampsAndActor() throws Exception {
        // When
        List<ChangeRecord> persisted = await(repository.append(1L,
                List.of(created("name", "Widget"), created("volume_cm3", "50.0")), "user1", T0));

        // Then
        assertEquals(2, persisted.size());
        persisted.forEach(record -> {
            assertNotNull(record.getId());
            assertEquals(1L, record.getEntityId());
            assertEquals(T0, record.getChangedAt());
            assertEquals("user1", record.getChangedBy());
        });
        assertTrue(persisted.get(0).getId() < persisted.get(1).getId());
    }

    @Test
    void listFor_shouldReturnWhatWasAppended() throws Exception {
        ChangeRecord update = ChangeRecord.builder()
                .fieldName("weight_g")
                .oldValue("100.0")
                .newValue("120.5")
                .changeKind(ChangeKind.UPDATED)
                .notes("New CAD revision")
                .build();
        List<ChangeRecord> persisted = await(repository.append(1L, List.of(created("name", "Widget"), update), "user1", T0));

        List<ChangeRecord> listed = await(repository.listFor(1L));

        assertEquals(persisted, listed);
        assertNull(listed.get(0).getOldValue());
        assertEquals(ChangeKind.CREATED, listed.get(0).getChangeKind());
        assertEquals("New CAD revision", listed.get(1).getNotes());
    }

    @Test
    void listFor_shouldOrderByTimestampThenId() throws Exception {
        // Given - batches with equal and increasing timestamps
        List<Long> appendOrder = new ArrayList<>();
        appendOrder.addAll(ids(await(repository.append(5L, List.of(created("name", "A"), created("notes", "x")), "user1", T0))));
        appendOrder.addAll(ids(await(repository.append(5L, List.of(updated("name", "A", "B")), "user2", T0))));
        appendOrder.addAll(ids(await(repository.append(5L, List.of(updated("name", "B", "C")), "user1", T0.plusSeconds(1)))));
        await(repository.append(6L, List.of(created("name", "Other")), "user1", T0.minusSeconds(60)));

        // When
        List<ChangeRecord> listed = await(repository.listFor(5L));

        // Then
        assertEquals(appendOrder, ids(listed));
        for (int i = 1; i < listed.size(); i++) {
            ChangeRecord previous = listed.get(i - 1);
            ChangeRecord current = listed.get(i);
            assertFalse(current.getChangedAt().isBefore(previous.getChangedAt()));
            if (current.getChangedAt().equals(previous.getChangedAt())) {
                assertTrue(previous.getId() < current.getId());
            }
        }
    }

    @Test
    void append_concurrentBatchesOfOneEntityDoNotInterleave() throws Exception {
        for (int round = 0; round < 5; round++) {
            long entityId = 100L + round;
            if (round % 2 == 1) {
                // Entity with history already logged
                await(repository.append(entityId, List.of(created("name", "Widget")), "setup", T0.minusSeconds(60)));
            }

            // When - two batches with the same timestamp race for the entity
            Future<List<ChangeRecord>> first = repository.append(entityId, batch("a", 30), "userA", T0);
            Future<List<ChangeRecord>> second = repository.append(entityId, batch("b", 30), "userB", T0);
            await(Future.all(first, second));

            // Then - each batch forms one contiguous run
            List<String> actors = await(repository.listFor(entityId)).stream()
                    .map(ChangeRecord::getChangedBy)
                    .filter(actor -> !"setup".equals(actor))
                    .collect(Collectors.toList());
            assertEquals(60, actors.size());
            int switches = 0;
            for (int i = 1; i < actors.size(); i++) {
                if (!actors.get(i).equals(actors.get(i - 1))) {
                    switches++;
                }
            }
            assertEquals(1, switches, "Batches interleaved in round " + round + ": " + actors);
        }
    }

    @Test
    void append_batchesOfDifferentEntitiesRunSideBySide() throws Exception {
        Future<List<ChangeRecord>> first = repository.append(201L, batch("a", 10), "userA", T0);
        Future<List<ChangeRecord>> second = repository.append(202L, batch("b", 10), "userB", T0);
        await(Future.all(first, second));

        assertEquals(10, await(repository.listFor(201L)).size());
        assertEquals(10, await(repository.listFor(202L)).size());
    }

    @Test
    void append_shouldNotGoBackInTimeForAnEntity() throws Exception {
        await(repository.append(3L, List.of(created("name", "A")), "user1", T0.plusSeconds(10)));

        // Clock stepped back
        List<ChangeRecord> later = await(repository.append(3L, List.of(updated("name", "A", "B")), "user1", T0));

        assertEquals(T0.plusSeconds(10), later.get(0).getChangedAt());
        List<ChangeRecord> listed = await(repository.listFor(3L));
        assertEquals("B", listed.get(1).getNewValue());
    }

    @Test
    void append_shouldKeepPresetTimestamps() throws Exception {
        Instant preset = T0.minusSeconds(3600);
        ChangeRecord draft = created("name", "Widget").toBuilder().changedAt(preset).build();

        List<ChangeRecord> persisted = await(repository.append(4L, List.of(draft), "importer", T0));

        assertEquals(preset, persisted.get(0).getChangedAt());
    }

    @Test
    void append_shouldTruncateToMilliseconds() throws Exception {
        Instant precise = Instant.parse("2026-01-26T09:15:00.123456789Z");

        List<ChangeRecord> persisted = await(repository.append(4L, List.of(created("name", "Widget")), "user1", precise));

        assertEquals(Instant.parse("2026-01-26T09:15:00.123Z"), persisted.get(0).getChangedAt());
        assertEquals(persisted.get(0).getChangedAt(), await(repository.listFor(4L)).get(0).getChangedAt());
    }

    @Test
    void append_emptyBatchWritesNothing() throws Exception {
        assertTrue(await(repository.append(1L, List.of(), "user1", T0)).isEmpty());
        assertEquals(0, database.count("REVISION_LOG"));
    }

    @Test
    void listFor_unknownEntityIsEmpty() throws Exception {
        assertTrue(await(repository.listFor(999L)).isEmpty());
    }

    @Test
    void append_shouldRejectBlankActor() throws Exception {
        Throwable error = awaitFailure(repository.append(1L, List.of(created("name", "Widget")), " ", T0));

        assertInstanceOf(ValidationException.class, error);
        assertEquals(0, database.count("REVISION_LOG"));
    }

    @Test
    void append_shouldRejectOversizedActorAndNotes() throws Exception {
        Throwable actorError = awaitFailure(repository.append(1L, List.of(created("name", "Widget")), "u".repeat(101), T0));
        ChangeRecord annotated = created("name", "Widget").toBuilder().notes("n".repeat(4001)).build();
        Throwable notesError = awaitFailure(repository.append(1L, List.of(annotated), "user1", T0));

        assertInstanceOf(ValidationException.class, actorError);
        assertInstanceOf(ValidationException.class, notesError);
        assertEquals(0, database.count("REVISION_LOG"));
    }

    @Test
    void append_shouldRejectNoOpChanges() throws Exception {
        Throwable error = awaitFailure(repository.append(1L, List.of(updated("name", "A", "A")), "user1", T0));

        assertInstanceOf(ValidationException.class, error);
    }

    @Test
    void append_shouldRejectAlreadyPersistedRecords() throws Exception {
        ChangeRecord persisted = await(repository.append(1L, List.of(created("name", "A")), "user1", T0)).get(0);

        Throwable error = awaitFailure(repository.append(1L, List.of(persisted), "user1", T0));

        assertInstanceOf(ValidationException.class, error);
        assertEquals(1, database.count("REVISION_LOG"));
    }

    @Test
    void append_isAllOrNothing() throws Exception {
        // Second record violates the FIELD_NAME column width
        List<ChangeRecord> batch = List.of(created("name", "Widget"), created("x".repeat(150), "value"));

        Throwable error = awaitFailure(repository.append(1L, batch, "user1", T0));

        assertInstanceOf(PersistenceException.class, error);
        assertEquals(0, database.count("REVISION_LOG"));
    }

    @Test
    void storageFailureIsReported() throws Exception {
        database.execute("DROP TABLE REVISION_LOG");

        assertInstanceOf(PersistenceException.class, awaitFailure(repository.listFor(1L)));
        assertInstanceOf(PersistenceException.class,
                awaitFailure(repository.append(1L, List.of(created("name", "A")), "user1", T0)));
    }

    @Test
    void toInstant_acceptsDriverTimestampTypes() {
        Instant expected = Instant.parse("2026-01-26T09:15:00Z");

        assertEquals(expected, JdbcRevisionPersistenceAdapter.toInstant(LocalDateTime.of(2026, 1, 26, 9, 15)));
        assertEquals(expected, JdbcRevisionPersistenceAdapter.toInstant(
                java.sql.Timestamp.valueOf(LocalDateTime.of(2026, 1, 26, 9, 15))));
        assertNull(JdbcRevisionPersistenceAdapter.toInstant(null));
    }

    private static ChangeRecord created(String field, String value) {
        return ChangeRecord.builder()
                .fieldName(field)
                .newValue(value)
                .changeKind(ChangeKind.CREATED)
                .build();
    }

    private static ChangeRecord updated(String field, String oldValue, String newValue) {
        return ChangeRecord.builder()
                .fieldName(field)
                .oldValue(oldValue)
                .newValue(newValue)
                .changeKind(ChangeKind.UPDATED)
                .build();
    }

    private static List<ChangeRecord> batch(String prefix, int size) {
        List<ChangeRecord> drafts = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            drafts.add(created("field_" + prefix + i, "value " + i));
        }
        return drafts;
    }

    private static List<Long> ids(List<ChangeRecord> records) {
        return records.stream().map(ChangeRecord::getId).collect(Collectors.toList());
    }
}
