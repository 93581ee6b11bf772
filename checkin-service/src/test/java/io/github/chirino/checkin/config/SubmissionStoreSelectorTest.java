package io.github.chirino.checkin.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.chirino.checkin.model.ModerationStatus;
import io.github.chirino.checkin.model.NewSubmission;
import io.github.chirino.checkin.store.MeteredSubmissionStore;
import io.github.chirino.checkin.store.impl.InMemorySubmissionStore;
import io.github.chirino.checkin.store.impl.PostgresSubmissionStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class SubmissionStoreSelectorTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();

    private SubmissionStoreSelector createSelector(String type) {
        SubmissionStoreSelector selector = new SubmissionStoreSelector();
        selector.postgresStore = TestInstance.of(new PostgresSubmissionStore());
        selector.inMemoryStore = TestInstance.of(new InMemorySubmissionStore());
        selector.meterRegistry = registry;
        selector.datastoreType = type;
        return selector;
    }

    @Test
    void selects_postgres_store_for_postgres_datastore() {
        assertInstanceOf(
                PostgresSubmissionStore.class, createSelector("postgres").selectDelegate());
        assertInstanceOf(
                PostgresSubmissionStore.class, createSelector(" PostgreSQL ").selectDelegate());
    }

    @Test
    void selects_in_memory_store_for_memory_datastore() {
        assertInstanceOf(
                InMemorySubmissionStore.class, createSelector("memory").selectDelegate());
        assertInstanceOf(
                InMemorySubmissionStore.class, createSelector("in-memory").selectDelegate());
    }

    @Test
    void missing_type_defaults_to_postgres() {
        assertInstanceOf(PostgresSubmissionStore.class, createSelector(null).selectDelegate());
    }

    @Test
    void unknown_datastore_fails_fast() {
        SubmissionStoreSelector selector = createSelector("mongodb");
        assertThrows(IllegalStateException.class, selector::init);
    }

    @Test
    void selected_store_is_timed() {
        SubmissionStoreSelector selector = createSelector("memory");
        selector.init();

        assertInstanceOf(MeteredSubmissionStore.class, selector.getStore());
        selector.getStore()
                .create(
                        new NewSubmission(
                                "hello", List.of(), "203.0.113.9", "XX", null, "nick", null,
                                null, null, null, Instant.parse("2024-05-01T10:00:00Z"),
                                ModerationStatus.PENDING, null, null));
        selector.getStore().findById(1);

        assertNotNull(registry.find("checkin.store.operation").tag("operation", "create").timer());
        assertEquals(
                1,
                registry.find("checkin.store.operation")
                        .tag("operation", "findById")
                        .timer()
                        .count());
    }
}
