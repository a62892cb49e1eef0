package io.taskqueue.jdbc.store;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PgmqMessageStoreTest {

    @Test
    void visibilityTimeoutRoundsUpToWholeSeconds() {
        assertEquals(0, PgmqMessageStore.toSeconds(Duration.ZERO));
        assertEquals(30, PgmqMessageStore.toSeconds(Duration.ofSeconds(30)));
        assertEquals(1, PgmqMessageStore.toSeconds(Duration.ofMillis(1)));
        assertEquals(3, PgmqMessageStore.toSeconds(Duration.ofMillis(2500)));
    }

    @Test
    void requiresProbingBeforeSelection() {
        PgmqMessageStore store = new PgmqMessageStore();

        assertTrue(store.probeRequired());
        assertEquals(List.of("jdbc:postgresql:"), store.jdbcUrlPrefixes());
        assertInstanceOf(PgmqMessageStore.class, store.withTables("ignored", Clock.systemUTC()));
    }

    @Test
    void peekRejectsMixedCaseQueueBeforeQueryingTable() {
        PgmqMessageStore store = new PgmqMessageStore();

        assertThrows(IllegalArgumentException.class, () -> store.peek(null, "Jobs", 5));
    }
}
