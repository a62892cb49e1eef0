package io.taskqueue.jdbc;

import io.taskqueue.QueueStoreException;
import io.taskqueue.jdbc.store.AbstractJdbcMessageStore;
import io.taskqueue.jdbc.store.H2MessageStore;
import io.taskqueue.model.StoredMessage;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.TimeZone;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class H2MessageStoreTest {

    private static final Instant START = Instant.parse("2024-03-01T12:00:00Z");

    private JdbcDataSource dataSource;
    private MutableClock clock;
    private AbstractJdbcMessageStore store;

    @BeforeEach
    void setUp() throws SQLException {
        dataSource = TestDatabases.h2();
        clock = new MutableClock(START);
        store = new H2MessageStore("task_queue", clock);
    }

    @Test
    void leaseExpiresAfterVisibilityTimeout() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            long msgId = store.send(conn, "emails", "{\"to\":\"a@example.com\"}");

            StoredMessage first = store.read(conn, "emails", Duration.ofSeconds(30)).orElseThrow();
            assertEquals(START, first.enqueuedAt());
            assertEquals(START.plusSeconds(30), first.visibleAt());

            clock.advance(Duration.ofSeconds(29));
            assertTrue(store.read(conn, "emails", Duration.ofSeconds(30)).isEmpty());

            clock.advance(Duration.ofSeconds(1));
            StoredMessage second = store.read(conn, "emails", Duration.ofSeconds(30)).orElseThrow();
            assertEquals(msgId, second.msgId());
            assertEquals(2, second.readCount());
        }
    }

    @Test
    void leaseHoldsAcrossDaylightSavingFallBack() throws SQLException {
        TimeZone previous = TimeZone.getDefault();
        TimeZone.setDefault(TimeZone.getTimeZone("America/New_York"));
        try {
            JdbcDataSource newYork = TestDatabases.h2();
            // 01:59:50 EDT, ten seconds before clocks fall back to 01:00 EST
            MutableClock fallBack = new MutableClock(Instant.parse("2024-11-03T05:59:50Z"));
            AbstractJdbcMessageStore dstStore = new H2MessageStore("task_queue", fallBack);
            try (Connection conn = newYork.getConnection()) {
                long msgId = dstStore.send(conn, "emails", "{}");
                StoredMessage leased = dstStore.read(conn, "emails", Duration.ofSeconds(30)).orElseThrow();
                assertEquals(Instant.parse("2024-11-03T06:00:20Z"), leased.visibleAt());

                fallBack.advance(Duration.ofSeconds(5));
                assertTrue(dstStore.read(conn, "emails", Duration.ofSeconds(30)).isEmpty());

                fallBack.advance(Duration.ofSeconds(25));
                assertEquals(msgId, dstStore.read(conn, "emails", Duration.ofSeconds(30)).orElseThrow().msgId());
            }
        } finally {
            TimeZone.setDefault(previous);
        }
    }

    @Test
    void archiveMovesRowToArchiveTable() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            long msgId = store.send(conn, "emails", "{}");
            clock.advance(Duration.ofMinutes(1));

            assertTrue(store.archive(conn, "emails", msgId));
            assertTrue(conn.getAutoCommit());
        }

        assertEquals(0L, TestDatabases.count(dataSource, "SELECT COUNT(*) FROM task_queue_message"));
        assertEquals(1L, TestDatabases.count(dataSource,
                "SELECT COUNT(*) FROM task_queue_archive WHERE queue_name='emails'"));
    }

    @Test
    void archiveWithWrongQueueLeavesMessage() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            long msgId = store.send(conn, "emails", "{}");

            assertFalse(store.archive(conn, "sms", msgId));
            assertEquals(1L, store.queueLength(conn, "emails"));
        }
    }

    @Test
    void dropQueueClearsMessagesArchiveAndRegistry() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            long archived = store.send(conn, "emails", "{}");
            store.send(conn, "emails", "{}");
            store.archive(conn, "emails", archived);
            store.send(conn, "emails_dlq", "{}");

            assertTrue(store.dropQueue(conn, "emails"));
        }

        assertEquals(0L, TestDatabases.count(dataSource,
                "SELECT COUNT(*) FROM task_queue_message WHERE queue_name='emails'"));
        assertEquals(0L, TestDatabases.count(dataSource, "SELECT COUNT(*) FROM task_queue_archive"));
        assertEquals(1L, TestDatabases.count(dataSource, "SELECT COUNT(*) FROM task_queue"));
        assertEquals(1L, TestDatabases.count(dataSource,
                "SELECT COUNT(*) FROM task_queue_message WHERE queue_name='emails_dlq'"));
    }

    @Test
    void sendRegistersQueueOnce() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            store.send(conn, "emails", "{}");
            store.send(conn, "emails", "{}");
        }

        assertEquals(1L, TestDatabases.count(dataSource, "SELECT COUNT(*) FROM task_queue"));
    }

    @Test
    void missingTablesSurfaceAsStoreException() throws SQLException {
        AbstractJdbcMessageStore misconfigured = store.withTables("no_such_table", clock);

        try (Connection conn = dataSource.getConnection()) {
            assertThrows(QueueStoreException.class, () -> misconfigured.send(conn, "emails", "{}"));
        }
    }

    @Test
    void invalidTablePrefixIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new H2MessageStore("task-queue", clock));
        assertThrows(NullPointerException.class, () -> new H2MessageStore("task_queue", null));
    }
}
