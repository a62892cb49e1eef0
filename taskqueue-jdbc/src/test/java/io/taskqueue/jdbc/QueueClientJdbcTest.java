package io.taskqueue.jdbc;

import io.taskqueue.QueueClient;
import io.taskqueue.QueueConfig;
import io.taskqueue.jdbc.store.H2MessageStore;
import io.taskqueue.model.QueueMessage;
import io.taskqueue.retry.ProcessingResult;
import io.taskqueue.retry.RetryOrchestrator;
import io.taskqueue.retry.TaskHandler;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * End-to-end behaviour of {@link QueueClient} and {@link RetryOrchestrator} over H2.
 */
class QueueClientJdbcTest {

    private JdbcDataSource dataSource;
    private MutableClock clock;
    private QueueClient client;

    @BeforeEach
    void setUp() throws SQLException {
        dataSource = TestDatabases.h2();
        clock = new MutableClock(Instant.parse("2024-03-01T12:00:00Z"));
        client = QueueClient.builder()
                .connectionProvider(new DataSourceConnectionProvider(dataSource))
                .messageStore(new H2MessageStore("task_queue", clock))
                .config(QueueConfig.defaults())
                .build();
    }

    @Test
    void fiveMessagesComeBackInOrder() {
        for (int i = 1; i <= 5; i++) {
            client.enqueue("fifo", Map.of("seq", i));
        }

        for (int i = 1; i <= 5; i++) {
            QueueMessage message = client.dequeue("fifo").orElseThrow();
            assertEquals(i, message.payload().get("seq"));
            assertTrue(client.archive("fifo", message.msgId()));
        }
        assertTrue(client.dequeue("fifo").isEmpty());
    }

    @Test
    void unarchivedMessageReappearsAfterLease() {
        long msgId = client.enqueue("jobs", Map.of("task", "resize"));

        assertEquals(msgId, client.dequeue("jobs", 10L).orElseThrow().msgId());
        assertTrue(client.dequeue("jobs").isEmpty());

        clock.advance(Duration.ofSeconds(10));
        QueueMessage again = client.dequeue("jobs").orElseThrow();
        assertEquals(msgId, again.msgId());
        assertEquals(2, again.readCount());
    }

    @Test
    void sendEmailEndsInDeadLetterQueueAfterThreeRetries() {
        client.enqueue("user_tasks", Map.of("task", "send_email", "user_id", 42));
        RetryOrchestrator orchestrator = new RetryOrchestrator(client);
        TaskHandler<Void> handler = payload -> {
            throw new IllegalStateException("SMTP unavailable");
        };

        ProcessingResult<Void> last = null;
        for (int attempt = 0; attempt < 4; attempt++) {
            QueueMessage message = client.dequeue("user_tasks").orElseThrow();
            last = orchestrator.processWithRetry("user_tasks", message, handler);
        }

        assertInstanceOf(ProcessingResult.DeadLettered.class, last);
        assertTrue(client.dequeue("user_tasks").isEmpty());
        QueueMessage dead = client.dequeue("user_tasks_dlq").orElseThrow();
        assertEquals("send_email", dead.payload().get("task"));
        assertEquals(42, dead.payload().get("user_id"));
        assertEquals(3, dead.retryCount());
        assertEquals("SMTP unavailable", dead.payload().get("error"));
        assertEquals("user_tasks", dead.payload().get("original_queue"));
    }

    @Test
    void successfulTaskIsArchived() {
        client.enqueue("jobs", Map.of("n", 2));
        QueueMessage message = client.dequeue("jobs").orElseThrow();

        ProcessingResult<Integer> result = new RetryOrchestrator(client).processWithRetry("jobs", message,
                payload -> ((Number) payload.get("n")).intValue() + 1);

        assertEquals(3, result.result().orElseThrow());
        assertEquals(0L, client.queueLength("jobs"));
        clock.advance(Duration.ofMinutes(5));
        assertTrue(client.dequeue("jobs").isEmpty());
    }

    @Test
    void deleteQueueReportsExistence() {
        client.enqueue("jobs", Map.of());

        assertTrue(client.deleteQueue("jobs"));
        assertFalse(client.deleteQueue("jobs"));
        assertFalse(client.archive("jobs", 1L));
    }
}
