package io.taskqueue;

import io.taskqueue.model.MessageFields;
import io.taskqueue.model.QueueMessage;
import io.taskqueue.model.StoredMessage;
import io.taskqueue.spi.ConnectionProvider;
import io.taskqueue.spi.MessageStore;
import io.taskqueue.spi.MetricsExporter;
import io.taskqueue.util.JsonCodec;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Main entry point for producing and consuming queued tasks.
 *
 * <p>Every operation borrows one connection from the {@link ConnectionProvider}
 * (in auto-commit mode) per store call and closes it before returning. Database
 * failures surface as {@link QueueStoreException}; a message or queue that does not
 * exist is reported as {@code false} instead.
 *
 * <p>{@link #retryMessage} and {@link #moveToDlq} send the new message <em>before</em>
 * archiving the original, so a failure between the two steps leaves a duplicate
 * rather than a lost message.
 *
 * <p>This class is thread-safe and holds no per-queue state.
 *
 * @see QueueClient.Builder
 * @see io.taskqueue.retry.RetryOrchestrator
 */
public final class QueueClient {
    private static final Logger logger = Logger.getLogger(QueueClient.class.getName());

    private final ConnectionProvider connectionProvider;
    private final MessageStore messageStore;
    private final JsonCodec jsonCodec;
    private final QueueConfig config;
    private final MetricsExporter metrics;

    private QueueClient(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.messageStore = Objects.requireNonNull(builder.messageStore, "messageStore");
        this.jsonCodec = builder.jsonCodec != null ? builder.jsonCodec : JsonCodec.getDefault();
        this.config = builder.config != null ? builder.config : QueueConfig.defaults();
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Sends a task to a queue, creating the queue if needed.
     *
     * <p>The payload is copied; {@code retry_count} is set to {@code 0} unless the caller
     * supplied one.
     *
     * @param queue   the queue name
     * @param payload the task payload
     * @return the new message id (always &gt; 0)
     * @throws IllegalArgumentException if the queue name is invalid, leaves no room for its
     *                                  dead-letter queue, or the payload carries a
     *                                  {@code retry_count} that is not an integer in
     *                                  {@code [0, Integer.MAX_VALUE]}
     * @throws QueueStoreException      if the store is unreachable
     */
    public long enqueue(String queue, Map<String, Object> payload) {
        QueueNames.validateSource(queue);
        Objects.requireNonNull(payload, "payload");
        Map<String, Object> message = new LinkedHashMap<>(payload);
        message.putIfAbsent(MessageFields.RETRY_COUNT, 0);
        Object retryCount = message.get(MessageFields.RETRY_COUNT);
        if (!MessageFields.isValidRetryCount(retryCount)) {
            throw new IllegalArgumentException(
                    MessageFields.RETRY_COUNT + " must be a non-negative int, got: " + retryCount);
        }
        long msgId = send(queue, message, "enqueue");
        metrics.incrementEnqueued();
        logger.log(Level.FINE, "Enqueued msgId={0} to queue={1}", new Object[]{msgId, queue});
        return msgId;
    }

    /**
     * Leases the oldest visible message using the configured default visibility timeout.
     *
     * @param queue the queue name
     * @return the leased message, or empty if none is visible or the queue does not exist
     * @see QueueConfig#visibilityTimeout()
     */
    public Optional<QueueMessage> dequeue(String queue) {
        return dequeue(queue, config.visibilityTimeout());
    }

    /**
     * Leases the oldest visible message for {@code visibilityTimeoutSeconds} seconds.
     *
     * @param queue                    the queue name
     * @param visibilityTimeoutSeconds lease duration in seconds, &ge; 0
     * @return the leased message, or empty if none is visible or the queue does not exist
     */
    public Optional<QueueMessage> dequeue(String queue, long visibilityTimeoutSeconds) {
        if (visibilityTimeoutSeconds < 0) {
            throw new IllegalArgumentException("visibilityTimeout must be >= 0, got: " + visibilityTimeoutSeconds);
        }
        return dequeue(queue, Duration.ofSeconds(visibilityTimeoutSeconds));
    }

    /**
     * Leases the oldest visible message.
     *
     * <p>Non-blocking: returns immediately when nothing is visible. While the lease is
     * held, no other reader can obtain the message. If the lease expires before the
     * message is archived, it becomes visible again.
     *
     * @param queue             the queue name
     * @param visibilityTimeout lease duration, &ge; 0
     * @return the leased message, or empty if none is visible or the queue does not exist
     * @throws QueueStoreException if the store is unreachable or the stored payload is not a JSON object
     */
    public Optional<QueueMessage> dequeue(String queue, Duration visibilityTimeout) {
        QueueNames.validate(queue);
        Objects.requireNonNull(visibilityTimeout, "visibilityTimeout");
        if (visibilityTimeout.isNegative()) {
            throw new IllegalArgumentException("visibilityTimeout must be >= 0, got: " + visibilityTimeout);
        }
        Optional<StoredMessage> stored = withConnection("dequeue from queue " + queue,
                conn -> messageStore.read(conn, queue, visibilityTimeout));
        if (stored.isEmpty()) {
            metrics.incrementDequeueEmpty();
            return Optional.empty();
        }
        QueueMessage message = toMessage(queue, stored.get());
        metrics.incrementDequeued();
        logger.log(Level.FINE, "Dequeued msgId={0} from queue={1} readCount={2}",
                new Object[]{message.msgId(), queue, message.readCount()});
        return Optional.of(message);
    }

    /**
     * Archives a message so it is never delivered again.
     *
     * @param queue the queue name
     * @param msgId the message id
     * @return {@code true} if archived, {@code false} if no such active message exists
     * @throws QueueStoreException if the store is unreachable
     */
    public boolean archive(String queue, long msgId) {
        QueueNames.validate(queue);
        boolean archived = withConnection("archive msgId=" + msgId + " in queue " + queue,
                conn -> messageStore.archive(conn, queue, msgId));
        if (archived) {
            metrics.incrementArchived();
            logger.log(Level.FINE, "Archived msgId={0} in queue={1}", new Object[]{msgId, queue});
        }
        return archived;
    }

    /**
     * Drops a queue with all of its messages. The queue's dead-letter queue is left untouched.
     *
     * @param queue the queue name
     * @return {@code true} if the queue existed
     * @throws QueueStoreException if the store is unreachable
     */
    public boolean deleteQueue(String queue) {
        QueueNames.validate(queue);
        boolean dropped = withConnection("delete queue " + queue,
                conn -> messageStore.dropQueue(conn, queue));
        if (dropped) {
            logger.log(Level.INFO, "Deleted queue {0}", queue);
        }
        return dropped;
    }

    /**
     * Re-enqueues a message with its retry counter incremented, then archives the original.
     *
     * @param queue   the queue name
     * @param msgId   id of the message being retried
     * @param payload the payload of the message being retried
     * @return id of the new message
     * @throws QueueStoreException if the store is unreachable
     */
    public long retryMessage(String queue, long msgId, Map<String, Object> payload) {
        QueueNames.validate(queue);
        Objects.requireNonNull(payload, "payload");
        int retryCount = MessageFields.retryCount(payload) + 1;
        Map<String, Object> message = new LinkedHashMap<>(payload);
        message.put(MessageFields.RETRY_COUNT, retryCount);

        long newMsgId = send(queue, message, "retry msgId=" + msgId);
        archiveReplaced(queue, msgId);
        metrics.incrementRetried();
        logger.log(Level.INFO, "Retrying msgId={0} in queue={1} as msgId={2} (retry {3})",
                new Object[]{msgId, queue, newMsgId, retryCount});
        return newMsgId;
    }

    /**
     * Promotes a message to the queue's dead-letter queue ({@code <queue>_dlq}), then
     * archives the original.
     *
     * <p>The dead-letter message carries the original payload (including its
     * {@code retry_count}) plus {@code error}, {@code original_queue} and
     * {@code original_msg_id}. Long errors are truncated.
     *
     * @param queue   the source queue name
     * @param msgId   id of the failed message
     * @param payload the payload of the failed message
     * @param error   description of the last failure
     * @return id of the message in the dead-letter queue
     * @throws QueueStoreException if the store is unreachable
     */
    public long moveToDlq(String queue, long msgId, Map<String, Object> payload, String error) {
        String dlq = QueueNames.deadLetterQueue(queue);
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(error, "error");
        Map<String, Object> message = new LinkedHashMap<>(payload);
        message.put(MessageFields.RETRY_COUNT, MessageFields.retryCount(payload));
        message.put(MessageFields.ERROR, MessageFields.truncateError(error));
        message.put(MessageFields.ORIGINAL_QUEUE, queue);
        message.put(MessageFields.ORIGINAL_MSG_ID, msgId);

        long dlqMsgId = send(dlq, message, "move msgId=" + msgId + " to dead-letter queue");
        archiveReplaced(queue, msgId);
        metrics.incrementDeadLettered();
        logger.log(Level.WARNING, "Moved msgId={0} from queue={1} to {2} as msgId={3}: {4}",
                new Object[]{msgId, queue, dlq, dlqMsgId, error});
        return dlqMsgId;
    }

    /**
     * Returns visible messages without leasing them, oldest first.
     *
     * @param queue the queue name
     * @param limit maximum number of messages, &gt; 0
     * @return visible messages; empty if the queue does not exist
     */
    public List<QueueMessage> peek(String queue, int limit) {
        QueueNames.validate(queue);
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0, got: " + limit);
        }
        List<StoredMessage> stored = withConnection("peek queue " + queue,
                conn -> messageStore.peek(conn, queue, limit));
        return stored.stream().map(m -> toMessage(queue, m)).toList();
    }

    /**
     * Counts active messages, leased or not.
     *
     * @param queue the queue name
     * @return number of messages not yet archived; 0 if the queue does not exist
     */
    public long queueLength(String queue) {
        QueueNames.validate(queue);
        return withConnection("count queue " + queue, conn -> messageStore.queueLength(conn, queue));
    }

    public QueueConfig config() {
        return config;
    }

    public MetricsExporter metrics() {
        return metrics;
    }

    private long send(String queue, Map<String, Object> payload, String action) {
        String json = jsonCodec.toJson(payload);
        long msgId = withConnection(action + " to queue " + queue,
                conn -> messageStore.send(conn, queue, json));
        if (msgId <= 0) {
            throw new QueueStoreException("Store returned invalid msgId " + msgId + " for queue " + queue);
        }
        return msgId;
    }

    private void archiveReplaced(String queue, long msgId) {
        boolean archived = withConnection("archive msgId=" + msgId + " in queue " + queue,
                conn -> messageStore.archive(conn, queue, msgId));
        if (!archived) {
            logger.log(Level.WARNING, "msgId={0} in queue={1} was already archived", new Object[]{msgId, queue});
        }
    }

    private QueueMessage toMessage(String queue, StoredMessage stored) {
        Map<String, Object> payload;
        try {
            payload = jsonCodec.parseObject(stored.payloadJson());
        } catch (IllegalArgumentException e) {
            throw new QueueStoreException("Corrupt payload for msgId=" + stored.msgId() + " in queue " + queue, e);
        }
        return new QueueMessage(stored.msgId(), queue, payload, stored.readCount(),
                stored.enqueuedAt(), stored.visibleAt());
    }

    private <T> T withConnection(String action, Function<Connection, T> callback) {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            return callback.apply(conn);
        } catch (SQLException e) {
            throw new QueueStoreException("Failed to " + action, e);
        }
    }

    /**
     * Builder for {@link QueueClient}.
     */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private MessageStore messageStore;
        private JsonCodec jsonCodec;
        private QueueConfig config;
        private MetricsExporter metrics;

        private Builder() {
        }

        /**
         * Sets the connection provider used for every store call.
         *
         * <p><b>Required.</b>
         *
         * @param connectionProvider the connection provider
         * @return this builder
         */
        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /**
         * Sets the message store backend.
         *
         * <p><b>Required.</b>
         *
         * @param messageStore the persistence backend
         * @return this builder
         */
        public Builder messageStore(MessageStore messageStore) {
            this.messageStore = messageStore;
            return this;
        }

        /**
         * Sets the payload codec.
         *
         * <p>Optional. Defaults to {@link JsonCodec#getDefault()}.
         *
         * @param jsonCodec the JSON codec
         * @return this builder
         */
        public Builder jsonCodec(JsonCodec jsonCodec) {
            this.jsonCodec = jsonCodec;
            return this;
        }

        /**
         * Sets queue settings.
         *
         * <p>Optional. Defaults to {@link QueueConfig#defaults()}.
         *
         * @param config the queue settings
         * @return this builder
         */
        public Builder config(QueueConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Sets the metrics exporter.
         *
         * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
         *
         * @param metrics the metrics exporter
         * @return this builder
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Builds the client.
         *
         * @return a new {@link QueueClient}
         * @throws NullPointerException if {@code connectionProvider} or {@code messageStore} is null
         */
        public QueueClient build() {
            return new QueueClient(this);
        }
    }
}
