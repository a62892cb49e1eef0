package io.taskqueue.spi;

import io.taskqueue.model.StoredMessage;

import java.sql.Connection;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Durable message storage consumed by {@link io.taskqueue.QueueClient}.
 *
 * <p>All methods receive an explicit {@link Connection} so the caller controls the
 * connection lifecycle. Implementations report database failures as
 * {@link io.taskqueue.QueueStoreException}. Implementations live in the
 * {@code taskqueue-jdbc} module.
 *
 * <p>Messages are leased oldest first (ascending {@code msgId}).
 *
 * @see io.taskqueue.jdbc.store.AbstractJdbcMessageStore
 */
public interface MessageStore {

    /**
     * Sends a message, creating the queue if it does not exist yet.
     *
     * @param conn        the JDBC connection
     * @param queue       the queue name
     * @param payloadJson the payload encoded as a JSON object
     * @return the new message id (always &gt; 0)
     */
    long send(Connection conn, String queue, String payloadJson);

    /**
     * Leases one currently-visible message, hiding it from other readers for
     * {@code visibilityTimeout}.
     *
     * @param conn              the JDBC connection
     * @param queue             the queue name
     * @param visibilityTimeout lease duration
     * @return the leased message, or empty if the queue has no visible message or does not exist
     */
    Optional<StoredMessage> read(Connection conn, String queue, Duration visibilityTimeout);

    /**
     * Permanently removes a message from active visibility.
     *
     * @param conn  the JDBC connection
     * @param queue the queue name
     * @param msgId the message id
     * @return {@code true} if a matching message was archived, {@code false} if not found
     */
    boolean archive(Connection conn, String queue, long msgId);

    /**
     * Drops a queue together with its messages and archive.
     *
     * @param conn  the JDBC connection
     * @param queue the queue name
     * @return {@code true} if the queue existed
     */
    boolean dropQueue(Connection conn, String queue);

    /**
     * Returns currently-visible messages, oldest first, without leasing them.
     *
     * <p>Default returns an empty list. JDBC implementations override this.
     *
     * @param conn  the JDBC connection
     * @param queue the queue name
     * @param limit maximum number of messages to return
     * @return visible messages
     */
    default List<StoredMessage> peek(Connection conn, String queue, int limit) {
        return List.of();
    }

    /**
     * Counts messages in the queue that have not been archived, leased or not.
     *
     * <p>Default returns {@code 0}. JDBC implementations override this.
     *
     * @param conn  the JDBC connection
     * @param queue the queue name
     * @return number of active messages
     */
    default long queueLength(Connection conn, String queue) {
        return 0L;
    }
}
