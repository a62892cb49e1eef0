package io.taskqueue.dead;

import io.taskqueue.QueueClient;
import io.taskqueue.QueueNames;
import io.taskqueue.model.MessageFields;
import io.taskqueue.model.QueueMessage;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Convenience facade for inspecting, replaying and purging the dead-letter queue of a
 * source queue.
 *
 * <p>All methods take the <em>source</em> queue name and operate on {@code <queue>_dlq}.
 *
 * @see QueueClient#moveToDlq
 */
public final class DeadLetterManager {
    private static final Logger logger = Logger.getLogger(DeadLetterManager.class.getName());

    private static final Duration REPLAY_LEASE = Duration.ofSeconds(30);

    private final QueueClient queueClient;

    public DeadLetterManager(QueueClient queueClient) {
        this.queueClient = Objects.requireNonNull(queueClient, "queueClient");
    }

    /**
     * Lists dead-lettered messages without leasing them.
     *
     * @param queue the source queue name
     * @param limit maximum number of messages to return
     * @return dead-letter messages, oldest first
     */
    public List<QueueMessage> peek(String queue, int limit) {
        return queueClient.peek(QueueNames.deadLetterQueue(queue), limit);
    }

    /**
     * Counts dead-lettered messages.
     *
     * @param queue the source queue name
     * @return the number of messages in the dead-letter queue
     */
    public long count(String queue) {
        return queueClient.queueLength(QueueNames.deadLetterQueue(queue));
    }

    /**
     * Re-enqueues the oldest dead-letter message to the source queue with a fresh retry
     * budget, then archives the dead-letter copy.
     *
     * @param queue the source queue name
     * @return id of the re-enqueued message, or empty if the dead-letter queue is empty
     */
    public Optional<Long> replay(String queue) {
        String dlq = QueueNames.deadLetterQueue(queue);
        Optional<QueueMessage> dead = queueClient.dequeue(dlq, REPLAY_LEASE);
        if (dead.isEmpty()) {
            return Optional.empty();
        }
        QueueMessage message = dead.get();
        long msgId = queueClient.enqueue(queue, businessPayload(message.payload()));
        queueClient.archive(dlq, message.msgId());
        logger.log(Level.INFO, "Replayed msgId={0} from {1} to queue={2} as msgId={3}",
                new Object[]{message.msgId(), dlq, queue, msgId});
        return Optional.of(msgId);
    }

    /**
     * Replays up to {@code limit} dead-letter messages.
     *
     * @param queue the source queue name
     * @param limit maximum number of messages to replay, &gt; 0
     * @return number of messages replayed
     */
    public int replayAll(String queue, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
        int replayed = 0;
        while (replayed < limit && replay(queue).isPresent()) {
            replayed++;
        }
        return replayed;
    }

    /**
     * Drops the dead-letter queue and all of its messages.
     *
     * @param queue the source queue name
     * @return {@code true} if the dead-letter queue existed
     */
    public boolean purge(String queue) {
        return queueClient.deleteQueue(QueueNames.deadLetterQueue(queue));
    }

    private static Map<String, Object> businessPayload(Map<String, Object> payload) {
        Map<String, Object> copy = new LinkedHashMap<>(payload);
        copy.remove(MessageFields.ERROR);
        copy.remove(MessageFields.ORIGINAL_QUEUE);
        copy.remove(MessageFields.ORIGINAL_MSG_ID);
        copy.remove(MessageFields.RETRY_COUNT);
        return copy;
    }
}
