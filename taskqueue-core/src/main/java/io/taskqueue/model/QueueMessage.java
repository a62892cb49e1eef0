package io.taskqueue.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A leased message returned by {@link io.taskqueue.QueueClient#dequeue}.
 *
 * <p>The payload is an immutable copy of the business fields plus the reserved
 * {@link MessageFields#RETRY_COUNT retry_count} field. Null values are allowed because
 * JSON payloads may carry them.
 *
 * @param msgId      store-assigned handle, unique within the queue
 * @param queueName  the queue the message was read from
 * @param payload    business fields plus reserved fields
 * @param readCount  number of times the message has been leased, including this one
 * @param enqueuedAt when the message was sent
 * @param visibleAt  when the current lease expires and the message becomes visible again
 */
public record QueueMessage(
        long msgId,
        String queueName,
        Map<String, Object> payload,
        int readCount,
        Instant enqueuedAt,
        Instant visibleAt) {

    public QueueMessage {
        if (msgId <= 0) {
            throw new IllegalArgumentException("msgId must be > 0, got: " + msgId);
        }
        Objects.requireNonNull(queueName, "queueName");
        Objects.requireNonNull(payload, "payload");
        payload = Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    /**
     * Returns the retry counter carried in the payload, or {@code 0} if absent.
     */
    public int retryCount() {
        return MessageFields.retryCount(payload);
    }
}
