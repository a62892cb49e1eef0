package io.taskqueue.model;

import java.time.Instant;

/**
 * Raw message row as returned by a {@link io.taskqueue.spi.MessageStore}.
 *
 * @param msgId       store-assigned id (always &gt; 0)
 * @param readCount   number of leases taken so far
 * @param enqueuedAt  when the message was sent
 * @param visibleAt   earliest time the message is visible to readers
 * @param payloadJson payload encoded as a JSON object
 */
public record StoredMessage(
        long msgId,
        int readCount,
        Instant enqueuedAt,
        Instant visibleAt,
        String payloadJson) {
}
