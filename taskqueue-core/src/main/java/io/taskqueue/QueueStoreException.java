package io.taskqueue;

/**
 * Unchecked exception signalling that the message store could not be reached or
 * rejected an operation.
 *
 * <p>This is an infrastructure failure: it always propagates to the caller of
 * {@link QueueClient} and is never absorbed by the retry policy.
 */
public final class QueueStoreException extends RuntimeException {
    public QueueStoreException(String message) {
        super(message);
    }

    public QueueStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
