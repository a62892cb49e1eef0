package io.taskqueue.retry;

import java.util.Optional;

/**
 * Outcome of {@link RetryOrchestrator#processWithRetry}.
 *
 * <p>{@link #result()} holds the handler's return value only for {@link Completed};
 * the other two outcomes record where the message went.
 *
 * @param <R> the handler's result type
 */
public sealed interface ProcessingResult<R>
        permits ProcessingResult.Completed, ProcessingResult.Retried, ProcessingResult.DeadLettered {

    static <R> ProcessingResult<R> completed(R value) {
        return new Completed<>(value);
    }

    static <R> ProcessingResult<R> retried(long newMsgId, int retryCount) {
        return new Retried<>(newMsgId, retryCount);
    }

    static <R> ProcessingResult<R> deadLettered(long dlqMsgId, String error) {
        return new DeadLettered<>(dlqMsgId, error);
    }

    /**
     * Returns the handler's result if processing succeeded.
     */
    default Optional<R> result() {
        return Optional.empty();
    }

    default boolean isSuccess() {
        return false;
    }

    /**
     * The handler returned normally and the message was archived.
     *
     * @param value the handler's return value, may be {@code null}
     */
    record Completed<R>(R value) implements ProcessingResult<R> {
        @Override
        public Optional<R> result() {
            return Optional.ofNullable(value);
        }

        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    /**
     * The handler failed and the message was re-enqueued.
     *
     * @param newMsgId   id of the re-enqueued message
     * @param retryCount retry counter carried by the new message
     */
    record Retried<R>(long newMsgId, int retryCount) implements ProcessingResult<R> {
    }

    /**
     * The handler failed with no retries left and the message went to the dead-letter queue.
     *
     * @param dlqMsgId id of the message in the dead-letter queue
     * @param error    the failure description that was recorded
     */
    record DeadLettered<R>(long dlqMsgId, String error) implements ProcessingResult<R> {
    }
}
