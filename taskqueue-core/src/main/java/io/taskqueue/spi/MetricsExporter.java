package io.taskqueue.spi;

/**
 * Observability hook for exporting queue counters to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of messages sent by {@code enqueue}.
     */
    void incrementEnqueued();

    /**
     * Increments the count of messages leased by {@code dequeue}.
     */
    void incrementDequeued();

    /**
     * Increments the count of {@code dequeue} calls that found no visible message.
     */
    void incrementDequeueEmpty();

    /**
     * Increments the count of messages archived after successful processing.
     */
    void incrementArchived();

    /**
     * Increments the count of messages re-enqueued with an incremented retry counter.
     */
    void incrementRetried();

    /**
     * Increments the count of messages promoted to a dead-letter queue.
     */
    void incrementDeadLettered();

    /**
     * Increments the count of handler invocations that completed without an exception.
     */
    default void incrementHandlerSuccess() {
    }

    /**
     * Records the time spent in a task handler.
     *
     * @param durationMs handler execution time in milliseconds (always non-negative)
     */
    default void recordHandlerDurationMs(long durationMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementEnqueued() {
        }

        @Override
        public void incrementDequeued() {
        }

        @Override
        public void incrementDequeueEmpty() {
        }

        @Override
        public void incrementArchived() {
        }

        @Override
        public void incrementRetried() {
        }

        @Override
        public void incrementDeadLettered() {
        }
    }
}
