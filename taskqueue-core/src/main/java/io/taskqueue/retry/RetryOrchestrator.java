package io.taskqueue.retry;

import io.taskqueue.QueueClient;
import io.taskqueue.QueueNames;
import io.taskqueue.QueueStoreException;
import io.taskqueue.model.MessageFields;
import io.taskqueue.model.QueueMessage;
import io.taskqueue.spi.MetricsExporter;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs a {@link TaskHandler} against a leased message and applies the retry policy.
 *
 * <p>On success the message is archived. On failure it is re-enqueued with
 * {@code retry_count + 1} while {@code retry_count < maxRetries}; once the counter
 * reaches {@code maxRetries} it is moved to {@code <queue>_dlq} instead. With the
 * default of 3 a task is attempted four times in total.
 *
 * <p>Handler exceptions never propagate. {@link QueueStoreException}s raised while
 * archiving, retrying or dead-lettering do.
 */
public final class RetryOrchestrator {
    private static final Logger logger = Logger.getLogger(RetryOrchestrator.class.getName());

    private final QueueClient queueClient;
    private final int maxRetries;
    private final MetricsExporter metrics;

    public RetryOrchestrator(QueueClient queueClient) {
        this(queueClient, Objects.requireNonNull(queueClient, "queueClient").config().maxRetries());
    }

    public RetryOrchestrator(QueueClient queueClient, int maxRetries) {
        this(queueClient, maxRetries, Objects.requireNonNull(queueClient, "queueClient").metrics());
    }

    public RetryOrchestrator(QueueClient queueClient, int maxRetries, MetricsExporter metrics) {
        this.queueClient = Objects.requireNonNull(queueClient, "queueClient");
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, got: " + maxRetries);
        }
        this.maxRetries = maxRetries;
        this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
    }

    /**
     * Processes a message with retry handling.
     *
     * @param queue   the queue the message was leased from
     * @param message the leased message
     * @param handler the business logic
     * @param <R>     the handler's result type
     * @return {@link ProcessingResult.Completed} with the handler's value on success,
     *         otherwise {@link ProcessingResult.Retried} or {@link ProcessingResult.DeadLettered}
     * @throws IllegalArgumentException if {@code queue} has no valid dead-letter queue; the
     *                                  handler is not run
     * @throws QueueStoreException      if the store is unreachable while settling the message
     */
    public <R> ProcessingResult<R> processWithRetry(String queue, QueueMessage message, TaskHandler<R> handler) {
        QueueNames.validateSource(queue);
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(handler, "handler");

        R value;
        long start = System.nanoTime();
        try {
            value = handler.handle(message.payload());
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            metrics.recordHandlerDurationMs(elapsedMs(start));
            return handleFailure(queue, message, e);
        }
        metrics.recordHandlerDurationMs(elapsedMs(start));
        metrics.incrementHandlerSuccess();

        if (!queueClient.archive(queue, message.msgId())) {
            logger.log(Level.WARNING, "msgId={0} in queue={1} was no longer active after processing",
                    new Object[]{message.msgId(), queue});
        }
        return ProcessingResult.completed(value);
    }

    public int maxRetries() {
        return maxRetries;
    }

    private <R> ProcessingResult<R> handleFailure(String queue, QueueMessage message, Exception failure) {
        int retryCount = message.retryCount();
        if (retryCount < maxRetries) {
            logger.log(Level.INFO, "Task msgId=" + message.msgId() + " in queue=" + queue
                    + " failed (retry " + retryCount + " of " + maxRetries + ")", failure);
            long newMsgId = queueClient.retryMessage(queue, message.msgId(), message.payload());
            return ProcessingResult.retried(newMsgId, retryCount + 1);
        }
        String error = MessageFields.truncateError(describe(failure));
        logger.log(Level.WARNING, "Task msgId=" + message.msgId() + " in queue=" + queue
                + " exhausted " + maxRetries + " retries", failure);
        long dlqMsgId = queueClient.moveToDlq(queue, message.msgId(), message.payload(), error);
        return ProcessingResult.deadLettered(dlqMsgId, error);
    }

    static String describe(Throwable failure) {
        String message = failure.getMessage();
        if (message == null || message.isBlank()) {
            return failure.getClass().getName();
        }
        return message;
    }

    private static long elapsedMs(long startNanos) {
        return Math.max(0L, (System.nanoTime() - startNanos) / 1_000_000L);
    }
}
