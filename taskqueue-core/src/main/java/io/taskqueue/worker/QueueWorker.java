package io.taskqueue.worker;

import io.taskqueue.QueueClient;
import io.taskqueue.QueueNames;
import io.taskqueue.model.QueueMessage;
import io.taskqueue.retry.ProcessingResult;
import io.taskqueue.retry.RetryOrchestrator;
import io.taskqueue.retry.TaskHandler;
import io.taskqueue.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scheduled consumer that drains one queue through a {@link RetryOrchestrator}.
 *
 * <p>Each tick leases up to {@code batchSize} messages one at a time and stops at the
 * first empty dequeue. Store failures are logged and end the tick; the schedule keeps
 * running.
 *
 * <p>Create instances via {@link #builder()}.
 *
 * <p>This class is thread-safe. The {@link #start()} and {@link #close()} methods are
 * synchronized to prevent concurrent lifecycle transitions.
 *
 * @param <R> the handler's result type
 */
public final class QueueWorker<R> implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(QueueWorker.class.getName());

    private final QueueClient queueClient;
    private final RetryOrchestrator orchestrator;
    private final String queue;
    private final TaskHandler<R> handler;
    private final Duration visibilityTimeout;
    private final Duration pollInterval;
    private final Duration drainTimeout;
    private final int batchSize;

    private ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> pollTask;
    private volatile boolean closed;

    private QueueWorker(Builder<R> builder) {
        this.queueClient = Objects.requireNonNull(builder.queueClient, "queueClient");
        this.queue = QueueNames.validateSource(builder.queue);
        this.handler = Objects.requireNonNull(builder.handler, "handler");
        this.orchestrator = builder.orchestrator != null ? builder.orchestrator : new RetryOrchestrator(queueClient);
        this.visibilityTimeout = builder.visibilityTimeout != null
                ? builder.visibilityTimeout : queueClient.config().visibilityTimeout();
        this.pollInterval = Objects.requireNonNull(builder.pollInterval, "pollInterval");
        this.drainTimeout = Objects.requireNonNull(builder.drainTimeout, "drainTimeout");

        if (visibilityTimeout.isNegative()) {
            throw new IllegalArgumentException("visibilityTimeout must be >= 0");
        }
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be > 0");
        }
        if (drainTimeout.isNegative()) {
            throw new IllegalArgumentException("drainTimeout must be >= 0");
        }
        if (builder.batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        this.batchSize = builder.batchSize;
    }

    public static <R> Builder<R> builder() {
        return new Builder<>();
    }

    /**
     * Starts the scheduled polling loop. Subsequent calls are no-ops if already started.
     *
     * @throws IllegalStateException if the worker has been closed
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("QueueWorker has been closed");
        }
        if (pollTask != null) {
            return;
        }
        long intervalMs = pollInterval.toMillis();
        scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("taskqueue-worker-"));
        pollTask = scheduler.scheduleWithFixedDelay(this::pollOnce, 0L, intervalMs, TimeUnit.MILLISECONDS);
        logger.log(Level.INFO, "Started worker for queue={0} every {1} ms", new Object[]{queue, intervalMs});
    }

    /**
     * Executes a single poll cycle. Called automatically by the scheduler, but may also be
     * invoked directly.
     *
     * @return number of messages processed in this cycle
     */
    public int pollOnce() {
        int processed = 0;
        try {
            while (!closed && processed < batchSize) {
                Optional<QueueMessage> next = queueClient.dequeue(queue, visibilityTimeout);
                if (next.isEmpty()) {
                    break;
                }
                ProcessingResult<R> result = orchestrator.processWithRetry(queue, next.get(), handler);
                logger.log(Level.FINE, "Processed msgId={0} from queue={1}: {2}",
                        new Object[]{next.get().msgId(), queue, result});
                processed++;
            }
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Poll cycle failed for queue=" + queue, t);
        }
        return processed;
    }

    public String queue() {
        return queue;
    }

    /**
     * Stops polling and shuts down the scheduler thread.
     *
     * <p>A message already being handled is allowed to finish for up to the drain timeout;
     * no further messages are leased. Only a handler still running after that is
     * interrupted, which the orchestrator records as a failed attempt.
     */
    @Override
    public synchronized void close() {
        closed = true;
        if (pollTask != null) {
            pollTask.cancel(false);
            pollTask = null;
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(drainTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    logger.log(Level.WARNING, "Worker for queue={0} did not drain within {1} ms; interrupting",
                            new Object[]{queue, drainTimeout.toMillis()});
                    scheduler.shutdownNow();
                    scheduler.awaitTermination(1, TimeUnit.SECONDS);
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
            scheduler = null;
        }
    }

    /**
     * Builder for {@link QueueWorker}.
     */
    public static final class Builder<R> {
        private QueueClient queueClient;
        private RetryOrchestrator orchestrator;
        private String queue;
        private TaskHandler<R> handler;
        private Duration visibilityTimeout;
        private Duration pollInterval = Duration.ofSeconds(1);
        private int batchSize = 10;
        private Duration drainTimeout = Duration.ofSeconds(5);

        private Builder() {
        }

        /**
         * <b>Required.</b>
         *
         * @param queueClient the client used to lease messages
         * @return this builder
         */
        public Builder<R> queueClient(QueueClient queueClient) {
            this.queueClient = queueClient;
            return this;
        }

        /**
         * Sets the orchestrator that applies the retry policy.
         *
         * <p>Optional. Defaults to a {@link RetryOrchestrator} using the client's configured
         * retry budget.
         *
         * @param orchestrator the retry orchestrator
         * @return this builder
         */
        public Builder<R> orchestrator(RetryOrchestrator orchestrator) {
            this.orchestrator = orchestrator;
            return this;
        }

        /**
         * <b>Required.</b>
         *
         * @param queue the queue to consume
         * @return this builder
         */
        public Builder<R> queue(String queue) {
            this.queue = queue;
            return this;
        }

        /**
         * <b>Required.</b>
         *
         * @param handler the business logic run for each message
         * @return this builder
         */
        public Builder<R> handler(TaskHandler<R> handler) {
            this.handler = handler;
            return this;
        }

        /**
         * Sets the lease duration for each dequeue.
         *
         * <p>Optional. Defaults to the client's configured visibility timeout.
         *
         * @param visibilityTimeout lease duration
         * @return this builder
         */
        public Builder<R> visibilityTimeout(Duration visibilityTimeout) {
            this.visibilityTimeout = visibilityTimeout;
            return this;
        }

        /**
         * Sets the delay between poll cycles.
         *
         * <p>Optional. Defaults to 1 second. Must be &gt; 0.
         *
         * @param pollInterval delay between cycles
         * @return this builder
         */
        public Builder<R> pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        /**
         * Sets the maximum number of messages processed per poll cycle.
         *
         * <p>Optional. Defaults to {@code 10}. Must be &gt; 0.
         *
         * @param batchSize max messages per cycle
         * @return this builder
         */
        public Builder<R> batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        /**
         * Sets how long {@link QueueWorker#close()} waits for an in-flight handler.
         *
         * <p>Optional. Defaults to 5 seconds. Must be &ge; 0.
         *
         * @param drainTimeout maximum wait on close
         * @return this builder
         */
        public Builder<R> drainTimeout(Duration drainTimeout) {
            this.drainTimeout = drainTimeout;
            return this;
        }

        public QueueWorker<R> build() {
            return new QueueWorker<>(this);
        }
    }
}
