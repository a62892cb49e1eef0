package io.taskqueue.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.taskqueue.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters and a distribution summary with a {@link MeterRegistry} for
 * export to Prometheus, Grafana, Datadog, and other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code taskqueue.enqueued}: messages sent by {@code enqueue}</li>
 *   <li>{@code taskqueue.dequeued}: messages leased by {@code dequeue}</li>
 *   <li>{@code taskqueue.dequeue.empty}: dequeue calls that found nothing visible</li>
 *   <li>{@code taskqueue.archived}: messages archived</li>
 *   <li>{@code taskqueue.handler.success}: handler invocations that returned normally</li>
 *   <li>{@code taskqueue.retried}: messages re-enqueued for another attempt</li>
 *   <li>{@code taskqueue.dead_lettered}: messages moved to a dead-letter queue</li>
 * </ul>
 *
 * <h3>Summaries</h3>
 * <ul>
 *   <li>{@code taskqueue.handler.duration.ms}: handler execution time in milliseconds</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

    private final MeterRegistry registry;
    private final Counter enqueued;
    private final Counter dequeued;
    private final Counter dequeueEmpty;
    private final Counter archived;
    private final Counter handlerSuccess;
    private final Counter retried;
    private final Counter deadLettered;
    private final DistributionSummary handlerDuration;
    private volatile boolean closed;

    /**
     * Creates an exporter with the default metric name prefix {@code "taskqueue"}.
     *
     * @param registry the Micrometer meter registry
     */
    public MicrometerMetricsExporter(MeterRegistry registry) {
        this(registry, "taskqueue");
    }

    /**
     * Creates an exporter with a custom metric name prefix for multi-instance use.
     *
     * @param registry   the Micrometer meter registry
     * @param namePrefix prefix for all meter names (e.g. {@code "billing.taskqueue"})
     */
    public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isEmpty()) {
            throw new IllegalArgumentException("namePrefix must not be empty");
        }
        if (namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must not end with '.'");
        }

        this.registry = registry;
        this.enqueued = Counter.builder(namePrefix + ".enqueued")
                .description("Messages sent by enqueue")
                .register(registry);
        this.dequeued = Counter.builder(namePrefix + ".dequeued")
                .description("Messages leased by dequeue")
                .register(registry);
        this.dequeueEmpty = Counter.builder(namePrefix + ".dequeue.empty")
                .description("Dequeue calls that found no visible message")
                .register(registry);
        this.archived = Counter.builder(namePrefix + ".archived")
                .description("Messages archived")
                .register(registry);
        this.handlerSuccess = Counter.builder(namePrefix + ".handler.success")
                .description("Task handler invocations that completed normally")
                .register(registry);
        this.retried = Counter.builder(namePrefix + ".retried")
                .description("Messages re-enqueued with an incremented retry count")
                .register(registry);
        this.deadLettered = Counter.builder(namePrefix + ".dead_lettered")
                .description("Messages moved to a dead-letter queue")
                .register(registry);
        this.handlerDuration = DistributionSummary.builder(namePrefix + ".handler.duration.ms")
                .description("Task handler execution time")
                .baseUnit("milliseconds")
                .register(registry);
    }

    @Override
    public void incrementEnqueued() {
        if (closed) return;
        enqueued.increment();
    }

    @Override
    public void incrementDequeued() {
        if (closed) return;
        dequeued.increment();
    }

    @Override
    public void incrementDequeueEmpty() {
        if (closed) return;
        dequeueEmpty.increment();
    }

    @Override
    public void incrementArchived() {
        if (closed) return;
        archived.increment();
    }

    @Override
    public void incrementRetried() {
        if (closed) return;
        retried.increment();
    }

    @Override
    public void incrementDeadLettered() {
        if (closed) return;
        deadLettered.increment();
    }

    @Override
    public void incrementHandlerSuccess() {
        if (closed) return;
        handlerSuccess.increment();
    }

    @Override
    public void recordHandlerDurationMs(long durationMs) {
        if (closed) return;
        handlerDuration.record(durationMs);
    }

    /**
     * Removes all meters registered by this exporter from the registry.
     *
     * <p>Call this when the exporter is no longer needed to prevent stale meters.
     */
    @Override
    public void close() {
        closed = true;
        RuntimeException first = null;
        for (Meter meter : List.of(enqueued, dequeued, dequeueEmpty, archived,
                handlerSuccess, retried, deadLettered, handlerDuration)) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e; else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }
}
