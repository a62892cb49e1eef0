package io.taskqueue.spring.boot;

import io.taskqueue.QueueConfig;
import io.taskqueue.jdbc.TableNames;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * Configuration properties for the task queue.
 *
 * <p>Relaxed binding maps {@code QUEUE_VISIBILITY_TIMEOUT}, {@code QUEUE_MAX_RETRIES} and
 * {@code QUEUE_NAME_PREFIX} onto the matching properties. A bare number for
 * {@code queue.visibility-timeout} is read as seconds.
 *
 * @see TaskQueueAutoConfiguration
 */
@ConfigurationProperties(prefix = "queue")
public class QueueProperties {

    /**
     * Default lease length for dequeued messages.
     */
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration visibilityTimeout = QueueConfig.DEFAULT_VISIBILITY_TIMEOUT;

    /**
     * Retries before a failing message is moved to its dead-letter queue.
     */
    private int maxRetries = QueueConfig.DEFAULT_MAX_RETRIES;

    /**
     * Prefix applied to logical queue names.
     */
    private String namePrefix = QueueConfig.DEFAULT_NAME_PREFIX;

    /**
     * Message store name ({@code pgmq}, {@code postgresql}, {@code h2}); detected from the
     * DataSource when unset.
     */
    private String store;

    /**
     * Table prefix for the table-backed stores.
     */
    private String tablePrefix = TableNames.DEFAULT_PREFIX;

    private final Metrics metrics = new Metrics();

    public Duration getVisibilityTimeout() {
        return visibilityTimeout;
    }

    public void setVisibilityTimeout(Duration visibilityTimeout) {
        this.visibilityTimeout = visibilityTimeout;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public String getNamePrefix() {
        return namePrefix;
    }

    public void setNamePrefix(String namePrefix) {
        this.namePrefix = namePrefix;
    }

    public String getStore() {
        return store;
    }

    public void setStore(String store) {
        this.store = store;
    }

    public String getTablePrefix() {
        return tablePrefix;
    }

    public void setTablePrefix(String tablePrefix) {
        this.tablePrefix = tablePrefix;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    /**
     * Converts these properties to the core {@link QueueConfig}.
     */
    public QueueConfig toQueueConfig() {
        return QueueConfig.builder()
                .visibilityTimeout(visibilityTimeout)
                .maxRetries(maxRetries)
                .namePrefix(namePrefix == null ? "" : namePrefix.trim())
                .build();
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "taskqueue";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
