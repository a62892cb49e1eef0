package io.taskqueue;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Settings shared by {@link QueueClient} and {@link io.taskqueue.retry.RetryOrchestrator}.
 *
 * <p>Instances are immutable. Build one explicitly or read it from the process
 * environment with {@link #fromEnvironment()}:
 * <ul>
 *   <li>{@code QUEUE_VISIBILITY_TIMEOUT}: default lease in seconds (default 30)</li>
 *   <li>{@code QUEUE_MAX_RETRIES}: retry budget before dead-lettering (default 3)</li>
 *   <li>{@code QUEUE_NAME_PREFIX}: namespace prefix for queue names (default {@code unison})</li>
 * </ul>
 */
public final class QueueConfig {
    public static final String ENV_VISIBILITY_TIMEOUT = "QUEUE_VISIBILITY_TIMEOUT";
    public static final String ENV_MAX_RETRIES = "QUEUE_MAX_RETRIES";
    public static final String ENV_NAME_PREFIX = "QUEUE_NAME_PREFIX";

    public static final Duration DEFAULT_VISIBILITY_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final String DEFAULT_NAME_PREFIX = "unison";

    private final Duration visibilityTimeout;
    private final int maxRetries;
    private final String namePrefix;

    private QueueConfig(Builder builder) {
        Duration visibilityTimeout = Objects.requireNonNull(builder.visibilityTimeout, "visibilityTimeout");
        if (visibilityTimeout.isNegative()) {
            throw new IllegalArgumentException("visibilityTimeout must be >= 0, got: " + visibilityTimeout);
        }
        if (builder.maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, got: " + builder.maxRetries);
        }
        this.visibilityTimeout = visibilityTimeout;
        this.maxRetries = builder.maxRetries;
        this.namePrefix = Objects.requireNonNull(builder.namePrefix, "namePrefix");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a configuration with all defaults.
     */
    public static QueueConfig defaults() {
        return builder().build();
    }

    /**
     * Reads the configuration from {@link System#getenv()}.
     *
     * @return the configuration, with defaults for unset variables
     * @throws IllegalArgumentException if a variable is set to a malformed value
     */
    public static QueueConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Reads the configuration from the given environment map.
     *
     * @param env environment variables
     * @return the configuration, with defaults for unset or blank variables
     * @throws IllegalArgumentException if a variable is set to a malformed value
     */
    public static QueueConfig fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        Builder builder = builder();
        String vt = env.get(ENV_VISIBILITY_TIMEOUT);
        if (vt != null && !vt.isBlank()) {
            builder.visibilityTimeout(Duration.ofSeconds(parseInt(ENV_VISIBILITY_TIMEOUT, vt)));
        }
        String maxRetries = env.get(ENV_MAX_RETRIES);
        if (maxRetries != null && !maxRetries.isBlank()) {
            builder.maxRetries(parseInt(ENV_MAX_RETRIES, maxRetries));
        }
        String prefix = env.get(ENV_NAME_PREFIX);
        if (prefix != null) {
            builder.namePrefix(prefix.trim());
        }
        return builder.build();
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer, got: " + value, e);
        }
    }

    /** Default lease duration used by {@link QueueClient#dequeue(String)}. */
    public Duration visibilityTimeout() {
        return visibilityTimeout;
    }

    /** Retry budget: failures at or beyond this retry count go to the dead-letter queue. */
    public int maxRetries() {
        return maxRetries;
    }

    /** Namespace prefix applied by callers when naming queues; not enforced by the client. */
    public String namePrefix() {
        return namePrefix;
    }

    /**
     * Applies {@link #namePrefix()} to an unprefixed queue name.
     *
     * @param name the unprefixed name
     * @return the prefixed queue name
     * @see QueueNames#prefixed(String, String)
     */
    public String queueName(String name) {
        return QueueNames.prefixed(namePrefix, name);
    }

    @Override
    public String toString() {
        return "QueueConfig{visibilityTimeout=" + visibilityTimeout
                + ", maxRetries=" + maxRetries
                + ", namePrefix='" + namePrefix + "'}";
    }

    /** Builder for {@link QueueConfig}. */
    public static final class Builder {
        private Duration visibilityTimeout = DEFAULT_VISIBILITY_TIMEOUT;
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private String namePrefix = DEFAULT_NAME_PREFIX;

        private Builder() {
        }

        /**
         * Sets the default lease duration.
         *
         * <p>Optional. Defaults to 30 seconds. Must be &ge; 0.
         *
         * @param visibilityTimeout the lease duration
         * @return this builder
         */
        public Builder visibilityTimeout(Duration visibilityTimeout) {
            this.visibilityTimeout = visibilityTimeout;
            return this;
        }

        /**
         * Sets the retry budget.
         *
         * <p>Optional. Defaults to {@code 3}. Must be &ge; 0; {@code 0} sends the first
         * failure straight to the dead-letter queue.
         *
         * @param maxRetries maximum number of retries
         * @return this builder
         */
        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        /**
         * Sets the queue name prefix.
         *
         * <p>Optional. Defaults to {@code "unison"}.
         *
         * @param namePrefix the prefix
         * @return this builder
         */
        public Builder namePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
            return this;
        }

        /**
         * Builds the configuration.
         *
         * @return a new {@link QueueConfig}
         * @throws NullPointerException     if {@code visibilityTimeout} or {@code namePrefix} is null
         * @throws IllegalArgumentException if {@code visibilityTimeout} is negative or
         *                                  {@code maxRetries < 0}
         */
        public QueueConfig build() {
            return new QueueConfig(this);
        }
    }
}
