package io.taskqueue;

import java.util.Objects;

/**
 * Queue naming rules shared by the client and the JDBC stores.
 *
 * <p>Names must be lower-case SQL identifiers ({@code [a-z_][a-z0-9_]*}) of at most
 * {@value #MAX_LENGTH} characters, the longest name the pgmq extension accepts. pgmq folds
 * queue names to lower case, so mixed-case names are rejected rather than silently merged.
 *
 * <p>Queues that receive new work must leave room for the {@value #DLQ_SUFFIX} suffix, so
 * they are limited to {@value #MAX_SOURCE_LENGTH} characters (see {@link #validateSource}).
 */
public final class QueueNames {
    public static final int MAX_LENGTH = 47;
    public static final String DLQ_SUFFIX = "_dlq";
    public static final int MAX_SOURCE_LENGTH = 43;
    private static final String QUEUE_NAME_PATTERN = "[a-z_][a-z0-9_]*";

    private QueueNames() {
    }

    /**
     * Validates a queue name.
     *
     * @param queue the queue name
     * @return the same name
     * @throws NullPointerException     if {@code queue} is null
     * @throws IllegalArgumentException if the name is not a valid queue name
     */
    public static String validate(String queue) {
        Objects.requireNonNull(queue, "queue");
        if (!queue.matches(QUEUE_NAME_PATTERN)) {
            throw new IllegalArgumentException("Invalid queue name: " + queue);
        }
        if (queue.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("Queue name longer than " + MAX_LENGTH + " characters: " + queue);
        }
        return queue;
    }

    /**
     * Validates a queue that new messages are sent to. Such a queue must have a valid
     * dead-letter queue, which limits it to {@value #MAX_SOURCE_LENGTH} characters.
     *
     * @param queue the queue name
     * @return the same name
     * @throws NullPointerException     if {@code queue} is null
     * @throws IllegalArgumentException if the name, or its dead-letter queue name, is invalid
     */
    public static String validateSource(String queue) {
        validate(queue);
        if (queue.length() > MAX_SOURCE_LENGTH) {
            throw new IllegalArgumentException("Queue name longer than " + MAX_SOURCE_LENGTH +
                    " characters leaves no room for its dead-letter queue: " + queue);
        }
        return queue;
    }

    /**
     * Returns the dead-letter queue for a source queue: {@code <queue>_dlq}.
     *
     * @param queue the source queue name
     * @return the dead-letter queue name
     * @throws IllegalArgumentException if the source name, or the derived name, is invalid
     */
    public static String deadLetterQueue(String queue) {
        return validate(validate(queue) + DLQ_SUFFIX);
    }

    /**
     * Applies a namespace prefix: {@code <prefix>_<name>}. An empty prefix returns the name unchanged.
     *
     * @param prefix the namespace prefix (e.g. {@link QueueConfig#namePrefix()})
     * @param name   the unprefixed queue name
     * @return the prefixed queue name
     */
    public static String prefixed(String prefix, String name) {
        Objects.requireNonNull(prefix, "prefix");
        Objects.requireNonNull(name, "name");
        return validate(prefix.isEmpty() ? name : prefix + "_" + name);
    }
}
