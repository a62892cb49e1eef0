/**
 * Postgres-resident task queue client.
 *
 * <p>{@link io.taskqueue.QueueClient} is the entry point: it enqueues tasks, leases them
 * with a visibility timeout, and settles them by archiving, retrying or moving them to a
 * dead-letter queue. Storage is pluggable through {@link io.taskqueue.spi.MessageStore};
 * JDBC implementations live in the {@code taskqueue-jdbc} module.
 */
package io.taskqueue;
