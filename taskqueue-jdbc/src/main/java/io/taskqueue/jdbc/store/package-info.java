/**
 * JDBC message store implementations and their {@link java.util.ServiceLoader} registry.
 *
 * <p>{@link io.taskqueue.jdbc.store.PostgresMessageStore} and
 * {@link io.taskqueue.jdbc.store.H2MessageStore} use the tables created by
 * {@code schema/postgresql.sql} and {@code schema/h2.sql};
 * {@link io.taskqueue.jdbc.store.PgmqMessageStore} delegates to the pgmq extension.
 */
package io.taskqueue.jdbc.store;
