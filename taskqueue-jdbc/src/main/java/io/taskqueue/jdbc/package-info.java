/**
 * JDBC building blocks shared by the message stores: connection provider, SQL helper,
 * table naming and pgmq extension checks.
 */
package io.taskqueue.jdbc;
