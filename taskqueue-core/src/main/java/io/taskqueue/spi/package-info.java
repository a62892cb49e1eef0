/**
 * Service Provider Interfaces (SPI) for plugging storage, connections and metrics into
 * the queue client.
 *
 * @see io.taskqueue.spi.MessageStore
 * @see io.taskqueue.spi.ConnectionProvider
 * @see io.taskqueue.spi.MetricsExporter
 */
package io.taskqueue.spi;
