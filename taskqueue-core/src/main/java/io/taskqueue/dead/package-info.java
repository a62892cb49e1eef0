/**
 * Inspection and replay of dead-letter queues.
 */
package io.taskqueue.dead;
