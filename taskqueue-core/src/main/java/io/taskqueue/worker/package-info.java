/**
 * Scheduled consumer loop for a single queue.
 */
package io.taskqueue.worker;
