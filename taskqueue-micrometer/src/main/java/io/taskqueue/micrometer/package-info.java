/**
 * Micrometer bridge for queue metrics.
 */
package io.taskqueue.micrometer;
