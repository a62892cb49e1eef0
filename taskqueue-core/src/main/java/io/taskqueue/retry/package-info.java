/**
 * Retry policy applied around task handlers: archive on success, re-enqueue on
 * failure, dead-letter once the retry budget is spent.
 */
package io.taskqueue.retry;
