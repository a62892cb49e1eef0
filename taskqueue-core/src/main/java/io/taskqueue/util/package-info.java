/**
 * Internal utilities: the payload {@link io.taskqueue.util.JsonCodec} and the worker
 * {@link io.taskqueue.util.DaemonThreadFactory}.
 */
package io.taskqueue.util;
