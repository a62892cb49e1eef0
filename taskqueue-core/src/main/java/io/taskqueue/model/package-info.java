/**
 * Message model: leased {@link io.taskqueue.model.QueueMessage}s, raw
 * {@link io.taskqueue.model.StoredMessage} rows and the reserved
 * {@link io.taskqueue.model.MessageFields payload fields}.
 */
package io.taskqueue.model;
