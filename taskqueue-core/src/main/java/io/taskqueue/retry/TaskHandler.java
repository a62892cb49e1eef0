package io.taskqueue.retry;

import java.util.Map;

/**
 * Business logic invoked for each leased message.
 *
 * <p>Any exception thrown counts as a processing failure and is handled by the
 * {@link RetryOrchestrator}; it never reaches the orchestrator's caller.
 *
 * @param <R> the handler's result type
 */
@FunctionalInterface
public interface TaskHandler<R> {

    /**
     * Processes one message payload.
     *
     * @param payload the message payload, including reserved fields such as {@code retry_count}
     * @return the processing result
     * @throws Exception on processing failure
     */
    R handle(Map<String, Object> payload) throws Exception;
}
