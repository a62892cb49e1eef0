package io.taskqueue.model;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Reserved payload field names and helpers for reading them.
 */
public final class MessageFields {

    /** Retry counter, defaulted to 0 on enqueue and incremented once per retry. */
    public static final String RETRY_COUNT = "retry_count";

    /** Failure description carried by dead-letter messages. */
    public static final String ERROR = "error";

    /** Source queue of a dead-letter message. */
    public static final String ORIGINAL_QUEUE = "original_queue";

    /** Id of the message that was promoted to the dead-letter queue. */
    public static final String ORIGINAL_MSG_ID = "original_msg_id";

    static final int MAX_ERROR_LENGTH = 4000;

    private MessageFields() {
    }

    /**
     * Reads {@link #RETRY_COUNT} from a payload. Absent values, and values that are not
     * valid counters (see {@link #isValidRetryCount}), count as 0.
     *
     * @param payload the message payload
     * @return the retry counter
     */
    public static int retryCount(Map<String, ?> payload) {
        Object value = payload.get(RETRY_COUNT);
        if (isValidRetryCount(value)) {
            return ((Number) value).intValue();
        }
        return 0;
    }

    /**
     * Whether {@code value} is a usable retry counter: a number with an integral value
     * between 0 and {@link Integer#MAX_VALUE}. {@code 2.0} qualifies; {@code 1.5} and
     * {@code 5_000_000_000L} do not.
     *
     * @param value the candidate value
     * @return {@code true} if the value can be stored as {@code retry_count}
     */
    public static boolean isValidRetryCount(Object value) {
        if (!(value instanceof Number n)) {
            return false;
        }
        BigDecimal exact;
        try {
            exact = new BigDecimal(n.toString());
        } catch (NumberFormatException e) {
            // NaN and infinities
            return false;
        }
        return exact.signum() >= 0
                && exact.stripTrailingZeros().scale() <= 0
                && exact.compareTo(BigDecimal.valueOf(Integer.MAX_VALUE)) <= 0;
    }

    /**
     * Truncates an error description to the length stored with dead-letter messages.
     *
     * @param error the error description
     * @return the description, truncated with a trailing {@code "..."} when too long
     */
    public static String truncateError(String error) {
        if (error == null || error.length() <= MAX_ERROR_LENGTH) {
            return error;
        }
        return error.substring(0, MAX_ERROR_LENGTH - 3) + "...";
    }
}
