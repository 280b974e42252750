package com.intteq.amqp.contract.retry;

import org.springframework.amqp.core.MessageProperties;

import java.util.Map;

/**
 * Headers carried by retried messages.
 */
public final class RetryHeaders {

    /** Number of retries already performed for this message. */
    public static final String RETRY_COUNT = "x-retry-count";

    /** Message of the handler failure that caused the latest retry. */
    public static final String LAST_ERROR = "x-last-error";

    /** Epoch millis of the first handler failure. */
    public static final String FIRST_FAILURE_TIMESTAMP = "x-first-failure-timestamp";

    /** Routing key of the message before its first retry. */
    public static final String ORIGINAL_ROUTING_KEY = "x-original-routing-key";

    private RetryHeaders() {
    }

    /**
     * Reads the retry count. Absent, negative or unparsable values count as 0.
     */
    public static int retryCount(Map<String, Object> headers) {
        if (headers == null) {
            return 0;
        }
        Object value = headers.get(RETRY_COUNT);

        long count;
        if (value instanceof Number) {
            count = ((Number) value).longValue();
        } else if (value != null) {
            try {
                count = Long.parseLong(value.toString().trim());
            } catch (NumberFormatException e) {
                return 0;
            }
        } else {
            return 0;
        }

        if (count < 0) {
            return 0;
        }
        return count > Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) count;
    }

    public static int retryCount(MessageProperties properties) {
        return properties == null ? 0 : retryCount(properties.getHeaders());
    }

    /**
     * @return the recorded original routing key, or {@code null} for a message never retried
     */
    public static String originalRoutingKey(Map<String, Object> headers) {
        Object value = headers == null ? null : headers.get(ORIGINAL_ROUTING_KEY);
        return value != null ? value.toString() : null;
    }
}
