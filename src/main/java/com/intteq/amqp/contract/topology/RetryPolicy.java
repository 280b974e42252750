package com.intteq.amqp.contract.topology;

import com.intteq.amqp.contract.exception.ContractConfigurationException;
import com.intteq.amqp.contract.exception.ContractConfigurationException.Code;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Retry budget of a queue.
 *
 * <p>{@code maxRetries == 0} fails fast: the first handler failure dead-letters
 * the message. A {@code null} backoff waits a flat second between attempts.</p>
 *
 * <p>A queue without any policy runs in legacy mode: failed messages are
 * requeued without limit.</p>
 */
@Getter
@ToString
@EqualsAndHashCode
public final class RetryPolicy {

    private final int maxRetries;
    private final BackoffPolicy backoff;

    private RetryPolicy(int maxRetries, BackoffPolicy backoff) {
        if (maxRetries < 0) {
            throw new ContractConfigurationException(Code.INVALID_RETRY_POLICY,
                    "maxRetries must not be negative, got " + maxRetries);
        }
        this.maxRetries = maxRetries;
        this.backoff = backoff;
    }

    public static RetryPolicy of(int maxRetries) {
        return new RetryPolicy(maxRetries, null);
    }

    public static RetryPolicy of(int maxRetries, BackoffPolicy backoff) {
        return new RetryPolicy(maxRetries, backoff);
    }

    public static RetryPolicy failFast() {
        return new RetryPolicy(0, null);
    }
}
