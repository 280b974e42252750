package com.intteq.amqp.contract.retry;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

import java.time.Duration;

/**
 * Result of {@link RetryDecisionEngine#decide}.
 */
@Getter
@Accessors(fluent = true)
@ToString
@EqualsAndHashCode
public final class RetryDecision {

    private final boolean shouldRetry;
    private final Duration delay;
    private final int currentRetryCount;

    private RetryDecision(boolean shouldRetry, Duration delay, int currentRetryCount) {
        this.shouldRetry = shouldRetry;
        this.delay = delay;
        this.currentRetryCount = currentRetryCount;
    }

    static RetryDecision retry(Duration delay, int currentRetryCount) {
        return new RetryDecision(true, delay, currentRetryCount);
    }

    static RetryDecision giveUp(int currentRetryCount) {
        return new RetryDecision(false, Duration.ZERO, currentRetryCount);
    }
}
