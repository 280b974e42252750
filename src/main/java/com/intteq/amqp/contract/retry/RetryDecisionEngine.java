package com.intteq.amqp.contract.retry;

import com.intteq.amqp.contract.topology.BackoffPolicy;
import com.intteq.amqp.contract.topology.BackoffType;
import com.intteq.amqp.contract.topology.RetryPolicy;

import java.time.Duration;

/**
 * Decides whether a failed delivery is retried and after which delay.
 *
 * <p>Pure function of {@code (retryCount, policy)}. {@code retryCount} is the
 * value of the {@code x-retry-count} header before increment, so the first retry
 * is computed with {@code retryCount = 0}.</p>
 *
 * <ul>
 *     <li>no policy: legacy mode, always retry with no delay, count reported as 0</li>
 *     <li>{@code maxRetries = 0}: never retry</li>
 *     <li>otherwise retry while {@code retryCount < maxRetries}</li>
 * </ul>
 */
public final class RetryDecisionEngine {

    /** Delay used when a policy has no backoff. */
    public static final Duration DEFAULT_DELAY = Duration.ofMillis(BackoffPolicy.DEFAULT_INITIAL_DELAY_MS);

    private RetryDecisionEngine() {
    }

    public static RetryDecision decide(int retryCount, RetryPolicy policy) {
        if (policy == null) {
            return RetryDecision.retry(Duration.ZERO, 0);
        }

        int count = Math.max(retryCount, 0);

        if (count >= policy.getMaxRetries()) {
            return RetryDecision.giveUp(count);
        }

        return RetryDecision.retry(backoffDelay(count, policy.getBackoff()), count);
    }

    /**
     * Delay before the retry following attempt {@code retryCount}.
     */
    public static Duration backoffDelay(int retryCount, BackoffPolicy backoff) {
        if (backoff == null) {
            return DEFAULT_DELAY;
        }
        if (backoff.getType() == BackoffType.FIXED) {
            return Duration.ofMillis(backoff.getInitialDelay());
        }

        double raw = backoff.getInitialDelay() * Math.pow(backoff.getMultiplier(), Math.max(retryCount, 0));
        long capped = (long) Math.min(raw, (double) backoff.getMaxDelay());
        return Duration.ofMillis(capped);
    }
}
