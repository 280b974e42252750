package com.intteq.amqp.contract.topology;

import com.intteq.amqp.contract.exception.ContractConfigurationException;
import com.intteq.amqp.contract.exception.ContractConfigurationException.Code;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Delay schedule between retry attempts.
 *
 * <ul>
 *     <li>{@link BackoffType#FIXED}: every attempt waits {@code initialDelay}</li>
 *     <li>{@link BackoffType#EXPONENTIAL}: attempt {@code n} waits
 *         {@code min(initialDelay * multiplier^n, maxDelay)}</li>
 * </ul>
 *
 * <p>Unset values fall back to {@link #DEFAULT_INITIAL_DELAY_MS},
 * {@link #DEFAULT_MULTIPLIER} and {@link #DEFAULT_MAX_DELAY_MS}.</p>
 */
@Getter
@ToString
@EqualsAndHashCode
public final class BackoffPolicy {

    public static final long DEFAULT_INITIAL_DELAY_MS = 1000L;
    public static final double DEFAULT_MULTIPLIER = 2.0;
    public static final long DEFAULT_MAX_DELAY_MS = 60_000L;

    private final BackoffType type;
    private final long initialDelay;
    private final double multiplier;
    private final long maxDelay;

    private BackoffPolicy(BackoffType type, Long initialDelay, Double multiplier, Long maxDelay) {
        this.type = type == null ? BackoffType.FIXED : type;
        this.initialDelay = initialDelay == null ? DEFAULT_INITIAL_DELAY_MS : initialDelay;
        this.multiplier = multiplier == null ? DEFAULT_MULTIPLIER : multiplier;
        this.maxDelay = maxDelay == null ? DEFAULT_MAX_DELAY_MS : maxDelay;

        if (this.initialDelay < 0 || this.maxDelay < 0) {
            throw new ContractConfigurationException(Code.INVALID_RETRY_POLICY,
                    "Backoff delays must not be negative: " + this);
        }
        if (this.multiplier < 1.0 || Double.isNaN(this.multiplier)) {
            throw new ContractConfigurationException(Code.INVALID_RETRY_POLICY,
                    "Backoff multiplier must be >= 1: " + this);
        }
    }

    public static BackoffPolicy fixed(long delayMs) {
        return new BackoffPolicy(BackoffType.FIXED, delayMs, null, null);
    }

    public static BackoffPolicy exponential() {
        return new BackoffPolicy(BackoffType.EXPONENTIAL, null, null, null);
    }

    public static BackoffPolicy exponential(long initialDelayMs, double multiplier, long maxDelayMs) {
        return new BackoffPolicy(BackoffType.EXPONENTIAL, initialDelayMs, multiplier, maxDelayMs);
    }

    /**
     * Builds a policy from optional parts, applying defaults for the missing ones.
     */
    public static BackoffPolicy of(BackoffType type, Long initialDelayMs, Double multiplier, Long maxDelayMs) {
        return new BackoffPolicy(type, initialDelayMs, multiplier, maxDelayMs);
    }
}
