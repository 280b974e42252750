package com.intteq.amqp.contract.worker;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Per-consumer runtime settings. Unset values fall back to the consumer
 * definition, then to the worker defaults.
 *
 * <p>{@code batchSize} and {@code batchTimeout} apply only to consumers registered
 * with a {@link BatchConsumerHandler}, which must set {@code batchSize}.</p>
 */
@Value
@Builder
public class ConsumerOptions {

    private static final ConsumerOptions DEFAULTS = ConsumerOptions.builder().build();

    /** Default wait for further messages before a partial batch is handed over. */
    public static final Duration DEFAULT_BATCH_TIMEOUT = Duration.ofSeconds(1);

    /** Maximum unacknowledged deliveries per channel. Defaults to the batch size for batch consumers. */
    Integer prefetch;

    /** Number of concurrent consumers (channels) on the queue. */
    Integer concurrency;

    /** Maximum number of messages handed to a batch handler at once. */
    Integer batchSize;

    /** How long a partial batch waits for the next message before it is handled. */
    Duration batchTimeout;

    public static ConsumerOptions defaults() {
        return DEFAULTS;
    }

    public boolean isBatch() {
        return batchSize != null;
    }

    public Duration effectiveBatchTimeout() {
        return batchTimeout != null ? batchTimeout : DEFAULT_BATCH_TIMEOUT;
    }
}
