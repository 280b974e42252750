package com.intteq.amqp.contract.worker;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Worker-wide settings.
 */
@Value
@Builder(toBuilder = true)
public class WorkerOptions {

    /** Prefetch used when neither the consumer options nor the consumer definition set one. */
    @Builder.Default
    int defaultPrefetch = 10;

    /** How long {@link ContractWorker#close()} waits for in-flight handlers per consumer. */
    @Builder.Default
    Duration shutdownTimeout = Duration.ofSeconds(30);

    /** Delay between attempts to recover a consumer after a connection failure. */
    @Builder.Default
    Duration recoveryInterval = Duration.ofSeconds(3);

    public static WorkerOptions defaults() {
        return builder().build();
    }
}
