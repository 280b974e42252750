package com.intteq.amqp.contract.rabbitmq;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Tuning applied to connection factories created by {@link SharedConnectionRegistry}.
 * Two leases share a connection only when their URLs and options are equal.
 */
@Value
@Builder(toBuilder = true)
public class ConnectionOptions {

    @Builder.Default
    Duration connectionTimeout = Duration.ofSeconds(10);

    @Builder.Default
    Duration requestedHeartbeat = Duration.ofSeconds(60);

    @Builder.Default
    int channelCacheSize = 50;

    @Builder.Default
    Duration channelCheckoutTimeout = Duration.ofSeconds(10);

    public static ConnectionOptions defaults() {
        return builder().build();
    }
}
