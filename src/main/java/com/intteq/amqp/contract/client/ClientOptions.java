package com.intteq.amqp.contract.client;

import com.intteq.amqp.contract.compression.CompressionAlgorithm;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Client-wide settings.
 */
@Value
@Builder(toBuilder = true)
public class ClientOptions {

    /** Wait for the broker to confirm each publish before completing its future. */
    @Builder.Default
    boolean publisherConfirms = true;

    @Builder.Default
    Duration confirmTimeout = Duration.ofSeconds(5);

    /** Compression applied when a publish does not choose one; {@code null} for none. */
    CompressionAlgorithm defaultCompression;

    public static ClientOptions defaults() {
        return builder().build();
    }
}
