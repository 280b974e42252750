package com.intteq.amqp.contract.client;

import com.intteq.amqp.contract.compression.CompressionAlgorithm;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.Map;

/**
 * Per-publish settings. Everything is optional.
 *
 * <ul>
 *     <li>{@code headers}: application headers, validated against the message's header schema</li>
 *     <li>{@code routingKey}: concrete key, required when the publisher declares a topic pattern</li>
 *     <li>{@code compression}: overrides the client default</li>
 *     <li>{@code priority}, {@code correlationId}, {@code replyTo}, {@code expiration},
 *         {@code messageId}: AMQP properties passed through</li>
 * </ul>
 */
@Value
@Builder(toBuilder = true)
public class PublishOptions {

    private static final PublishOptions NONE = PublishOptions.builder().build();

    @Singular
    Map<String, Object> headers;

    String routingKey;

    CompressionAlgorithm compression;

    Integer priority;

    String correlationId;

    String replyTo;

    Duration expiration;

    String messageId;

    @Builder.Default
    boolean persistent = true;

    public static PublishOptions none() {
        return NONE;
    }

    public static PublishOptions headers(Map<String, Object> headers) {
        return PublishOptions.builder().headers(headers).build();
    }
}
