package com.intteq.amqp.contract.topology;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

/**
 * Dead-letter target of a queue: the exchange rejected and expired messages are
 * forwarded to, and optionally the routing key they are forwarded with.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class DeadLetterConfig {

    private final ExchangeDefinition exchange;
    private final String routingKey;

    private DeadLetterConfig(ExchangeDefinition exchange, String routingKey) {
        this.exchange = Objects.requireNonNull(exchange, "dead-letter exchange must not be null");
        this.routingKey = routingKey;
    }

    public static DeadLetterConfig of(ExchangeDefinition exchange) {
        return new DeadLetterConfig(exchange, null);
    }

    public static DeadLetterConfig of(ExchangeDefinition exchange, String routingKey) {
        return new DeadLetterConfig(exchange, routingKey);
    }
}
