package com.intteq.amqp.contract.topology;

import com.intteq.amqp.contract.exception.ContractConfigurationException;
import com.intteq.amqp.contract.exception.ContractConfigurationException.Code;
import lombok.Getter;
import lombok.ToString;

import java.util.Map;
import java.util.Objects;

/**
 * Where and what a named publisher sends.
 *
 * <p>On a topic exchange the routing key may be a pattern such as
 * {@code order.*}; the caller then supplies a concrete key matching it at
 * publish time. Direct exchanges take exact keys only.</p>
 */
@Getter
@ToString
public final class PublisherDefinition {

    private final ExchangeDefinition exchange;
    private final String routingKey;
    private final MessageDefinition message;

    private PublisherDefinition(ExchangeDefinition exchange, String routingKey, MessageDefinition message) {
        this.exchange = Objects.requireNonNull(exchange, "exchange must not be null");
        this.message = Objects.requireNonNull(message, "message must not be null");
        this.routingKey = RoutingKeys.resolve(exchange, routingKey, "Publisher");
        if (exchange.getType() == ExchangeType.DIRECT && RoutingKeys.containsWildcards(this.routingKey)) {
            throw new ContractConfigurationException(Code.ROUTING_KEY_CONTAINS_WILDCARDS,
                    "Publisher routing key \"" + this.routingKey + "\" on direct exchange \""
                            + exchange.getName() + "\" must not contain wildcards",
                    Map.of("exchange", exchange.getName(), "routingKey", this.routingKey));
        }
    }

    public static PublisherDefinition of(ExchangeDefinition exchange, MessageDefinition message) {
        return new PublisherDefinition(exchange, null, message);
    }

    public static PublisherDefinition of(ExchangeDefinition exchange, String routingKey, MessageDefinition message) {
        return new PublisherDefinition(exchange, routingKey, message);
    }

    /**
     * @return whether the caller must pick a concrete routing key per publish
     */
    public boolean isRoutingKeyPattern() {
        return RoutingKeys.containsWildcards(routingKey);
    }
}
