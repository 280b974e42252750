package com.intteq.amqp.contract.topology;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Map;
import java.util.Objects;

/**
 * Binds a destination exchange to a source exchange. {@link #getExchange()} is the source.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class ExchangeBindingDefinition implements BindingDefinition {

    private final ExchangeDefinition exchange;
    private final ExchangeDefinition destination;
    private final String routingKey;
    private final Map<String, Object> arguments;

    private ExchangeBindingDefinition(ExchangeDefinition source,
                                      ExchangeDefinition destination,
                                      String routingKey,
                                      Map<String, Object> arguments) {
        this.exchange = Objects.requireNonNull(source, "source exchange must not be null");
        this.destination = Objects.requireNonNull(destination, "destination exchange must not be null");
        this.routingKey = RoutingKeys.resolve(source, routingKey,
                "Binding of exchange \"" + destination.getName() + "\"");
        this.arguments = arguments == null ? Map.of() : Map.copyOf(arguments);
    }

    public static ExchangeBindingDefinition of(ExchangeDefinition destination, ExchangeDefinition source) {
        return new ExchangeBindingDefinition(source, destination, null, null);
    }

    public static ExchangeBindingDefinition of(ExchangeDefinition destination,
                                               ExchangeDefinition source,
                                               String routingKey) {
        return new ExchangeBindingDefinition(source, destination, routingKey, null);
    }

    @Override
    public BindingType getType() {
        return BindingType.EXCHANGE;
    }
}
