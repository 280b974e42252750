package com.intteq.amqp.contract.topology;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Map;
import java.util.Objects;

/**
 * Binds a queue to an exchange.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class QueueBindingDefinition implements BindingDefinition {

    private final ExchangeDefinition exchange;
    private final QueueDefinition queue;
    private final String routingKey;
    private final Map<String, Object> arguments;

    private QueueBindingDefinition(ExchangeDefinition exchange,
                                   QueueDefinition queue,
                                   String routingKey,
                                   Map<String, Object> arguments) {
        this.exchange = Objects.requireNonNull(exchange, "exchange must not be null");
        this.queue = Objects.requireNonNull(queue, "queue must not be null");
        this.routingKey = RoutingKeys.resolve(exchange, routingKey,
                "Binding of queue \"" + queue.getName() + "\"");
        this.arguments = arguments == null ? Map.of() : Map.copyOf(arguments);
    }

    public static QueueBindingDefinition of(QueueEntry queue, ExchangeDefinition exchange) {
        return new QueueBindingDefinition(exchange, queue.getQueue(), null, null);
    }

    public static QueueBindingDefinition of(QueueEntry queue, ExchangeDefinition exchange, String routingKey) {
        return new QueueBindingDefinition(exchange, queue.getQueue(), routingKey, null);
    }

    public static QueueBindingDefinition of(QueueEntry queue,
                                            ExchangeDefinition exchange,
                                            String routingKey,
                                            Map<String, Object> arguments) {
        return new QueueBindingDefinition(exchange, queue.getQueue(), routingKey, arguments);
    }

    @Override
    public BindingType getType() {
        return BindingType.QUEUE;
    }
}
