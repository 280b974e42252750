package com.intteq.amqp.contract.topology;

import com.intteq.amqp.contract.exception.ContractConfigurationException;
import com.intteq.amqp.contract.exception.ContractConfigurationException.Code;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Map;

/**
 * Immutable declaration of an exchange.
 *
 * <pre>
 * ExchangeDefinition orders = ExchangeDefinition.topic("orders");
 * ExchangeDefinition dlx = ExchangeDefinition.builder()
 *         .name("orders-dlx")
 *         .type(ExchangeType.DIRECT)
 *         .build();
 * </pre>
 *
 * <p>Exchanges are durable unless stated otherwise.</p>
 */
@Getter
@ToString
@EqualsAndHashCode
public final class ExchangeDefinition {

    private final String name;
    private final ExchangeType type;
    private final boolean durable;
    private final boolean autoDelete;
    private final boolean internal;
    private final Map<String, Object> arguments;

    @Builder(toBuilder = true)
    private ExchangeDefinition(String name,
                               ExchangeType type,
                               Boolean durable,
                               boolean autoDelete,
                               boolean internal,
                               Map<String, Object> arguments) {
        if (name == null || name.isBlank()) {
            throw new ContractConfigurationException(Code.INVALID_EXCHANGE_NAME,
                    "Exchange name must not be blank");
        }
        if (type == null) {
            throw new ContractConfigurationException(Code.INVALID_EXCHANGE_NAME,
                    "Exchange \"" + name + "\" must declare a type",
                    Map.of("exchange", name));
        }
        this.name = name;
        this.type = type;
        this.durable = durable == null || durable;
        this.autoDelete = autoDelete;
        this.internal = internal;
        this.arguments = arguments == null ? Map.of() : Map.copyOf(arguments);
    }

    public static ExchangeDefinition fanout(String name) {
        return builder().name(name).type(ExchangeType.FANOUT).build();
    }

    public static ExchangeDefinition direct(String name) {
        return builder().name(name).type(ExchangeType.DIRECT).build();
    }

    public static ExchangeDefinition topic(String name) {
        return builder().name(name).type(ExchangeType.TOPIC).build();
    }
}
