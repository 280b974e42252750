package com.intteq.amqp.contract.topology;

import org.springframework.amqp.core.ExchangeTypes;

/**
 * Exchange routing semantics supported by the contract model.
 */
public enum ExchangeType {

    FANOUT(ExchangeTypes.FANOUT),
    DIRECT(ExchangeTypes.DIRECT),
    TOPIC(ExchangeTypes.TOPIC);

    private final String amqpType;

    ExchangeType(String amqpType) {
        this.amqpType = amqpType;
    }

    /**
     * @return the broker-level type name ({@code fanout}, {@code direct}, {@code topic})
     */
    public String amqpType() {
        return amqpType;
    }

    /**
     * @return whether bindings and publishers on this exchange need a routing key
     */
    public boolean requiresRoutingKey() {
        return this != FANOUT;
    }
}
